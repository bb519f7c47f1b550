package org.smtlib.encoding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 用一组文本缓冲区模拟嵌套的断言作用域 (push/pop)。
 * 每次求解器调用都是无状态的，因此当前逻辑上下文就是所有缓冲区按顺序拼接的结果。
 * 不变式：任何时刻至少存在一个缓冲区，写入总是追加到最顶层的缓冲区。
 */
public final class ScopeStack {

    private static final Logger logger = LoggerFactory.getLogger(ScopeStack.class);

    private final List<StringBuilder> buffers = new ArrayList<>();

    public ScopeStack() {
        reset();
    }

    /**
     * 丢弃所有作用域，只保留一个空的根缓冲区。
     */
    public void reset() {
        buffers.clear();
        buffers.add(new StringBuilder());
        logger.debug("作用域栈已重置");
    }

    public void push() {
        buffers.add(new StringBuilder());
        logger.debug("进入作用域，当前深度 {}", buffers.size());
    }

    /**
     * 丢弃最近一次 push 之后写入的所有命令。
     * @throws IllegalStateException 如果只剩根缓冲区。
     */
    public void pop() {
        if (buffers.size() <= 1) {
            logger.error("ScopeStack.pop: 没有可弹出的作用域。");
            throw new IllegalStateException("无法弹出根作用域");
        }
        buffers.remove(buffers.size() - 1);
        logger.debug("离开作用域，当前深度 {}", buffers.size());
    }

    /**
     * 把一条命令写入最顶层缓冲区，并以换行结束。
     * @param command SMT-LIB2 命令文本。
     */
    public void write(String command) {
        buffers.get(buffers.size() - 1).append(command).append('\n');
    }

    public int depth() {
        return buffers.size();
    }

    /**
     * @return 当前逻辑上下文：各缓冲区按栈序以换行连接。
     */
    public String contents() {
        return buffers.stream().map(StringBuilder::toString).collect(Collectors.joining("\n"));
    }
}
