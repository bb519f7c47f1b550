package org.smtlib.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 逐字符读取的递归下降 S-表达式解析器，用于读取求解器输出（例如模型中的项）。
 * 解析器独占构造时传入的 Reader。
 * 只在需要时才读取下一个字符：列表的右括号被消费后不会再向后读，
 * 因此在阻塞的流上解析完一个表达式不会卡在下一次读取上。
 * 分号开始的行注释与空白一样可以出现在任意两个记号之间，竖线原子内部的分号按字面读取。
 * @author Ayalyt
 */
public final class SmtLib2Parser {

    private static final Logger logger = LoggerFactory.getLogger(SmtLib2Parser.class);

    private static final int EOF = -1;
    private static final int NONE = -2;

    private final Reader input;

    // 当前的前瞻字符；NONE 表示尚未读入
    private int lookahead = NONE;

    public SmtLib2Parser(Reader input) {
        this.input = Objects.requireNonNull(input, "Input reader cannot be null.");
    }

    public static SmtLib2Parser of(String text) {
        return new SmtLib2Parser(new StringReader(text));
    }

    /**
     * 解析一个完整的 S-表达式。
     * @return 原子或列表。
     * @throws SmtLib2ParsingException 列表或竖线原子未闭合就到达了输入末尾。
     */
    public SmtLib2Expression parseExpression() {
        skipWhitespace();
        if (peek() == '(') {
            advance();
            skipWhitespace();
            List<SmtLib2Expression> subExpressions = new ArrayList<>();
            while (peek() != EOF && peek() != ')') {
                subExpressions.add(parseExpression());
                skipWhitespace();
            }
            if (peek() != ')') {
                logger.error("SmtLib2Parser: 列表未闭合就到达输入末尾，已读入 {} 个元素。", subExpressions.size());
                throw new SmtLib2ParsingException("Unexpected end of input: missing ')'");
            }
            // 消费右括号，但不读取其后的字符
            advance();
            return SmtLib2Expression.list(subExpressions);
        }
        return SmtLib2Expression.atom(parseToken());
    }

    /**
     * 跳过空白与注释后判断输入是否已经耗尽。
     */
    public boolean isEof() {
        skipWhitespace();
        return peek() == EOF;
    }

    private String parseToken() {
        StringBuilder result = new StringBuilder();
        skipWhitespace();
        boolean isPipe = peek() == '|';
        if (isPipe) {
            advance();
        }
        while (true) {
            int c = peek();
            if (c == EOF) {
                if (isPipe) {
                    throw new SmtLib2ParsingException("Unexpected end of input inside |" + result);
                }
                break;
            }
            if (isPipe && c == '|') {
                advance();
                break;
            } else if (!isPipe && (isWhitespace(c) || c == '(' || c == ')' || c == ';')) {
                break;
            }
            result.append((char) c);
            advance();
        }
        return result.toString();
    }

    /**
     * 返回当前前瞻字符，必要时从流中读入一个字符。
     */
    private int peek() {
        if (lookahead == NONE) {
            lookahead = read();
        }
        return lookahead;
    }

    private void advance() {
        if (peek() == EOF) {
            throw new SmtLib2ParsingException("Attempt to read past end of input");
        }
        lookahead = NONE;
    }

    /**
     * 跳过记号之间的空白与行注释。注释的结尾换行符按空白处理。
     */
    private void skipWhitespace() {
        while (true) {
            int c = peek();
            if (isWhitespace(c)) {
                advance();
            } else if (c == ';') {
                while (peek() != '\n' && peek() != EOF) {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private int read() {
        try {
            return input.read();
        } catch (IOException e) {
            throw new SmtLib2ParsingException("Failed to read solver output", e);
        }
    }

    private static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
    }
}
