package org.smtlib.encoding;

import org.apache.commons.lang3.tuple.Pair;
import org.smtlib.core.ArraySort;
import org.smtlib.core.BitVectorSort;
import org.smtlib.core.Sort;
import org.smtlib.core.TupleSort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 把 Sort 翻译成 SMT-LIB2 的 Sort 文本。
 * 结果按 Sort 的 id 缓存；元组在第一次使用时生成 declare-datatypes 命令并写入当前作用域。
 * @author Ayalyt
 */
public final class SortEncoder {

    private static final Logger logger = LoggerFactory.getLogger(SortEncoder.class);

    private final ScopeStack scopes;

    // 以 Sort 的 id 为键，结构相同的不同实例分别编码
    private final Map<Integer, String> sortNames = new HashMap<>();

    // (带引号的元组名, 声明文本)，按首次使用的顺序排列
    private final List<Pair<String, String>> userSorts = new ArrayList<>();

    public SortEncoder(ScopeStack scopes) {
        this.scopes = Objects.requireNonNull(scopes, "ScopeStack cannot be null.");
    }

    public void reset() {
        sortNames.clear();
        userSorts.clear();
    }

    /**
     * @return 已注册的用户 datatype，顺序即声明顺序。
     */
    public List<Pair<String, String>> getUserSorts() {
        return Collections.unmodifiableList(userSorts);
    }

    /**
     * 编码单个 Sort。
     * @param sort 要编码的 Sort，不能是 Function 或 Sort 种类。
     * @return SMT-LIB2 Sort 文本。
     */
    public String toSmtLibSort(Sort sort) {
        Objects.requireNonNull(sort, "Sort cannot be null.");
        String cached = sortNames.get(sort.getId());
        if (cached != null) {
            return cached;
        }
        // 不用 computeIfAbsent：编码元组时会递归写入同一个 Map
        String smtLibName = sortToString(sort);
        sortNames.put(sort.getId(), smtLibName);
        return smtLibName;
    }

    /**
     * 编码一个 Sort 列表，用作函数声明的参数类型表，形如 "(Int Bool )"。
     */
    public String toSmtLibSort(List<Sort> sorts) {
        StringBuilder ssort = new StringBuilder("(");
        for (Sort sort : sorts) {
            ssort.append(toSmtLibSort(sort)).append(' ');
        }
        return ssort.append(')').toString();
    }

    private String sortToString(Sort sort) {
        return switch (sort.getKind()) {
            case INT -> "Int";
            case BOOL -> "Bool";
            case BIT_VECTOR -> "(_ BitVec " + ((BitVectorSort) sort).getSize() + ")";
            case ARRAY -> {
                ArraySort arraySort = (ArraySort) sort;
                yield "(Array " + toSmtLibSort(arraySort.getDomain()) + ' ' + toSmtLibSort(arraySort.getRange()) + ')';
            }
            case TUPLE -> tupleToString((TupleSort) sort);
            case FUNCTION, SORT -> {
                logger.error("SortEncoder: 无法内联编码 {} 种类的 Sort: {}", sort.getKind(), sort);
                throw new IllegalStateException("Invalid SMT sort: " + sort);
            }
        };
    }

    private String tupleToString(TupleSort tupleSort) {
        String tupleName = "|" + tupleSort.getName() + "|";
        boolean registered = userSorts.stream().anyMatch(entry -> entry.getLeft().equals(tupleName));
        if (!registered) {
            // 先编码成员 Sort，被依赖的 datatype 因此先于本声明写出
            StringBuilder decl = new StringBuilder("(declare-datatypes ((" + tupleName + " 0)) (((" + tupleName);
            for (int i = 0; i < tupleSort.getMembers().size(); i++) {
                decl.append(" (|").append(tupleSort.getMembers().get(i)).append("| ")
                        .append(toSmtLibSort(tupleSort.getComponents().get(i))).append(')');
            }
            decl.append("))))");
            userSorts.add(Pair.of(tupleName, decl.toString()));
            scopes.write(decl.toString());
            logger.debug("声明元组 datatype: {}", tupleName);
        }
        return tupleName;
    }
}
