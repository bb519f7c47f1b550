package org.smtlib.encoding;

import org.smtlib.core.ArraySort;
import org.smtlib.core.BitVectorSort;
import org.smtlib.core.Expression;
import org.smtlib.core.IntSort;
import org.smtlib.core.SortSort;
import org.smtlib.core.TupleSort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 把 {@link Expression} 树递归翻译为 S-表达式文本。
 * int2bv、bv2int、const_array、tuple_get、tuple_constructor 在 SMT-LIB2 中没有直接对应，需要改写；
 * 其余运算符按 (op arg1 arg2 ...) 输出。
 * @author Ayalyt
 */
public final class ExpressionEncoder {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionEncoder.class);

    private final SortEncoder sortEncoder;

    public ExpressionEncoder(SortEncoder sortEncoder) {
        this.sortEncoder = Objects.requireNonNull(sortEncoder, "SortEncoder cannot be null.");
    }

    /**
     * 编码一个表达式。
     * @param expr 表达式。
     * @return S-表达式文本；原子直接返回其名称。
     */
    public String toSExpr(Expression expr) {
        if (expr.getArguments().isEmpty()) {
            return expr.getName();
        }

        StringBuilder sexpr = new StringBuilder("(");
        switch (expr.getName()) {
            case "int2bv" -> sexpr.append(int2bv(expr));
            case "bv2int" -> {
                IntSort intSort = requireSort(expr, IntSort.class, expr);
                String arg = toSExpr(expr.getArguments().get(0));
                String nat = "(bv2nat " + arg + ")";
                if (!intSort.isSigned()) {
                    return nat;
                }
                sexpr.append(signedBv2int(expr, arg, nat));
            }
            case "const_array" -> {
                requireArity(expr, 2);
                SortSort sortSort = requireSort(expr.getArguments().get(0), SortSort.class, expr);
                if (!(sortSort.getInner() instanceof ArraySort arraySort)) {
                    throw contractViolation("const_array 的类型见证不是数组 Sort: " + sortSort);
                }
                sexpr.append("(as const ").append(sortEncoder.toSmtLibSort(arraySort)).append(") ");
                sexpr.append(toSExpr(expr.getArguments().get(1)));
            }
            case "tuple_get" -> {
                requireArity(expr, 2);
                TupleSort tupleSort = requireSort(expr.getArguments().get(0), TupleSort.class, expr);
                int index = Integer.parseInt(expr.getArguments().get(1).getName());
                if (index < 0 || index >= tupleSort.getMembers().size()) {
                    throw contractViolation("元组 " + tupleSort.getName() + " 的下标越界: " + index);
                }
                sexpr.append('|').append(tupleSort.getMembers().get(index)).append("| ")
                        .append(toSExpr(expr.getArguments().get(0)));
            }
            case "tuple_constructor" -> {
                TupleSort tupleSort = requireSort(expr, TupleSort.class, expr);
                sexpr.append('|').append(tupleSort.getName()).append('|');
                appendArguments(sexpr, expr.getArguments());
            }
            default -> {
                sexpr.append(expr.getName());
                appendArguments(sexpr, expr.getArguments());
            }
        }
        return sexpr.append(')').toString();
    }

    /*
     * 某些求解器把所有位向量都当作无符号数，负数需要手动取补码：
     * (ite (>= v 0) ((_ int2bv n) v) (bvneg ((_ int2bv n) (- v))))
     */
    private String int2bv(Expression expr) {
        requireArity(expr, 2);
        long size = Long.parseLong(expr.getArguments().get(1).getName());
        String arg = toSExpr(expr.getArguments().get(0));
        String int2bv = "(_ int2bv " + size + ")";
        return "ite "
                + "(>= " + arg + " 0) "
                + "(" + int2bv + " " + arg + ") "
                + "(bvneg (" + int2bv + " (- " + arg + ")))";
    }

    // 最高位为 0 时按无符号读取，否则取 bvneg 后的无符号值再取负
    private String signedBv2int(Expression expr, String arg, String nat) {
        BitVectorSort bvSort = requireSort(expr.getArguments().get(0), BitVectorSort.class, expr);
        int pos = bvSort.getSize() - 1;
        return "ite "
                + "(= ((_ extract " + pos + " " + pos + ")" + arg + ") #b0) "
                + nat + " "
                + "(- (bv2nat (bvneg " + arg + ")))";
    }

    private void appendArguments(StringBuilder sexpr, List<Expression> arguments) {
        for (Expression arg : arguments) {
            sexpr.append(' ').append(toSExpr(arg));
        }
    }

    private static void requireArity(Expression expr, int arity) {
        if (expr.getArguments().size() != arity) {
            throw contractViolation(expr.getName() + " 需要 " + arity + " 个参数，实际为 " + expr.getArguments().size());
        }
    }

    private static <S> S requireSort(Expression carrier, Class<S> sortType, Expression context) {
        if (!sortType.isInstance(carrier.getSort())) {
            throw contractViolation(context.getName() + ": 期望 " + sortType.getSimpleName()
                    + "，实际为 " + carrier.getSort());
        }
        return sortType.cast(carrier.getSort());
    }

    private static IllegalStateException contractViolation(String message) {
        logger.error("ExpressionEncoder: {}", message);
        return new IllegalStateException(message);
    }
}
