package org.smtlib.core;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 带类型的表达式树节点：运算符（或原子文本）、有序参数列表以及结果 Sort。
 * 没有参数的节点是原子（变量、常量、字面量）。
 * 此类是不可变的，编码器只读取它。
 */
@Getter
public final class Expression {

    private final String name;
    private final List<Expression> arguments;
    private final Sort sort;

    private Expression(String name, List<Expression> arguments, Sort sort) {
        this.name = Objects.requireNonNull(name, "Expression name cannot be null.");
        this.arguments = List.copyOf(Objects.requireNonNull(arguments, "Expression arguments cannot be null."));
        this.sort = Objects.requireNonNull(sort, "Expression sort cannot be null.");
    }

    // --- 静态工厂方法 ---

    /**
     * 创建一个原子表达式（变量名或常量文本）。
     * @param name 原子文本。
     * @param sort 原子的 Sort。
     * @return 新的 Expression 实例。
     */
    public static Expression atom(String name, Sort sort) {
        return new Expression(name, List.of(), sort);
    }

    /**
     * 创建一个有符号整数字面量。负数按 SMT-LIB2 写作 (- n)。
     */
    public static Expression literal(long value) {
        if (value < 0) {
            // Long.MIN_VALUE 取负会溢出，按无符号数输出其绝对值
            return of("-", SortProvider.SINT, atom(Long.toUnsignedString(-value), SortProvider.SINT));
        }
        return atom(Long.toString(value), SortProvider.SINT);
    }

    public static Expression literal(boolean value) {
        return atom(Boolean.toString(value), SortProvider.BOOL);
    }

    /**
     * 创建一个运算符应用。
     * @param name 运算符名称。
     * @param sort 结果 Sort。
     * @param arguments 参数表达式。
     * @return 新的 Expression 实例。
     */
    public static Expression of(String name, Sort sort, Expression... arguments) {
        return new Expression(name, Arrays.asList(arguments), sort);
    }

    public static Expression of(String name, Sort sort, List<Expression> arguments) {
        return new Expression(name, arguments, sort);
    }

    // --- 需要特殊编码的运算符 ---

    /**
     * 整数转位向量，负数按二进制补码处理。
     */
    public static Expression int2bv(Expression value, BitVectorSort bvSort) {
        return of("int2bv", bvSort, value, atom(Integer.toString(bvSort.getSize()), SortProvider.UINT));
    }

    /**
     * 位向量转整数，resultSort 的 isSigned 决定是否按补码解读。
     */
    public static Expression bv2int(Expression bitVector, IntSort resultSort) {
        return of("bv2int", resultSort, bitVector);
    }

    /**
     * 所有元素都等于 value 的常量数组。
     */
    public static Expression constArray(ArraySort arraySort, Expression value) {
        return of("const_array", arraySort, atom(arraySort.toString(), new SortSort(arraySort)), value);
    }

    /**
     * 取元组第 index 个成员。
     */
    public static Expression tupleGet(Expression tuple, int index) {
        if (!(tuple.getSort() instanceof TupleSort tupleSort)) {
            throw new IllegalArgumentException("tuple_get 的参数不是元组: " + tuple);
        }
        Sort memberSort = tupleSort.getComponents().get(index);
        return of("tuple_get", memberSort, tuple, atom(Integer.toString(index), SortProvider.UINT));
    }

    public static Expression tupleConstructor(TupleSort tupleSort, Expression... members) {
        return of("tuple_constructor", tupleSort, members);
    }

    public boolean isAtom() {
        return arguments.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Expression that = (Expression) o;
        return name.equals(that.name) && arguments.equals(that.arguments) && sort.equals(that.sort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments, sort);
    }

    @Override
    public String toString() {
        if (arguments.isEmpty()) {
            return name;
        }
        return name + "(" + arguments.stream().map(Expression::toString).collect(Collectors.joining(", ")) + ")";
    }
}
