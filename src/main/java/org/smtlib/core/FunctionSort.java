package org.smtlib.core;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 函数 Sort：(domain_1, ..., domain_n) -> codomain。
 * 只出现在函数符号的声明中，不能作为内联 Sort 字符串编码。
 */
@Getter
public final class FunctionSort extends Sort {

    private final List<Sort> domain;
    private final Sort codomain;

    public FunctionSort(List<Sort> domain, Sort codomain) {
        super(SortKind.FUNCTION);
        this.domain = List.copyOf(Objects.requireNonNull(domain, "Function domain cannot be null."));
        this.codomain = Objects.requireNonNull(codomain, "Function codomain cannot be null.");
    }

    @Override
    public String toString() {
        return "Function(" + domain + " -> " + codomain + ")";
    }
}
