package org.smtlib.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 把一个 Sort 当作值携带的 Sort，例如 const_array 的类型见证参数。
 */
@Getter
public final class SortSort extends Sort {

    private final Sort inner;

    public SortSort(Sort inner) {
        super(SortKind.SORT);
        this.inner = Objects.requireNonNull(inner, "Inner sort cannot be null.");
    }

    @Override
    public String toString() {
        return "Sort(" + inner + ")";
    }
}
