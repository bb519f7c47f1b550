package org.smtlib.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 数组 Sort：domain -> range。
 */
@Getter
public final class ArraySort extends Sort {

    private final Sort domain;
    private final Sort range;

    public ArraySort(Sort domain, Sort range) {
        super(SortKind.ARRAY);
        this.domain = Objects.requireNonNull(domain, "Array domain cannot be null.");
        this.range = Objects.requireNonNull(range, "Array range cannot be null.");
    }

    @Override
    public String toString() {
        return "Array(" + domain + " -> " + range + ")";
    }
}
