package org.smtlib.core;

import lombok.Getter;

/**
 * 整数 Sort。isSigned 只影响 bv2int 的编码方式。
 */
@Getter
public final class IntSort extends Sort {

    private final boolean isSigned;

    public IntSort(boolean isSigned) {
        super(SortKind.INT);
        this.isSigned = isSigned;
    }

    @Override
    public String toString() {
        return isSigned ? "Int(signed)" : "Int(unsigned)";
    }
}
