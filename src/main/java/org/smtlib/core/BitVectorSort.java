package org.smtlib.core;

import lombok.Getter;

/**
 * 定宽位向量 Sort。
 */
@Getter
public final class BitVectorSort extends Sort {

    private final int size;

    public BitVectorSort(int size) {
        super(SortKind.BIT_VECTOR);
        if (size <= 0) {
            throw new IllegalArgumentException("位向量宽度必须为正数: " + size);
        }
        this.size = size;
    }

    @Override
    public String toString() {
        return "BitVec(" + size + ")";
    }
}
