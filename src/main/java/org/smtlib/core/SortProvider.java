package org.smtlib.core;

/**
 * 常用 Sort 的共享实例。
 * 由于 Sort 按实例区分，复用这些常量可以让编码器的缓存命中。
 */
public final class SortProvider {

    public static final IntSort SINT = new IntSort(true);
    public static final IntSort UINT = new IntSort(false);
    public static final BoolSort BOOL = new BoolSort();

    private SortProvider() {
    }
}
