package org.smtlib.core;

/**
 * Sort 的种类标签。
 * 所有对 Sort 的分派都对此枚举做穷举 switch，新增种类时编译器会指出每个需要处理的位置。
 */
public enum SortKind {
    INT,
    BOOL,
    BIT_VECTOR,
    ARRAY,
    TUPLE,
    FUNCTION,
    // 以 Sort 本身作为值（例如 const_array 的第一个参数），不直接编码
    SORT
}
