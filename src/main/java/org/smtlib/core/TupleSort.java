package org.smtlib.core;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 元组 Sort，编码为只有一个构造子的 SMT-LIB2 datatype。
 * members 与 components 按下标一一对应：第 i 个成员名及其 Sort。
 */
@Getter
public final class TupleSort extends Sort {

    private final String name;
    private final List<String> members;
    private final List<Sort> components;

    public TupleSort(String name, List<String> members, List<Sort> components) {
        super(SortKind.TUPLE);
        this.name = Objects.requireNonNull(name, "Tuple name cannot be null.");
        this.members = List.copyOf(Objects.requireNonNull(members, "Tuple members cannot be null."));
        this.components = List.copyOf(Objects.requireNonNull(components, "Tuple components cannot be null."));
        if (this.members.size() != this.components.size()) {
            throw new IllegalArgumentException("元组 " + name + " 的成员名数量 (" + this.members.size()
                    + ") 与成员 Sort 数量 (" + this.components.size() + ") 不一致。");
        }
    }

    @Override
    public String toString() {
        return "Tuple(" + name + ")";
    }
}
