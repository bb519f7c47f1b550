package org.smtlib.core;

import lombok.Getter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 求解器逻辑中的类型 (Sort)。
 * 每个实例在构造时获得一个全局唯一的 id，相等性与哈希只依赖 id：
 * 结构相同但不是同一实例的两个 Sort 被视为不同的 Sort。
 * 所有子类都是不可变的。
 * @author Ayalyt
 */
@Getter
public abstract class Sort {

    // AtomicInteger 保证唯一性和线程安全
    private static final AtomicInteger NEXT_ID = new AtomicInteger(0);

    private final int id;
    private final SortKind kind;

    Sort(SortKind kind) {
        this.kind = Objects.requireNonNull(kind, "Sort kind cannot be null.");
        this.id = NEXT_ID.getAndIncrement();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Sort sort = (Sort) obj;
        return this.id == sort.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }
}
