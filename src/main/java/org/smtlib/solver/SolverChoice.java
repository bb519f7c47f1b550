package org.smtlib.solver;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 启用的求解器后端集合，在会话构造时给定。
 * 此类是不可变的。
 */
public final class SolverChoice {

    private final Set<SolverBackend> enabled;

    private SolverChoice(Set<SolverBackend> enabled) {
        this.enabled = Collections.unmodifiableSet(enabled);
    }

    public static SolverChoice all() {
        return new SolverChoice(EnumSet.allOf(SolverBackend.class));
    }

    public static SolverChoice none() {
        return new SolverChoice(EnumSet.noneOf(SolverBackend.class));
    }

    public static SolverChoice of(SolverBackend first, SolverBackend... rest) {
        Objects.requireNonNull(first, "Solver backend cannot be null.");
        return new SolverChoice(EnumSet.of(first, rest));
    }

    public boolean isEnabled(SolverBackend backend) {
        return enabled.contains(backend);
    }

    public boolean isNone() {
        return enabled.isEmpty();
    }

    /**
     * @return 已启用的后端，按 {@link SolverBackend} 的声明顺序。
     */
    public List<SolverBackend> enabledInOrder() {
        // EnumSet 的迭代顺序就是枚举声明顺序
        return List.copyOf(enabled);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SolverChoice that && enabled.equals(that.enabled);
    }

    @Override
    public int hashCode() {
        return enabled.hashCode();
    }

    @Override
    public String toString() {
        return "SolverChoice" + enabled;
    }
}
