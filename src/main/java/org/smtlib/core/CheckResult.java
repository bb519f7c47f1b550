package org.smtlib.core;

/**
 * 一次可满足性检查的结论。
 * CONFLICTING 只由多个后端意见不一致产生，单个后端不会返回它。
 */
public enum CheckResult {
    SATISFIABLE,
    UNSATISFIABLE,
    UNKNOWN,
    CONFLICTING,
    ERROR;

    /**
     * 是否为决定性的结论 (sat 或 unsat)。
     */
    public boolean isDecisive() {
        return this == SATISFIABLE || this == UNSATISFIABLE;
    }
}
