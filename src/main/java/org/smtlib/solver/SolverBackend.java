package org.smtlib.solver;

import lombok.Getter;

/**
 * 可用的求解器后端。声明顺序就是查询顺序，它决定了哪个结论先被采纳。
 */
@Getter
public enum SolverBackend {

    Z3("z3 rlimit=1000000"),
    CVC4("cvc4");

    private final String invocation;

    SolverBackend(String invocation) {
        this.invocation = invocation;
    }

    /**
     * @return 传给 {@link ReadCallback} 的种类字符串，例如 "smt-query z3 rlimit=1000000"。
     */
    public String kind() {
        return ReadCallback.KIND_SMT_QUERY + ' ' + invocation;
    }
}
