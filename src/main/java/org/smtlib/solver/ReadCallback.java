package org.smtlib.solver;

import lombok.Getter;

import java.util.Objects;

/**
 * 外部提供的求解器调用回调：给定调用种类与查询文本，返回求解器的输出或错误信息。
 * 回调负责真正启动求解器进程（或以其他方式得到回答），调用是阻塞的。
 */
@FunctionalInterface
public interface ReadCallback {

    /**
     * SMT 查询的种类前缀，完整的种类为 "smt-query " 加上后端的调用参数。
     */
    String KIND_SMT_QUERY = "smt-query";

    Result solve(String kind, String query);

    /**
     * 回调结果：success 为 false 时 responseOrErrorMessage 是错误信息。
     */
    @Getter
    final class Result {

        private final boolean success;
        private final String responseOrErrorMessage;

        private Result(boolean success, String responseOrErrorMessage) {
            this.success = success;
            this.responseOrErrorMessage = Objects.requireNonNull(responseOrErrorMessage, "Response cannot be null.");
        }

        public static Result success(String response) {
            return new Result(true, response);
        }

        public static Result failure(String errorMessage) {
            return new Result(false, errorMessage);
        }

        @Override
        public String toString() {
            return (success ? "Result(success, " : "Result(failure, ") + responseOrErrorMessage + ")";
        }
    }
}
