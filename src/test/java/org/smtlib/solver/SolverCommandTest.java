package org.smtlib.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.smtlib.core.CheckResult;

import static org.junit.jupiter.api.Assertions.*;

class SolverCommandTest {

    private final SolverCommand command = new SolverCommand();

    @Test
    @DisplayName("种类必须以 smt-query 开头")
    void testRejectsOtherKinds() {
        assertThrows(IllegalArgumentException.class, () -> command.solve("source z3", "(check-sat)\n"));
    }

    @Test
    @DisplayName("没有命令行时失败")
    void testEmptyCommandLine() {
        assertFalse(command.solve("smt-query", "(check-sat)\n").isSuccess());
    }

    @Test
    @DisplayName("找不到可执行文件时报告失败而不是抛出异常")
    void testMissingBinary() {
        ReadCallback.Result result = command.solve("smt-query no-such-solver-binary-3f9a", "(check-sat)\n");

        assertFalse(result.isSuccess());
        assertTrue(result.getResponseOrErrorMessage().contains("Exception during solver call"));
    }

    @Test
    @DisplayName("查询文件作为最后一个参数传给命令")
    @DisabledOnOs(OS.WINDOWS)
    void testQueryFilePassedToCommand() {
        String query = "(set-logic ALL)\n(check-sat)\n";
        ReadCallback.Result result = command.solve("smt-query cat", query);

        assertTrue(result.isSuccess());
        assertEquals(query, result.getResponseOrErrorMessage());
    }

    @Test
    @DisplayName("标准错误输出不混入回答")
    @DisabledOnOs(OS.WINDOWS)
    void testStandardErrorKeptOutOfResponse() {
        // 查询文件本身作为 sh 脚本执行：先向标准错误写警告，再输出结论
        String script = "echo 'warning: unknown option' >&2\necho sat\n";
        ReadCallback.Result result = command.solve("smt-query sh", script);

        assertTrue(result.isSuccess());
        assertEquals("sat\n", result.getResponseOrErrorMessage());
        assertEquals(CheckResult.SATISFIABLE, ResponseParser.classify(result.getResponseOrErrorMessage()));
    }
}
