package org.smtlib.solver;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 通过操作系统中的求解器可执行文件回答查询的 {@link ReadCallback}。
 * 种类字符串在 "smt-query" 之后的部分就是完整的命令行，例如 "z3 rlimit=1000000"；
 * 查询写入临时文件，文件路径作为最后一个参数，求解器的标准输出即为回答。
 * 标准错误不计入回答，只记录到 debug 日志。
 */
public final class SolverCommand implements ReadCallback {

    private static final Logger logger = LoggerFactory.getLogger(SolverCommand.class);

    @Override
    public Result solve(String kind, String query) {
        if (!StringUtils.startsWith(kind, KIND_SMT_QUERY)) {
            logger.error("SolverCommand: 不支持的调用种类 {}", kind);
            throw new IllegalArgumentException("Not an SMT query kind: " + kind);
        }
        List<String> command = new ArrayList<>(Arrays.asList(
                StringUtils.split(kind.substring(KIND_SMT_QUERY.length()))));
        if (command.isEmpty()) {
            return Result.failure("No solver command given in kind '" + kind + "'");
        }

        Path queryFile = null;
        Path errorFile = null;
        try {
            queryFile = Files.createTempFile("smt-query", ".smt2");
            Files.writeString(queryFile, query, StandardCharsets.UTF_8);
            command.add(queryFile.toString());

            logger.debug("执行求解器命令: {}", command);
            errorFile = Files.createTempFile("smt-query", ".err");
            Process process = new ProcessBuilder(command)
                    .redirectError(errorFile.toFile())
                    .start();
            String output;
            try (InputStream stdout = process.getInputStream()) {
                output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            String errors = new String(Files.readAllBytes(errorFile), StandardCharsets.UTF_8);
            if (!errors.isBlank()) {
                logger.debug("求解器 {} 的标准错误输出: {}", command.get(0), errors.strip());
            }
            if (exitCode != 0 && output.isBlank()) {
                return Result.failure("Solver '" + command.get(0) + "' exited with code " + exitCode);
            }
            return Result.success(output);
        } catch (IOException e) {
            logger.warn("无法执行求解器 {}: {}", command.get(0), e.getMessage());
            return Result.failure("Exception during solver call: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure("Interrupted while waiting for solver '" + command.get(0) + "'");
        } finally {
            deleteQuietly(queryFile);
            deleteQuietly(errorFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("无法删除临时查询文件 {}: {}", file, e.getMessage());
        }
    }
}
