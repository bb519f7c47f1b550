package org.smtlib.solver;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import org.apache.commons.lang3.StringUtils;
import org.smtlib.parser.SmtLib2Expression;
import org.smtlib.parser.SmtLib2Parser;
import org.smtlib.parser.SmtLib2ParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 使用 Z3 Java API 在进程内回答查询的 {@link ReadCallback}，回答格式与求解器可执行文件的输出一致。
 * 每次查询都创建并关闭一个新的 Z3 Context，相当于每次启动一个新的求解器进程。
 * 查询中的声明与断言交给 Z3 的 SMT-LIB2 解析器，check-sat 与 get-value 由本类执行。
 * @author Ayalyt
 */
public final class Z3InProcessSolver implements ReadCallback {

    private static final Logger logger = LoggerFactory.getLogger(Z3InProcessSolver.class);

    /**
     * 检查 Z3 本地库能否加载。
     */
    public static boolean isAvailable() {
        try (Context ignored = new Context()) {
            return true;
        } catch (LinkageError | Z3Exception e) {
            logger.warn("Z3 不可用: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Result solve(String kind, String query) {
        if (!StringUtils.startsWith(kind, KIND_SMT_QUERY)) {
            logger.error("Z3InProcessSolver: 不支持的调用种类 {}", kind);
            throw new IllegalArgumentException("Not an SMT query kind: " + kind);
        }

        StringBuilder script = new StringBuilder();
        Map<String, String> constSorts = new HashMap<>();
        List<String> valueNames = new ArrayList<>();
        Integer timeout = null;
        try {
            for (String line : query.split("\n")) {
                String command = line.trim();
                if (command.startsWith("(declare-const")) {
                    // (declare-const |name| Sort)
                    SmtLib2Expression.SList decl = SmtLib2Parser.of(command).parseExpression().asList();
                    constSorts.put(decl.get(1).asAtom().getText(), decl.get(2).toString());
                    script.append(command).append('\n');
                } else if (command.startsWith("(declare-") || command.startsWith("(assert")) {
                    script.append(command).append('\n');
                } else if (command.startsWith("(get-value")) {
                    // (get-value (|n0| |n1| ))
                    for (SmtLib2Expression name : SmtLib2Parser.of(command).parseExpression().asList().get(1).asList().getElements()) {
                        valueNames.add(name.asAtom().getText());
                    }
                } else if (command.startsWith("(set-option :timeout")) {
                    timeout = Integer.valueOf(StringUtils.substringBetween(command, ":timeout", ")").trim());
                }
            }
        } catch (SmtLib2ParsingException | IllegalStateException | IndexOutOfBoundsException | NumberFormatException e) {
            logger.warn("无法读取查询: {}", e.getMessage());
            return Result.failure("Malformed query: " + e.getMessage());
        }

        try (Context ctx = new Context()) {
            BoolExpr[] assertions = ctx.parseSMTLIB2String(script.toString(), null, null, null, null);
            Solver solver = ctx.mkSolver();
            if (timeout != null) {
                Params params = ctx.mkParams();
                params.add("timeout", timeout.intValue());
                solver.setParameters(params);
            }
            solver.add(assertions);
            Status status = solver.check();
            logger.debug("Z3 结论: {}", status);

            StringBuilder response = new StringBuilder(switch (status) {
                case SATISFIABLE -> "sat";
                case UNSATISFIABLE -> "unsat";
                case UNKNOWN -> "unknown";
            }).append('\n');
            if (status == Status.SATISFIABLE && !valueNames.isEmpty()) {
                response.append(renderValues(ctx, solver.getModel(), valueNames, constSorts)).append('\n');
            }
            return Result.success(response.toString());
        } catch (Z3Exception e) {
            logger.warn("Z3 求解失败: {}", e.getMessage());
            return Result.failure("Z3 error: " + e.getMessage());
        }
    }

    private static String renderValues(Context ctx, Model model, List<String> names, Map<String, String> constSorts) {
        StringBuilder values = new StringBuilder("(");
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            Sort sort = "Bool".equals(constSorts.get(name)) ? ctx.getBoolSort() : ctx.getIntSort();
            String value = model.eval(ctx.mkConst(name, sort), true).toString();
            if (i > 0) {
                values.append(' ');
            }
            values.append("(|").append(name).append("| ").append(value).append(')');
        }
        return values.append(')').toString();
    }
}
