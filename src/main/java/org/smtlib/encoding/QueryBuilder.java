package org.smtlib.encoding;

import org.smtlib.core.Expression;
import org.smtlib.core.SortKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 生成一次检查所需的命令块：求值辅助常量的声明与断言、check-sat 以及 get-value。
 */
public final class QueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(QueryBuilder.class);

    /**
     * 辅助常量名前缀，第 i 个待求值表达式对应 EVALEXPR_i。
     * 不检查与调用方声明的符号是否重名。
     */
    public static final String EVAL_PREFIX = "EVALEXPR_";

    private final ExpressionEncoder expressionEncoder;

    public QueryBuilder(ExpressionEncoder expressionEncoder) {
        this.expressionEncoder = Objects.requireNonNull(expressionEncoder, "ExpressionEncoder cannot be null.");
    }

    /**
     * @param expressionsToEvaluate 需要取值的表达式，只能是 Int 或 Bool Sort。
     * @return 以 (check-sat) 结尾的命令块；有待求值表达式时再追加一条 (get-value ...)。
     */
    public String checkSatAndGetValuesCommand(List<Expression> expressionsToEvaluate) {
        if (expressionsToEvaluate.isEmpty()) {
            return "(check-sat)\n";
        }

        StringBuilder command = new StringBuilder();
        for (int i = 0; i < expressionsToEvaluate.size(); i++) {
            Expression e = expressionsToEvaluate.get(i);
            SortKind kind = e.getSort().getKind();
            if (kind != SortKind.INT && kind != SortKind.BOOL) {
                logger.error("QueryBuilder: 待求值表达式 {} 的 Sort {} 不是 Int 或 Bool。", e, e.getSort());
                throw new IllegalArgumentException("Invalid sort for expression to evaluate: " + e.getSort());
            }
            String name = "|" + EVAL_PREFIX + i + "|";
            command.append("(declare-const ").append(name).append(' ')
                    .append(kind == SortKind.INT ? "Int" : "Bool").append(")\n");
            command.append("(assert (= ").append(name).append(' ')
                    .append(expressionEncoder.toSExpr(e)).append("))\n");
        }
        command.append("(check-sat)\n");
        command.append("(get-value (");
        for (int i = 0; i < expressionsToEvaluate.size(); i++) {
            command.append('|').append(EVAL_PREFIX).append(i).append("| ");
        }
        command.append("))\n");
        return command.toString();
    }
}
