package org.smtlib.solver;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.smtlib.core.Expression;
import org.smtlib.core.QueryResult;
import org.smtlib.core.Sort;
import org.smtlib.encoding.DeclarationManager;
import org.smtlib.encoding.ExpressionEncoder;
import org.smtlib.encoding.QueryBuilder;
import org.smtlib.encoding.ScopeStack;
import org.smtlib.encoding.SortEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 通过 SMT-LIB2 文本与外部求解器交互的会话。
 * 每次求解器调用都是无状态的：check 会把完整的累积上下文连同本次查询一起发给每个启用的后端，
 * 并按 {@link SolverBackend} 的顺序合并它们的结论。
 * 会话拥有自己的全部可变状态，不做同步；需要并发时请使用独立的会话实例。
 * @author Ayalyt
 */
public final class SmtLib2Interface implements SolverInterface {

    private static final Logger logger = LoggerFactory.getLogger(SmtLib2Interface.class);

    private final ReadCallback smtCallback;
    @Getter
    private final SolverChoice enabledSolvers;
    // 毫秒，null 表示不设置
    @Getter
    private final Integer queryTimeout;

    private final ScopeStack scopes;
    private final SortEncoder sortEncoder;
    private final DeclarationManager declarations;
    private final ExpressionEncoder expressionEncoder;
    private final QueryBuilder queryBuilder;

    private final List<String> unhandledQueries = new ArrayList<>();

    /**
     * @param smtCallback 求解器调用回调。
     * @param enabledSolvers 启用的后端。
     * @param queryTimeout 写入前导的 :timeout 选项，可为 null。
     */
    public SmtLib2Interface(ReadCallback smtCallback, SolverChoice enabledSolvers, Integer queryTimeout) {
        this.smtCallback = Objects.requireNonNull(smtCallback, "SMT callback cannot be null.");
        this.enabledSolvers = Objects.requireNonNull(enabledSolvers, "Solver choice cannot be null.");
        this.queryTimeout = queryTimeout;

        this.scopes = new ScopeStack();
        this.sortEncoder = new SortEncoder(scopes);
        this.declarations = new DeclarationManager(scopes, sortEncoder);
        this.expressionEncoder = new ExpressionEncoder(sortEncoder);
        this.queryBuilder = new QueryBuilder(expressionEncoder);

        reset();
        logger.info("SmtLib2Interface 初始化完成，启用后端 {}，超时 {}。", enabledSolvers, queryTimeout);
    }

    public SmtLib2Interface(ReadCallback smtCallback, SolverChoice enabledSolvers) {
        this(smtCallback, enabledSolvers, null);
    }

    @Override
    public void reset() {
        scopes.reset();
        declarations.reset();
        sortEncoder.reset();
        write("(set-option :produce-models true)");
        if (queryTimeout != null) {
            write("(set-option :timeout " + queryTimeout + ")");
        }
        write("(set-logic ALL)");
        logger.debug("会话已重置");
    }

    @Override
    public void push() {
        scopes.push();
    }

    @Override
    public void pop() {
        scopes.pop();
    }

    @Override
    public void declareVariable(String name, Sort sort) {
        declarations.declareVariable(name, sort);
    }

    @Override
    public void declareFunction(String name, Sort sort) {
        declarations.declareFunction(name, sort);
    }

    @Override
    public void addAssertion(Expression expr) {
        write("(assert " + expressionEncoder.toSExpr(expr) + ")");
    }

    @Override
    public QueryResult check(List<Expression> expressionsToEvaluate) {
        String query = dumpQuery(expressionsToEvaluate);

        VerdictReconciler reconciler = new VerdictReconciler();
        for (SolverBackend backend : enabledSolvers.enabledInOrder()) {
            logger.debug("向后端 {} 发送查询", backend);
            ReadCallback.Result callbackResult = smtCallback.solve(backend.kind(), query);
            if (!reconciler.accept(backend.name(), callbackResult)) {
                break;
            }
        }

        QueryResult result = reconciler.result();
        if (reconciler.getState() == VerdictReconciler.State.UNDETERMINED) {
            logger.error("没有任何后端回答此查询，已记录到未处理查询列表。");
            unhandledQueries.add(query);
        }
        if (expressionsToEvaluate.isEmpty()) {
            // 没有 get-value 时不返回取值
            return QueryResult.of(result.getResult());
        }
        return result;
    }

    /**
     * @return 会发送给后端的完整查询文本，不调用任何后端。
     */
    public String dumpQuery(List<Expression> expressionsToEvaluate) {
        return scopes.contents() + queryBuilder.checkSatAndGetValuesCommand(expressionsToEvaluate);
    }

    /**
     * @return 没有任何后端给出结论的查询，按发生顺序排列。
     */
    public List<String> getUnhandledQueries() {
        return Collections.unmodifiableList(unhandledQueries);
    }

    public List<String> getUserSortDeclarations() {
        return sortEncoder.getUserSorts().stream().map(Pair::getRight).toList();
    }

    private void write(String command) {
        scopes.write(command);
    }
}
