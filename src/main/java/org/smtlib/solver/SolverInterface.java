package org.smtlib.solver;

import org.smtlib.core.Expression;
import org.smtlib.core.QueryResult;
import org.smtlib.core.Sort;

import java.util.List;

/**
 * 增量式求解器会话：声明、断言、作用域以及可满足性检查。
 */
public interface SolverInterface {

    /**
     * 清空所有状态，重新开始一个会话。
     */
    void reset();

    void push();

    void pop();

    void declareVariable(String name, Sort sort);

    void declareFunction(String name, Sort sort);

    void addAssertion(Expression expr);

    /**
     * 检查当前上下文的可满足性。
     * @param expressionsToEvaluate 可满足时需要取值的表达式。
     * @return 结论以及按请求顺序排列的取值。
     */
    QueryResult check(List<Expression> expressionsToEvaluate);

    default QueryResult check() {
        return check(List.of());
    }
}
