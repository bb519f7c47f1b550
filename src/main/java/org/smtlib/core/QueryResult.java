package org.smtlib.core;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * check 的返回值：结论以及（仅当 SATISFIABLE 时）按请求顺序排列的原始取值字符串。
 */
@Getter
public final class QueryResult {

    private final CheckResult result;
    private final List<String> values;

    private QueryResult(CheckResult result, List<String> values) {
        this.result = Objects.requireNonNull(result, "Check result cannot be null.");
        this.values = List.copyOf(Objects.requireNonNull(values, "Values cannot be null."));
    }

    public static QueryResult of(CheckResult result, List<String> values) {
        // 只有可满足时才携带取值
        return new QueryResult(result, result == CheckResult.SATISFIABLE ? values : List.of());
    }

    public static QueryResult of(CheckResult result) {
        return new QueryResult(result, List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QueryResult that = (QueryResult) o;
        return result == that.result && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(result, values);
    }

    @Override
    public String toString() {
        return "QueryResult(" + result + ", " + values + ")";
    }
}
