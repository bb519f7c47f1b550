package org.smtlib.solver;

import lombok.Getter;
import org.smtlib.core.CheckResult;
import org.smtlib.core.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 按配置顺序合并各后端结论的状态机。
 * <ul>
 *     <li>UNDETERMINED：还没有任何后端给出结论；</li>
 *     <li>UNKNOWN：至少一个后端回答 unknown，但没有决定性结论；</li>
 *     <li>DECISIVE：采纳了第一个 sat/unsat 结论；</li>
 *     <li>CONFLICTING：后来的后端给出了不同的决定性结论，终止查询。</li>
 * </ul>
 * 每次检查使用一个新实例。
 */
public final class VerdictReconciler {

    private static final Logger logger = LoggerFactory.getLogger(VerdictReconciler.class);

    public enum State {
        UNDETERMINED,
        UNKNOWN,
        DECISIVE,
        CONFLICTING
    }

    @Getter
    private State state = State.UNDETERMINED;

    private CheckResult adopted;
    private List<String> values = List.of();

    /**
     * 合并一个后端的回调结果。
     * @param source 后端名称，仅用于日志。
     * @param callbackResult 回调返回值。
     * @return 是否应继续询问后面的后端；出现冲突时为 false。
     */
    public boolean accept(String source, ReadCallback.Result callbackResult) {
        if (state == State.CONFLICTING) {
            logger.error("VerdictReconciler: 已经冲突，不应再合并 {} 的结果。", source);
            throw new IllegalStateException("Reconciliation already finished with CONFLICTING");
        }
        if (!callbackResult.isSuccess()) {
            logger.warn("后端 {} 调用失败，跳过: {}", source, callbackResult.getResponseOrErrorMessage());
            return true;
        }

        String response = callbackResult.getResponseOrErrorMessage();
        CheckResult result = ResponseParser.classify(response);
        logger.debug("后端 {} 的结论: {}", source, result);

        if (result.isDecisive()) {
            if (state != State.DECISIVE) {
                state = State.DECISIVE;
                adopted = result;
                if (result == CheckResult.SATISFIABLE) {
                    values = ResponseParser.extractValues(response);
                }
            } else if (adopted != result) {
                logger.warn("后端 {} 的结论 {} 与已采纳的结论 {} 冲突。", source, result, adopted);
                state = State.CONFLICTING;
                return false;
            }
        } else if (result == CheckResult.UNKNOWN && state == State.UNDETERMINED) {
            state = State.UNKNOWN;
        } else if (result == CheckResult.ERROR) {
            logger.warn("无法识别后端 {} 的回复: {}", source, response);
        }
        return true;
    }

    /**
     * @return 当前的合并结果；UNDETERMINED 对应 ERROR。
     */
    public QueryResult result() {
        return switch (state) {
            case UNDETERMINED -> QueryResult.of(CheckResult.ERROR);
            case UNKNOWN -> QueryResult.of(CheckResult.UNKNOWN);
            case DECISIVE -> QueryResult.of(adopted, values);
            case CONFLICTING -> QueryResult.of(CheckResult.CONFLICTING);
        };
    }
}
