package org.smtlib.solver;

import org.apache.commons.lang3.StringUtils;
import org.smtlib.core.CheckResult;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析求解器的原始输出：第一行的结论，以及 get-value 回复中的取值。
 */
public final class ResponseParser {

    private ResponseParser() {
    }

    /**
     * 按前缀（区分大小写）判断结论。"unsat" 不以 "sat" 开头，因此不会被误判为可满足。
     * @param response 求解器输出。
     * @return 无法识别时返回 {@link CheckResult#ERROR}。
     */
    public static CheckResult classify(String response) {
        if (StringUtils.startsWith(response, "sat")) {
            return CheckResult.SATISFIABLE;
        } else if (StringUtils.startsWith(response, "unsat")) {
            return CheckResult.UNSATISFIABLE;
        } else if (StringUtils.startsWith(response, "unknown")) {
            return CheckResult.UNKNOWN;
        }
        return CheckResult.ERROR;
    }

    /**
     * 从第一个换行之后的 get-value 回复 ((name value) (name value) ...) 中按顺序取出 value。
     * 这是按位置扫描而不是完整的 S-表达式解析：value 是名字后第一个空格与下一个右括号之间的文本，
     * 之后跳到下一个左括号继续。
     * @param response 求解器输出。
     * @return 原始取值字符串；没有换行时为空列表。
     */
    public static List<String> extractValues(String response) {
        List<String> values = new ArrayList<>();
        int end = response.length();
        int start = response.indexOf('\n');
        if (start < 0) {
            return values;
        }
        while (start < end) {
            int valStart = indexOf(response, ' ', start);
            if (valStart < end) {
                ++valStart;
            }
            int valEnd = indexOf(response, ')', valStart);
            values.add(response.substring(valStart, valEnd));
            start = indexOf(response, '(', valEnd);
        }
        return values;
    }

    // 找不到时返回 text.length()
    private static int indexOf(String text, char c, int from) {
        int index = text.indexOf(c, from);
        return index < 0 ? text.length() : index;
    }
}
