package org.smtlib.parser;

/**
 * 求解器输出不符合 S-表达式语法，或者在还需要输入时已到达流末尾。
 */
public class SmtLib2ParsingException extends RuntimeException {

    public SmtLib2ParsingException(String message) {
        super(message);
    }

    public SmtLib2ParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
