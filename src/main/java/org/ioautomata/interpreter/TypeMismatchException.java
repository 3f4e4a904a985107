package org.ioautomata.interpreter;

import lombok.Getter;

/**
 * 运算符作用于类型不匹配的操作数，或值无法归约到期望的类型。
 */
@Getter
public final class TypeMismatchException extends LanguageException {

    private final String expected;
    private final String actual;

    public TypeMismatchException(String expected, String actual, String context) {
        super("类型不匹配: " + context + " 期望 " + expected + "，实际为 " + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
