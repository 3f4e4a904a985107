package org.ioautomata.interpreter;

/**
 * 语言层面的错误：求值或类型检查失败。
 */
public abstract class LanguageException extends Exception {

    protected LanguageException(String message) {
        super(message);
    }
}
