package org.ioautomata.interpreter;

import lombok.Getter;

/**
 * 引用了环境中未声明的标识符。
 */
@Getter
public final class UnknownIdentifierException extends LanguageException {

    private final String identifier;

    public UnknownIdentifierException(String identifier) {
        super("未知标识符: " + identifier);
        this.identifier = identifier;
    }
}
