package org.ioautomata.core;

/**
 * 语言的两种语义类型。
 */
public enum LangType {

    /**
     * 表达式的类型
     */
    LOGICAL("logical"),
    /**
     * 语句的类型
     */
    VOID("void");

    private final String symbol;

    LangType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
