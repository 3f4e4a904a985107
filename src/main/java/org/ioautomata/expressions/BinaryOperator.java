package org.ioautomata.expressions;

/**
 * 二元逻辑运算符。
 */
public enum BinaryOperator {

    AND("&&"),
    OR("||"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    IMPLICATION("-->"),
    BI_IMPLICATION("<-->");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 在两个布尔操作数上应用此运算符。
     * EQUAL 与 BI_IMPLICATION 在布尔域上语义相同。
     */
    public boolean apply(boolean lhs, boolean rhs) {
        return switch (this) {
            case AND -> lhs && rhs;
            case OR -> lhs || rhs;
            case EQUAL, BI_IMPLICATION -> lhs == rhs;
            case NOT_EQUAL -> lhs != rhs;
            case IMPLICATION -> !lhs || rhs;
        };
    }

    /**
     * 是否为逻辑连接词（要求两侧都是 Logical 类型）。
     * EQUAL/NOT_EQUAL 只要求两侧类型相同。
     */
    public boolean isConnective() {
        return switch (this) {
            case AND, OR, IMPLICATION, BI_IMPLICATION -> true;
            case EQUAL, NOT_EQUAL -> false;
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
