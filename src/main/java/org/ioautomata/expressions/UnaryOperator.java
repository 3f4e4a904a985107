package org.ioautomata.expressions;

public enum UnaryOperator {

    NEGATION("!");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean apply(boolean operand) {
        return switch (this) {
            case NEGATION -> !operand;
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
