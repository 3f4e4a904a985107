package org.ioautomata.core;

/**
 * 解释器对表达式或语句求值的结果。
 * 表达式的结果为 TRUE/FALSE，语句的结果为 VOID。
 */
public enum Evaluation {

    TRUE,
    FALSE,
    VOID;

    public static Evaluation of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isTrue() {
        return this == TRUE;
    }

    public boolean isFalse() {
        return this == FALSE;
    }

    public boolean isVoid() {
        return this == VOID;
    }

    /**
     * 转换为布尔值。
     * @throws IllegalStateException 如果结果为 VOID。
     */
    public boolean asBoolean() {
        return switch (this) {
            case TRUE -> true;
            case FALSE -> false;
            case VOID -> throw new IllegalStateException("void 求值结果不能转换为布尔值");
        };
    }

    /**
     * 转换为语言中的 {@link Value}。
     * @throws IllegalStateException 如果结果为 VOID。
     */
    public Value toValue() {
        return Value.of(asBoolean());
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
