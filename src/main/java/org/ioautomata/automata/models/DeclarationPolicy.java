package org.ioautomata.automata.models;

import org.ioautomata.core.Value;

import java.util.Objects;

/**
 * 自动机构造时对未声明标识符的处理策略。
 * 严格模式与自动声明模式共用同一条校验流程，只在遇到缺失标识符时分叉。
 */
public final class DeclarationPolicy {

    /**
     * 缺失标识符自动以 false 声明，这是未提供初始环境时的约定。
     */
    public static final DeclarationPolicy AUTO_DECLARE_FALSE = new DeclarationPolicy(true, Value.FALSE);

    private static final DeclarationPolicy STRICT = new DeclarationPolicy(false, null);

    private final boolean autoDeclare;
    private final Value defaultValue;

    private DeclarationPolicy(boolean autoDeclare, Value defaultValue) {
        this.autoDeclare = autoDeclare;
        this.defaultValue = defaultValue;
    }

    /**
     * 所有被引用的标识符必须已在初始环境中声明，否则构造失败。
     */
    public static DeclarationPolicy strict() {
        return STRICT;
    }

    /**
     * 缺失标识符以给定的默认值自动声明，不报错。
     */
    public static DeclarationPolicy autoDeclare(Value defaultValue) {
        Objects.requireNonNull(defaultValue, "Default value cannot be null");
        if (!defaultValue.isBool()) {
            throw new IllegalArgumentException("自动声明的默认值必须是布尔值，实际为 " + defaultValue);
        }
        return new DeclarationPolicy(true, defaultValue);
    }

    public boolean isAutoDeclare() {
        return autoDeclare;
    }

    /**
     * @return 自动声明使用的默认值；严格模式下为 null。
     */
    public Value getDefaultValue() {
        return defaultValue;
    }

    @Override
    public String toString() {
        return autoDeclare ? "auto-declare(" + defaultValue + ")" : "strict";
    }
}
