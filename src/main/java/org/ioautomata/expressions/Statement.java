package org.ioautomata.expressions;

import lombok.Getter;
import org.ioautomata.core.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 语句。目前唯一的变体是赋值 {@code identifier = value}。
 * 左侧必须在求值时得到一个标识符，这一点由解释器检查，构造时不检查。
 * 此类是不可变的。
 */
@Getter
public final class Statement {

    private final Expression identifier;
    private final Expression value;

    private final int hashCode;

    private Statement(Expression identifier, Expression value) {
        this.identifier = Objects.requireNonNull(identifier, "Assignment target cannot be null");
        this.value = Objects.requireNonNull(value, "Assignment value cannot be null");
        this.hashCode = Objects.hash(identifier, value);
    }

    public static Statement assignment(Expression identifier, Expression value) {
        return new Statement(identifier, value);
    }

    /**
     * 工厂方法：{@code name = value}，右侧为字面量。
     */
    public static Statement assign(String name, Value value) {
        return new Statement(Expression.identifier(name), Expression.literal(value));
    }

    public static Statement assign(String name, Expression value) {
        return new Statement(Expression.identifier(name), value);
    }

    public List<String> identifiers() {
        List<String> identifiers = new ArrayList<>(identifier.identifiers());
        identifiers.addAll(value.identifiers());
        return identifiers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Statement that = (Statement) o;
        return identifier.equals(that.identifier) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return identifier + " = " + value;
    }
}
