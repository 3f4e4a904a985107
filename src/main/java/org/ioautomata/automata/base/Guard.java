package org.ioautomata.automata.base;

import lombok.Getter;
import org.ioautomata.expressions.Expression;

import java.util.Objects;

/**
 * 边上的守卫：一个必须为 Logical 类型的表达式。
 */
@Getter
public final class Guard {

    public static final Guard TRUE = new Guard(Expression.bool(true));
    public static final Guard FALSE = new Guard(Expression.bool(false));

    private final Expression expression;

    private Guard(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "Guard expression cannot be null");
    }

    public static Guard of(Expression expression) {
        return new Guard(expression);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return expression.equals(((Guard) o).expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression.toString();
    }
}
