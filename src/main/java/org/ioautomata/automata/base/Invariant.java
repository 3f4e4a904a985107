package org.ioautomata.automata.base;

import lombok.Getter;
import org.ioautomata.expressions.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 位置上的不变量：一个必须为 Logical 类型的表达式，约束哪些环境可以停留在该位置。
 * 此类是不可变的。
 */
@Getter
public final class Invariant {

    private static final Logger logger = LoggerFactory.getLogger(Invariant.class);

    public static final Invariant TRUE = new Invariant(Expression.bool(true));
    public static final Invariant FALSE = new Invariant(Expression.bool(false));

    private final Expression expression;

    private Invariant(Expression expression) {
        this.expression = Objects.requireNonNull(expression, "Invariant expression cannot be null");
    }

    public static Invariant of(Expression expression) {
        return new Invariant(expression);
    }

    /**
     * n 元合取：把多个不变量左折叠为 {@code (i1) && (i2) && ...}。
     * @param invariants 至少两个不变量。
     * @return 合取后的新 Invariant。
     * @throws IllegalArgumentException 如果操作数少于两个。
     */
    public static Invariant conjunction(Collection<Invariant> invariants) {
        Objects.requireNonNull(invariants, "Invariants cannot be null");
        if (invariants.size() < 2) {
            logger.error("不变量合取需要至少两个操作数，实际为 {}", invariants.size());
            throw new IllegalArgumentException("不变量合取需要至少两个操作数。");
        }
        Iterator<Invariant> iterator = invariants.iterator();
        Expression result = operand(iterator.next());
        while (iterator.hasNext()) {
            result = Expression.and(result, operand(iterator.next()));
        }
        logger.debug("合取 {} 个不变量得到 {}", invariants.size(), result);
        return new Invariant(result);
    }

    public static Invariant conjunction(Invariant first, Invariant second, Invariant... rest) {
        List<Invariant> all = new ArrayList<>(List.of(first, second));
        all.addAll(List.of(rest));
        return conjunction(all);
    }

    private static Expression operand(Invariant invariant) {
        Expression expression = invariant.getExpression();
        if (expression instanceof Expression.Binary) {
            return Expression.parenthesized(expression);
        }
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return expression.equals(((Invariant) o).expression);
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
