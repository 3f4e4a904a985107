package org.ioautomata.automata.base;

import lombok.Getter;
import org.ioautomata.automata.transition.EdgeExecutionException;
import org.ioautomata.automata.transition.State;
import org.ioautomata.core.Environment;
import org.ioautomata.expressions.Statement;
import org.ioautomata.interpreter.Interpreter;
import org.ioautomata.interpreter.LanguageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * 自动机的一条边 (source, action, guard, update, target)。
 * 此类是不可变的，端点以值的形式持有，不引用所属的自动机。
 */
@Getter
public final class Edge {

    private static final Logger logger = LoggerFactory.getLogger(Edge.class);

    private final Location source;
    private final Channel action;
    private final Guard guard;
    private final Update update;
    private final Location target;

    private final int hashCode;

    /**
     * @param source 源位置
     * @param action 同步通道
     * @param guard  守卫
     * @param update 更新，{@link Update#NONE} 表示不改变环境
     * @param target 目标位置
     */
    public Edge(Location source, Channel action, Guard guard, Update update, Location target) {
        this.source = Objects.requireNonNull(source, "Source location cannot be null.");
        this.action = Objects.requireNonNull(action, "Action cannot be null.");
        this.guard = Objects.requireNonNull(guard, "Guard cannot be null.");
        this.update = Objects.requireNonNull(update, "Update cannot be null.");
        this.target = Objects.requireNonNull(target, "Target location cannot be null.");
        this.hashCode = Objects.hash(source, action, guard, update, target);
    }

    /**
     * 工厂方法：自环边。
     */
    public static Edge loop(Location location, Channel action, Guard guard, Update update) {
        return new Edge(location, action, guard, update, location);
    }

    /**
     * 判断此边在给定状态下是否使能。
     * 守卫求值失败（例如未知标识符）视为未使能，不会向调用者抛出。
     * 需要区分“未使能”与“守卫求值失败”的调用者应使用 {@link #checkEnabled(State)}。
     */
    public boolean enabled(State state) {
        try {
            return checkEnabled(state);
        } catch (LanguageException e) {
            logger.warn("边 {} 的守卫在 {} 上求值失败，视为未使能: {}", this, state, e.getMessage());
            return false;
        }
    }

    /**
     * 判断此边在给定状态下是否使能，守卫求值失败时抛出异常。
     * @throws LanguageException 如果守卫无法求值。
     */
    public boolean checkEnabled(State state) throws LanguageException {
        Objects.requireNonNull(state, "State cannot be null.");
        if (!source.equals(state.getLocation())) {
            return false;
        }
        return new Interpreter(state.getEnvironment()).evaluate(guard.getExpression()).isTrue();
    }

    /**
     * 执行此边，得到位于 target 的新状态。
     * 更新存在时，在状态的环境上运行它得到新环境；否则环境保持不变。
     * @throws EdgeExecutionException 如果更新求值失败。对已确认使能的边这是内部一致性错误。
     */
    public State execute(State state) {
        Objects.requireNonNull(state, "State cannot be null.");
        Optional<Statement> statement = update.getStatement();
        if (statement.isEmpty()) {
            return new State(target, state.getEnvironment());
        }
        Interpreter interpreter = new Interpreter(state.getEnvironment());
        try {
            interpreter.execute(statement.get());
        } catch (LanguageException e) {
            logger.error("边 {} 的更新在 {} 上执行失败", this, state, e);
            throw new EdgeExecutionException(this, state, e);
        }
        Environment next = interpreter.getEnvironment();
        return new State(target, next);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Edge that = (Edge) o;
        return source.equals(that.source) &&
                action.equals(that.action) &&
                guard.equals(that.guard) &&
                update.equals(that.update) &&
                target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("%s -(%s, %s, %s)-> %s",
                source.getName(),
                action,
                guard,
                update,
                target.getName());
    }
}
