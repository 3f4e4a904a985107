package org.ioautomata.automata.transition;

import lombok.Getter;
import org.ioautomata.automata.base.Edge;
import org.ioautomata.interpreter.LanguageException;

/**
 * 已使能的边在执行更新时失败。这违反了内部一致性，不能降级为空操作。
 */
@Getter
public class EdgeExecutionException extends IllegalStateException {

    private final transient Edge edge;
    private final transient State state;

    public EdgeExecutionException(Edge edge, State state, LanguageException cause) {
        super("边 " + edge + " 在状态 " + state + " 上执行更新失败: " + cause.getMessage(), cause);
        this.edge = edge;
        this.state = state;
    }
}
