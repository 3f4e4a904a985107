package org.ioautomata.automata.models;

import lombok.Getter;
import org.ioautomata.automata.base.Channel;
import org.ioautomata.automata.base.Edge;
import org.ioautomata.automata.base.Location;
import org.ioautomata.core.LangType;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;

/**
 * 自动机构造失败。每种失败原因对应一个子类，携带足以定位问题的上下文。
 * 构造是全有或全无的：抛出此异常时不会得到任何可用的自动机。
 */
@Getter
public abstract class AutomatonException extends Exception {

    private final String automaton;

    protected AutomatonException(String automaton, String message) {
        super("自动机 " + automaton + ": " + message);
        this.automaton = automaton;
    }

    protected AutomatonException(String automaton, String message, Throwable cause) {
        super("自动机 " + automaton + ": " + message, cause);
        this.automaton = automaton;
    }

    public static final class MissingInitialLocation extends AutomatonException {

        public MissingInitialLocation(String automaton) {
            super(automaton, "缺少初始位置");
        }
    }

    @Getter
    public static final class TooManyInitialLocations extends AutomatonException {

        private final transient Set<Location> initials;

        public TooManyInitialLocations(String automaton, Set<Location> initials) {
            super(automaton, "存在多个初始位置 " + initials);
            this.initials = Set.copyOf(initials);
        }
    }

    public static final class EmptyAutomaton extends AutomatonException {

        public EmptyAutomaton(String automaton) {
            super(automaton, "没有任何位置");
        }
    }

    /**
     * 同一通道名既被用作输入又被用作输出。
     */
    @Getter
    public static final class PartitionError extends AutomatonException {

        private final transient Set<Channel> violating;

        public PartitionError(String automaton, Set<Channel> violating) {
            super(automaton, "动作未被划分为输入与输出，冲突的通道为 " + violating);
            this.violating = Set.copyOf(violating);
        }
    }

    @Getter
    public static final class InconsistentInitialLocation extends AutomatonException {

        private final transient Location location;

        public InconsistentInitialLocation(String automaton, Location location) {
            super(automaton, "初始位置 " + location + " 的不变量 " + location.getInvariant() + " 在初始环境下不成立");
            this.location = location;
        }

        public InconsistentInitialLocation(String automaton, Location location, Throwable cause) {
            super(automaton, "初始位置 " + location + " 的不变量 " + location.getInvariant() + " 无法求值", cause);
            this.location = location;
        }
    }

    @Getter
    public static final class MissingIdentifiersInEdgeGuard extends AutomatonException {

        private final transient Edge edge;
        private final List<String> missing;

        public MissingIdentifiersInEdgeGuard(String automaton, Edge edge, List<String> missing) {
            super(automaton, "边 " + edge + " 的守卫 " + edge.getGuard() + " 引用了未声明的标识符 " + missing);
            this.edge = edge;
            this.missing = List.copyOf(missing);
        }
    }

    @Getter
    public static final class EdgeGuardIsNotLogical extends AutomatonException {

        private final transient Edge edge;
        /**
         * 守卫的实际类型；类型检查本身失败时为 null，原因见 {@link #getCause()}。
         */
        private final LangType actual;

        public EdgeGuardIsNotLogical(String automaton, Edge edge, LangType actual) {
            super(automaton, "边 " + edge + " 的守卫不是 " + LangType.LOGICAL + " 而是 " + actual);
            this.edge = edge;
            this.actual = actual;
        }

        public EdgeGuardIsNotLogical(String automaton, Edge edge, Throwable cause) {
            super(automaton, "边 " + edge + " 的守卫类型检查失败: " + cause.getMessage(), cause);
            this.edge = edge;
            this.actual = null;
        }
    }

    @Getter
    public static final class MissingIdentifiersInEdgeUpdate extends AutomatonException {

        private final transient Edge edge;
        private final List<String> missing;

        public MissingIdentifiersInEdgeUpdate(String automaton, Edge edge, List<String> missing) {
            super(automaton, "边 " + edge + " 的更新 " + edge.getUpdate() + " 引用了未声明的标识符 " + missing);
            this.edge = edge;
            this.missing = List.copyOf(missing);
        }
    }

    @Getter
    public static final class EdgeUpdateIsNotVoid extends AutomatonException {

        private final transient Edge edge;
        private final LangType actual;

        public EdgeUpdateIsNotVoid(String automaton, Edge edge, LangType actual) {
            super(automaton, "边 " + edge + " 的更新不是 " + LangType.VOID + " 而是 " + actual);
            this.edge = edge;
            this.actual = actual;
        }
    }

    @Getter
    public static final class MissingIdentifiersInLocationInvariant extends AutomatonException {

        private final transient Location location;
        private final List<String> missing;

        public MissingIdentifiersInLocationInvariant(String automaton, Location location, List<String> missing) {
            super(automaton, "位置 " + location + " 的不变量 " + location.getInvariant() + " 引用了未声明的标识符 " + missing);
            this.location = location;
            this.missing = List.copyOf(missing);
        }
    }

    /**
     * 合取至少需要两个自动机。
     */
    @Getter
    public static final class NotEnoughOperands extends AutomatonException {

        private final int operands;

        public NotEnoughOperands(String automaton, int operands) {
            super(automaton, "合取至少需要两个自动机，实际为 " + operands);
            this.operands = operands;
        }
    }

    /**
     * 参与合取的自动机的变量命名空间相交。
     */
    @Getter
    public static final class OverlappingEnvironments extends AutomatonException {

        private final SortedSet<String> shared;

        public OverlappingEnvironments(String automaton, SortedSet<String> shared) {
            super(automaton, "参与合取的自动机共享标识符 " + shared);
            this.shared = shared;
        }
    }
}
