package org.ioautomata.automata.transition;

import org.ioautomata.automata.base.Channel;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 可前向与后向单步执行的迁移系统，所有操作都限制在给定的动作子集上。
 * {@link StateSpaceSearch} 可以在任何实现上枚举可达状态。
 */
public interface TransitionSystem {

    String getName();

    State getInitialState();

    Set<Channel> getActions();

    Set<Channel> getInputs();

    Set<Channel> getOutputs();

    /**
     * 从给定状态出发，经一条动作属于 actions 且已使能的边可以到达的所有状态。
     */
    List<State> successors(State state, Set<Channel> actions);

    /**
     * 可达状态中，经一条动作属于 actions 的已使能边可以到达给定状态所在位置的那些状态。
     * 守卫的满足与环境有关，因此不能只看图结构：结构上的前驱位置里未必有可达状态能触发连接它们的边。
     */
    List<State> predecessors(State state, Set<Channel> actions);

    /**
     * 多个目标状态的前驱之并，去重并保持发现顺序。
     */
    default List<State> predecessors(Collection<State> states, Set<Channel> actions) {
        Set<State> result = new LinkedHashSet<>();
        for (State state : states) {
            result.addAll(predecessors(state, actions));
        }
        return List.copyOf(result);
    }

    default List<State> inputSuccessors(State state) {
        return successors(state, getInputs());
    }

    default List<State> outputSuccessors(State state) {
        return successors(state, getOutputs());
    }

    default List<State> inputPredecessors(State state) {
        return predecessors(state, getInputs());
    }

    default List<State> outputPredecessors(State state) {
        return predecessors(state, getOutputs());
    }
}
