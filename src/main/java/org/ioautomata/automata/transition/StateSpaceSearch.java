package org.ioautomata.automata.transition;

import org.ioautomata.automata.base.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * 惰性、可重启的状态空间枚举器。
 * <p>
 * 从迁移系统的初始状态出发，只沿动作属于给定子集的边前进，每个可达状态恰好产出一次。
 * 状态在被发现（加入 frontier）时即标记为已发现，已发现集合按状态的值比较，
 * 因此同一位置上环境不同的状态是不同的状态。
 * <p>
 * 每次 {@link #next()} 取出一个 frontier 中的状态，展开其后继后返回它。
 * 调用者可以在任意一次 {@code next()} 之后停止，从而自行限制探索规模。
 * 只有当可达状态空间有限时搜索才会终止。
 */
public final class StateSpaceSearch implements Iterator<State> {

    private static final Logger logger = LoggerFactory.getLogger(StateSpaceSearch.class);

    private final TransitionSystem system;
    private final Set<Channel> actions;
    private final SearchOrder order;

    private final Set<State> discovered = new LinkedHashSet<>();
    private final Deque<State> frontier = new ArrayDeque<>();
    private boolean started;

    public StateSpaceSearch(TransitionSystem system, Set<Channel> actions) {
        this(system, actions, SearchOrder.BREADTH_FIRST);
    }

    public StateSpaceSearch(TransitionSystem system, Set<Channel> actions, SearchOrder order) {
        this.system = Objects.requireNonNull(system, "Transition system cannot be null.");
        this.actions = Set.copyOf(Objects.requireNonNull(actions, "Actions cannot be null."));
        this.order = Objects.requireNonNull(order, "Search order cannot be null.");
    }

    /**
     * 枚举给定动作子集下的全部可达状态（广度优先发现顺序）。
     */
    public static Set<State> reachable(TransitionSystem system, Set<Channel> actions) {
        StateSpaceSearch search = new StateSpaceSearch(system, actions);
        Set<State> states = new LinkedHashSet<>();
        while (search.hasNext()) {
            states.add(search.next());
        }
        logger.debug("{} 在动作 {} 下共有 {} 个可达状态", system.getName(), actions, states.size());
        return states;
    }

    @Override
    public boolean hasNext() {
        start();
        return !frontier.isEmpty();
    }

    @Override
    public State next() {
        start();
        if (frontier.isEmpty()) {
            throw new NoSuchElementException("状态空间已遍历完毕");
        }
        State state = order == SearchOrder.BREADTH_FIRST ? frontier.peekFirst() : frontier.peekLast();
        // 后继计算失败时状态留在 frontier 中，搜索可以继续
        List<State> successors = system.successors(state, actions);
        if (order == SearchOrder.BREADTH_FIRST) {
            frontier.pollFirst();
        } else {
            frontier.pollLast();
        }
        for (State successor : successors) {
            if (discovered.add(successor)) {
                frontier.addLast(successor);
            }
        }
        logger.debug("访问 {}，frontier 大小 {}", state, frontier.size());
        return state;
    }

    /**
     * 重新从初始状态开始搜索。
     */
    public void reset() {
        discovered.clear();
        frontier.clear();
        started = false;
    }

    /**
     * 目前已发现的状态（包括尚在 frontier 中未产出的）。
     */
    public Set<State> getDiscovered() {
        return Collections.unmodifiableSet(discovered);
    }

    public SearchOrder getOrder() {
        return order;
    }

    private void start() {
        if (started) {
            return;
        }
        started = true;
        State initial = system.getInitialState();
        discovered.add(initial);
        frontier.addLast(initial);
    }
}
