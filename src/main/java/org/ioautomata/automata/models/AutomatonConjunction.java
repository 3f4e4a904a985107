package org.ioautomata.automata.models;

import lombok.Getter;
import org.ioautomata.automata.base.Channel;
import org.ioautomata.automata.base.Edge;
import org.ioautomata.automata.base.Location;
import org.ioautomata.automata.transition.ConjunctionState;
import org.ioautomata.automata.transition.State;
import org.ioautomata.automata.transition.StateSpaceSearch;
import org.ioautomata.automata.transition.TransitionSystem;
import org.ioautomata.core.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 若干自动机的合取（规格论意义上的组合）。
 * <p>
 * 参与者在共同的动作上同步：对某个动作，字母表中含有它的每个参与者都必须走一条使能的边，
 * 其余参与者原地不动。处于 Universal 位置的参与者接受任何动作并停留原地，
 * 乘积位置坍缩为 Inconsistent 后没有任何后继。
 * <p>
 * 与普通的并行组合不同，同一通道名不允许在一个参与者中是输入而在另一个参与者中是输出。
 */
@Getter
public final class AutomatonConjunction implements TransitionSystem {

    private static final Logger logger = LoggerFactory.getLogger(AutomatonConjunction.class);

    private final String name;
    private final List<Automaton> operands;
    private final Set<Channel> actions;
    private final Set<Channel> inputs;
    private final Set<Channel> outputs;
    private final ConjunctionState initialState;

    private AutomatonConjunction(String name, List<Automaton> operands, Set<Channel> inputs,
                                 Set<Channel> outputs, ConjunctionState initialState) {
        this.name = name;
        this.operands = List.copyOf(operands);
        this.inputs = Collections.unmodifiableSet(new LinkedHashSet<>(inputs));
        this.outputs = Collections.unmodifiableSet(new LinkedHashSet<>(outputs));
        Set<Channel> all = new LinkedHashSet<>(inputs);
        all.addAll(outputs);
        this.actions = Collections.unmodifiableSet(all);
        this.initialState = initialState;
    }

    public static AutomatonConjunction of(Automaton... automata) throws AutomatonException {
        return of(Arrays.asList(automata));
    }

    /**
     * 校验并构造合取：
     * <ol>
     *     <li>至少两个参与者；</li>
     *     <li>任一通道名不能同时是某参与者的输入与另一参与者的输出；</li>
     *     <li>参与者的初始环境两两不相交，合并后作为乘积的初始环境。</li>
     * </ol>
     * 初始位置是各参与者初始位置按吸收代数合成的乘积位置。
     *
     * @throws AutomatonException 描述第一个失败原因。
     */
    public static AutomatonConjunction of(List<Automaton> automata) throws AutomatonException {
        Objects.requireNonNull(automata, "Automata cannot be null.");
        String name = automata.stream().map(Automaton::getName).collect(Collectors.joining(" && "));
        if (automata.size() < 2) {
            logger.error("合取 {} 只有 {} 个参与者", name, automata.size());
            throw new AutomatonException.NotEnoughOperands(name, automata.size());
        }

        Set<Channel> inputs = new LinkedHashSet<>();
        Set<Channel> outputs = new LinkedHashSet<>();
        for (Automaton automaton : automata) {
            inputs.addAll(automaton.getInputs());
            outputs.addAll(automaton.getOutputs());
        }
        // 通道按名称比较，交集即同名的输入/输出
        Set<Channel> violating = new LinkedHashSet<>(inputs);
        violating.retainAll(outputs);
        if (!violating.isEmpty()) {
            logger.error("合取 {} 的动作未被划分，冲突通道 {}", name, violating);
            throw new AutomatonException.PartitionError(name, violating);
        }

        Environment environment = Environment.empty();
        List<Location> initials = new ArrayList<>();
        for (Automaton automaton : automata) {
            Environment next = automaton.getInitialEnvironment();
            if (!environment.isDisjoint(next)) {
                SortedSet<String> shared = environment.sharedIdentifiers(next);
                logger.error("合取 {} 的参与者 {} 与之前的参与者共享标识符 {}", name, automaton.getName(), shared);
                throw new AutomatonException.OverlappingEnvironments(name, shared);
            }
            environment = environment.concat(next);
            initials.add(automaton.getInitialLocation());
        }

        ConjunctionState initial = new ConjunctionState(initials, environment);
        logger.info("创建合取 {}: 初始位置 {}, 输入 {}, 输出 {}, 初始环境 {}",
                name, initial.getLocation(), inputs, outputs, environment);
        return new AutomatonConjunction(name, automata, inputs, outputs, initial);
    }

    public Location getInitialLocation() {
        return initialState.getLocation();
    }

    @Override
    public List<State> successors(State state, Set<Channel> actions) {
        ConjunctionState product = asProduct(state);
        if (product.getLocation().getType() == Location.LocationType.INCONSISTENT) {
            return List.of();
        }
        Set<State> result = new LinkedHashSet<>();
        for (Channel action : this.actions) {
            if (!actions.contains(action)) {
                continue;
            }
            for (Step step : synchronise(product, action)) {
                result.add(new ConjunctionState(step.components, step.environment));
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * 可达的乘积状态中，在 actions 下存在一个后继位于给定状态所在位置的那些状态。
     */
    @Override
    public List<State> predecessors(State state, Set<Channel> actions) {
        Location target = state.getLocation();
        List<State> result = new ArrayList<>();
        for (State reachable : StateSpaceSearch.reachable(this, actions)) {
            for (State successor : successors(reachable, actions)) {
                if (successor.getLocation().equals(target)) {
                    result.add(reachable);
                    break;
                }
            }
        }
        logger.debug("{} 在动作 {} 下的前驱为 {}", state, actions, result);
        return result;
    }

    /**
     * 所有参与者在 action 上的联合一步，返回全部组合。
     * 守卫在步前的环境上求值，更新按参与者顺序依次作用于合并后的环境。
     */
    private List<Step> synchronise(ConjunctionState product, Channel action) {
        Environment before = product.getEnvironment();
        List<Step> partial = List.of(new Step(List.of(), before));
        for (int i = 0; i < operands.size(); i++) {
            Automaton operand = operands.get(i);
            Location component = product.getComponent(i);
            if (component.getType() == Location.LocationType.UNIVERSAL || !operand.getActions().contains(action)) {
                partial = partial.stream().map(step -> step.then(component, step.environment)).toList();
                continue;
            }
            State local = new State(component, before);
            List<Edge> enabled = operand.outgoingEdges(component, Set.of(action)).stream()
                    .filter(edge -> edge.enabled(local))
                    .toList();
            if (enabled.isEmpty()) {
                return List.of();
            }
            List<Step> extended = new ArrayList<>();
            for (Step step : partial) {
                for (Edge edge : enabled) {
                    State moved = edge.execute(new State(component, step.environment));
                    extended.add(step.then(moved.getLocation(), moved.getEnvironment()));
                }
            }
            partial = extended;
        }
        return partial;
    }

    private ConjunctionState asProduct(State state) {
        Objects.requireNonNull(state, "State cannot be null.");
        if (!(state instanceof ConjunctionState product) || product.getComponents().size() != operands.size()) {
            logger.error("{} 不是合取 {} 的乘积状态", state, name);
            throw new IllegalArgumentException("状态 " + state + " 不是合取 " + name + " 的乘积状态。");
        }
        return product;
    }

    @Override
    public String toString() {
        return "AutomatonConjunction(name='" + name + "', operands=" + operands.size() + ")";
    }

    /**
     * 联合一步的中间结果：已处理参与者的新位置与当前环境。
     */
    private static final class Step {

        private final List<Location> components;
        private final Environment environment;

        private Step(List<Location> components, Environment environment) {
            this.components = components;
            this.environment = environment;
        }

        private Step then(Location component, Environment next) {
            List<Location> extended = new ArrayList<>(components);
            extended.add(component);
            return new Step(extended, next);
        }
    }
}
