package org.ioautomata.automata.models;

import lombok.Getter;
import org.ioautomata.automata.base.Channel;
import org.ioautomata.automata.base.Edge;
import org.ioautomata.automata.base.Location;
import org.ioautomata.automata.transition.State;
import org.ioautomata.automata.transition.StateSpaceSearch;
import org.ioautomata.automata.transition.TransitionSystem;
import org.ioautomata.core.Environment;
import org.ioautomata.core.Evaluation;
import org.ioautomata.core.LangType;
import org.ioautomata.expressions.Expression;
import org.ioautomata.expressions.Statement;
import org.ioautomata.interpreter.Interpreter;
import org.ioautomata.interpreter.LanguageException;
import org.ioautomata.interpreter.TypeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 带守卫、输入/输出标注的自动机。
 * <p>
 * 只能通过校验工厂方法 {@link #of} 创建，创建后不可变，所有后续操作都是纯查询。
 * 对任何存活的 Automaton 实例，以下性质总是成立：
 * <ul>
 *     <li>位置集合恰好是所有边的端点；</li>
 *     <li>输入与输出按通道名不相交；</li>
 *     <li>边集合非空；</li>
 *     <li>恰好有一个 Initial 位置，且其不变量在初始环境下为 true；</li>
 *     <li>守卫、更新与不变量引用的标识符都已在初始环境中声明。</li>
 * </ul>
 */
@Getter
public final class Automaton implements TransitionSystem {

    private static final Logger logger = LoggerFactory.getLogger(Automaton.class);

    private final String name;
    private final Set<Edge> edges;
    private final Set<Location> locations;
    private final Set<Channel> actions;
    private final Set<Channel> inputs;
    private final Set<Channel> outputs;
    private final Location initialLocation;
    private final Environment initialEnvironment;

    private Automaton(String name, Set<Edge> edges, Set<Location> locations, Set<Channel> actions,
                      Set<Channel> inputs, Set<Channel> outputs, Location initialLocation,
                      Environment initialEnvironment) {
        this.name = name;
        this.edges = Collections.unmodifiableSet(new LinkedHashSet<>(edges));
        this.locations = Collections.unmodifiableSet(new LinkedHashSet<>(locations));
        this.actions = Collections.unmodifiableSet(new LinkedHashSet<>(actions));
        this.inputs = Collections.unmodifiableSet(new LinkedHashSet<>(inputs));
        this.outputs = Collections.unmodifiableSet(new LinkedHashSet<>(outputs));
        this.initialLocation = initialLocation;
        this.initialEnvironment = initialEnvironment;
    }

    /**
     * 自动声明模式：守卫、更新、不变量中引用的未声明标识符以 false 声明。
     */
    public static Automaton of(String name, Set<Edge> edges) throws AutomatonException {
        return of(name, edges, Environment.empty(), DeclarationPolicy.AUTO_DECLARE_FALSE);
    }

    /**
     * 严格模式：所有被引用的标识符必须已在 environment 中声明。
     */
    public static Automaton of(String name, Set<Edge> edges, Environment environment) throws AutomatonException {
        return of(name, edges, environment, DeclarationPolicy.strict());
    }

    /**
     * 校验边集合并构造自动机。第一个失败的检查决定抛出的异常。
     * <ol>
     *     <li>收集动作并按每条边的方向划分为输入/输出；</li>
     *     <li>逐条边检查守卫与更新的标识符声明与类型；</li>
     *     <li>从边的端点导出位置，检查不变量的标识符声明；</li>
     *     <li>输入与输出必须不相交；</li>
     *     <li>位置集合非空；</li>
     *     <li>恰好一个 Initial 位置；</li>
     *     <li>初始位置的不变量在最终环境下为 true。</li>
     * </ol>
     *
     * @param name        自动机名称。
     * @param edges       边集合。
     * @param environment 初始环境。
     * @param policy      未声明标识符的处理策略。
     * @return 校验通过的自动机。
     * @throws AutomatonException 描述第一个失败原因。
     */
    public static Automaton of(String name, Set<Edge> edges, Environment environment, DeclarationPolicy policy)
            throws AutomatonException {
        Objects.requireNonNull(name, "Automaton name cannot be null.");
        Objects.requireNonNull(edges, "Edges cannot be null.");
        Objects.requireNonNull(environment, "Environment cannot be null.");
        Objects.requireNonNull(policy, "Declaration policy cannot be null.");

        Declarations declarations = new Declarations(name, environment, policy);
        Set<Channel> actions = new LinkedHashSet<>();
        Set<Channel> inputs = new LinkedHashSet<>();
        Set<Channel> outputs = new LinkedHashSet<>();

        for (Edge edge : edges) {
            Channel action = edge.getAction();
            actions.add(action);
            if (action.isInput()) {
                inputs.add(action);
            } else {
                outputs.add(action);
            }

            List<String> missing = declarations.declare(edge.getGuard().getExpression());
            if (!missing.isEmpty()) {
                logger.error("自动机 {} 的边 {} 的守卫引用了未声明的标识符 {}", name, edge, missing);
                throw new AutomatonException.MissingIdentifiersInEdgeGuard(name, edge, missing);
            }
            LangType guardType;
            try {
                guardType = new TypeChecker(declarations.environment).check(edge.getGuard().getExpression());
            } catch (LanguageException e) {
                logger.error("自动机 {} 的边 {} 的守卫类型检查失败", name, edge, e);
                throw new AutomatonException.EdgeGuardIsNotLogical(name, edge, e);
            }
            if (guardType != LangType.LOGICAL) {
                throw new AutomatonException.EdgeGuardIsNotLogical(name, edge, guardType);
            }

            Optional<Statement> update = edge.getUpdate().getStatement();
            if (update.isPresent()) {
                missing = declarations.declare(update.get());
                if (!missing.isEmpty()) {
                    logger.error("自动机 {} 的边 {} 的更新引用了未声明的标识符 {}", name, edge, missing);
                    throw new AutomatonException.MissingIdentifiersInEdgeUpdate(name, edge, missing);
                }
                LangType updateType = new TypeChecker(declarations.environment).check(update.get());
                if (updateType != LangType.VOID) {
                    throw new AutomatonException.EdgeUpdateIsNotVoid(name, edge, updateType);
                }
            }
        }

        Set<Location> locations = new LinkedHashSet<>();
        for (Edge edge : edges) {
            locations.add(edge.getSource());
            locations.add(edge.getTarget());
        }

        Deque<Location> worklist = new ArrayDeque<>(locations);
        while (!worklist.isEmpty()) {
            Location current = worklist.pop();
            switch (current.getType()) {
                case NORMAL, INITIAL -> {
                    List<String> missing = declarations.declare(current.getInvariant().getExpression());
                    if (!missing.isEmpty()) {
                        logger.error("自动机 {} 的位置 {} 的不变量引用了未声明的标识符 {}", name, current, missing);
                        throw new AutomatonException.MissingIdentifiersInLocationInvariant(name, current, missing);
                    }
                }
                case CONJUNCTION -> worklist.addAll(((Location.Conjunction) current).getLocations());
                // 吸收元没有需要声明的标识符
                case INCONSISTENT, UNIVERSAL -> {
                }
            }
        }

        Set<Channel> violating = new LinkedHashSet<>(inputs);
        violating.retainAll(outputs);
        if (!violating.isEmpty()) {
            logger.error("自动机 {} 的动作未被划分，冲突通道 {}", name, violating);
            throw new AutomatonException.PartitionError(name, violating);
        }

        if (locations.isEmpty()) {
            logger.error("自动机 {} 没有任何位置", name);
            throw new AutomatonException.EmptyAutomaton(name);
        }

        Set<Location> initials = new LinkedHashSet<>();
        for (Location location : locations) {
            if (location.isInitial()) {
                initials.add(location);
            }
        }
        if (initials.isEmpty()) {
            logger.error("自动机 {} 缺少初始位置", name);
            throw new AutomatonException.MissingInitialLocation(name);
        }
        if (initials.size() > 1) {
            logger.error("自动机 {} 存在多个初始位置 {}", name, initials);
            throw new AutomatonException.TooManyInitialLocations(name, initials);
        }

        Location initial = initials.iterator().next();
        Environment initialEnvironment = declarations.environment;
        Evaluation evaluation;
        try {
            evaluation = new Interpreter(initialEnvironment).evaluate(initial.getInvariant().getExpression());
        } catch (LanguageException e) {
            logger.error("自动机 {} 的初始位置 {} 的不变量无法求值", name, initial, e);
            throw new AutomatonException.InconsistentInitialLocation(name, initial, e);
        }
        if (!evaluation.isTrue()) {
            logger.error("自动机 {} 的初始位置 {} 的不变量在 {} 下不成立", name, initial, initialEnvironment);
            throw new AutomatonException.InconsistentInitialLocation(name, initial);
        }

        Automaton automaton = new Automaton(name, edges, locations, actions, inputs, outputs, initial, initialEnvironment);
        logger.info("创建自动机 {}: {} 个位置, {} 条边, 输入 {}, 输出 {}, 初始环境 {}",
                name, locations.size(), edges.size(), inputs, outputs, initialEnvironment);
        return automaton;
    }

    // --- 结构查询（只看拓扑，与守卫无关）---

    /**
     * 以 location 为目标且动作属于 actions 的边。
     */
    public List<Edge> ingoingEdges(Location location, Set<Channel> actions) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getTarget().equals(location) && actions.contains(edge.getAction())) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * 以 location 为源且动作属于 actions 的边。
     */
    public List<Edge> outgoingEdges(Location location, Set<Channel> actions) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getSource().equals(location) && actions.contains(edge.getAction())) {
                result.add(edge);
            }
        }
        return result;
    }

    public Set<Location> precedingLocations(Location location, Set<Channel> actions) {
        Set<Location> result = new LinkedHashSet<>();
        for (Edge edge : ingoingEdges(location, actions)) {
            result.add(edge.getSource());
        }
        return result;
    }

    public Set<Location> succeedingLocations(Location location, Set<Channel> actions) {
        Set<Location> result = new LinkedHashSet<>();
        for (Edge edge : outgoingEdges(location, actions)) {
            result.add(edge.getTarget());
        }
        return result;
    }

    // --- 迁移系统 ---

    @Override
    public State getInitialState() {
        return new State(initialLocation, initialEnvironment);
    }

    @Override
    public List<State> successors(State state, Set<Channel> actions) {
        List<State> result = new ArrayList<>();
        for (Edge edge : outgoingEdges(state.getLocation(), actions)) {
            if (edge.enabled(state)) {
                result.add(edge.execute(state));
            }
        }
        return result;
    }

    /**
     * 分三步计算前驱：
     * 先找出目标位置在 actions 下的结构前驱位置，再枚举同一动作子集下的全部可达状态，
     * 最后保留位于前驱位置且确实使能一条通往目标位置的边的那些可达状态。
     */
    @Override
    public List<State> predecessors(State state, Set<Channel> actions) {
        Set<Location> preceding = precedingLocations(state.getLocation(), actions);
        if (preceding.isEmpty()) {
            return List.of();
        }
        List<Edge> connecting = ingoingEdges(state.getLocation(), actions);
        List<State> result = new ArrayList<>();
        for (State reachable : StateSpaceSearch.reachable(this, actions)) {
            if (preceding.contains(reachable.getLocation()) && reachable.enablesAny(connecting)) {
                result.add(reachable);
            }
        }
        logger.debug("{} 在动作 {} 下的前驱为 {}", state, actions, result);
        return result;
    }

    @Override
    public String toString() {
        return "Automaton(name='" + name + "', initial=" + initialLocation.getName() + ")";
    }

    /**
     * 构造过程中的工作环境，按策略处理缺失标识符。
     */
    private static final class Declarations {

        private final String automaton;
        private final DeclarationPolicy policy;
        private Environment environment;

        private Declarations(String automaton, Environment environment, DeclarationPolicy policy) {
            this.automaton = automaton;
            this.environment = environment;
            this.policy = policy;
        }

        private List<String> declare(Expression expression) {
            return declareMissing(environment.missingIdentifiers(expression));
        }

        private List<String> declare(Statement statement) {
            return declareMissing(environment.missingIdentifiers(statement));
        }

        /**
         * 自动声明模式下补齐缺失的标识符并返回空列表；严格模式下原样返回缺失的标识符。
         */
        private List<String> declareMissing(List<String> missing) {
            if (missing.isEmpty() || !policy.isAutoDeclare()) {
                return missing;
            }
            for (String identifier : missing) {
                environment = environment.insert(identifier, policy.getDefaultValue());
            }
            logger.debug("自动机 {} 自动声明标识符 {} = {}", automaton, missing, policy.getDefaultValue());
            return List.of();
        }
    }
}
