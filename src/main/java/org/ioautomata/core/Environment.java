package org.ioautomata.core;

import lombok.Getter;
import org.ioautomata.expressions.Expression;
import org.ioautomata.expressions.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 标识符到 {@link Value} 的映射，是语言的状态载体。
 * Environment 是不可变对象：insert/set/concat 都返回新的实例。
 * 首次声明 (insert) 不会覆盖已有标识符，更新 (set) 不会隐式声明新标识符。
 */
public final class Environment {

    private static final Logger logger = LoggerFactory.getLogger(Environment.class);

    public static final Environment EMPTY = new Environment(Collections.emptyMap());

    /**
     * 有序存储，保证 toString 与迭代顺序确定。
     */
    @Getter
    private final SortedMap<String, Value> bindings;

    private final int hashCode;

    private Environment(Map<String, Value> bindings) {
        this.bindings = Collections.unmodifiableSortedMap(new TreeMap<>(bindings));
        this.hashCode = Objects.hash(this.bindings);
    }

    public static Environment empty() {
        return EMPTY;
    }

    /**
     * 工厂方法：从 Map 创建 Environment。
     * @param bindings 标识符及其值。
     * @return Environment 实例。
     */
    public static Environment of(Map<String, Value> bindings) {
        Objects.requireNonNull(bindings, "Bindings cannot be null");
        for (Map.Entry<String, Value> entry : bindings.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "Identifier cannot be null");
            Objects.requireNonNull(entry.getValue(), "Value cannot be null");
        }
        logger.debug("创建 Environment: {}", bindings);
        return new Environment(bindings);
    }

    public boolean contains(String identifier) {
        return bindings.containsKey(identifier);
    }

    /**
     * 获取标识符绑定的值。
     * @param identifier 标识符。
     * @return 对应的值，如果不存在则返回 null。
     */
    public Value get(String identifier) {
        return bindings.get(identifier);
    }

    /**
     * 获取标识符绑定的值。
     * @throws IllegalArgumentException 如果标识符未声明。
     */
    public Value getValue(String identifier) {
        if (!contains(identifier)) {
            logger.error("尝试获取不存在的标识符 '{}'，当前环境为 {}", identifier, this);
            throw new IllegalArgumentException("标识符 '" + identifier + "' 不存在于当前环境中。");
        }
        return bindings.get(identifier);
    }

    /**
     * 声明一个新的标识符。
     * @return 包含新绑定的 Environment。
     * @throws IllegalArgumentException 如果标识符已经声明过。
     */
    public Environment insert(String identifier, Value value) {
        Objects.requireNonNull(identifier, "Identifier cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        if (contains(identifier)) {
            logger.error("标识符 '{}' 已经声明，不能重复声明", identifier);
            throw new IllegalArgumentException("标识符 '" + identifier + "' 已经声明。");
        }
        Map<String, Value> next = new HashMap<>(bindings);
        next.put(identifier, value);
        return new Environment(next);
    }

    /**
     * 更新一个已声明的标识符。
     * @return 包含新值的 Environment。
     * @throws IllegalArgumentException 如果标识符未声明。
     */
    public Environment set(String identifier, Value value) {
        Objects.requireNonNull(value, "Value cannot be null");
        if (!contains(identifier)) {
            logger.error("标识符 '{}' 未声明，不能更新", identifier);
            throw new IllegalArgumentException("标识符 '" + identifier + "' 未声明。");
        }
        if (value.equals(bindings.get(identifier))) {
            return this;
        }
        Map<String, Value> next = new HashMap<>(bindings);
        next.put(identifier, value);
        return new Environment(next);
    }

    /**
     * 合并两个互不相交的环境。
     * @throws IllegalArgumentException 如果两个环境存在相同的标识符。
     */
    public Environment concat(Environment other) {
        Objects.requireNonNull(other, "Other environment cannot be null");
        if (!isDisjoint(other)) {
            logger.error("环境 {} 与 {} 不相交性不成立，共享标识符 {}", this, other, sharedIdentifiers(other));
            throw new IllegalArgumentException("环境不相交，共享标识符 " + sharedIdentifiers(other));
        }
        Map<String, Value> next = new HashMap<>(bindings);
        next.putAll(other.bindings);
        return new Environment(next);
    }

    public boolean isDisjoint(Environment other) {
        for (String key : bindings.keySet()) {
            if (other.contains(key)) {
                return false;
            }
        }
        return true;
    }

    public SortedSet<String> sharedIdentifiers(Environment other) {
        SortedSet<String> shared = new TreeSet<>(bindings.keySet());
        shared.retainAll(other.bindings.keySet());
        return shared;
    }

    /**
     * 返回表达式中引用但未在此环境中声明的标识符（去重，保持出现顺序）。
     */
    public List<String> missingIdentifiers(Expression expression) {
        return missing(expression.identifiers());
    }

    public List<String> missingIdentifiers(Statement statement) {
        return missing(statement.identifiers());
    }

    private List<String> missing(List<String> identifiers) {
        return identifiers.stream()
                .filter(identifier -> !contains(identifier))
                .distinct()
                .toList();
    }

    public Set<String> identifiers() {
        return bindings.keySet();
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Environment that = (Environment) o;
        return bindings.equals(that.bindings);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "{" +
                bindings.entrySet().stream()
                        .map(entry -> entry.getKey() + "=" + entry.getValue())
                        .collect(Collectors.joining(", ")) +
                "}";
    }
}
