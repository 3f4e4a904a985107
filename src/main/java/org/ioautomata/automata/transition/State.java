package org.ioautomata.automata.transition;

import lombok.Getter;
import org.ioautomata.automata.base.Edge;
import org.ioautomata.automata.base.Location;
import org.ioautomata.core.Environment;

import java.util.Collection;
import java.util.Objects;

/**
 * 自动机行为中的一个点 (location, environment)。
 * 状态由边的执行函数式地产生，从不原地修改。比较按位置与环境的值进行。
 */
@Getter
public class State {

    private final Location location;
    private final Environment environment;

    public State(Location location, Environment environment) {
        this.location = Objects.requireNonNull(location, "Location cannot be null.");
        this.environment = Objects.requireNonNull(environment, "Environment cannot be null.");
    }

    /**
     * 是否至少使能给定边中的一条。
     */
    public boolean enablesAny(Collection<Edge> edges) {
        for (Edge edge : edges) {
            if (edge.enabled(this)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State that = (State) o;
        return location.equals(that.location) &&
                environment.equals(that.environment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, environment);
    }

    @Override
    public String toString() {
        return "State(" + location.getName() + ", " + environment + ")";
    }
}
