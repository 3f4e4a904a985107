package org.ioautomata.automata.transition;

import lombok.Getter;
import org.ioautomata.automata.base.Location;
import org.ioautomata.core.Environment;

import java.util.List;
import java.util.Objects;

/**
 * 乘积迁移系统中的状态。
 * <p>
 * 除了按吸收代数合成的乘积位置外，还保留每个参与者各自所在的位置。
 * 合成时吸收元会从乘积位置中消失，只有分量序列能还原每个参与者的进度。
 */
@Getter
public final class ConjunctionState extends State {

    private final List<Location> components;

    public ConjunctionState(List<Location> components, Environment environment) {
        super(Location.conjunction(Objects.requireNonNull(components, "Components cannot be null.")), environment);
        this.components = List.copyOf(components);
    }

    public Location getComponent(int index) {
        return components.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        return components.equals(((ConjunctionState) o).components);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + components.hashCode();
    }

    @Override
    public String toString() {
        return "ConjunctionState(" + components + ", " + getEnvironment() + ")";
    }
}
