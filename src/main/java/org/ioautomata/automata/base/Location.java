package org.ioautomata.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 自动机中的位置。变体集合是封闭的，见 {@link LocationType}。
 * <p>
 * Normal/Initial/Inconsistent/Universal 按 (变体, 名称) 比较，不变量不参与比较；
 * Conjunction 按有序的子位置序列比较。
 * 此类是不可变的。
 */
public abstract class Location {

    private static final Logger logger = LoggerFactory.getLogger(Location.class);

    public enum LocationType {
        NORMAL,
        INITIAL,
        CONJUNCTION,
        INCONSISTENT,
        UNIVERSAL
    }

    private Location() {
    }

    public abstract LocationType getType();

    public abstract String getName();

    /**
     * 位置的不变量。Inconsistent 恒为 false，Universal 恒为 true。
     */
    public abstract Invariant getInvariant();

    public boolean isInitial() {
        return getType() == LocationType.INITIAL;
    }

    /**
     * 是否为组合代数中的吸收元（Inconsistent 或 Universal）。
     */
    public boolean isAbsorbing() {
        return switch (getType()) {
            case INCONSISTENT, UNIVERSAL -> true;
            case NORMAL, INITIAL, CONJUNCTION -> false;
        };
    }

    // --- 工厂方法 ---

    public static Location normal(String name, Invariant invariant) {
        return new Normal(name, invariant);
    }

    public static Location normal(String name) {
        return new Normal(name, Invariant.TRUE);
    }

    public static Location initial(String name, Invariant invariant) {
        return new Initial(name, invariant);
    }

    public static Location initial(String name) {
        return new Initial(name, Invariant.TRUE);
    }

    public static Location inconsistent(String name) {
        return new Inconsistent(name);
    }

    public static Location universal(String name) {
        return new Universal(name);
    }

    /**
     * 按吸收代数构造乘积位置：
     * <ul>
     *     <li>任一子位置为 Inconsistent，结果为 Inconsistent；</li>
     *     <li>所有子位置都为 Universal，结果为 Universal；</li>
     *     <li>否则保留非吸收的子位置，不变量为它们不变量的合取。</li>
     * </ul>
     * 子位置的顺序保持不变，不做规范化。
     * @param locations 至少一个子位置。
     * @return 构造得到的位置。
     */
    public static Location conjunction(List<Location> locations) {
        Objects.requireNonNull(locations, "Locations cannot be null");
        if (locations.isEmpty()) {
            logger.error("乘积位置需要至少一个子位置");
            throw new IllegalArgumentException("乘积位置需要至少一个子位置。");
        }
        String name = conjunctionName(locations);
        if (locations.stream().anyMatch(location -> location.getType() == LocationType.INCONSISTENT)) {
            logger.debug("子位置中存在 Inconsistent，乘积 {} 坍缩为 Inconsistent", name);
            return new Inconsistent(name);
        }
        if (locations.stream().allMatch(location -> location.getType() == LocationType.UNIVERSAL)) {
            logger.debug("所有子位置都是 Universal，乘积 {} 为 Universal", name);
            return new Universal(name);
        }
        List<Location> retained = locations.stream()
                .filter(location -> !location.isAbsorbing())
                .toList();
        Set<Invariant> invariants = new LinkedHashSet<>();
        for (Location location : retained) {
            invariants.add(location.getInvariant());
        }
        Invariant invariant = invariants.size() == 1
                ? invariants.iterator().next()
                : Invariant.conjunction(invariants);
        return new Conjunction(retained, invariant);
    }

    private static String conjunctionName(List<Location> locations) {
        return locations.stream().map(Location::getName).collect(Collectors.joining(" && ", "(", ")"));
    }

    /**
     * 带名称与不变量的位置的公共部分。
     */
    private abstract static class Named extends Location {

        @Getter
        private final String name;
        private final int hashCode;

        private Named(String name) {
            this.name = Objects.requireNonNull(name, "Location name cannot be null");
            this.hashCode = Objects.hash(getType(), name);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return name.equals(((Named) o).name);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }
    }

    public static final class Normal extends Named {

        @Getter
        private final Invariant invariant;

        private Normal(String name, Invariant invariant) {
            super(name);
            this.invariant = Objects.requireNonNull(invariant, "Invariant cannot be null");
        }

        @Override
        public LocationType getType() {
            return LocationType.NORMAL;
        }

        @Override
        public String toString() {
            return getName();
        }
    }

    public static final class Initial extends Named {

        @Getter
        private final Invariant invariant;

        private Initial(String name, Invariant invariant) {
            super(name);
            this.invariant = Objects.requireNonNull(invariant, "Invariant cannot be null");
        }

        @Override
        public LocationType getType() {
            return LocationType.INITIAL;
        }

        @Override
        public String toString() {
            return getName();
        }
    }

    public static final class Inconsistent extends Named {

        private Inconsistent(String name) {
            super(name);
        }

        @Override
        public LocationType getType() {
            return LocationType.INCONSISTENT;
        }

        @Override
        public Invariant getInvariant() {
            return Invariant.FALSE;
        }

        @Override
        public String toString() {
            return "⊥" + getName();
        }
    }

    public static final class Universal extends Named {

        private Universal(String name) {
            super(name);
        }

        @Override
        public LocationType getType() {
            return LocationType.UNIVERSAL;
        }

        @Override
        public Invariant getInvariant() {
            return Invariant.TRUE;
        }

        @Override
        public String toString() {
            return "⊤" + getName();
        }
    }

    /**
     * 由若干子位置构成的乘积位置。
     */
    public static final class Conjunction extends Location {

        @Getter
        private final List<Location> locations;
        @Getter
        private final Invariant invariant;
        private final int hashCode;

        private Conjunction(List<Location> locations, Invariant invariant) {
            this.locations = List.copyOf(locations);
            this.invariant = invariant;
            this.hashCode = this.locations.hashCode();
        }

        @Override
        public LocationType getType() {
            return LocationType.CONJUNCTION;
        }

        @Override
        public String getName() {
            return conjunctionName(locations);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return locations.equals(((Conjunction) o).locations);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }

        @Override
        public String toString() {
            return getName();
        }
    }
}
