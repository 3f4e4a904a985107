package org.ioautomata.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 同步通道（动作标签）。
 * 通道的身份只由名称决定：同名的输入通道与输出通道是同一个同步通道，
 * 方向只是每条边上的标注。因此 equals/hashCode 只比较名称。
 */
@Getter
public final class Channel implements Comparable<Channel> {

    private static final Logger logger = LoggerFactory.getLogger(Channel.class);

    private final String name;
    private final boolean input;

    private Channel(String name, boolean input) {
        this.name = Objects.requireNonNull(name, "Channel name cannot be null");
        if (name.isEmpty()) {
            logger.error("尝试创建一个空名称的通道");
            throw new IllegalArgumentException("通道名称不能为空。");
        }
        this.input = input;
        logger.debug("创建 Channel: {}", this);
    }

    public static Channel of(String name, boolean isInput) {
        return new Channel(name, isInput);
    }

    public static Channel input(String name) {
        return new Channel(name, true);
    }

    public static Channel output(String name) {
        return new Channel(name, false);
    }

    public boolean isOutput() {
        return !input;
    }

    @Override
    public int compareTo(Channel other) {
        return this.name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((Channel) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + (input ? "?" : "!");
    }
}
