package org.ioautomata.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 语言中的值：布尔字面量或标识符。
 * 只有这两种变体，比较与哈希均按结构进行。
 * 此类是不可变的。
 */
public abstract class Value {

    private static final Logger logger = LoggerFactory.getLogger(Value.class);

    public static final Value TRUE = new Bool(true);
    public static final Value FALSE = new Bool(false);

    private Value() {
    }

    public static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * 工厂方法：创建一个标识符值。
     * @param name 标识符名称，不能为空。
     * @return 对应的 Identifier 实例。
     */
    public static Value identifier(String name) {
        Objects.requireNonNull(name, "Identifier name cannot be null");
        if (name.isEmpty()) {
            logger.error("尝试创建一个空名称的标识符");
            throw new IllegalArgumentException("标识符名称不能为空。");
        }
        return new Identifier(name);
    }

    public abstract boolean isBool();

    public boolean isIdentifier() {
        return !isBool();
    }

    /**
     * 布尔值。
     */
    @Getter
    public static final class Bool extends Value {

        private final boolean value;

        private Bool(boolean value) {
            this.value = value;
        }

        @Override
        public boolean isBool() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return value == ((Bool) o).value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * 标识符，在 {@link Environment} 中解析。
     */
    @Getter
    public static final class Identifier extends Value {

        private final String name;

        private Identifier(String name) {
            this.name = name;
            logger.debug("创建标识符: {}", name);
        }

        @Override
        public boolean isBool() {
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
            return name.equals(((Identifier) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
