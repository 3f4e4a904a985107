package org.ioautomata.automata.base;

import org.ioautomata.expressions.Statement;

import java.util.Objects;
import java.util.Optional;

/**
 * 边上的更新：可选的 Void 类型语句。
 * {@link #NONE} 表示不改变环境的迁移。
 */
public final class Update {

    public static final Update NONE = new Update(null);

    private final Statement statement;

    private Update(Statement statement) {
        this.statement = statement;
    }

    public static Update of(Statement statement) {
        return new Update(Objects.requireNonNull(statement, "Update statement cannot be null, use Update.NONE"));
    }

    public Optional<Statement> getStatement() {
        return Optional.ofNullable(statement);
    }

    public boolean isNone() {
        return statement == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(statement, ((Update) o).statement);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(statement);
    }

    @Override
    public String toString() {
        return statement == null ? "void" : statement.toString();
    }
}
