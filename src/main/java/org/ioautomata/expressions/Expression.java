package org.ioautomata.expressions;

import lombok.Getter;
import org.ioautomata.core.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 嵌入式逻辑语言的表达式树。
 * 变体集合是封闭的：Literal、Parenthesized、Binary、Unary，每个节点独占其子节点。
 * 此类是不可变的，比较与哈希按结构进行。
 */
public abstract class Expression {

    private Expression() {
    }

    public abstract <R, E extends Exception> R accept(ExpressionVisitor<R, E> visitor) throws E;

    // --- 工厂方法 ---

    public static Expression literal(Value value) {
        return new Literal(value);
    }

    public static Expression bool(boolean value) {
        return new Literal(Value.of(value));
    }

    public static Expression identifier(String name) {
        return new Literal(Value.identifier(name));
    }

    public static Expression parenthesized(Expression expression) {
        return new Parenthesized(expression);
    }

    public static Expression binary(Expression lhs, BinaryOperator operator, Expression rhs) {
        return new Binary(lhs, operator, rhs);
    }

    public static Expression unary(UnaryOperator operator, Expression operand) {
        return new Unary(operator, operand);
    }

    public static Expression and(Expression lhs, Expression rhs) {
        return binary(lhs, BinaryOperator.AND, rhs);
    }

    public static Expression or(Expression lhs, Expression rhs) {
        return binary(lhs, BinaryOperator.OR, rhs);
    }

    public static Expression equal(Expression lhs, Expression rhs) {
        return binary(lhs, BinaryOperator.EQUAL, rhs);
    }

    public static Expression notEqual(Expression lhs, Expression rhs) {
        return binary(lhs, BinaryOperator.NOT_EQUAL, rhs);
    }

    public static Expression implies(Expression lhs, Expression rhs) {
        return binary(lhs, BinaryOperator.IMPLICATION, rhs);
    }

    public static Expression iff(Expression lhs, Expression rhs) {
        return binary(lhs, BinaryOperator.BI_IMPLICATION, rhs);
    }

    public static Expression not(Expression operand) {
        return unary(UnaryOperator.NEGATION, operand);
    }

    /**
     * 收集表达式中引用的所有标识符，按从左到右的出现顺序，可能重复。
     * @return 标识符名称列表。
     */
    public List<String> identifiers() {
        List<String> identifiers = new ArrayList<>();
        accept(new ExpressionVisitor<Void, RuntimeException>() {
            @Override
            public Void visitLiteral(Literal literal) {
                if (literal.getValue() instanceof Value.Identifier identifier) {
                    identifiers.add(identifier.getName());
                }
                return null;
            }

            @Override
            public Void visitParenthesized(Parenthesized parenthesized) {
                return parenthesized.getExpression().accept(this);
            }

            @Override
            public Void visitBinary(Binary binary) {
                binary.getLhs().accept(this);
                return binary.getRhs().accept(this);
            }

            @Override
            public Void visitUnary(Unary unary) {
                return unary.getOperand().accept(this);
            }
        });
        return identifiers;
    }

    /**
     * 字面量：布尔值或标识符。
     */
    @Getter
    public static final class Literal extends Expression {

        private final Value value;

        private Literal(Value value) {
            this.value = Objects.requireNonNull(value, "Literal value cannot be null");
        }

        @Override
        public <R, E extends Exception> R accept(ExpressionVisitor<R, E> visitor) throws E {
            return visitor.visitLiteral(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return value.equals(((Literal) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Literal.class, value);
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    @Getter
    public static final class Parenthesized extends Expression {

        private final Expression expression;

        private Parenthesized(Expression expression) {
            this.expression = Objects.requireNonNull(expression, "Parenthesized expression cannot be null");
        }

        @Override
        public <R, E extends Exception> R accept(ExpressionVisitor<R, E> visitor) throws E {
            return visitor.visitParenthesized(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return expression.equals(((Parenthesized) o).expression);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Parenthesized.class, expression);
        }

        @Override
        public String toString() {
            return "(" + expression + ")";
        }
    }

    @Getter
    public static final class Binary extends Expression {

        private final Expression lhs;
        private final BinaryOperator operator;
        private final Expression rhs;

        private final int hashCode;

        private Binary(Expression lhs, BinaryOperator operator, Expression rhs) {
            this.lhs = Objects.requireNonNull(lhs, "Left operand cannot be null");
            this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
            this.rhs = Objects.requireNonNull(rhs, "Right operand cannot be null");
            this.hashCode = Objects.hash(lhs, operator, rhs);
        }

        @Override
        public <R, E extends Exception> R accept(ExpressionVisitor<R, E> visitor) throws E {
            return visitor.visitBinary(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Binary that = (Binary) o;
            return operator == that.operator && lhs.equals(that.lhs) && rhs.equals(that.rhs);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }

        @Override
        public String toString() {
            return lhs + " " + operator.getSymbol() + " " + rhs;
        }
    }

    @Getter
    public static final class Unary extends Expression {

        private final UnaryOperator operator;
        private final Expression operand;

        private Unary(UnaryOperator operator, Expression operand) {
            this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
            this.operand = Objects.requireNonNull(operand, "Operand cannot be null");
        }

        @Override
        public <R, E extends Exception> R accept(ExpressionVisitor<R, E> visitor) throws E {
            return visitor.visitUnary(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Unary that = (Unary) o;
            return operator == that.operator && operand.equals(that.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, operand);
        }

        @Override
        public String toString() {
            return operator.getSymbol() + operand;
        }
    }
}
