package org.ioautomata.interpreter;

import org.ioautomata.core.Environment;
import org.ioautomata.core.Evaluation;
import org.ioautomata.core.LangType;
import org.ioautomata.core.Value;
import org.ioautomata.expressions.Expression;
import org.ioautomata.expressions.ExpressionVisitor;
import org.ioautomata.expressions.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 在给定 {@link Environment} 上对表达式求值、执行语句。
 * 环境是不可变的：执行赋值后解释器持有新的环境，调用者通过 {@link #getEnvironment()} 读取结果，
 * 传入的环境本身不会被修改。
 */
public final class Interpreter {

    private static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

    private Environment environment;

    public Interpreter(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "Environment cannot be null");
    }

    public static Interpreter empty() {
        return new Interpreter(Environment.empty());
    }

    public Environment getEnvironment() {
        return environment;
    }

    /**
     * 对表达式求值。所有运算符先将两侧归约为布尔值再计算。
     * @param expression 要求值的表达式。
     * @return TRUE 或 FALSE。
     * @throws UnknownIdentifierException 如果引用了未声明的标识符。
     * @throws TypeMismatchException 如果某个操作数无法归约为布尔值。
     */
    public Evaluation evaluate(Expression expression) throws LanguageException {
        Objects.requireNonNull(expression, "Expression cannot be null");
        boolean result = expression.accept(new BooleanReducer());
        logger.debug("求值 {} 于 {} 得到 {}", expression, environment, result);
        return Evaluation.of(result);
    }

    /**
     * 执行一条赋值语句：左侧解析为标识符名，右侧求值后写入环境。
     * @return VOID。
     * @throws UnknownIdentifierException 如果被赋值的标识符未声明，或右侧引用了未声明的标识符。
     * @throws TypeMismatchException 如果左侧不是标识符。
     */
    public Evaluation execute(Statement statement) throws LanguageException {
        Objects.requireNonNull(statement, "Statement cannot be null");
        String target = targetOf(statement.getIdentifier());
        if (!environment.contains(target)) {
            logger.debug("赋值目标 '{}' 未声明", target);
            throw new UnknownIdentifierException(target);
        }
        Evaluation value = evaluate(statement.getValue());
        environment = environment.set(target, value.toValue());
        logger.debug("执行 {} 后环境为 {}", statement, environment);
        return Evaluation.VOID;
    }

    /**
     * 沿标识符链解析一个值，直到得到布尔值。
     */
    boolean resolve(Value value) throws LanguageException {
        Set<String> seen = new HashSet<>();
        Value current = value;
        while (current instanceof Value.Identifier identifier) {
            String name = identifier.getName();
            if (!seen.add(name)) {
                throw new TypeMismatchException(LangType.LOGICAL.getSymbol(), "cyclic identifier " + name, "identifier resolution");
            }
            Value bound = environment.get(name);
            if (bound == null) {
                throw new UnknownIdentifierException(name);
            }
            current = bound;
        }
        return ((Value.Bool) current).isValue();
    }

    private static String targetOf(Expression expression) throws LanguageException {
        Expression current = expression;
        while (current instanceof Expression.Parenthesized parenthesized) {
            current = parenthesized.getExpression();
        }
        if (current instanceof Expression.Literal literal
                && literal.getValue() instanceof Value.Identifier identifier) {
            return identifier.getName();
        }
        throw new TypeMismatchException("identifier", expression.toString(), "assignment target");
    }

    private final class BooleanReducer implements ExpressionVisitor<Boolean, LanguageException> {

        @Override
        public Boolean visitLiteral(Expression.Literal literal) throws LanguageException {
            return resolve(literal.getValue());
        }

        @Override
        public Boolean visitParenthesized(Expression.Parenthesized parenthesized) throws LanguageException {
            return parenthesized.getExpression().accept(this);
        }

        @Override
        public Boolean visitBinary(Expression.Binary binary) throws LanguageException {
            boolean lhs = binary.getLhs().accept(this);
            boolean rhs = binary.getRhs().accept(this);
            return binary.getOperator().apply(lhs, rhs);
        }

        @Override
        public Boolean visitUnary(Expression.Unary unary) throws LanguageException {
            return unary.getOperator().apply(unary.getOperand().accept(this));
        }
    }
}
