package org.ioautomata.interpreter;

import org.ioautomata.core.Environment;
import org.ioautomata.core.LangType;
import org.ioautomata.core.Value;
import org.ioautomata.expressions.BinaryOperator;
import org.ioautomata.expressions.Expression;
import org.ioautomata.expressions.ExpressionVisitor;
import org.ioautomata.expressions.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 在给定 {@link Environment} 上为表达式与语句分配类型。
 * <ul>
 *     <li>布尔字面量与可解析的标识符为 Logical。</li>
 *     <li>And/Or/Implication/BiImplication 要求两侧都为 Logical。</li>
 *     <li>Equal/NotEqual 要求两侧类型相同。</li>
 *     <li>Negation 要求操作数为 Logical。</li>
 *     <li>赋值总是 Void，其良类型性由解释器在求值时保证。</li>
 * </ul>
 */
public final class TypeChecker {

    private static final Logger logger = LoggerFactory.getLogger(TypeChecker.class);

    private final Environment environment;

    public TypeChecker(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "Environment cannot be null");
    }

    public static TypeChecker empty() {
        return new TypeChecker(Environment.empty());
    }

    public Environment getEnvironment() {
        return environment;
    }

    public LangType check(Expression expression) throws LanguageException {
        Objects.requireNonNull(expression, "Expression cannot be null");
        LangType type = expression.accept(new Typer());
        logger.debug("表达式 {} 的类型为 {}", expression, type);
        return type;
    }

    public LangType check(Statement statement) {
        Objects.requireNonNull(statement, "Statement cannot be null");
        return LangType.VOID;
    }

    public LangType check(Value value) throws LanguageException {
        Set<String> seen = new HashSet<>();
        Value current = value;
        while (current instanceof Value.Identifier identifier) {
            String name = identifier.getName();
            if (!seen.add(name)) {
                throw new TypeMismatchException(LangType.LOGICAL.getSymbol(), "cyclic identifier " + name, "identifier " + value);
            }
            Value bound = environment.get(name);
            if (bound == null) {
                throw new UnknownIdentifierException(name);
            }
            current = bound;
        }
        return LangType.LOGICAL;
    }

    private final class Typer implements ExpressionVisitor<LangType, LanguageException> {

        @Override
        public LangType visitLiteral(Expression.Literal literal) throws LanguageException {
            return check(literal.getValue());
        }

        @Override
        public LangType visitParenthesized(Expression.Parenthesized parenthesized) throws LanguageException {
            return parenthesized.getExpression().accept(this);
        }

        @Override
        public LangType visitBinary(Expression.Binary binary) throws LanguageException {
            LangType lhs = binary.getLhs().accept(this);
            LangType rhs = binary.getRhs().accept(this);
            BinaryOperator operator = binary.getOperator();
            if (operator.isConnective()) {
                if (lhs != LangType.LOGICAL || rhs != LangType.LOGICAL) {
                    throw new TypeMismatchException("logical " + operator + " logical",
                            lhs + " " + operator + " " + rhs, binary.toString());
                }
            } else if (lhs != rhs) {
                throw new TypeMismatchException("operands of the same type",
                        lhs + " " + operator + " " + rhs, binary.toString());
            }
            return LangType.LOGICAL;
        }

        @Override
        public LangType visitUnary(Expression.Unary unary) throws LanguageException {
            LangType operand = unary.getOperand().accept(this);
            if (operand != LangType.LOGICAL) {
                throw new TypeMismatchException(LangType.LOGICAL.getSymbol(), operand.getSymbol(), unary.toString());
            }
            return LangType.LOGICAL;
        }
    }
}
