package org.ioautomata.interpreter;

import org.apache.commons.lang3.tuple.Pair;
import org.ioautomata.core.Environment;
import org.ioautomata.core.Evaluation;
import org.ioautomata.core.Value;
import org.ioautomata.expressions.BinaryOperator;
import org.ioautomata.expressions.Expression;
import org.ioautomata.expressions.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InterpreterTest {

    private static final Expression A = Expression.identifier("a");
    private static final Expression B = Expression.identifier("b");
    private static final Expression C = Expression.identifier("c");

    /**
     * a、b、c 的全部 8 种赋值。
     */
    private static List<Environment> allAssignments() {
        List<Environment> environments = new ArrayList<>();
        for (int bits = 0; bits < 8; bits++) {
            environments.add(Environment.of(Map.of(
                    "a", Value.of((bits & 1) != 0),
                    "b", Value.of((bits & 2) != 0),
                    "c", Value.of((bits & 4) != 0))));
        }
        return environments;
    }

    @Nested
    @DisplayName("表达式求值 (Expression evaluation)")
    class EvaluationTests {

        @Test
        @DisplayName("字面量与标识符")
        void testLiteralsAndIdentifiers() throws LanguageException {
            Interpreter interpreter = new Interpreter(Environment.of(Map.of("x", Value.TRUE, "y", Value.FALSE)));

            assertAll(
                    () -> assertEquals(Evaluation.TRUE, interpreter.evaluate(Expression.bool(true))),
                    () -> assertEquals(Evaluation.FALSE, interpreter.evaluate(Expression.bool(false))),
                    () -> assertEquals(Evaluation.TRUE, interpreter.evaluate(Expression.identifier("x"))),
                    () -> assertEquals(Evaluation.FALSE, interpreter.evaluate(Expression.identifier("y")))
            );
        }

        @Test
        @DisplayName("表格驱动：常见表达式的求值结果")
        void testTable() throws LanguageException {
            Interpreter interpreter = new Interpreter(Environment.of(Map.of("x", Value.TRUE, "y", Value.FALSE)));
            Expression x = Expression.identifier("x");
            Expression y = Expression.identifier("y");
            List<Pair<Expression, Evaluation>> cases = List.of(
                    Pair.of(Expression.and(x, y), Evaluation.FALSE),
                    Pair.of(Expression.or(x, y), Evaluation.TRUE),
                    Pair.of(Expression.implies(y, x), Evaluation.TRUE),
                    Pair.of(Expression.implies(x, y), Evaluation.FALSE),
                    Pair.of(Expression.iff(x, Expression.not(y)), Evaluation.TRUE),
                    Pair.of(Expression.equal(x, y), Evaluation.FALSE),
                    Pair.of(Expression.notEqual(x, y), Evaluation.TRUE),
                    Pair.of(Expression.not(Expression.parenthesized(Expression.and(x, x))), Evaluation.FALSE)
            );
            for (Pair<Expression, Evaluation> testCase : cases) {
                assertEquals(testCase.getRight(), interpreter.evaluate(testCase.getLeft()), testCase.getLeft().toString());
            }
        }

        @ParameterizedTest
        @EnumSource(value = BinaryOperator.class, names = {"AND", "OR", "EQUAL", "NOT_EQUAL", "BI_IMPLICATION"})
        @DisplayName("对称运算符在所有赋值下满足交换律")
        void testCommutativity(BinaryOperator operator) throws LanguageException {
            for (Environment environment : allAssignments()) {
                Interpreter interpreter = new Interpreter(environment);
                assertEquals(
                        interpreter.evaluate(Expression.binary(A, operator, B)),
                        interpreter.evaluate(Expression.binary(B, operator, A)),
                        operator + " under " + environment);
            }
        }

        @ParameterizedTest
        @EnumSource(value = BinaryOperator.class, names = {"AND", "OR", "BI_IMPLICATION"})
        @DisplayName("可结合运算符在所有赋值下满足结合律")
        void testAssociativity(BinaryOperator operator) throws LanguageException {
            for (Environment environment : allAssignments()) {
                Interpreter interpreter = new Interpreter(environment);
                Expression left = Expression.binary(Expression.parenthesized(Expression.binary(A, operator, B)), operator, C);
                Expression right = Expression.binary(A, operator, Expression.parenthesized(Expression.binary(B, operator, C)));
                assertEquals(interpreter.evaluate(left), interpreter.evaluate(right), operator + " under " + environment);
            }
        }

        @Test
        @DisplayName("求值不改变环境，重复求值结果相同")
        void testEvaluationIsIdempotent() throws LanguageException {
            Expression guard = Expression.implies(Expression.and(A, Expression.not(B)), Expression.or(C, A));
            for (Environment environment : allAssignments()) {
                Interpreter interpreter = new Interpreter(environment);
                Evaluation first = interpreter.evaluate(guard);
                Evaluation second = interpreter.evaluate(guard);
                assertAll(
                        () -> assertEquals(first, second, "under " + environment),
                        () -> assertEquals(environment, interpreter.getEnvironment(), "under " + environment)
                );
            }
        }

        @Test
        @DisplayName("蕴含不满足交换律")
        void testImplicationIsNotCommutative() throws LanguageException {
            Interpreter interpreter = new Interpreter(Environment.of(Map.of("a", Value.TRUE, "b", Value.FALSE)));
            assertNotEquals(
                    interpreter.evaluate(Expression.implies(A, B)),
                    interpreter.evaluate(Expression.implies(B, A)));
        }

        @Test
        @DisplayName("标识符链会被逐级解析")
        void testIdentifierChain() throws LanguageException {
            Environment environment = Environment.of(Map.of(
                    "x", Value.identifier("y"),
                    "y", Value.identifier("z"),
                    "z", Value.TRUE));
            assertEquals(Evaluation.TRUE, new Interpreter(environment).evaluate(Expression.identifier("x")));
        }

        @Test
        @DisplayName("未声明的标识符抛出 UnknownIdentifierException")
        void testUnknownIdentifier() {
            UnknownIdentifierException exception = assertThrows(UnknownIdentifierException.class,
                    () -> Interpreter.empty().evaluate(Expression.and(Expression.bool(true), Expression.identifier("ghost"))));
            assertEquals("ghost", exception.getIdentifier());
        }

        @Test
        @DisplayName("循环的标识符链抛出 TypeMismatchException")
        void testCyclicIdentifier() {
            Environment environment = Environment.of(Map.of(
                    "x", Value.identifier("y"),
                    "y", Value.identifier("x")));
            assertThrows(TypeMismatchException.class,
                    () -> new Interpreter(environment).evaluate(Expression.identifier("x")));
        }
    }

    @Nested
    @DisplayName("语句执行 (Statement execution)")
    class ExecutionTests {

        @Test
        @DisplayName("赋值更新环境并返回 VOID")
        void testAssignment() throws LanguageException {
            Environment environment = Environment.of(Map.of("x", Value.FALSE, "y", Value.TRUE));
            Interpreter interpreter = new Interpreter(environment);

            Evaluation result = interpreter.execute(Statement.assign("x", Expression.identifier("y")));

            assertAll(
                    () -> assertEquals(Evaluation.VOID, result),
                    () -> assertEquals(Value.TRUE, interpreter.getEnvironment().getValue("x")),
                    () -> assertEquals(Value.FALSE, environment.getValue("x"), "Original environment is immutable")
            );
        }

        @Test
        @DisplayName("连续执行的语句作用于上一次的结果")
        void testSequentialStatements() throws LanguageException {
            Interpreter interpreter = new Interpreter(Environment.of(Map.of("x", Value.FALSE, "y", Value.FALSE)));
            interpreter.execute(Statement.assign("x", Value.TRUE));
            interpreter.execute(Statement.assign("y", Expression.not(Expression.identifier("x"))));

            assertEquals(Environment.of(Map.of("x", Value.TRUE, "y", Value.FALSE)), interpreter.getEnvironment());
        }

        @Test
        @DisplayName("对所有赋值，a = b 之后 a == b 成立")
        void testAssignmentEstablishesEquality() throws LanguageException {
            for (Environment environment : allAssignments()) {
                Interpreter interpreter = new Interpreter(environment);
                interpreter.execute(Statement.assign("a", B));
                assertTrue(interpreter.evaluate(Expression.equal(A, B)).isTrue(), "under " + environment);
            }
        }

        @Test
        @DisplayName("括号包裹的赋值目标也被接受")
        void testParenthesizedTarget() throws LanguageException {
            Interpreter interpreter = new Interpreter(Environment.of(Map.of("x", Value.FALSE)));
            interpreter.execute(Statement.assignment(Expression.parenthesized(Expression.identifier("x")), Expression.bool(true)));
            assertEquals(Value.TRUE, interpreter.getEnvironment().getValue("x"));
        }

        @Test
        @DisplayName("赋值给未声明的标识符抛出 UnknownIdentifierException")
        void testAssignToUndeclared() {
            assertThrows(UnknownIdentifierException.class,
                    () -> Interpreter.empty().execute(Statement.assign("x", Value.TRUE)));
        }

        @Test
        @DisplayName("赋值目标不是标识符时抛出 TypeMismatchException")
        void testAssignToNonIdentifier() {
            Statement statement = Statement.assignment(Expression.bool(true), Expression.bool(false));
            assertThrows(TypeMismatchException.class, () -> Interpreter.empty().execute(statement));
        }
    }
}
