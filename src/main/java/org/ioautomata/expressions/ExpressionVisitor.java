package org.ioautomata.expressions;

/**
 * 表达式树的访问者。每种表达式变体对应一个方法，新增变体时编译器会要求所有访问者补齐。
 *
 * @param <R> 访问结果的类型。
 * @param <E> 访问过程中可能抛出的异常类型。
 */
public interface ExpressionVisitor<R, E extends Exception> {

    R visitLiteral(Expression.Literal literal) throws E;

    R visitParenthesized(Expression.Parenthesized parenthesized) throws E;

    R visitBinary(Expression.Binary binary) throws E;

    R visitUnary(Expression.Unary unary) throws E;
}
