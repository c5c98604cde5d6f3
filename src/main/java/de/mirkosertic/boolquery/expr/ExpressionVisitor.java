package de.mirkosertic.boolquery.expr;

/**
 * Exhaustive case analysis over {@link Expression} nodes.
 *
 * @param <R> the result type
 */
public interface ExpressionVisitor<R> {

    R visitLiteral(Expression.Literal literal);

    R visitAnd(Expression.And and);

    R visitOr(Expression.Or or);

    R visitNot(Expression.Not not);
}
