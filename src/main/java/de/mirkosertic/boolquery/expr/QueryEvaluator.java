package de.mirkosertic.boolquery.expr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Evaluates an expression tree against one text.
 *
 * <ul>
 *   <li>Literal: the text contains the pattern</li>
 *   <li>And: both operands match, the right operand is skipped if the left one fails</li>
 *   <li>Or: either operand matches, the right operand is skipped if the left one succeeds</li>
 *   <li>Not: the operand does not match</li>
 * </ul>
 *
 * <p>The parser folds {@code "a" & "b" & "c"} into a left-deep chain {@code And(And(a, b), c)}.
 * Such chains are walked iteratively, so the recursion depth only grows with parenthesis and
 * negation nesting and never with the number of operands.</p>
 *
 * <p>Instances are bound to a single text and are cheap to create; evaluation never fails.</p>
 */
public final class QueryEvaluator implements ExpressionVisitor<Boolean> {

    private final String text;

    private QueryEvaluator(final String text) {
        this.text = text;
    }

    /**
     * Evaluates the given tree against the text.
     *
     * @param root the compiled query
     * @param text the text to test, may be empty
     * @return whether the text matches the query
     */
    public static boolean evaluate(final Expression root, final String text) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(text, "text");
        return root.accept(new QueryEvaluator(text));
    }

    @Override
    public Boolean visitLiteral(final Expression.Literal literal) {
        return literal.matcher().contains(text);
    }

    @Override
    public Boolean visitAnd(final Expression.And and) {
        final Deque<Expression> operands = new ArrayDeque<>();
        Expression current = and;
        while (current instanceof Expression.And chain) {
            operands.push(chain.right());
            current = chain.left();
        }
        operands.push(current);

        // Leftmost operand first
        for (final Expression operand : operands) {
            if (!operand.accept(this)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Boolean visitOr(final Expression.Or or) {
        final Deque<Expression> operands = new ArrayDeque<>();
        Expression current = or;
        while (current instanceof Expression.Or chain) {
            operands.push(chain.right());
            current = chain.left();
        }
        operands.push(current);

        for (final Expression operand : operands) {
            if (operand.accept(this)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Boolean visitNot(final Expression.Not not) {
        return !not.operand().accept(this);
    }
}
