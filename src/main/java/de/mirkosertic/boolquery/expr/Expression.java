package de.mirkosertic.boolquery.expr;

import de.mirkosertic.boolquery.match.StringMatcher;

import java.util.Objects;

/**
 * Node of a compiled query.
 *
 * <p>The node kinds form a closed set. Each interior node exclusively owns its children, trees are
 * never shared or mutated after construction. Code that needs to handle every kind implements
 * {@link ExpressionVisitor}, so a new kind cannot be added without the compiler pointing at every
 * place that has to deal with it.</p>
 */
public sealed interface Expression permits Expression.Literal, Expression.And, Expression.Or, Expression.Not {

    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Leaf matching texts that contain {@code pattern}. The matcher holds the precomputed
     * failure table for the pattern.
     */
    record Literal(String pattern, StringMatcher matcher) implements Expression {

        public Literal {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(matcher, "matcher");
            if (!pattern.equals(matcher.getPattern())) {
                throw new IllegalArgumentException("Matcher was built for a different pattern");
            }
        }

        public static Literal of(final String pattern) {
            return new Literal(pattern, new StringMatcher(pattern));
        }

        @Override
        public <R> R accept(final ExpressionVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String toString() {
            return "Literal[" + pattern + "]";
        }
    }

    record And(Expression left, Expression right) implements Expression {

        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(final ExpressionVisitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    record Or(Expression left, Expression right) implements Expression {

        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(final ExpressionVisitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    record Not(Expression operand) implements Expression {

        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(final ExpressionVisitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }
}
