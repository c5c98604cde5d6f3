package de.mirkosertic.boolquery.expr;

import de.mirkosertic.boolquery.match.StringMatcher;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link QueryEvaluator} on hand-built trees.
 */
class QueryEvaluatorTest {

    private static final Expression A = Expression.Literal.of("a");
    private static final Expression B = Expression.Literal.of("b");

    @Test
    void literalShouldTestContainment() {
        assertThat(QueryEvaluator.evaluate(A, "xax")).isTrue();
        assertThat(QueryEvaluator.evaluate(A, "xyz")).isFalse();
        assertThat(QueryEvaluator.evaluate(A, "")).isFalse();
    }

    @Test
    void andShouldFollowTruthTable() {
        final Expression and = new Expression.And(A, B);

        assertThat(QueryEvaluator.evaluate(and, "ab")).isTrue();
        assertThat(QueryEvaluator.evaluate(and, "a")).isFalse();
        assertThat(QueryEvaluator.evaluate(and, "b")).isFalse();
        assertThat(QueryEvaluator.evaluate(and, "")).isFalse();
    }

    @Test
    void orShouldFollowTruthTable() {
        final Expression or = new Expression.Or(A, B);

        assertThat(QueryEvaluator.evaluate(or, "ab")).isTrue();
        assertThat(QueryEvaluator.evaluate(or, "a")).isTrue();
        assertThat(QueryEvaluator.evaluate(or, "b")).isTrue();
        assertThat(QueryEvaluator.evaluate(or, "")).isFalse();
    }

    @Test
    void notShouldInvertOperand() {
        assertThat(QueryEvaluator.evaluate(new Expression.Not(A), "b")).isTrue();
        assertThat(QueryEvaluator.evaluate(new Expression.Not(A), "a")).isFalse();
        assertThat(QueryEvaluator.evaluate(new Expression.Not(new Expression.Not(A)), "a")).isTrue();
    }

    @Test
    void emptyTextShouldOnlyMatchNegations() {
        final Expression tree = new Expression.Or(new Expression.And(A, B), new Expression.Not(B));

        assertThat(QueryEvaluator.evaluate(tree, "")).isTrue();
    }

    @Test
    void mixedChainShouldEvaluateEveryOperand() {
        // ((a & b) | c) & !d, built left-deep like the parser does
        final Expression tree = new Expression.And(
                new Expression.Or(new Expression.And(A, B), Expression.Literal.of("c")),
                new Expression.Not(Expression.Literal.of("d")));

        assertThat(QueryEvaluator.evaluate(tree, "ab")).isTrue();
        assertThat(QueryEvaluator.evaluate(tree, "c")).isTrue();
        assertThat(QueryEvaluator.evaluate(tree, "a")).isFalse();
        assertThat(QueryEvaluator.evaluate(tree, "abd")).isFalse();
        assertThat(QueryEvaluator.evaluate(tree, "cd")).isFalse();
    }

    @Test
    void deepLeftChainsShouldNotExhaustTheStack() {
        Expression and = Expression.Literal.of("x");
        Expression or = Expression.Literal.of("x");
        for (int i = 0; i < 100_000; i++) {
            and = new Expression.And(and, Expression.Literal.of("x"));
            or = new Expression.Or(or, Expression.Literal.of("y"));
        }

        assertThat(QueryEvaluator.evaluate(and, "xx")).isTrue();
        assertThat(QueryEvaluator.evaluate(and, "yy")).isFalse();
        assertThat(QueryEvaluator.evaluate(or, "y")).isTrue();
        assertThat(QueryEvaluator.evaluate(or, "z")).isFalse();
    }

    @Test
    void literalShouldRejectMismatchedMatcher() {
        assertThatThrownBy(() -> new Expression.Literal("a", new StringMatcher("b")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
