package de.mirkosertic.boolquery;

import de.mirkosertic.boolquery.expr.Expression;
import de.mirkosertic.boolquery.expr.ExpressionVisitor;
import de.mirkosertic.boolquery.expr.QueryEvaluator;
import de.mirkosertic.boolquery.parser.QueryParseException;
import de.mirkosertic.boolquery.parser.QueryParser;
import de.mirkosertic.boolquery.parser.QuerySyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A compiled boolean query that tests texts for the presence of literals.
 *
 * <h2>Query syntax</h2>
 * <pre>
 * query         := or_group ('|' or_group)*
 * or_group      := and_group ('&amp;' and_group)*
 * and_group     := STRINGLITERAL | '!' and_group | '(' query ')'
 * STRINGLITERAL := '"' &lt;any characters except '"'&gt; '"'
 * </pre>
 * A literal matches every text that contains it as a substring. Matching is case-sensitive and
 * there are no escape sequences.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * // matches texts containing "these", "those" and either "this" or "that"
 * Matcher matcher = Matcher.from("(\"this\" | \"that\") & \"these\" & \"those\"");
 * matcher.query("this these those");   // true
 * matcher.query("this that these");    // false, no "those"
 * }</pre>
 *
 * <p>A Matcher is immutable once built. {@link #query(String)} may be called any number of
 * times from any number of threads.</p>
 */
public final class Matcher {

    private static final Logger logger = LoggerFactory.getLogger(Matcher.class);

    private final String query;
    private final Expression root;

    private Matcher(final String query, final Expression root) {
        this.query = query;
        this.root = root;
    }

    /**
     * Compiles a query using {@link MatcherOptions#defaults()}.
     *
     * @param query the query text
     * @return the compiled matcher
     * @throws QuerySyntaxException if the query is malformed
     */
    public static Matcher from(final String query) throws QuerySyntaxException {
        return from(query, MatcherOptions.defaults());
    }

    /**
     * Compiles a query with explicit limits.
     *
     * @param query   the query text
     * @param options the compilation limits
     * @return the compiled matcher
     * @throws QuerySyntaxException if the query is malformed or exceeds the limits
     */
    public static Matcher from(final String query, final MatcherOptions options) throws QuerySyntaxException {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(options, "options");

        if (query.length() > options.maxQueryLength()) {
            throw new QueryParseException(QuerySyntaxException.Reason.QUERY_TOO_LONG,
                    query.length() + " characters, at most " + options.maxQueryLength() + " allowed",
                    options.maxQueryLength(), query);
        }

        final Expression root = new QueryParser(options.maxNestingDepth()).parse(query);
        if (logger.isDebugEnabled()) {
            logger.debug("Compiled query '{}' with {} literal(s)", query, countLiterals(root));
        }
        return new Matcher(query, root);
    }

    /**
     * Tests the text against the compiled query.
     *
     * @param text the text to test, may be empty
     * @return true if the text satisfies the query
     */
    public boolean query(final String text) {
        return QueryEvaluator.evaluate(root, text);
    }

    /**
     * Returns the query this matcher was compiled from.
     */
    public String getQuery() {
        return query;
    }

    /**
     * Returns the root of the compiled expression tree.
     */
    public Expression getExpression() {
        return root;
    }

    @Override
    public String toString() {
        return "Matcher[" + query + "]";
    }

    static int countLiterals(final Expression root) {
        return root.accept(LiteralCounter.INSTANCE);
    }

    /**
     * Counts literal leaves. Chains of the same operator are walked along their left spine, like
     * {@link QueryEvaluator} does, so the count never recurses once per operand.
     */
    private static final class LiteralCounter implements ExpressionVisitor<Integer> {

        private static final LiteralCounter INSTANCE = new LiteralCounter();

        @Override
        public Integer visitLiteral(final Expression.Literal literal) {
            return 1;
        }

        @Override
        public Integer visitAnd(final Expression.And and) {
            int count = 0;
            Expression current = and;
            while (current instanceof Expression.And chain) {
                count += chain.right().accept(this);
                current = chain.left();
            }
            return count + current.accept(this);
        }

        @Override
        public Integer visitOr(final Expression.Or or) {
            int count = 0;
            Expression current = or;
            while (current instanceof Expression.Or chain) {
                count += chain.right().accept(this);
                current = chain.left();
            }
            return count + current.accept(this);
        }

        @Override
        public Integer visitNot(final Expression.Not not) {
            return not.operand().accept(this);
        }
    }
}
