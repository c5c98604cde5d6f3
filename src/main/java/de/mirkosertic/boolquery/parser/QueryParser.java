package de.mirkosertic.boolquery.parser;

import de.mirkosertic.boolquery.expr.Expression;
import de.mirkosertic.boolquery.match.StringMatcher;
import de.mirkosertic.boolquery.parser.QuerySyntaxException.Reason;

import java.util.List;
import java.util.Objects;

/**
 * Recursive descent parser building an {@link Expression} tree from query tokens.
 *
 * <h2>Grammar</h2>
 * <pre>
 * query      := or_group ( '|' or_group )*
 * or_group   := and_group ( '&amp;' and_group )*
 * and_group  := LITERAL | '!' and_group | '(' query ')'
 * </pre>
 * Precedence follows from the nesting of the rules: {@code !} binds tightest, then {@code &},
 * then {@code |}. Chains of the same operator are folded to the left, so
 * {@code "a" | "b" | "c"} becomes {@code Or(Or(a, b), c)}.
 *
 * <h2>Examples</h2>
 * <pre>
 * !"a" &amp; "b"        →  And(Not(a), b)
 * "a" &amp; "b" | "c"   →  Or(And(a, b), c)
 * "a" &amp; ("b" | "c") →  And(a, Or(b, c))
 * </pre>
 *
 * <p>Every literal is compiled into its {@link StringMatcher} while parsing. The parser either
 * returns a complete tree or throws; it never hands out a partial result.</p>
 */
public class QueryParser {

    /**
     * Default limit for nested {@code !} and {@code (} constructs.
     */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private final QueryLexer lexer;
    private final int maxNestingDepth;

    public QueryParser() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param maxNestingDepth the maximum number of nested {@code !} and {@code (} constructs;
     *                        bounds the recursion depth of parsing and evaluation
     */
    public QueryParser(final int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, was " + maxNestingDepth);
        }
        this.lexer = new QueryLexer();
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Tokenizes and parses the given query.
     *
     * @param query the query text
     * @return the root of the compiled tree
     * @throws QuerySyntaxException if the query is malformed
     */
    public Expression parse(final String query) throws QuerySyntaxException {
        return parse(lexer.tokenize(query), query);
    }

    /**
     * Parses an already tokenized query.
     *
     * @param tokens the tokens produced by {@link QueryLexer}
     * @param query  the query the tokens were read from, used for error reporting
     * @return the root of the compiled tree
     * @throws QueryParseException if the tokens do not form a valid query
     */
    public Expression parse(final List<Token> tokens, final String query) throws QueryParseException {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(query, "query");

        if (tokens.isEmpty()) {
            throw new QueryParseException(Reason.EMPTY_QUERY, null, 0, query);
        }

        final ParseState state = new ParseState(tokens, query);
        final Expression root = parseQuery(state);

        if (state.hasNext()) {
            final Token trailing = state.peek();
            if (trailing.type() == TokenType.RPAREN) {
                throw new QueryParseException(Reason.UNMATCHED_CLOSE_PAREN, null, trailing.position(), query);
            }
            throw new QueryParseException(Reason.TRAILING_TOKENS,
                    "found " + trailing.describe() + ", expected '&' or '|'", trailing.position(), query);
        }
        return root;
    }

    // query := or_group ( '|' or_group )*
    private Expression parseQuery(final ParseState state) throws QueryParseException {
        Expression left = parseOrGroup(state);
        while (state.nextIs(TokenType.OR)) {
            state.next();
            left = new Expression.Or(left, parseOrGroup(state));
        }
        return left;
    }

    // or_group := and_group ( '&' and_group )*
    private Expression parseOrGroup(final ParseState state) throws QueryParseException {
        Expression left = parseAndGroup(state);
        while (state.nextIs(TokenType.AND)) {
            state.next();
            left = new Expression.And(left, parseAndGroup(state));
        }
        return left;
    }

    // and_group := LITERAL | '!' and_group | '(' query ')'
    private Expression parseAndGroup(final ParseState state) throws QueryParseException {
        if (!state.hasNext()) {
            throw new QueryParseException(Reason.UNEXPECTED_END,
                    "expected a literal, '!' or '('", state.query.length(), state.query);
        }

        final Token token = state.next();
        switch (token.type()) {
            case LITERAL:
                return compileLiteral(token, state.query);

            case NOT: {
                state.enter(token);
                final Expression operand = parseAndGroup(state);
                state.leave();
                return new Expression.Not(operand);
            }

            case LPAREN: {
                state.enter(token);
                state.openParens++;
                final Expression inner = parseQuery(state);
                if (!state.hasNext()) {
                    throw new QueryParseException(Reason.UNMATCHED_OPEN_PAREN, null, token.position(), state.query);
                }
                final Token closing = state.next();
                if (closing.type() != TokenType.RPAREN) {
                    throw new QueryParseException(Reason.UNEXPECTED_TOKEN,
                            "found " + closing.describe() + ", expected '&', '|' or ')'",
                            closing.position(), state.query);
                }
                state.openParens--;
                state.leave();
                return inner;
            }

            case RPAREN:
                if (state.openParens == 0) {
                    throw new QueryParseException(Reason.UNMATCHED_CLOSE_PAREN, null, token.position(), state.query);
                }
                throw new QueryParseException(Reason.UNEXPECTED_TOKEN,
                        "found ')', expected a literal, '!' or '('", token.position(), state.query);

            default:
                throw new QueryParseException(Reason.UNEXPECTED_TOKEN,
                        "found " + token.describe() + ", expected a literal, '!' or '('",
                        token.position(), state.query);
        }
    }

    private static Expression compileLiteral(final Token token, final String query) throws QueryParseException {
        final String pattern = token.value();
        if (pattern == null || pattern.isEmpty()) {
            throw new QueryParseException(Reason.EMPTY_LITERAL, null, token.position(), query);
        }
        return new Expression.Literal(pattern, new StringMatcher(pattern));
    }

    /**
     * Cursor over the token list plus nesting bookkeeping. Lives only for one parse call.
     */
    private final class ParseState {

        private final List<Token> tokens;
        private final String query;
        private int index;
        private int depth;
        private int openParens;

        private ParseState(final List<Token> tokens, final String query) {
            this.tokens = tokens;
            this.query = query;
        }

        boolean hasNext() {
            return index < tokens.size();
        }

        boolean nextIs(final TokenType type) {
            return hasNext() && tokens.get(index).type() == type;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            return tokens.get(index++);
        }

        void enter(final Token token) throws QueryParseException {
            depth++;
            if (depth > maxNestingDepth) {
                throw new QueryParseException(Reason.NESTING_TOO_DEEP,
                        "more than " + maxNestingDepth + " nested '!' or '('", token.position(), query);
            }
        }

        void leave() {
            depth--;
        }
    }
}
