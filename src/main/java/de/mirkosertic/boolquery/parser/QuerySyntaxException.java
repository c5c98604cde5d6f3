package de.mirkosertic.boolquery.parser;

import org.jspecify.annotations.Nullable;

/**
 * Base class for all errors raised while compiling a query.
 *
 * <p>Carries the reason, the zero-based character offset the error refers to, and the query
 * itself so callers can point at the offending input.</p>
 */
public abstract class QuerySyntaxException extends Exception {

    /**
     * Why a query was rejected.
     */
    public enum Reason {
        UNTERMINATED_LITERAL("Unterminated literal, missing closing quote"),
        UNEXPECTED_CHARACTER("Unexpected character"),
        UNQUOTED_TERM("Found a letter or digit outside of quotes, literals must be enclosed in double quotes"),
        EMPTY_QUERY("Query is empty"),
        UNEXPECTED_TOKEN("Unexpected token"),
        UNEXPECTED_END("Unexpected end of query"),
        UNMATCHED_OPEN_PAREN("Missing closing parenthesis for '('"),
        UNMATCHED_CLOSE_PAREN("Closing parenthesis without matching '('"),
        TRAILING_TOKENS("Unexpected input after a complete query"),
        EMPTY_LITERAL("Empty literal, literals must contain at least one character"),
        NESTING_TOO_DEEP("Query is nested too deeply"),
        QUERY_TOO_LONG("Query is too long");

        private final String description;

        Reason(final String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Reason reason;
    private final int position;
    private final String query;

    protected QuerySyntaxException(final Reason reason, @Nullable final String detail, final int position, final String query) {
        super(buildMessage(reason, detail, position));
        this.reason = reason;
        this.position = position;
        this.query = query;
    }

    private static String buildMessage(final Reason reason, @Nullable final String detail, final int position) {
        final StringBuilder message = new StringBuilder(reason.getDescription());
        if (detail != null && !detail.isEmpty()) {
            message.append(": ").append(detail);
        }
        message.append(" (at position ").append(position).append(")");
        return message.toString();
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the zero-based character offset the error refers to. For errors at the end of the
     * query this is the query length.
     */
    public int getPosition() {
        return position;
    }

    public String getQuery() {
        return query;
    }
}
