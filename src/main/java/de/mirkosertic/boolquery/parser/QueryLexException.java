package de.mirkosertic.boolquery.parser;

import org.jspecify.annotations.Nullable;

/**
 * Raised by {@link QueryLexer} when a query cannot be split into tokens.
 */
public class QueryLexException extends QuerySyntaxException {

    public QueryLexException(final Reason reason, @Nullable final String detail, final int position, final String query) {
        super(reason, detail, position, query);
    }
}
