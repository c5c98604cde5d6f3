package de.mirkosertic.boolquery.parser;

import org.jspecify.annotations.Nullable;

/**
 * Raised by {@link QueryParser} when a token sequence does not form a valid query.
 */
public class QueryParseException extends QuerySyntaxException {

    public QueryParseException(final Reason reason, @Nullable final String detail, final int position, final String query) {
        super(reason, detail, position, query);
    }
}
