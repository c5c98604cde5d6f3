package de.mirkosertic.boolquery;

import de.mirkosertic.boolquery.parser.QueryParser;

/**
 * Limits applied while compiling a query.
 *
 * @param maxQueryLength  the maximum number of characters a query may have
 * @param maxNestingDepth the maximum number of nested {@code !} and {@code (} constructs
 */
public record MatcherOptions(int maxQueryLength, int maxNestingDepth) {

    public static final int DEFAULT_MAX_QUERY_LENGTH = 64 * 1024;
    public static final int DEFAULT_MAX_NESTING_DEPTH = QueryParser.DEFAULT_MAX_NESTING_DEPTH;

    private static final MatcherOptions DEFAULTS =
            new MatcherOptions(DEFAULT_MAX_QUERY_LENGTH, DEFAULT_MAX_NESTING_DEPTH);

    public MatcherOptions {
        if (maxQueryLength < 1) {
            throw new IllegalArgumentException("maxQueryLength must be positive, was " + maxQueryLength);
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, was " + maxNestingDepth);
        }
    }

    public static MatcherOptions defaults() {
        return DEFAULTS;
    }

    public MatcherOptions withMaxQueryLength(final int maxQueryLength) {
        return new MatcherOptions(maxQueryLength, maxNestingDepth);
    }

    public MatcherOptions withMaxNestingDepth(final int maxNestingDepth) {
        return new MatcherOptions(maxQueryLength, maxNestingDepth);
    }
}
