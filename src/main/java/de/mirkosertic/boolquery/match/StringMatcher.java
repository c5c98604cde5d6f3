package de.mirkosertic.boolquery.match;

import java.util.Objects;

/**
 * Substring test for a single fixed pattern using the Knuth-Morris-Pratt algorithm.
 *
 * <p>The failure table is computed once in the constructor. Every call to {@link #contains(String)}
 * then runs in {@code O(pattern + text)} time without allocating, so one instance can be shared
 * between any number of queries and threads.</p>
 *
 * <h2>Failure table</h2>
 * For every prefix {@code pattern[0..i]} the table holds the length of the longest proper prefix
 * of that prefix which is also its suffix:
 * <pre>
 * pattern:  a  b  a  b  c
 * table:    0  0  1  2  0
 * </pre>
 * On a mismatch after {@code k} matched characters the scan continues with {@code table[k - 1]}
 * matched characters instead of rescanning the text.
 *
 * <p>Characters are compared as UTF-16 code units, so {@code new StringMatcher(p).contains(t)}
 * always equals {@code t.contains(p)}.</p>
 */
public final class StringMatcher {

    private final String pattern;
    private final char[] patternChars;
    private final int[] failureTable;

    /**
     * Creates a matcher for the given pattern and precomputes its failure table.
     *
     * @param pattern the non-empty literal to search for
     * @throws IllegalArgumentException if the pattern is empty
     */
    public StringMatcher(final String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.isEmpty()) {
            throw new IllegalArgumentException("Pattern must not be empty");
        }
        this.pattern = pattern;
        this.patternChars = pattern.toCharArray();
        this.failureTable = computeFailureTable(patternChars);
    }

    static int[] computeFailureTable(final char[] pattern) {
        final int[] table = new int[pattern.length];
        int matched = 0;
        for (int i = 1; i < pattern.length; i++) {
            while (matched > 0 && pattern[i] != pattern[matched]) {
                matched = table[matched - 1];
            }
            if (pattern[i] == pattern[matched]) {
                matched++;
            }
            table[i] = matched;
        }
        return table;
    }

    /**
     * Tests whether the pattern occurs anywhere in the given text.
     *
     * @param text the text to scan
     * @return true as soon as the first complete occurrence is found
     */
    public boolean contains(final String text) {
        final int textLength = text.length();
        final int patternLength = patternChars.length;
        if (textLength < patternLength) {
            return false;
        }

        int matched = 0;
        for (int i = 0; i < textLength; i++) {
            final char c = text.charAt(i);
            while (matched > 0 && c != patternChars[matched]) {
                matched = failureTable[matched - 1];
            }
            if (c == patternChars[matched]) {
                matched++;
                if (matched == patternLength) {
                    return true;
                }
            }
            // Not even a full match is possible any more in the rest of the text
            if (textLength - i - 1 < patternLength - matched) {
                return false;
            }
        }
        return false;
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * Returns a copy of the failure table, mainly for diagnostics and tests.
     */
    public int[] getFailureTable() {
        return failureTable.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StringMatcher)) {
            return false;
        }
        // The failure table is derived from the pattern
        return pattern.equals(((StringMatcher) o).pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return "StringMatcher[pattern=" + pattern + "]";
    }
}
