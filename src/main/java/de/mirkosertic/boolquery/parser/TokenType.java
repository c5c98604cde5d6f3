package de.mirkosertic.boolquery.parser;

/**
 * Kinds of tokens produced by {@link QueryLexer}.
 */
public enum TokenType {
    LITERAL,
    AND,
    OR,
    NOT,
    LPAREN,
    RPAREN;

    /**
     * Returns how the token reads in a query, used in error messages.
     */
    public String describe() {
        return switch (this) {
            case LITERAL -> "literal";
            case AND -> "'&'";
            case OR -> "'|'";
            case NOT -> "'!'";
            case LPAREN -> "'('";
            case RPAREN -> "')'";
        };
    }
}
