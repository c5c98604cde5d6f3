package de.mirkosertic.boolquery.parser;

import org.jspecify.annotations.Nullable;

/**
 * A single lexical token of a query.
 *
 * @param type     the token kind
 * @param value    the literal content for {@link TokenType#LITERAL}, null for operators
 * @param position zero-based offset of the token's first character (the opening quote for literals)
 */
public record Token(TokenType type, @Nullable String value, int position) {

    public static Token literal(final String value, final int position) {
        return new Token(TokenType.LITERAL, value, position);
    }

    public static Token operator(final TokenType type, final int position) {
        return new Token(type, null, position);
    }

    public String describe() {
        if (type == TokenType.LITERAL) {
            return "literal \"" + value + "\"";
        }
        return type.describe();
    }
}
