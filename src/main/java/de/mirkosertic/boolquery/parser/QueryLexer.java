package de.mirkosertic.boolquery.parser;

import de.mirkosertic.boolquery.parser.QuerySyntaxException.Reason;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a raw query string into {@link Token}s.
 *
 * <p>Recognized input:</p>
 * <ul>
 *   <li>{@code "..."} - a literal; everything up to the next double quote is taken verbatim,
 *       there are no escape sequences</li>
 *   <li>{@code &}, {@code |}, {@code !}, {@code (}, {@code )} - operators and grouping</li>
 *   <li>whitespace between tokens, which is skipped</li>
 * </ul>
 * Anything else is rejected with a {@link QueryLexException}.
 */
public class QueryLexer {

    private static final char QUOTE = '"';

    /**
     * Tokenizes the given query.
     *
     * @param query the query text
     * @return the tokens in input order, empty if the query contains only whitespace
     * @throws QueryLexException on an unterminated literal or an unrecognized character
     */
    public List<Token> tokenize(final String query) throws QueryLexException {
        Objects.requireNonNull(query, "query");

        final List<Token> tokens = new ArrayList<>();
        int index = 0;
        while (index < query.length()) {
            final char c = query.charAt(index);

            if (Character.isWhitespace(c)) {
                index++;
                continue;
            }

            switch (c) {
                case QUOTE -> index = readLiteral(query, index, tokens);
                case '&' -> tokens.add(Token.operator(TokenType.AND, index++));
                case '|' -> tokens.add(Token.operator(TokenType.OR, index++));
                case '!' -> tokens.add(Token.operator(TokenType.NOT, index++));
                case '(' -> tokens.add(Token.operator(TokenType.LPAREN, index++));
                case ')' -> tokens.add(Token.operator(TokenType.RPAREN, index++));
                default -> throw unexpectedCharacter(query, index);
            }
        }
        return tokens;
    }

    /**
     * Reads a literal starting at the opening quote and returns the index after its closing quote.
     */
    private int readLiteral(final String query, final int quoteIndex, final List<Token> tokens)
            throws QueryLexException {
        final int closingQuote = query.indexOf(QUOTE, quoteIndex + 1);
        if (closingQuote < 0) {
            throw new QueryLexException(Reason.UNTERMINATED_LITERAL,
                    "literal starting with " + preview(query, quoteIndex), quoteIndex, query);
        }
        tokens.add(Token.literal(query.substring(quoteIndex + 1, closingQuote), quoteIndex));
        return closingQuote + 1;
    }

    private QueryLexException unexpectedCharacter(final String query, final int index) {
        final int codePoint = query.codePointAt(index);
        final String character = new String(Character.toChars(codePoint));
        if (Character.isLetterOrDigit(codePoint)) {
            final int end = wordEnd(query, index);
            return new QueryLexException(Reason.UNQUOTED_TERM,
                    "'" + query.substring(index, end) + "'", index, query);
        }
        return new QueryLexException(Reason.UNEXPECTED_CHARACTER, "'" + character + "'", index, query);
    }

    private static int wordEnd(final String query, final int start) {
        int end = start;
        while (end < query.length()) {
            final int codePoint = query.codePointAt(end);
            if (!Character.isLetterOrDigit(codePoint)) {
                break;
            }
            end += Character.charCount(codePoint);
        }
        return end;
    }

    private static String preview(final String query, final int start) {
        final int maxPreview = 20;
        if (query.length() - start <= maxPreview) {
            return query.substring(start);
        }
        return query.substring(start, start + maxPreview) + "...";
    }
}
