package com.huntql.service.core.kql.lexer;

import java.util.Locale;

/**
 * Immutable lexical token.
 *
 * @param kind token category
 * @param text source text for keywords, identifiers and operators; decoded text for strings
 * @param value decoded literal value ({@code String}, {@code Long}, {@code Double}, {@code Instant},
 *     {@code Duration}, {@code UUID}) or {@code null}
 * @param startOffset inclusive source offset
 * @param endOffset exclusive source offset
 * @param line 1-based line of the first character
 * @param column 1-based column of the first character
 */
public record Token(
        TokenKind kind, String text, Object value, int startOffset, int endOffset, int line, int column) {

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    /** True for an operator/punctuation token with exactly this text. */
    public boolean isSymbol(String symbol) {
        return kind == TokenKind.OPERATOR && text.equals(symbol);
    }

    /** True for a keyword or identifier spelled {@code word}, ignoring case. */
    public boolean isWord(String word) {
        return (kind == TokenKind.KEYWORD || kind == TokenKind.IDENTIFIER) && text.equalsIgnoreCase(word);
    }

    public boolean isWordLike() {
        return kind == TokenKind.KEYWORD || kind == TokenKind.IDENTIFIER;
    }

    /** Text used when re-joining the token stream into normalized query text. */
    public String canonicalText() {
        return switch (kind) {
            case KEYWORD -> text.toLowerCase(Locale.ROOT);
            case STRING_LITERAL -> '"' + escape(text) + '"';
            // bracketed names keep their brackets so ['a , b'] stays distinct from a , b
            case IDENTIFIER -> value != null ? "[\"" + escape(text) + "\"]" : text;
            default -> text;
        };
    }

    public String describe() {
        if (kind == TokenKind.END_OF_INPUT) {
            return "end of input";
        }
        return kind.displayName() + " '" + text + "'";
    }

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
