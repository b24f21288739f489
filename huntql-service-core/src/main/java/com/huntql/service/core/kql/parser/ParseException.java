package com.huntql.service.core.kql.parser;

import com.huntql.service.core.error.QueryException;
import com.huntql.service.core.error.QueryStage;
import com.huntql.service.core.kql.lexer.Token;
import com.huntql.service.core.kql.lexer.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Grammar violation at {@link #found()}. {@link #expectedKinds()} lists the token categories that would have been
 * accepted, {@link #expectedSymbols()} the specific operators or words.
 */
public class ParseException extends QueryException {

    private final List<TokenKind> expectedKinds;
    private final List<String> expectedSymbols;
    private final Token found;

    public ParseException(List<TokenKind> expectedKinds, List<String> expectedSymbols, Token found) {
        super(QueryStage.PARSE, message(expectedKinds, expectedSymbols, found));
        this.expectedKinds = List.copyOf(expectedKinds);
        this.expectedSymbols = List.copyOf(expectedSymbols);
        this.found = found;
    }

    public List<TokenKind> expectedKinds() {
        return expectedKinds;
    }

    public List<String> expectedSymbols() {
        return expectedSymbols;
    }

    public Token found() {
        return found;
    }

    private static String message(List<TokenKind> kinds, List<String> symbols, Token found) {
        List<String> parts = new ArrayList<>();
        kinds.forEach(k -> parts.add(k.displayName()));
        symbols.forEach(s -> parts.add("'" + s + "'"));
        String expected = parts.size() <= 1
                ? String.join("", parts)
                : parts.stream().limit(parts.size() - 1).collect(Collectors.joining(", "))
                        + " or " + parts.get(parts.size() - 1);
        return "Expected " + expected + " but found " + found.describe()
                + " at line " + found.line() + ", column " + found.column();
    }
}
