package com.huntql.service.core.kql.lexer;

public enum TokenKind {
    KEYWORD("keyword"),
    IDENTIFIER("identifier"),
    OPERATOR("operator"),
    STRING_LITERAL("string literal"),
    NUMERIC_LITERAL("numeric literal"),
    DATETIME_LITERAL("datetime literal"),
    TIMESPAN_LITERAL("timespan literal"),
    GUID_LITERAL("guid literal"),
    COMMENT("comment"),
    END_OF_INPUT("end of input");

    private final String displayName;

    TokenKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isLiteral() {
        return switch (this) {
            case STRING_LITERAL, NUMERIC_LITERAL, DATETIME_LITERAL, TIMESPAN_LITERAL, GUID_LITERAL -> true;
            default -> false;
        };
    }
}
