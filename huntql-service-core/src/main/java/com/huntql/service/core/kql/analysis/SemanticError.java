package com.huntql.service.core.kql.analysis;

/** One validation finding; {@code name} is the offending identifier. */
public record SemanticError(Kind kind, String name, String message) {

    public enum Kind {
        UNKNOWN_TABLE,
        UNKNOWN_COLUMN,
        UNKNOWN_FUNCTION,
        ARITY_MISMATCH,
        AGGREGATE_NOT_ALLOWED,
        NOT_AN_AGGREGATE,
        DUPLICATE_COLUMN
    }
}
