package com.huntql.service.core.api;

import com.huntql.service.core.error.QueryStage;

/**
 * One problem found by {@link QueryService#validate}. Lexical and grammar problems carry a 1-based source
 * position; semantic problems carry the offending identifier instead.
 */
public record Diagnostic(QueryStage stage, String code, String message, String name, Integer line, Integer column) {

    public static Diagnostic at(QueryStage stage, String code, String message, int line, int column) {
        return new Diagnostic(stage, code, message, null, line, column);
    }

    public static Diagnostic named(QueryStage stage, String code, String message, String name) {
        return new Diagnostic(stage, code, message, name, null, null);
    }
}
