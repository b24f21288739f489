package com.huntql.service.core.kql.completion;

public enum CompletionKind {
    TABLE,
    COLUMN,
    FUNCTION,
    AGGREGATE,
    OPERATION,
    OPERATOR,
    KEYWORD
}
