package com.huntql.service.core.error;

/** Compilation / execution stage a failure is attributed to. */
public enum QueryStage {
    LEX,
    PARSE,
    VALIDATE,
    OPTIMIZE,
    GENERATE,
    EXECUTE
}
