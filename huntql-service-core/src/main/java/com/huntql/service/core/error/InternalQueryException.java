package com.huntql.service.core.error;

/** An unexpected runtime failure inside a stage, attributed to that stage. Not retryable. */
public class InternalQueryException extends QueryException {

    public InternalQueryException(QueryStage stage, Throwable cause) {
        super(stage, "Internal error during " + stage + ": " + cause, cause);
    }
}
