package com.huntql.service.core.executor;

import com.huntql.service.core.error.QueryException;
import com.huntql.service.core.error.QueryStage;

/** The backing store failed. The fault is external, so the caller may retry the same request. */
public class QueryExecutionException extends QueryException {

    public QueryExecutionException(String message, Throwable cause) {
        super(QueryStage.EXECUTE, message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
