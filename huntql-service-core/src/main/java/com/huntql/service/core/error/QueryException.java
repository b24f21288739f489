package com.huntql.service.core.error;

import com.huntql.service.core.executor.ExecutionMetrics;
import java.util.Optional;

/**
 * Base of every failure surfaced by the query core. Each subclass is bound to the stage that raised it so
 * telemetry can attribute failures precisely.
 */
public abstract class QueryException extends RuntimeException {

    private final QueryStage stage;
    private volatile ExecutionMetrics metrics;

    protected QueryException(QueryStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected QueryException(QueryStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public QueryStage stage() {
        return stage;
    }

    /** Whether re-issuing the same request unchanged can succeed. */
    public boolean retryable() {
        return false;
    }

    /** Metrics gathered up to the failure, when the failure happened inside {@code execute}. */
    public Optional<ExecutionMetrics> metrics() {
        return Optional.ofNullable(metrics);
    }

    public void attachMetrics(ExecutionMetrics metrics) {
        if (this.metrics == null) {
            this.metrics = metrics;
        }
    }
}
