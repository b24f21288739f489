package com.huntql.service.core.executor;

import com.huntql.service.core.store.RowSet;
import java.util.List;

/**
 * Outcome of a call that reached {@link ExecutionState#COMPLETED} or {@link ExecutionState#TIMED_OUT}. A timed-out
 * result never carries rows. Failures are thrown instead.
 */
public record ExecutionResult(
        List<String> columns, List<List<Object>> rows, boolean truncated, ExecutionState state, ExecutionMetrics metrics) {

    public ExecutionResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    static ExecutionResult completed(RowSet rows, boolean truncated, ExecutionMetrics metrics) {
        return new ExecutionResult(rows.columns(), rows.rows(), truncated, ExecutionState.COMPLETED, metrics);
    }

    static ExecutionResult timedOut(ExecutionMetrics metrics) {
        return new ExecutionResult(List.of(), List.of(), false, ExecutionState.TIMED_OUT, metrics);
    }

    public boolean timedOut() {
        return state == ExecutionState.TIMED_OUT;
    }
}
