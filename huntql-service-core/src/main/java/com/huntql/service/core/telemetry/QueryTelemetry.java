package com.huntql.service.core.telemetry;

import com.huntql.service.core.error.QueryStage;
import com.huntql.service.core.executor.ExecutionMetrics;

public interface QueryTelemetry {
    void recordCompleted(ExecutionMetrics metrics, boolean truncated);

    void recordTimedOut(ExecutionMetrics metrics);

    void recordFailed(QueryStage stage, ExecutionMetrics metrics);

    void recordOptimizerPasses(Iterable<String> appliedPasses);
}
