package com.huntql.service.core.telemetry;

import com.huntql.service.core.error.QueryStage;
import com.huntql.service.core.executor.ExecutionMetrics;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/** In-process counters for query outcomes and stage timings. */
public class QueryTelemetryRegistry implements QueryTelemetry {
    private final LongAdder completed = new LongAdder();
    private final LongAdder timedOut = new LongAdder();
    private final LongAdder truncated = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder rowsReturned = new LongAdder();

    private final LongAdder parseMillis = new LongAdder();
    private final LongAdder optimizeMillis = new LongAdder();
    private final LongAdder generateMillis = new LongAdder();
    private final LongAdder executeMillis = new LongAdder();

    private final Map<QueryStage, LongAdder> failuresByStage = new EnumMap<>(QueryStage.class);
    private final Map<String, LongAdder> passApplications = new ConcurrentHashMap<>();

    public QueryTelemetryRegistry() {
        for (QueryStage stage : QueryStage.values()) {
            failuresByStage.put(stage, new LongAdder());
        }
    }

    @Override
    public void recordCompleted(ExecutionMetrics metrics, boolean wasTruncated) {
        completed.increment();
        if (wasTruncated) {
            truncated.increment();
        }
        if (metrics.cacheHit()) {
            cacheHits.increment();
        }
        rowsReturned.add(metrics.rowCount());
        addTimings(metrics);
    }

    @Override
    public void recordTimedOut(ExecutionMetrics metrics) {
        timedOut.increment();
        addTimings(metrics);
    }

    @Override
    public void recordFailed(QueryStage stage, ExecutionMetrics metrics) {
        failuresByStage.get(stage).increment();
        if (metrics != null) {
            addTimings(metrics);
        }
    }

    @Override
    public void recordOptimizerPasses(Iterable<String> appliedPasses) {
        for (String pass : appliedPasses) {
            passApplications.computeIfAbsent(pass, key -> new LongAdder()).increment();
        }
    }

    private void addTimings(ExecutionMetrics metrics) {
        parseMillis.add(metrics.parseMs());
        optimizeMillis.add(metrics.optimizeMs());
        generateMillis.add(metrics.generateMs());
        executeMillis.add(metrics.executeMs());
    }

    public Snapshot snapshot() {
        Map<QueryStage, Long> failures = new EnumMap<>(QueryStage.class);
        failuresByStage.forEach((stage, count) -> failures.put(stage, count.sum()));
        Map<String, Long> passes = new ConcurrentHashMap<>();
        passApplications.forEach((pass, count) -> passes.put(pass, count.sum()));
        return new Snapshot(
                completed.sum(),
                timedOut.sum(),
                truncated.sum(),
                cacheHits.sum(),
                rowsReturned.sum(),
                parseMillis.sum(),
                optimizeMillis.sum(),
                generateMillis.sum(),
                executeMillis.sum(),
                Map.copyOf(failures),
                Map.copyOf(passes));
    }

    public record Snapshot(
            long completed,
            long timedOut,
            long truncated,
            long cacheHits,
            long rowsReturned,
            long parseMillis,
            long optimizeMillis,
            long generateMillis,
            long executeMillis,
            Map<QueryStage, Long> failuresByStage,
            Map<String, Long> passApplications) {

        public long failures(QueryStage stage) {
            return failuresByStage.getOrDefault(stage, 0L);
        }
    }
}
