package com.huntql.service.core.executor;

/**
 * Timings of one {@code execute} call. {@code parseMs} covers lexing, parsing and validation. Stages that did not
 * run report zero.
 */
public record ExecutionMetrics(
        long parseMs, long optimizeMs, long generateMs, long executeMs, long rowCount, boolean cacheHit) {

    public long totalMs() {
        return parseMs + optimizeMs + generateMs + executeMs;
    }
}
