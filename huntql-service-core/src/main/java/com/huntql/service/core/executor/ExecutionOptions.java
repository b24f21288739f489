package com.huntql.service.core.executor;

import com.huntql.service.core.kql.sql.TimeRange;

/**
 * Per-call limits; a {@code null} limit falls back to the executor's configured default.
 *
 * @param timeoutMs budget for the backing-store call
 * @param maxRows row cap; larger results are truncated and flagged
 * @param timeRange optional window applied to every scanned table's time column
 * @param bypassCache when set, the call neither reads nor fills the result cache
 */
public record ExecutionOptions(Long timeoutMs, Integer maxRows, TimeRange timeRange, boolean bypassCache) {

    private static final ExecutionOptions DEFAULTS = new ExecutionOptions(null, null);

    public ExecutionOptions {
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, was " + timeoutMs);
        }
        if (maxRows != null && maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive, was " + maxRows);
        }
    }

    public ExecutionOptions(Long timeoutMs, Integer maxRows) {
        this(timeoutMs, maxRows, null, false);
    }

    public static ExecutionOptions defaults() {
        return DEFAULTS;
    }

    public static ExecutionOptions of(long timeoutMs, int maxRows) {
        return new ExecutionOptions(timeoutMs, maxRows);
    }

    public ExecutionOptions withTimeRange(TimeRange range) {
        return new ExecutionOptions(timeoutMs, maxRows, range, bypassCache);
    }

    public ExecutionOptions withoutCache() {
        return new ExecutionOptions(timeoutMs, maxRows, timeRange, true);
    }

    public long timeoutMsOr(long fallback) {
        return timeoutMs != null ? timeoutMs : fallback;
    }

    public int maxRowsOr(int fallback) {
        return maxRows != null ? maxRows : fallback;
    }
}
