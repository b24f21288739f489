package com.huntql.service.core.kql.sql;

import java.time.Instant;
import java.util.Objects;

/** Inclusive time window applied to every table scan, on the table's time column. */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time range end " + end + " is before its start " + start);
        }
    }

    public static TimeRange between(Instant start, Instant end) {
        return new TimeRange(start, end);
    }
}
