package com.huntql.service.core.executor;

import com.huntql.service.core.store.RowSet;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Cached outcome of a completed execution. Never mutated after construction. */
public record CacheEntry(String fingerprint, RowSet result, boolean truncated, Instant createdAt, Duration ttl) {

    public CacheEntry {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(ttl, "ttl");
    }

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }
}
