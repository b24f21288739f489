package com.huntql.service.core.store;

/**
 * Per-call store limits.
 *
 * @param timeoutMs statement timeout; the store should cancel the statement server-side after it
 * @param maxRows maximum number of rows to fetch
 */
public record StoreOptions(long timeoutMs, int maxRows) {

    public StoreOptions {
        if (timeoutMs <= 0) throw new IllegalArgumentException("timeoutMs must be positive");
        if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be positive");
    }
}
