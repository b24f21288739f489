package com.huntql.service.core.executor;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.huntql.service.core.store.RowSet;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Result cache keyed by query fingerprint. Bounded by entry count (Caffeine's size-based eviction approximates
 * LRU) and by time since write. Entries are immutable, so concurrent writers for the same key are harmless: the
 * last one wins.
 */
@Slf4j
public class QueryResultCache {

    private final Cache<String, CacheEntry> entries;
    private final Duration ttl;
    private final Clock clock;

    public QueryResultCache(long capacity, Duration ttl) {
        this(capacity, ttl, Ticker.systemTicker(), Clock.systemUTC());
    }

    /** Test seam: {@code ticker} drives expiry, {@code clock} stamps {@link CacheEntry#createdAt()}. */
    public QueryResultCache(long capacity, Duration ttl, Ticker ticker, Clock clock) {
        if (capacity <= 0) throw new IllegalArgumentException("cache capacity must be positive");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("cache ttl must be positive");
        this.ttl = ttl;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(capacity)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();
        log.info("Initialized query result cache capacity={} ttl={}", capacity, ttl);
    }

    public Optional<CacheEntry> get(String fingerprint) {
        return Optional.ofNullable(entries.getIfPresent(fingerprint));
    }

    public CacheEntry put(String fingerprint, RowSet result, boolean truncated) {
        CacheEntry entry = new CacheEntry(fingerprint, result, truncated, clock.instant(), ttl);
        entries.put(fingerprint, entry);
        return entry;
    }

    public void invalidateAll() {
        entries.invalidateAll();
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    public CacheStats stats() {
        return entries.stats();
    }
}
