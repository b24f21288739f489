package com.huntql.service.core.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.benmanes.caffeine.cache.Ticker;
import com.huntql.service.core.store.RowSet;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class QueryResultCacheTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final RowSet ROWS = new RowSet(List.of("n"), List.of(List.of(1L)));

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;
    private final QueryResultCache cache =
            new QueryResultCache(2, Duration.ofMinutes(5), ticker, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void entriesCarryTheirLifetime() {
        CacheEntry entry = cache.put("fp", ROWS, true);

        assertThat(entry.createdAt()).isEqualTo(NOW);
        assertThat(entry.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
        assertThat(cache.get("fp")).contains(entry);
        assertThat(cache.get("other")).isEmpty();
    }

    @Test
    void entriesExpireAfterTheTtl() {
        cache.put("fp", ROWS, false);

        nanos.addAndGet(TimeUnit.MINUTES.toNanos(4));
        assertThat(cache.get("fp")).isPresent();

        nanos.addAndGet(TimeUnit.MINUTES.toNanos(2));
        assertThat(cache.get("fp")).isEmpty();
    }

    @Test
    void capacityIsBounded() {
        cache.put("a", ROWS, false);
        cache.put("b", ROWS, false);
        cache.put("c", ROWS, false);

        assertThat(cache.size()).isLessThanOrEqualTo(2);
    }

    @Test
    void lastWriterWins() {
        cache.put("fp", ROWS, false);
        CacheEntry second = cache.put("fp", RowSet.empty(List.of("n")), true);

        assertThat(cache.get("fp")).contains(second);
    }

    @Test
    void invalidateAllEmptiesTheCache() {
        cache.put("a", ROWS, false);
        cache.invalidateAll();

        assertThat(cache.size()).isZero();
    }

    @Test
    void concurrentWritersNeverExposeAPartialEntry() throws Exception {
        QueryResultCache shared = new QueryResultCache(1_000, Duration.ofMinutes(5));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                long value = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        shared.put("k" + (i % 20), new RowSet(List.of("n"), List.of(List.of(value))), false);
                        shared.get("k" + ((i + 7) % 20))
                                .ifPresent(e -> assertThat(e.result().rows()).hasSize(1));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(shared.size()).isEqualTo(20);
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new QueryResultCache(0, Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new QueryResultCache(10, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
