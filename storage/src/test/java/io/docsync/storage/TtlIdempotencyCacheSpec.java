package io.docsync.storage;

import io.docsync.core.WriteResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavior checks for TtlIdempotencyCache.
 */
class TtlIdempotencyCacheSpec {

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(0));

    private static WriteResult accepted(long v) {
        return new WriteResult.Accepted(v, Instant.ofEpochSecond(v));
    }

    @Test
    void same_opid_within_ttl_returns_recorded_result_without_rerunning() {
        var cache = new TtlIdempotencyCache(Duration.ofHours(24), clock);
        AtomicInteger runs = new AtomicInteger();

        WriteResult first = cache.resolve("op-1", () -> { runs.incrementAndGet(); return accepted(8); });
        WriteResult second = cache.resolve("op-1", () -> { runs.incrementAndGet(); return accepted(9); });

        assertEquals(accepted(8), first);
        assertEquals(first, second);
        assertEquals(1, runs.get());
    }

    @Test
    void opid_runs_again_after_ttl_expires() {
        var cache = new TtlIdempotencyCache(Duration.ofHours(24), clock);
        cache.resolve("op", () -> accepted(1));

        clock.advance(Duration.ofHours(24).plusMillis(1));

        assertTrue(cache.lookup("op").isEmpty());
        assertEquals(accepted(2), cache.resolve("op", () -> accepted(2)));
    }

    @Test
    void conflicts_are_recorded_but_rate_limits_are_not() {
        var cache = new TtlIdempotencyCache(Duration.ofHours(1), clock);
        var conflict = new WriteResult.Conflict(3, List.of(), Instant.EPOCH);

        cache.resolve("c", () -> conflict);
        cache.resolve("r", () -> new WriteResult.RateLimited(Duration.ofSeconds(2)));

        assertEquals(conflict, cache.lookup("c").orElseThrow().result());
        assertTrue(cache.lookup("r").isEmpty());
    }

    @Test
    void failed_write_records_nothing() {
        var cache = new TtlIdempotencyCache(Duration.ofHours(1), clock);

        assertThrows(IllegalStateException.class, () -> cache.resolve("op", () -> {
            throw new IllegalStateException("boom");
        }));

        assertTrue(cache.lookup("op").isEmpty());
        assertEquals(accepted(1), cache.resolve("op", () -> accepted(1)));
    }

    @Test
    void concurrent_duplicates_execute_once() throws Exception {
        var cache = new TtlIdempotencyCache(Duration.ofHours(1), clock);
        AtomicInteger runs = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<WriteResult>> futures = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return cache.resolve("dup", () -> accepted(runs.incrementAndGet()));
            }));
        }
        start.countDown();
        for (Future<WriteResult> f : futures) {
            assertEquals(accepted(1), f.get());
        }
        pool.shutdownNow();
        assertEquals(1, runs.get());
    }

    @Test
    void expired_entries_are_cleaned_lazily() {
        var cache = new TtlIdempotencyCache(Duration.ofSeconds(1), clock);
        for (int i = 0; i < 10; i++) {
            cache.resolve("old-" + i, () -> accepted(1));
        }
        clock.advance(Duration.ofSeconds(5));
        cache.resolve("fresh", () -> accepted(2));

        assertEquals(1, cache.size());
    }

    @Test
    void set_ttl_rejects_non_positive_values() {
        var cache = new TtlIdempotencyCache();
        assertThrows(IllegalArgumentException.class, () -> cache.setTtl(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> cache.setTtl(Duration.ofMillis(-1)));
    }
}
