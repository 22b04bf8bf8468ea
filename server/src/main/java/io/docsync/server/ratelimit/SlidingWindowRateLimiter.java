package io.docsync.server.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window limiter: at most {@code limit} admissions per key in any
 * window of length {@code window}.
 * <p>
 * Semantics:
 *   - Each key keeps the admission times that are still inside the window.
 *   - A key at its limit must wait until its oldest admission leaves the
 *     window; that wait is the retry-after hint.
 *   - A key whose admissions have all left the window is dropped, either when
 *     it is next touched or by the sweep that runs every {@link #SWEEP_EVERY} records.
 * <p>
 * Per-key state is only touched inside {@link ConcurrentHashMap#compute}, which
 * is atomic per key.
 */
public final class SlidingWindowRateLimiter<K> implements RateLimiter<K> {
    static final int SWEEP_EVERY = 1024;

    private final int limit;
    private final long windowMillis;
    private final Clock clock;
    private final ConcurrentHashMap<K, Deque<Long>> admissions = new ConcurrentHashMap<>();
    private int recordsSinceSweep;

    public SlidingWindowRateLimiter(int limit, Duration window, Clock clock) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.limit = limit;
        this.windowMillis = window.toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<Duration> peek(K key) {
        Objects.requireNonNull(key, "key");
        long now = clock.millis();
        long[] wait = {0L};
        admissions.computeIfPresent(key, (k, q) -> {
            evict(q, now);
            if (q.size() >= limit) {
                wait[0] = Math.max(1L, q.peekFirst() + windowMillis - now);
            }
            return q.isEmpty() ? null : q;
        });
        return wait[0] > 0 ? Optional.of(Duration.ofMillis(wait[0])) : Optional.empty();
    }

    @Override
    public void record(K key) {
        Objects.requireNonNull(key, "key");
        long now = clock.millis();
        admissions.compute(key, (k, q) -> {
            Deque<Long> d = q == null ? new ArrayDeque<>() : q;
            evict(d, now);
            d.addLast(now);
            return d;
        });
        maybeSweep(now);
    }

    /** Keys currently holding admissions. */
    int trackedKeys() {
        return admissions.size();
    }

    /** Drop every key whose admissions have all expired. */
    void sweep(long now) {
        for (K key : admissions.keySet()) {
            admissions.computeIfPresent(key, (k, q) -> {
                evict(q, now);
                return q.isEmpty() ? null : q;
            });
        }
    }

    private void maybeSweep(long now) {
        boolean due;
        synchronized (this) {
            due = ++recordsSinceSweep >= SWEEP_EVERY;
            if (due) recordsSinceSweep = 0;
        }
        if (due) {
            sweep(now);
        }
    }

    private void evict(Deque<Long> q, long now) {
        while (!q.isEmpty() && q.peekFirst() <= now - windowMillis) {
            q.pollFirst();
        }
    }
}
