package io.docsync.server.ratelimit;

import java.time.Duration;
import java.util.Optional;

/**
 * Keyed admission check for the write path.
 * <p>
 * Implementations are non-blocking: they answer immediately and never
 * queue callers.
 *
 * @param <K> key type; needs value equality
 */
public interface RateLimiter<K> {

    /**
     * How long the caller must wait before {@code key} is admitted again,
     * or empty if it would be admitted now. Does not consume a slot.
     */
    Optional<Duration> peek(K key);

    /** Consume one slot for {@code key}. */
    void record(K key);

    /**
     * Admit and consume in one step.
     *
     * @return empty if admitted, otherwise the positive wait
     */
    default Optional<Duration> tryAcquire(K key) {
        Optional<Duration> wait = peek(key);
        if (wait.isEmpty()) {
            record(key);
        }
        return wait;
    }
}
