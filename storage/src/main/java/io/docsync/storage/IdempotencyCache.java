package io.docsync.storage;

import io.docsync.core.WriteResult;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Remembers the outcome of each opId for a bounded time window.
 * Rationale:
 *  - Clients retry after timeouts and replay their offline queue, so the same
 *    logical write can arrive more than once.
 *  - A replayed opId must observe the original outcome and cause no new
 *    side effects.
 */
public interface IdempotencyCache {

    /**
     * Return the recorded outcome for {@code opId} if present and unexpired,
     * otherwise run {@code write}, record its outcome and return it.
     * <p>
     * Calls for the same opId are serialized, so concurrent duplicates run
     * {@code write} at most once. Rate-limited outcomes are returned but not
     * recorded; exceptions propagate and record nothing.
     */
    WriteResult resolve(String opId, Supplier<WriteResult> write);

    /** Unexpired record for an opId, if any. */
    Optional<IdempotencyRecord> lookup(String opId);

    /** Configure the retention window for newly recorded outcomes. */
    void setTtl(Duration ttl);
}
