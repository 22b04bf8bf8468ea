package io.docsync.storage;

import io.docsync.core.WriteResult;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome remembered for one opId.
 */
public record IdempotencyRecord(String opId, WriteResult result, Instant recordedAt) {
    public IdempotencyRecord {
        Objects.requireNonNull(opId, "opId");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(recordedAt, "recordedAt");
        if (result instanceof WriteResult.RateLimited) {
            throw new IllegalArgumentException("rate-limited outcomes are not recorded");
        }
    }
}
