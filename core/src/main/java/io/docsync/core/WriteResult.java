package io.docsync.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a compare-and-swap write.
 * <p>
 *  - Accepted:    the write was applied and consumed exactly one version.
 *  - Conflict:    base version was stale; nothing was applied. Carries the
 *                 current row so the caller can fast-forward or merge.
 *  - RateLimited: rejected before touching the store or the idempotency cache.
 * <p>
 * Only Accepted and Conflict are ever recorded for idempotent replay.
 */
public sealed interface WriteResult
        permits WriteResult.Accepted, WriteResult.Conflict, WriteResult.RateLimited {

    record Accepted(long newVersion, Instant updatedAt) implements WriteResult {
        public Accepted {
            Objects.requireNonNull(updatedAt, "updatedAt");
        }
    }

    record Conflict(long latestVersion, List<ContentBlock> latestContent, Instant latestUpdatedAt)
            implements WriteResult {
        public Conflict {
            latestContent = List.copyOf(latestContent);
            Objects.requireNonNull(latestUpdatedAt, "latestUpdatedAt");
        }

        public static Conflict of(Document current) {
            return new Conflict(current.version(), current.content(), current.updatedAt());
        }
    }

    record RateLimited(Duration retryAfter) implements WriteResult {
        public RateLimited {
            if (retryAfter == null || retryAfter.isNegative() || retryAfter.isZero()) {
                throw new IllegalArgumentException("retryAfter must be positive");
            }
        }

        /** Whole seconds for the Retry-After header, never below 1. */
        public long retryAfterSeconds() {
            long secs = (retryAfter.toMillis() + 999) / 1000;
            return Math.max(1L, secs);
        }
    }
}
