package io.docsync.core;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Single arbiter between the versioned store and the replicated update log.
 * <p>
 * Rules:
 *  - No log entries, or store written strictly after the log tail: STORE.
 *  - Otherwise (tail newer or equal): LOG.
 * <p>
 * Both the REST read path and session reconciliation must call this and
 * nothing else to answer "what is current". Stateless, so safe to share.
 */
public final class ReconciliationPolicy {

    private ReconciliationPolicy() {
        // utility
    }

    public static ContentSource choose(Optional<Instant> logTail, Instant storeUpdatedAt) {
        Objects.requireNonNull(logTail, "logTail");
        Objects.requireNonNull(storeUpdatedAt, "storeUpdatedAt");
        if (logTail.isEmpty()) {
            return ContentSource.STORE;
        }
        return storeUpdatedAt.isAfter(logTail.get()) ? ContentSource.STORE : ContentSource.LOG;
    }
}
