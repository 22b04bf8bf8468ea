package io.docsync.storage;

import io.docsync.core.LogEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, per-document log of opaque replica updates.
 * <p>
 * Contract:
 *  - Sequence numbers start at 1 and increase by 1 per append.
 *  - createdAt never decreases within a document.
 *  - Entries are immutable and durable once append() returns.
 *  - replay() starts at the most recent baseline entry, so a reseed
 *    supersedes everything before it.
 */
public interface UpdateLog {

    /** Append a replica delta stamped with the current server time. */
    LogEntry append(String documentId, byte[] payload);

    /**
     * Append a full replica state that replaces all earlier history for replay.
     * The entry's createdAt is at least {@code notBefore}.
     */
    LogEntry appendBaseline(String documentId, byte[] fullState, Instant notBefore);

    /** Entries from the latest baseline (inclusive) in sequence order. */
    List<LogEntry> replay(String documentId);

    /** createdAt of the newest entry, empty if the document has no log. */
    Optional<Instant> tailTimestamp(String documentId);

    /** Number of entries replay() would return. */
    int size(String documentId);
}
