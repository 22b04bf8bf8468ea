package io.docsync.client.autosave;

import java.util.List;
import java.util.Optional;

/**
 * Durable FIFO of writes for one document.
 * <p>
 * Every mutation is persisted before it returns, so a crash never loses an
 * entry that was reported as queued.
 */
public interface OfflineQueue {

    void append(OfflineQueueEntry entry);

    Optional<OfflineQueueEntry> peek();

    /** Replace the head entry (same position), e.g. after a retry or a fast-forward. */
    void replaceHead(OfflineQueueEntry entry);

    void removeHead();

    /** Move every entry onto {@code version}; keeps order and opIds. */
    void rebaseAll(long version);

    List<OfflineQueueEntry> entries();

    /** Drop every entry; only on an explicit user decision. */
    void clear();

    default boolean isEmpty() {
        return peek().isEmpty();
    }

    default int size() {
        return entries().size();
    }
}
