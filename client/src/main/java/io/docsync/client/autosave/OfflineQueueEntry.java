package io.docsync.client.autosave;

import io.docsync.core.ContentBlock;
import io.docsync.core.WriteRequest;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One write parked while the client was offline.
 *
 * @param opId                 idempotency key, reused when the entry is replayed
 * @param documentId           target document
 * @param content              full content to write
 * @param baseVersionAtEnqueue version the write is based on (moved by rebasing)
 * @param enqueueTime          when the write was parked
 * @param retryCount           failed replay attempts so far
 */
public record OfflineQueueEntry(
        String opId,
        String documentId,
        List<ContentBlock> content,
        long baseVersionAtEnqueue,
        Instant enqueueTime,
        int retryCount
) {
    public OfflineQueueEntry {
        Objects.requireNonNull(opId, "opId");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(enqueueTime, "enqueueTime");
        content = List.copyOf(Objects.requireNonNull(content, "content"));
    }

    static OfflineQueueEntry of(WriteRequest req, Instant now) {
        return new OfflineQueueEntry(req.opId(), req.documentId(), req.content(), req.baseVersion(), now, 0);
    }

    WriteRequest toRequest() {
        return new WriteRequest(documentId, content, baseVersionAtEnqueue, opId, enqueueTime);
    }

    OfflineQueueEntry rebase(long version) {
        return new OfflineQueueEntry(opId, documentId, content, version, enqueueTime, retryCount);
    }

    OfflineQueueEntry rebase(long version, String newOpId) {
        return new OfflineQueueEntry(newOpId, documentId, content, version, enqueueTime, retryCount);
    }

    OfflineQueueEntry withRetryCount(int count) {
        return new OfflineQueueEntry(opId, documentId, content, baseVersionAtEnqueue, enqueueTime, count);
    }

    OfflineQueueEntry failedOnce() {
        return new OfflineQueueEntry(opId, documentId, content, baseVersionAtEnqueue, enqueueTime, retryCount + 1);
    }
}
