package io.docsync.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One compare-and-swap write attempt, consumed once by the write path.
 *
 * @param documentId      target document
 * @param content         full replacement content
 * @param baseVersion     version the client believes is current
 * @param opId            client-generated idempotency key
 * @param clientTimestamp client wall clock at creation, informational only
 */
public record WriteRequest(
        String documentId,
        List<ContentBlock> content,
        long baseVersion,
        String opId,
        Instant clientTimestamp
) {
    public WriteRequest {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(opId, "opId");
        content = List.copyOf(Objects.requireNonNull(content, "content"));
    }

    /** Same content and opId, rebased onto another version. */
    public WriteRequest rebase(long newBaseVersion) {
        return new WriteRequest(documentId, content, newBaseVersion, opId, clientTimestamp);
    }

    /** Same content, rebased, under a new idempotency key. */
    public WriteRequest rebase(long newBaseVersion, String newOpId) {
        return new WriteRequest(documentId, content, newBaseVersion, newOpId, clientTimestamp);
    }
}
