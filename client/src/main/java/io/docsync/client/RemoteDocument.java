package io.docsync.client;

import io.docsync.core.ContentBlock;

import java.time.Instant;
import java.util.List;

/** A document as the server currently presents it. */
public record RemoteDocument(
        String id,
        List<ContentBlock> content,
        long version,
        Instant updatedAt,
        String updatedBy,
        String contentSource
) {
    public RemoteDocument {
        content = content == null ? List.of() : List.copyOf(content);
    }
}
