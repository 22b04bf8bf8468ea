package io.docsync.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable view of one versioned document row.
 * <p>
 * Fields:
 *  - id:        document identifier.
 *  - content:   ordered content blocks, always replaced wholesale on write.
 *  - version:   starts at 0, +1 per accepted write.
 *  - updatedAt: server time of the last accepted write.
 *  - updatedBy: user of the last accepted write, null for imported rows.
 */
public record Document(
        String id,
        List<ContentBlock> content,
        long version,
        Instant updatedAt,
        String updatedBy
) {
    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(updatedAt, "updatedAt");
        content = List.copyOf(Objects.requireNonNull(content, "content"));
        if (version < 0) throw new IllegalArgumentException("version must be >= 0");
    }

    /** Next row after an accepted write. */
    public Document next(List<ContentBlock> newContent, Instant at, String by) {
        return new Document(id, newContent, version + 1, at, by);
    }
}
