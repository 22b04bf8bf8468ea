package io.docsync.server.dto;

import io.docsync.core.ContentBlock;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for GET /documents/{id}.
 *   {
 *     "id": "doc-1",
 *     "content": [ ... ],
 *     "version": 8,
 *     "updatedAt": "2024-05-01T10:00:01Z",
 *     "updatedBy": "alice",
 *     "contentSource": "store" | "log"
 *   }
 */
public class DocumentResponse {
    public String id;
    public List<ContentBlock> content;
    public long version;
    public Instant updatedAt;
    public String updatedBy;
    public String contentSource;
}
