package io.docsync.server.dto;

import io.docsync.core.ContentBlock;

import java.time.Instant;
import java.util.List;

/**
 * JSON body for PATCH /documents/{id}.
 * Example:
 *   {
 *     "content": [ { "type": "action", "payload": "INT. HOUSE - DAY" } ],
 *     "baseVersion": 7,
 *     "opId": "5f0c...",
 *     "clientTimestamp": "2024-05-01T10:00:00Z"
 *   }
 * The Idempotency-Key header, when present, supplies the opId.
 */
public class PatchDocumentRequest {
    public List<ContentBlock> content;
    public Long baseVersion;
    public String opId;
    public Instant clientTimestamp;
}
