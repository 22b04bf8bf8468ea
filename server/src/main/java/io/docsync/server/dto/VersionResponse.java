package io.docsync.server.dto;

import java.time.Instant;

/** JSON response for GET /documents/{id}/version. */
public class VersionResponse {
    public String id;
    public long version;
    public Instant updatedAt;
    public String updatedBy;
}
