package io.docsync.server.dto;

import io.docsync.core.ContentBlock;

import java.time.Instant;
import java.util.List;

/** 409 body: the server's current row, for fast-forward or manual merge. */
public class ConflictResponse {
    public long latestVersion;
    public List<ContentBlock> latestContent;
    public Instant latestUpdatedAt;
}
