package io.docsync.server.dto;

import java.time.Instant;

/** 200 body of an accepted PATCH. */
public class WriteAcceptedResponse {
    public long newVersion;
    public Instant updatedAt;
}
