package io.docsync.server.dto;

/** 429 body; the same value is sent in the Retry-After header. */
public class RateLimitedResponse {
    public long retryAfterSeconds;
}
