package io.docsync.server.collab;

/**
 * A connected peer and its latest presence payload (raw JSON, may be null).
 */
public record Participant(String peerId, String userId, String presence) {}
