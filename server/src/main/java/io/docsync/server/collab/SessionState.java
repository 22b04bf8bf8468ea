package io.docsync.server.collab;

/**
 * Lifecycle of a per-document collaboration session.
 */
public enum SessionState {
    DISCONNECTED,
    RECONCILING,
    LIVE
}
