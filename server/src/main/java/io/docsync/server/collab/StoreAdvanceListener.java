package io.docsync.server.collab;

/**
 * Told when the versioned store accepted a REST write for a document.
 */
@FunctionalInterface
public interface StoreAdvanceListener {

    StoreAdvanceListener NONE = documentId -> { };

    void storeAdvanced(String documentId);
}
