package io.docsync.storage;

import io.docsync.core.Document;

import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the current document rows at some point in time.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records; rows whose version is not newer than the snapshot
 *    are skipped, so replaying from the start of the WAL is safe.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the current rows.
     *
     * @param current immutable copy of id -> Document
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(Map<String, Document> current);

    /** Load the latest snapshot, or null when none exists. */
    LoadedSnapshot loadLatest();

    record LoadedSnapshot(String id, Map<String, Document> data) {}
}
