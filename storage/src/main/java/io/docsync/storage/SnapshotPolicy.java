package io.docsync.storage;

import io.docsync.core.Document;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Counts accepted store mutations and asks for a full snapshot every {@code everyWrites}.
 */
public final class SnapshotPolicy {
    private static final Logger log = Logger.getLogger(SnapshotPolicy.class.getName());

    private final int everyWrites;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyWrites) {
        if (everyWrites <= 0) throw new IllegalArgumentException("everyWrites must be > 0");
        this.everyWrites = everyWrites;
    }

    /**
     * Call after each durable create, CAS or reseed.
     *
     * @return true if a snapshot was written
     */
    public boolean maybeSnapshot(Map<String, Document> rows, Snapshotter snaps) {
        if (sinceLast.incrementAndGet() < everyWrites) {
            return false;
        }
        sinceLast.set(0);
        snaps.writeSnapshot(Map.copyOf(rows));
        log.fine(() -> "Snapshot of " + rows.size() + " document(s) after " + everyWrites + " writes");
        return true;
    }
}
