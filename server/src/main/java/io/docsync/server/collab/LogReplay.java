package io.docsync.server.collab;

import io.docsync.core.LogEntry;
import io.docsync.core.crdt.CrdtReplica;

import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Rebuilds a replica from update log entries.
 */
public final class LogReplay {
    private static final Logger log = Logger.getLogger(LogReplay.class.getName());

    private LogReplay() {
        // utility
    }

    /**
     * Apply {@code entries} in order to a fresh replica. An entry the replica
     * rejects is skipped and logged; the rest still apply.
     */
    public static CrdtReplica replay(List<LogEntry> entries, Supplier<CrdtReplica> factory) {
        CrdtReplica replica = factory.get();
        for (LogEntry e : entries) {
            try {
                replica.apply(e.payload());
            } catch (IllegalArgumentException bad) {
                log.warning(() -> "Skipping unreadable log entry " + e + ": " + bad.getMessage());
            }
        }
        return replica;
    }
}
