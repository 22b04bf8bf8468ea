package io.docsync.storage;

import io.docsync.core.LogEntry;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * WAL-backed update log.
 * <p>
 * Memory holds, per document, only the entries from the latest baseline on;
 * older entries remain in the WAL and are skipped again on recovery until
 * {@link #compact()} rewrites the WAL down to what memory holds.
 */
public class DurableUpdateLog implements UpdateLog {
    private static final Logger log = Logger.getLogger(DurableUpdateLog.class.getName());

    private final Map<String, DocLog> logs = new ConcurrentHashMap<>();
    private final Wal wal;
    private final Clock clock;
    // appends share it, compaction takes it exclusively
    private final ReadWriteLock walLock = new ReentrantReadWriteLock();
    private final AtomicLong walRecords = new AtomicLong();

    public DurableUpdateLog(Wal wal, Clock clock) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.clock = Objects.requireNonNull(clock, "clock");
        recover();
    }

    @Override
    public LogEntry append(String documentId, byte[] payload) {
        return docLog(documentId).append(payload, null, false);
    }

    @Override
    public LogEntry appendBaseline(String documentId, byte[] fullState, Instant notBefore) {
        Objects.requireNonNull(notBefore, "notBefore");
        return docLog(documentId).append(fullState, notBefore, true);
    }

    @Override
    public List<LogEntry> replay(String documentId) {
        DocLog d = logs.get(documentId);
        return d == null ? List.of() : d.entries();
    }

    @Override
    public Optional<Instant> tailTimestamp(String documentId) {
        DocLog d = logs.get(documentId);
        return d == null ? Optional.empty() : d.tail();
    }

    @Override
    public int size(String documentId) {
        DocLog d = logs.get(documentId);
        return d == null ? 0 : d.size();
    }

    /** Records in the WAL that no document replays any more. */
    public long staleRecords() {
        walLock.readLock().lock();
        try {
            return walRecords.get() - liveRecords();
        } finally {
            walLock.readLock().unlock();
        }
    }

    /**
     * Rewrite the WAL so it holds, for every document, only the entries from
     * its latest baseline on. Sequence numbers and timestamps are kept, so
     * replay, tail and the next sequence number read the same afterwards.
     *
     * @return number of records dropped
     */
    public long compact() {
        walLock.writeLock().lock();
        try {
            List<byte[]> kept = new ArrayList<>();
            for (DocLog d : logs.values()) {
                for (LogEntry e : d.entries()) {
                    kept.add(RecordCodec.encodeLogEntry(e));
                }
            }
            long dropped = walRecords.get() - kept.size();
            if (dropped == 0) {
                return 0;
            }
            wal.rewrite(kept);
            walRecords.set(kept.size());
            log.info(() -> "Compacted update log: dropped " + dropped + " records, kept " + kept.size());
            return dropped;
        } finally {
            walLock.writeLock().unlock();
        }
    }

    private long liveRecords() {
        long live = 0;
        for (DocLog d : logs.values()) {
            live += d.size();
        }
        return live;
    }

    private DocLog docLog(String documentId) {
        Objects.requireNonNull(documentId, "documentId");
        return logs.computeIfAbsent(documentId, DocLog::new);
    }

    private void recover() {
        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                if (RecordCodec.decode(payload) instanceof RecordCodec.LogAppend la) {
                    LogEntry e = la.entry();
                    logs.computeIfAbsent(e.documentId(), DocLog::new).restore(e);
                    replayed++;
                    walRecords.incrementAndGet();
                }
            }
        } catch (Exception e) {
            throw new IllegalStateException("Update log recovery failed", e);
        }
        int count = replayed;
        log.info(() -> "Replayed " + count + " log records across " + logs.size() + " documents");
    }

    /** Per-document state; all access synchronized on the instance. */
    private final class DocLog {
        private final String documentId;
        private final List<LogEntry> sinceBaseline = new ArrayList<>();
        private long lastSeq;
        private Instant lastCreatedAt;

        DocLog(String documentId) {
            this.documentId = documentId;
        }

        LogEntry append(byte[] payload, Instant notBefore, boolean baseline) {
            walLock.readLock().lock();
            try {
                return appendLocked(payload, notBefore, baseline);
            } finally {
                walLock.readLock().unlock();
            }
        }

        private synchronized LogEntry appendLocked(byte[] payload, Instant notBefore, boolean baseline) {
            Instant at = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            if (notBefore != null && notBefore.isAfter(at)) at = notBefore;
            if (lastCreatedAt != null && lastCreatedAt.isAfter(at)) at = lastCreatedAt;

            LogEntry e = new LogEntry(documentId, lastSeq + 1, payload, at, baseline);
            wal.append(RecordCodec.encodeLogEntry(e));
            walRecords.incrementAndGet();
            restore(e);
            return e;
        }

        synchronized void restore(LogEntry e) {
            if (e.sequenceNo() <= lastSeq) return;
            if (e.baseline()) sinceBaseline.clear();
            sinceBaseline.add(e);
            lastSeq = e.sequenceNo();
            lastCreatedAt = e.createdAt();
        }

        synchronized List<LogEntry> entries() {
            return List.copyOf(sinceBaseline);
        }

        synchronized Optional<Instant> tail() {
            return Optional.ofNullable(lastCreatedAt);
        }

        synchronized int size() {
            return sinceBaseline.size();
        }
    }
}
