package io.docsync.storage;

import io.docsync.core.ContentBlock;
import io.docsync.core.Document;
import io.docsync.core.WriteResult;
import io.docsync.core.error.DocumentExistsException;
import io.docsync.core.error.DocumentNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Durable versioned document store.
 * <p>
 * Responsibilities:
 *  - Maintain an in-memory map: id -> Document (latest row).
 *  - On write, inside the per-document critical section:
 *      1) Check the expected version.
 *      2) Serialize the next row to a WAL record.
 *      3) Append+fsync to the WAL.
 *      4) Publish the row in memory.
 *      5) Possibly trigger a full snapshot based on SnapshotPolicy.
 *    A failed append leaves the previous row in place.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records, keeping the row with the highest version per id.
 * <p>
 * Timestamps are millisecond precision and never move backwards for a
 * document, so a write is always at or after the previous one.
 */
public class DurableDocumentStore implements DocumentStore {
    private static final Logger log = Logger.getLogger(DurableDocumentStore.class.getName());

    private final Map<String, Document> mem = new ConcurrentHashMap<>();
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final Clock clock;

    public DurableDocumentStore(Wal wal, Snapshotter snaps, Clock clock) {
        this(wal, snaps, new SnapshotPolicy(50_000), clock);
    }

    public DurableDocumentStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy, Clock clock) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        recover();
    }

    @Override
    public Optional<Document> get(String id) {
        return Optional.ofNullable(mem.get(id));
    }

    @Override
    public Document create(String id, List<ContentBlock> content, String createdBy) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        Document created = mem.compute(id, (k, existing) -> {
            if (existing != null) {
                throw new DocumentExistsException(id);
            }
            Document row = new Document(id, content, 0L, now(null), createdBy);
            wal.append(RecordCodec.encodeDocument(row));
            return row;
        });
        afterWrite();
        return created;
    }

    @Override
    public WriteResult compareAndSet(String id, long expectedVersion, List<ContentBlock> content, String updatedBy) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        WriteResult[] outcome = new WriteResult[1];
        mem.compute(id, (k, current) -> {
            if (current == null) {
                throw new DocumentNotFoundException(id);
            }
            if (current.version() != expectedVersion) {
                outcome[0] = WriteResult.Conflict.of(current);
                return current;
            }
            Document next = current.next(content, now(current), updatedBy);
            wal.append(RecordCodec.encodeDocument(next));
            outcome[0] = new WriteResult.Accepted(next.version(), next.updatedAt());
            return next;
        });
        if (outcome[0] instanceof WriteResult.Accepted) {
            afterWrite();
        }
        return outcome[0];
    }

    @Override
    public Document reseed(String id, List<ContentBlock> content, String updatedBy) {
        Objects.requireNonNull(content, "content");
        Document reseeded = mem.compute(id, (k, current) -> {
            if (current == null) {
                throw new DocumentNotFoundException(id);
            }
            Document next = current.next(content, now(current), updatedBy);
            wal.append(RecordCodec.encodeDocument(next));
            return next;
        });
        log.info(() -> "Reseeded " + id + " to version " + reseeded.version());
        afterWrite();
        return reseeded;
    }

    private Instant now(Document previous) {
        Instant t = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        if (previous != null && previous.updatedAt().isAfter(t)) {
            return previous.updatedAt();
        }
        return t;
    }

    private void afterWrite() {
        snapPolicy.maybeSnapshot(mem, snaps);
    }

    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null && loaded.data() != null) {
            mem.putAll(loaded.data());
            log.info(() -> "Loaded snapshot " + loaded.id() + " with " + loaded.data().size() + " documents");
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                if (RecordCodec.decode(payload) instanceof RecordCodec.DocWrite dw) {
                    Document row = dw.document();
                    mem.merge(row.id(), row, (a, b) -> b.version() > a.version() ? b : a);
                    replayed++;
                }
            }
        } catch (Exception e) {
            throw new IllegalStateException("Document store recovery failed", e);
        }
        int count = replayed;
        log.info(() -> "Replayed " + count + " document records, " + mem.size() + " documents live");
    }
}
