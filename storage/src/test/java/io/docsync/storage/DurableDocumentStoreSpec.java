package io.docsync.storage;

import io.docsync.core.ContentBlock;
import io.docsync.core.Document;
import io.docsync.core.WriteResult;
import io.docsync.core.error.DocumentExistsException;
import io.docsync.core.error.DocumentNotFoundException;
import io.docsync.core.error.TransientStorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class DurableDocumentStoreSpec {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_000));

    private static List<ContentBlock> text(String s) {
        return List.of(new ContentBlock("dialogue", s));
    }

    private DurableDocumentStore open() {
        return new DurableDocumentStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir), clock);
    }

    @Test
    void create_starts_at_version_zero_and_rejects_duplicates() {
        var store = open();
        Document d = store.create("doc", text("hi"), "alice");
        assertEquals(0L, d.version());
        assertThrows(DocumentExistsException.class, () -> store.create("doc", text("again"), "bob"));
    }

    @Test
    void matching_version_is_accepted_and_bumps_by_one() {
        var store = open();
        store.create("doc", text("v0"), "alice");
        clock.advance(Duration.ofSeconds(1));

        WriteResult r = store.compareAndSet("doc", 0, text("v1"), "bob");

        var accepted = assertInstanceOf(WriteResult.Accepted.class, r);
        assertEquals(1L, accepted.newVersion());
        Document d = store.get("doc").orElseThrow();
        assertEquals(text("v1"), d.content());
        assertEquals("bob", d.updatedBy());
        assertEquals(clock.instant(), d.updatedAt());
    }

    @Test
    void stale_version_conflicts_with_current_row_and_changes_nothing() {
        var store = open();
        store.create("doc", text("v0"), "alice");
        store.compareAndSet("doc", 0, text("v1"), "alice");

        WriteResult r = store.compareAndSet("doc", 0, text("mine"), "bob");

        var conflict = assertInstanceOf(WriteResult.Conflict.class, r);
        assertEquals(1L, conflict.latestVersion());
        assertEquals(text("v1"), conflict.latestContent());
        assertEquals(1L, store.get("doc").orElseThrow().version());
    }

    @Test
    void unknown_document_is_not_found() {
        var store = open();
        assertThrows(DocumentNotFoundException.class, () -> store.compareAndSet("nope", 0, text("x"), "a"));
        assertTrue(store.get("nope").isEmpty());
    }

    @Test
    void concurrent_writers_on_same_base_version_yield_exactly_one_winner() throws Exception {
        var store = open();
        store.create("doc", text("v0"), "alice");
        store.compareAndSet("doc", 0, text("v1"), "alice");
        store.compareAndSet("doc", 1, text("v2"), "alice");
        store.compareAndSet("doc", 2, text("v3"), "alice");
        store.compareAndSet("doc", 3, text("v4"), "alice");

        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<WriteResult>> futures = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            String content = "writer-" + i;
            futures.add(pool.submit(() -> {
                start.await();
                return store.compareAndSet("doc", 4, text(content), "w");
            }));
        }
        start.countDown();

        int accepted = 0;
        int conflicts = 0;
        for (Future<WriteResult> f : futures) {
            WriteResult r = f.get();
            if (r instanceof WriteResult.Accepted a) {
                accepted++;
                assertEquals(5L, a.newVersion());
            } else if (r instanceof WriteResult.Conflict c) {
                conflicts++;
                assertEquals(5L, c.latestVersion());
            }
        }
        pool.shutdownNow();

        assertEquals(1, accepted);
        assertEquals(writers - 1, conflicts);
        assertEquals(5L, store.get("doc").orElseThrow().version());
    }

    @Test
    void updated_at_never_moves_backwards() {
        var store = open();
        store.create("doc", text("v0"), "alice");
        Instant first = store.get("doc").orElseThrow().updatedAt();

        clock.set(first.minusSeconds(30));
        var accepted = (WriteResult.Accepted) store.compareAndSet("doc", 0, text("v1"), "alice");

        assertEquals(first, accepted.updatedAt());
    }

    @Test
    void rows_survive_restart() {
        var store1 = open();
        store1.create("doc", text("v0"), "alice");
        store1.compareAndSet("doc", 0, text("v1"), "bob");
        store1.reseed("doc", text("imported"), null);

        var store2 = open();

        Document d = store2.get("doc").orElseThrow();
        assertEquals(2L, d.version());
        assertEquals(text("imported"), d.content());
        assertNull(d.updatedBy());
    }

    @Test
    void recovery_after_snapshot_keeps_highest_version() {
        var store1 = new DurableDocumentStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir),
                new SnapshotPolicy(2), clock);
        store1.create("doc", text("v0"), "alice");
        store1.compareAndSet("doc", 0, text("v1"), "alice");  // snapshot here
        store1.compareAndSet("doc", 1, text("v2"), "alice");

        var store2 = open();

        assertEquals(2L, store2.get("doc").orElseThrow().version());
        assertEquals(text("v2"), store2.get("doc").orElseThrow().content());
    }

    @Test
    void failed_append_leaves_previous_row_in_place() {
        Wal failing = new Wal() {
            private int calls;

            @Override
            public void append(byte[] framedRecord) {
                if (++calls > 1) throw new TransientStorageException("disk full", null);
            }

            @Override
            public void rewrite(List<byte[]> framedRecords) {
            }

            @Override
            public WalReader openReader() {
                return new WalReader() {
                    @Override
                    public byte[] next() {
                        return null;
                    }

                    @Override
                    public void close() {
                    }
                };
            }

            @Override
            public void close() {
            }
        };
        var store = new DurableDocumentStore(failing, new FileSnapshotter(snapDir), clock);
        store.create("doc", text("v0"), "alice");

        assertThrows(TransientStorageException.class, () -> store.compareAndSet("doc", 0, text("v1"), "a"));
        assertEquals(0L, store.get("doc").orElseThrow().version());
    }
}
