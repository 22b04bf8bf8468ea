package io.docsync.storage;

import io.docsync.core.ContentBlock;
import io.docsync.core.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private static Document row(String id, long version, String text) {
        return new Document(id, List.of(new ContentBlock("action", text)), version,
                Instant.ofEpochMilli(1_000 + version), "alice");
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(RecordCodec.encodeDocument(row("d1", 0, "v0")));
        wal.append(RecordCodec.encodeDocument(row("d1", 1, "v1")));

        byte[] torn = RecordCodec.encodeDocument(row("d1", 2, "v2"));
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(torn, 0, torn.length - 5);
        }
        wal.close();

        var store = new DurableDocumentStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir),
                new MutableClock(Instant.ofEpochSecond(10)));

        Document d = store.get("d1").orElseThrow();
        assertEquals(1L, d.version(), "torn record must not be applied");
        assertEquals("v1", d.content().get(0).payload());
    }

    @Test
    void reader_walks_every_segment_in_order() throws Exception {
        // tiny threshold: every append rolls to a new segment
        var wal = new FileWal(walDir, 1);
        wal.append(RecordCodec.encodeDocument(row("a", 0, "x")));
        wal.append(RecordCodec.encodeDocument(row("a", 1, "y")));
        wal.append(RecordCodec.encodeDocument(row("b", 0, "z")));
        wal.close();

        try (var s = Files.list(walDir)) {
            assertTrue(s.count() >= 3, "expected one segment per record");
        }

        int n = 0;
        try (Wal.WalReader r = new FileWal(walDir, 1).openReader()) {
            while (r.next() != null) n++;
        }
        assertEquals(3, n);
    }

    @Test
    void corrupted_crc_stops_replay() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(RecordCodec.encodeDocument(row("d", 0, "ok")));
        byte[] bad = RecordCodec.encodeDocument(row("d", 1, "flipped"));
        bad[bad.length - 1] ^= 0x55;
        wal.append(bad);
        wal.close();

        try (Wal.WalReader r = new FileWal(walDir, 1L << 60).openReader()) {
            assertNotNull(r.next());
            assertNull(r.next());
        }
    }
}
