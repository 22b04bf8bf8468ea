package io.docsync.storage;

import io.docsync.core.ContentBlock;
import io.docsync.core.Document;
import io.docsync.core.error.TransientStorageException;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int32 count
 *   repeated 'count' times:
 *     - id:          int32 len + UTF-8 bytes
 *     - version:     int64
 *     - updatedAtMs: int64
 *     - updatedBy:   int32 len + UTF-8 bytes (len == -1 => null)
 *     - blockCount:  int32
 *         repeated blockCount times:
 *           - type:    int32 len + UTF-8 bytes
 *           - payload: int32 len + UTF-8 bytes
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<ts>.bin.tmp" first,
 *   - then move to "snapshot-<ts>.bin" using ATOMIC_MOVE.
 */
public final class FileSnapshotter implements Snapshotter {
    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new TransientStorageException("cannot create snapshot dir " + dir, e);
        }
    }

    @Override
    public synchronized String writeSnapshot(Map<String, Document> current) {
        String name = String.format("snapshot-%016d.bin", System.currentTimeMillis());
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING))) {
            out.writeInt(current.size());
            for (Document d : current.values()) {
                writeString(out, d.id());
                out.writeLong(d.version());
                out.writeLong(d.updatedAt().toEpochMilli());
                writeString(out, d.updatedBy());
                out.writeInt(d.content().size());
                for (ContentBlock b : d.content()) {
                    writeString(out, b.type());
                    writeString(out, b.payload());
                }
            }
        } catch (IOException e) {
            throw new TransientStorageException("snapshot write failed", e);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new TransientStorageException("snapshot publish failed", e);
        }
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        Path snap;
        try (Stream<Path> files = Files.list(dir)) {
            snap = files
                    .filter(p -> p.getFileName().toString().startsWith("snapshot-"))
                    .filter(p -> p.getFileName().toString().endsWith(".bin"))
                    .sorted()
                    .reduce((a, b) -> b)
                    .orElse(null);
        } catch (IOException e) {
            throw new TransientStorageException("cannot list snapshot dir " + dir, e);
        }
        if (snap == null) return null;

        try (var in = new DataInputStream(Files.newInputStream(snap))) {
            int count = in.readInt();
            Map<String, Document> map = new HashMap<>(count * 2);
            for (int i = 0; i < count; i++) {
                String id = readString(in);
                long version = in.readLong();
                Instant updatedAt = Instant.ofEpochMilli(in.readLong());
                String updatedBy = readString(in);
                int blocks = in.readInt();
                List<ContentBlock> content = new ArrayList<>(blocks);
                for (int j = 0; j < blocks; j++) {
                    content.add(new ContentBlock(readString(in), readString(in)));
                }
                map.put(id, new Document(id, content, version, updatedAt, updatedBy));
            }
            return new LoadedSnapshot(snap.getFileName().toString(), map);
        } catch (IOException e) {
            throw new TransientStorageException("snapshot read failed: " + snap, e);
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        if (s == null) {
            out.writeInt(-1);
            return;
        }
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len == -1) return null;
        return new String(in.readNBytes(len), StandardCharsets.UTF_8);
    }
}
