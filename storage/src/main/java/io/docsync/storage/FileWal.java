package io.docsync.storage;

import io.docsync.core.error.TransientStorageException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends framed records to numbered segment files.
 * <p>
 * Properties:
 *  - On construction it creates the directory if needed and opens the newest
 *    segment ("00000001.log", "00000002.log", ...) for append.
 *  - append() writes, fsyncs (data and metadata) and rolls to a new segment
 *    once the current one has reached rotateBytes.
 *  - The reader walks all segments in name order and stops at the first
 *    truncated header/payload or CRC mismatch.
 *  - rewrite() writes "compact.tmp", moves it into place as the next segment
 *    with ATOMIC_MOVE and only then deletes the older segments.
 */
public class FileWal implements Wal {
    private static final String COMPACT_TMP = "compact.tmp";

    private final Path dir;
    private final long rotateBytes;

    // guarded by this
    private FileChannel ch;
    private Path current;
    private long writtenInSegment;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
            // left behind by a rewrite that never reached its move
            Files.deleteIfExists(dir.resolve(COMPACT_TMP));
        } catch (IOException e) {
            throw new TransientStorageException("cannot create WAL dir " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] framedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(framedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += framedRecord.length;
        } catch (IOException e) {
            throw new TransientStorageException("WAL append failed in " + current, e);
        }
        if (writtenInSegment >= rotateBytes) {
            rotate();
        }
    }

    @Override
    public synchronized void rewrite(List<byte[]> framedRecords) {
        Path tmp = dir.resolve(COMPACT_TMP);
        long written = 0;
        try (FileChannel out = FileChannel.open(tmp, CREATE, TRUNCATE_EXISTING, WRITE)) {
            for (byte[] rec : framedRecords) {
                ByteBuffer buf = ByteBuffer.wrap(rec);
                while (buf.hasRemaining()) {
                    out.write(buf);
                }
                written += rec.length;
            }
            out.force(true);
        } catch (IOException e) {
            throw new TransientStorageException("WAL rewrite failed in " + tmp, e);
        }

        List<Path> old = segments(dir);
        Path next = dir.resolve(String.format("%08d.log", segmentIndex(current) + 1));
        try {
            ch.close();
            Files.move(tmp, next, ATOMIC_MOVE);
            current = next;
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            ch.position(written);
            writtenInSegment = written;
        } catch (IOException e) {
            openNewestOrCreate();
            throw new TransientStorageException("WAL rewrite could not install " + next, e);
        }
        try {
            for (Path p : old) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            // the new segment is already authoritative; stale ones replay as duplicates
            throw new TransientStorageException("WAL rewrite could not delete old segments", e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() throws IOException {
        if (ch != null) ch.close();
    }

    private void rotate() {
        try {
            ch.close();
            current = dir.resolve(String.format("%08d.log", segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new TransientStorageException("WAL rotation failed", e);
        }
    }

    private void openNewestOrCreate() {
        List<Path> segs = segments(dir);
        current = segs.isEmpty() ? dir.resolve("00000001.log") : segs.get(segs.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new TransientStorageException("cannot open WAL segment " + current, e);
        }
    }

    private static int segmentIndex(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(".log", ""));
    }

    static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new TransientStorageException("cannot list WAL dir " + dir, e);
        }
    }

    /**
     * Sequential reader across segments used during recovery.
     * A corrupt record ends the whole read, later segments included.
     */
    private static final class Reader implements WalReader {
        private final Iterator<Path> remaining;
        private FileChannel ch;
        private long pos;
        private boolean done;

        Reader(List<Path> segments) {
            this.remaining = new ArrayList<>(segments).iterator();
        }

        @Override
        public byte[] next() {
            while (!done) {
                if (ch == null && !openNext()) {
                    return null;
                }
                try {
                    ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                    int read = ch.read(hdr, pos);
                    if (read <= 0) {
                        // clean end of this segment
                        ch.close();
                        ch = null;
                        continue;
                    }
                    if (read < RecordCodec.HEADER_BYTES) return stop();
                    hdr.flip();
                    short magic = hdr.getShort();
                    byte ver = hdr.get();
                    int len = hdr.getInt();
                    int crc = hdr.getInt();
                    if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return stop();
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
                    if (r2 < len) return stop();
                    byte[] bytes = payload.array();
                    if (RecordCodec.crc32(bytes) != crc) return stop();
                    pos += RecordCodec.HEADER_BYTES + (long) len;
                    return bytes;
                } catch (IOException e) {
                    throw new TransientStorageException("WAL read failed", e);
                }
            }
            return null;
        }

        private boolean openNext() {
            if (!remaining.hasNext()) {
                done = true;
                return false;
            }
            try {
                ch = FileChannel.open(remaining.next(), READ);
                pos = 0;
                return true;
            } catch (IOException e) {
                throw new TransientStorageException("cannot open WAL segment", e);
            }
        }

        private byte[] stop() {
            done = true;
            return null;
        }

        @Override
        public void close() throws IOException {
            if (ch != null) ch.close();
        }
    }
}
