package io.docsync.storage;

import io.docsync.core.ContentBlock;
import io.docsync.core.ContentCodec;
import io.docsync.core.Document;
import io.docsync.core.LogEntry;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD0C5
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - kind: byte (1 = document write, 2 = log append)
 * <p>
 *   kind 1, document write:
 *     - id:            int32 len + UTF-8 bytes
 *     - version:       int64
 *     - updatedAtMs:   int64 epoch millis
 *     - updatedBy:     int32 len + UTF-8 bytes (len == -1 => null)
 *     - content:       see {@link ContentCodec}
 * <p>
 *   kind 2, log append:
 *     - documentId:    int32 len + UTF-8 bytes
 *     - sequenceNo:    int64
 *     - createdAtMs:   int64 epoch millis
 *     - baseline:      byte (0 or 1)
 *     - payload:       int32 len + bytes
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xD0C5;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    static final byte KIND_DOC_WRITE = 1;
    static final byte KIND_LOG_APPEND = 2;

    private RecordCodec() {
    }

    /** Decoded WAL payload. */
    sealed interface WalRecord permits DocWrite, LogAppend {}

    record DocWrite(Document document) implements WalRecord {}

    record LogAppend(LogEntry entry) implements WalRecord {}

    static byte[] encodeDocument(Document d) {
        int size = 1
                + ContentCodec.sizeOf(d.id())
                + 8 + 8
                + (d.updatedBy() == null ? 4 : ContentCodec.sizeOf(d.updatedBy()))
                + ContentCodec.sizeOf(d.content());
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.put(KIND_DOC_WRITE);
        ContentCodec.writeString(b, d.id());
        b.putLong(d.version());
        b.putLong(d.updatedAt().toEpochMilli());
        if (d.updatedBy() == null) {
            b.putInt(-1);
        } else {
            ContentCodec.writeString(b, d.updatedBy());
        }
        ContentCodec.write(b, d.content());
        return frame(b.array());
    }

    static byte[] encodeLogEntry(LogEntry e) {
        byte[] payload = e.payload();
        int size = 1
                + ContentCodec.sizeOf(e.documentId())
                + 8 + 8 + 1
                + 4 + payload.length;
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.put(KIND_LOG_APPEND);
        ContentCodec.writeString(b, e.documentId());
        b.putLong(e.sequenceNo());
        b.putLong(e.createdAt().toEpochMilli());
        b.put((byte) (e.baseline() ? 1 : 0));
        b.putInt(payload.length).put(payload);
        return frame(b.array());
    }

    /**
     * Decode a full payload (not including header).
     *
     * @throws IllegalArgumentException if the payload is malformed
     */
    static WalRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        try {
            byte kind = b.get();
            switch (kind) {
                case KIND_DOC_WRITE: {
                    String id = ContentCodec.readString(b);
                    long version = b.getLong();
                    Instant updatedAt = Instant.ofEpochMilli(b.getLong());
                    String updatedBy = readNullableString(b);
                    List<ContentBlock> content = ContentCodec.read(b);
                    return new DocWrite(new Document(id, content, version, updatedAt, updatedBy));
                }
                case KIND_LOG_APPEND: {
                    String docId = ContentCodec.readString(b);
                    long seq = b.getLong();
                    Instant createdAt = Instant.ofEpochMilli(b.getLong());
                    boolean baseline = b.get() != 0;
                    int len = b.getInt();
                    if (len < 0 || len > b.remaining()) {
                        throw new IllegalArgumentException("bad payload length: " + len);
                    }
                    byte[] bytes = new byte[len];
                    b.get(bytes);
                    return new LogAppend(new LogEntry(docId, seq, bytes, createdAt, baseline));
                }
                default:
                    throw new IllegalArgumentException("unknown record kind: " + kind);
            }
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("truncated WAL payload", e);
        }
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static byte[] frame(byte[] payload) {
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    private static String readNullableString(ByteBuffer b) {
        int mark = b.position();
        if (b.getInt() == -1) return null;
        b.position(mark);
        return ContentCodec.readString(b);
    }
}
