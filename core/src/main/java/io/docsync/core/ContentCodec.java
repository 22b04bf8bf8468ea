package io.docsync.core;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Little-endian binary layout for content blocks, shared by the WAL records
 * and the replica state encoding.
 * <p>
 * Layout:
 *   int32 blockCount
 *   repeated blockCount times:
 *     - type:    int32 len + UTF-8 bytes
 *     - payload: int32 len + UTF-8 bytes
 * <p>
 * Callers own the buffer and its byte order; use {@link #sizeOf(List)} to
 * allocate exactly.
 */
public final class ContentCodec {

    private ContentCodec() {
        // utility
    }

    public static int sizeOf(List<ContentBlock> blocks) {
        int size = 4;
        for (ContentBlock b : blocks) {
            size += sizeOf(b.type());
            size += sizeOf(b.payload());
        }
        return size;
    }

    public static void write(ByteBuffer buf, List<ContentBlock> blocks) {
        buf.putInt(blocks.size());
        for (ContentBlock b : blocks) {
            writeString(buf, b.type());
            writeString(buf, b.payload());
        }
    }

    public static List<ContentBlock> read(ByteBuffer buf) {
        int count = buf.getInt();
        // every block carries at least two int32 length prefixes
        if (count < 0 || count > buf.remaining() / 8) {
            throw new IllegalArgumentException("bad block count: " + count);
        }
        List<ContentBlock> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String type = readString(buf);
            String payload = readString(buf);
            out.add(new ContentBlock(type, payload));
        }
        return List.copyOf(out);
    }

    public static int sizeOf(String s) {
        return 4 + s.getBytes(StandardCharsets.UTF_8).length;
    }

    public static void writeString(ByteBuffer buf, String s) {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        buf.putInt(b.length).put(b);
    }

    public static String readString(ByteBuffer buf) {
        int len = buf.getInt();
        if (len < 0 || len > buf.remaining()) {
            throw new IllegalArgumentException("bad string length: " + len);
        }
        byte[] b = new byte[len];
        buf.get(b);
        return new String(b, StandardCharsets.UTF_8);
    }
}
