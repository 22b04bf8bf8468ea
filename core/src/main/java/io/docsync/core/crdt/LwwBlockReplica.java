package io.docsync.core.crdt;

import io.docsync.core.ContentBlock;
import io.docsync.core.ContentCodec;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.Objects;

/**
 * Default replica: a last-writer-wins register over the whole block list.
 * <p>
 * State is (clock, writerId, blocks). An incoming update replaces the state
 * when its (clock, writerId) pair is greater than the current one, compared
 * by clock first and writerId second. That ordering is total, so merges are
 * commutative, associative and idempotent.
 * <p>
 * Update layout (little-endian):
 *   - magic:    int16 = 0x1B10
 *   - clock:    int64
 *   - writerId: int32 len + UTF-8 bytes
 *   - blocks:   see {@link ContentCodec}
 */
public final class LwwBlockReplica implements CrdtReplica {
    static final short MAGIC = (short) 0x1B10;

    /** Highest clock an update may carry; {@link #write} refuses to go past it. */
    public static final long MAX_CLOCK = 1L << 53;

    private long clock;
    private String writerId = "";
    private List<ContentBlock> blocks = List.of();

    @Override
    public void apply(byte[] update) {
        Objects.requireNonNull(update, "update");
        State incoming = decode(update);
        if (dominates(incoming.clock, incoming.writerId, clock, writerId)) {
            clock = incoming.clock;
            writerId = incoming.writerId;
            blocks = incoming.blocks;
        }
    }

    @Override
    public byte[] encodeState() {
        return encode(clock, writerId, blocks);
    }

    @Override
    public boolean isEmpty() {
        return clock == 0L;
    }

    @Override
    public List<ContentBlock> content() {
        return blocks;
    }

    @Override
    public byte[] write(List<ContentBlock> content, String writer) {
        Objects.requireNonNull(writer, "writer");
        if (clock >= MAX_CLOCK) {
            throw new IllegalStateException("replica clock exhausted at " + clock);
        }
        clock = clock + 1;
        writerId = writer;
        blocks = List.copyOf(content);
        return encodeState();
    }

    /** Logical clock of the current state; 0 when empty. */
    public long clock() {
        return clock;
    }

    // ---------- codec ----------

    private record State(long clock, String writerId, List<ContentBlock> blocks) {}

    static byte[] encode(long clock, String writerId, List<ContentBlock> blocks) {
        int size = 2 + 8 + ContentCodec.sizeOf(writerId) + ContentCodec.sizeOf(blocks);
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.putShort(MAGIC);
        b.putLong(clock);
        ContentCodec.writeString(b, writerId);
        ContentCodec.write(b, blocks);
        return b.array();
    }

    private static State decode(byte[] update) {
        try {
            ByteBuffer b = ByteBuffer.wrap(update).order(ByteOrder.LITTLE_ENDIAN);
            if (b.getShort() != MAGIC) {
                throw new IllegalArgumentException("not a block replica update");
            }
            long c = b.getLong();
            if (c < 0 || c > MAX_CLOCK) throw new IllegalArgumentException("clock out of range: " + c);
            String w = ContentCodec.readString(b);
            List<ContentBlock> bl = ContentCodec.read(b);
            return new State(c, w, bl);
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("truncated replica update", e);
        }
    }

    private static boolean dominates(long c1, String w1, long c2, String w2) {
        if (c1 != c2) return c1 > c2;
        return w1.compareTo(w2) > 0;
    }
}
