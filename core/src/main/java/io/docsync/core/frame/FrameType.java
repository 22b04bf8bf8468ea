package io.docsync.core.frame;

/**
 * Realtime channel message kinds. The code is the first byte on the wire.
 */
public enum FrameType {
    /** Server to peer: full replica state on join. */
    SYNC((byte) 0),
    /** Both ways: one replica delta. */
    UPDATE((byte) 1),
    /** Both ways: ephemeral awareness payload (UTF-8 JSON), never persisted. */
    PRESENCE((byte) 2),
    /** Server to peers: full state after a reseed from the versioned store. */
    RESET((byte) 3);

    private final byte code;

    FrameType(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    public static FrameType fromCode(byte code) {
        for (FrameType t : values()) {
            if (t.code == code) return t;
        }
        throw new IllegalArgumentException("unknown frame type: " + code);
    }
}
