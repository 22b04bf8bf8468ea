package io.docsync.core.frame;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One realtime message: a type byte followed by an opaque body.
 * <p>
 * Wire layout: [type (1B)][body (rest of the message)]. The transport
 * (a WebSocket binary message) already provides ordering and boundaries.
 */
public final class Frame {
    private final FrameType type;
    private final byte[] body;

    public Frame(FrameType type, byte[] body) {
        this.type = Objects.requireNonNull(type, "type");
        this.body = body == null ? new byte[0] : Arrays.copyOf(body, body.length);
    }

    public static Frame sync(byte[] state) { return new Frame(FrameType.SYNC, state); }

    public static Frame update(byte[] delta) { return new Frame(FrameType.UPDATE, delta); }

    public static Frame reset(byte[] state) { return new Frame(FrameType.RESET, state); }

    public static Frame presence(String json) {
        return new Frame(FrameType.PRESENCE, json.getBytes(StandardCharsets.UTF_8));
    }

    public FrameType type() { return type; }

    public byte[] body() { return Arrays.copyOf(body, body.length); }

    public String bodyAsText() { return new String(body, StandardCharsets.UTF_8); }

    public byte[] encode() {
        byte[] out = new byte[1 + body.length];
        out[0] = type.code();
        System.arraycopy(body, 0, out, 1, body.length);
        return out;
    }

    /**
     * @throws IllegalArgumentException on an empty message or unknown type byte
     */
    public static Frame decode(byte[] message) {
        if (message == null || message.length == 0) {
            throw new IllegalArgumentException("empty frame");
        }
        FrameType t = FrameType.fromCode(message[0]);
        return new Frame(t, Arrays.copyOfRange(message, 1, message.length));
    }
}
