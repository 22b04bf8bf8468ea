package io.docsync.core;

import java.util.Objects;

/**
 * Opaque, application-defined unit of document content.
 * <p>
 * The sync core never looks inside {@code payload}; it only stores, compares
 * and ships blocks around as whole values.
 */
public record ContentBlock(String type, String payload) {
    public ContentBlock {
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) throw new IllegalArgumentException("block type must not be blank");
        payload = payload == null ? "" : payload;
    }
}
