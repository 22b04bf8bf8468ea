package io.docsync.core;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One entry of a document's replicated update log.
 * <p>
 * Fields:
 *  - sequenceNo: per-document, strictly increasing from 1.
 *  - payload:    opaque replica delta (or full state when baseline).
 *  - createdAt:  server time of append.
 *  - baseline:   marks a reseed point; replay starts from the latest one.
 * <p>
 * Invariants:
 *  - Immutable once appended; payload bytes are copied in and out.
 */
public final class LogEntry {
    private final String documentId;
    private final long sequenceNo;
    private final byte[] payload;
    private final Instant createdAt;
    private final boolean baseline;

    public LogEntry(String documentId, long sequenceNo, byte[] payload, Instant createdAt, boolean baseline) {
        this.documentId = Objects.requireNonNull(documentId, "documentId");
        if (sequenceNo <= 0) throw new IllegalArgumentException("sequenceNo must be > 0");
        this.sequenceNo = sequenceNo;
        this.payload = Arrays.copyOf(Objects.requireNonNull(payload, "payload"), payload.length);
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.baseline = baseline;
    }

    public String documentId() { return documentId; }

    public long sequenceNo() { return sequenceNo; }

    public byte[] payload() { return Arrays.copyOf(payload, payload.length); }

    public Instant createdAt() { return createdAt; }

    public boolean baseline() { return baseline; }

    @Override
    public String toString() {
        return "LogEntry{" + documentId + "#" + sequenceNo + ", " + payload.length + "B, "
                + createdAt + (baseline ? ", baseline" : "") + "}";
    }
}
