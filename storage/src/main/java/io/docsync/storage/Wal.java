package io.docsync.storage;

import java.util.List;

/**
 * Write-ahead log abstraction shared by the document store and the update log.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a torn write is treated as
 *    absent during recovery (the reader stops at the first corrupt record).
 *  - append() fsyncs before returning, so a record that was acknowledged
 *    survives a crash.
 *  - append() may be called from several threads; records never interleave.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single framed record and fsync it.
     *
     * @param framedRecord header+payload bytes from {@link RecordCodec}
     * @throws io.docsync.core.error.TransientStorageException on I/O failure
     */
    void append(byte[] framedRecord);

    /**
     * Replace the whole log with the given records, in order.
     * <p>
     * The new content becomes visible in one step: a crash part-way through
     * leaves either the old segments or the new one readable, possibly both.
     * Callers must make sure replaying both is harmless and must not append
     * concurrently.
     *
     * @param framedRecords header+payload bytes from {@link RecordCodec}
     * @throws io.docsync.core.error.TransientStorageException on I/O failure
     */
    void rewrite(List<byte[]> framedRecords);

    /**
     * Open a sequential reader over every segment, oldest first.
     */
    WalReader openReader();

    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (header stripped), or null at the end of
         *         the log or at the first truncated/corrupt record.
         */
        byte[] next();
    }
}
