package io.docsync.client;

import io.docsync.core.ContentBlock;
import io.docsync.core.WriteRequest;
import io.docsync.core.WriteResult;

import java.util.List;
import java.util.Optional;

/**
 * Client view of the document REST surface.
 * <p>
 * Typed outcomes come back as values; network failures as
 * {@link TransportException}; any other status as {@link RemoteCallException}.
 */
public interface DocumentApiClient {

    /** Versioned write; the request's opId travels as the Idempotency-Key. */
    WriteResult write(WriteRequest request) throws TransportException;

    Optional<RemoteDocument> read(String documentId) throws TransportException;

    /**
     * Materialize a new document at version 0.
     *
     * @throws io.docsync.core.error.DocumentExistsException if the id is taken
     */
    long create(String documentId, List<ContentBlock> content) throws TransportException;
}
