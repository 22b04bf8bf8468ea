package io.docsync.storage;

import io.docsync.core.ContentBlock;
import io.docsync.core.Document;
import io.docsync.core.WriteResult;

import java.util.List;
import java.util.Optional;

/**
 * Versioned document store used by the server layer.
 * <p>
 * Semantics:
 *  - Every mutation is durable before returning (WAL+fsync).
 *  - compareAndSet() is atomic per document: of two calls with the same
 *    expected version at most one is accepted.
 *  - Versions move by exactly +1 per accepted write or reseed.
 */
public interface DocumentStore {

    Optional<Document> get(String id);

    /**
     * Materialize a document at version 0.
     *
     * @throws io.docsync.core.error.DocumentExistsException if the id is taken
     */
    Document create(String id, List<ContentBlock> content, String createdBy);

    /**
     * Replace the content if the current version equals {@code expectedVersion}.
     *
     * @return Accepted with version+1, or Conflict carrying the current row
     * @throws io.docsync.core.error.DocumentNotFoundException if the document does not exist
     * @throws io.docsync.core.error.TransientStorageException on I/O failure
     */
    WriteResult compareAndSet(String id, long expectedVersion, List<ContentBlock> content, String updatedBy);

    /**
     * Administrative reseed: unconditional replacement, version+1.
     *
     * @throws io.docsync.core.error.DocumentNotFoundException if the document does not exist
     */
    Document reseed(String id, List<ContentBlock> content, String updatedBy);
}
