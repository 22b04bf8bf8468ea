package io.docsync.server;

import io.docsync.core.ContentBlock;
import io.docsync.core.ContentSource;
import io.docsync.core.Document;
import io.docsync.core.ReconciliationPolicy;
import io.docsync.core.WriteRequest;
import io.docsync.core.WriteResult;
import io.docsync.core.crdt.CrdtReplica;
import io.docsync.core.error.DocumentNotFoundException;
import io.docsync.server.collab.LogReplay;
import io.docsync.server.collab.StoreAdvanceListener;
import io.docsync.server.ratelimit.WriteRateLimits;
import io.docsync.storage.DocumentStore;
import io.docsync.storage.IdempotencyCache;
import io.docsync.storage.UpdateLog;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Application service for document reads and writes.
 * <p>
 * Responsibilities:
 *  - Hide storage details (WAL, update log, idempotency cache) from the HTTP layer.
 *  - Run the write path in a fixed order:
 *      1) validate the request,
 *      2) check the per-document and per-user rate limits,
 *      3) return the recorded outcome of a known opId,
 *      4) compare-and-swap against the store,
 *      5) record the outcome under the opId,
 *      6) tell live sessions that the store advanced.
 *  - Answer reads with whichever of store and log the reconciliation policy picks.
 */
public class DocumentService {
    private static final Logger log = Logger.getLogger(DocumentService.class.getName());

    private final DocumentStore store;
    private final UpdateLog updateLog;
    private final IdempotencyCache idempotency;
    private final WriteRateLimits limits;
    private final Supplier<CrdtReplica> replicaFactory;
    private final StoreAdvanceListener storeAdvanced;

    public DocumentService(DocumentStore store,
                           UpdateLog updateLog,
                           IdempotencyCache idempotency,
                           WriteRateLimits limits,
                           Supplier<CrdtReplica> replicaFactory,
                           StoreAdvanceListener storeAdvanced) {
        this.store = Objects.requireNonNull(store, "store");
        this.updateLog = Objects.requireNonNull(updateLog, "updateLog");
        this.idempotency = Objects.requireNonNull(idempotency, "idempotency");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.replicaFactory = Objects.requireNonNull(replicaFactory, "replicaFactory");
        this.storeAdvanced = storeAdvanced == null ? StoreAdvanceListener.NONE : storeAdvanced;
    }

    /**
     * Versioned write on behalf of {@code userId}.
     *
     * @throws IllegalArgumentException  on a malformed request
     * @throws DocumentNotFoundException if the document does not exist
     * @throws io.docsync.core.error.TransientStorageException on storage failure
     */
    public WriteResult write(String userId, WriteRequest req) {
        validate(userId, req);

        Optional<Duration> wait = limits.tryAcquire(userId, req.documentId());
        if (wait.isPresent()) {
            log.fine(() -> "Rate limited " + userId + " on " + req.documentId() + " for " + wait.get());
            return new WriteResult.RateLimited(wait.get());
        }

        boolean[] executed = new boolean[1];
        WriteResult result = idempotency.resolve(req.opId(), () -> {
            executed[0] = true;
            return store.compareAndSet(req.documentId(), req.baseVersion(), req.content(), userId);
        });

        if (!executed[0]) {
            log.fine(() -> "Replayed recorded outcome for opId " + req.opId());
        } else if (result instanceof WriteResult.Accepted a) {
            log.fine(() -> "Accepted " + req.documentId() + " v" + a.newVersion() + " by " + userId);
            storeAdvanced.storeAdvanced(req.documentId());
        } else if (result instanceof WriteResult.Conflict c) {
            log.fine(() -> "Conflict on " + req.documentId() + ": base v" + req.baseVersion()
                    + ", current v" + c.latestVersion());
        }
        return result;
    }

    /**
     * Current canonical content of a document.
     *
     * @throws DocumentNotFoundException if the document does not exist
     */
    public ReadResult read(String documentId) {
        Document row = store.get(documentId).orElseThrow(() -> new DocumentNotFoundException(documentId));
        ContentSource source = ReconciliationPolicy.choose(updateLog.tailTimestamp(documentId), row.updatedAt());
        if (source == ContentSource.STORE) {
            return new ReadResult(row, row.content(), ContentSource.STORE);
        }
        CrdtReplica replayed = LogReplay.replay(updateLog.replay(documentId), replicaFactory);
        return new ReadResult(row, replayed.content(), ContentSource.LOG);
    }

    /** Materialize a new document at version 0. */
    public Document create(String userId, String documentId, List<ContentBlock> content) {
        requireId(documentId);
        Objects.requireNonNull(content, "content");
        Document d = store.create(documentId, content, userId);
        log.info(() -> "Created document " + documentId + " by " + userId);
        return d;
    }

    /** Administrative reseed: replace content unconditionally, version+1. */
    public Document reseed(String userId, String documentId, List<ContentBlock> content) {
        requireId(documentId);
        Document d = store.reseed(documentId, content, userId);
        storeAdvanced.storeAdvanced(documentId);
        return d;
    }

    /** Version metadata without content. */
    public Document version(String documentId) {
        return store.get(documentId).orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    private static void validate(String userId, WriteRequest req) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be empty");
        }
        if (req == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        requireId(req.documentId());
        if (req.opId().isBlank()) {
            throw new IllegalArgumentException("opId must not be empty");
        }
        if (req.baseVersion() < 0) {
            throw new IllegalArgumentException("baseVersion must be >= 0");
        }
    }

    private static void requireId(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("document id must not be empty");
        }
    }

    /**
     * Read view: the row's metadata plus the content from the chosen source.
     */
    public record ReadResult(Document row, List<ContentBlock> content, ContentSource source) {}
}
