package io.docsync.server.collab;

import io.docsync.core.crdt.CrdtReplica;
import io.docsync.core.frame.Frame;
import io.docsync.storage.DocumentStore;
import io.docsync.storage.UpdateLog;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of live collaboration sessions, one per document with at least
 * one connected peer.
 * <p>
 * Sessions retire themselves when their last peer leaves; a connect that
 * races with retirement is retried against a fresh session.
 */
public final class SessionManager implements StoreAdvanceListener {
    private static final Logger log = Logger.getLogger(SessionManager.class.getName());

    private final Map<String, CollaborationSession> sessions = new ConcurrentHashMap<>();
    private final DocumentStore store;
    private final UpdateLog updateLog;
    private final Supplier<CrdtReplica> replicaFactory;

    public SessionManager(DocumentStore store, UpdateLog updateLog, Supplier<CrdtReplica> replicaFactory) {
        this.store = Objects.requireNonNull(store, "store");
        this.updateLog = Objects.requireNonNull(updateLog, "updateLog");
        this.replicaFactory = Objects.requireNonNull(replicaFactory, "replicaFactory");
    }

    /**
     * Join {@code peer} to the document's session, creating and reconciling
     * the session if needed. Completes once the peer has been sent SYNC.
     */
    public CompletableFuture<Void> connect(String documentId, Peer peer) {
        CollaborationSession s = sessions.computeIfAbsent(documentId, this::newSession);
        return s.connect(peer).thenCompose(joined -> joined
                ? CompletableFuture.<Void>completedFuture(null)
                : connect(documentId, peer));
    }

    public CompletableFuture<Void> receive(String documentId, Peer peer, Frame frame) {
        CollaborationSession s = sessions.get(documentId);
        if (s == null) {
            return CompletableFuture.completedFuture(null);
        }
        return s.receive(peer, frame);
    }

    public CompletableFuture<Void> disconnect(String documentId, Peer peer) {
        CollaborationSession s = sessions.get(documentId);
        if (s == null) {
            return CompletableFuture.completedFuture(null);
        }
        return s.disconnect(peer);
    }

    /** Re-run reconciliation on a live session after the store moved. */
    @Override
    public void storeAdvanced(String documentId) {
        CollaborationSession s = sessions.get(documentId);
        if (s == null) {
            return;
        }
        s.reconcile().whenComplete((ok, err) -> {
            if (err != null) {
                log.log(Level.WARNING, "Reconcile after store write failed for " + documentId, err);
            }
        });
    }

    public CompletableFuture<List<Participant>> participants(String documentId) {
        CollaborationSession s = sessions.get(documentId);
        if (s == null) {
            return CompletableFuture.completedFuture(List.of());
        }
        return s.participants();
    }

    public Optional<CollaborationSession> session(String documentId) {
        return Optional.ofNullable(sessions.get(documentId));
    }

    public int activeSessions() {
        return sessions.size();
    }

    public void shutdown() {
        sessions.values().forEach(CollaborationSession::shutdownNow);
        sessions.clear();
    }

    private CollaborationSession newSession(String documentId) {
        log.fine(() -> "Creating session for " + documentId);
        return new CollaborationSession(documentId, store, updateLog, replicaFactory,
                retired -> sessions.remove(retired.documentId(), retired));
    }
}
