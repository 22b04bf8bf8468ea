package io.docsync.server.collab;

import io.docsync.core.ContentBlock;
import io.docsync.core.ContentSource;
import io.docsync.core.Document;
import io.docsync.core.LogEntry;
import io.docsync.core.ReconciliationPolicy;
import io.docsync.core.crdt.CrdtReplica;
import io.docsync.core.error.DocumentNotFoundException;
import io.docsync.core.error.TransientStorageException;
import io.docsync.core.frame.Frame;
import io.docsync.storage.DocumentStore;
import io.docsync.storage.UpdateLog;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Actor owning the live replica of one document.
 * <p>
 * Every state change runs on a private single-threaded executor, so peer
 * joins, incoming frames and reconciliation for a document are strictly
 * sequential and need no locks. Public methods only enqueue work.
 * <p>
 * Lifecycle:
 *  - DISCONNECTED -> RECONCILING on the first connect: the log is replayed and
 *    the store row is read; {@link ReconciliationPolicy} decides which wins.
 *  - RECONCILING -> LIVE once the replica is settled; peers get a SYNC frame.
 *  - LIVE -> DISCONNECTED when the last peer leaves. The session then retires:
 *    its replica is released and its executor shut down, and the manager
 *    builds a fresh session on the next connect.
 * <p>
 * A store write accepted while LIVE re-enters {@link #reconcile()}; if the
 * store wins, the replica is reseeded and every peer gets a RESET frame.
 */
public final class CollaborationSession {
    private static final Logger log = Logger.getLogger(CollaborationSession.class.getName());

    /** Writer id used when the server overwrites replica content. */
    static final String SERVER_WRITER = "server";

    private final String documentId;
    private final DocumentStore store;
    private final UpdateLog updateLog;
    private final Supplier<CrdtReplica> replicaFactory;
    private final Consumer<CollaborationSession> onRetired;
    private final ExecutorService executor;

    // confined to executor
    private final Map<String, Peer> peers = new LinkedHashMap<>();
    private final Map<String, String> presence = new HashMap<>();
    private CrdtReplica replica;
    private boolean retired;

    private volatile SessionState state = SessionState.DISCONNECTED;

    CollaborationSession(String documentId,
                         DocumentStore store,
                         UpdateLog updateLog,
                         Supplier<CrdtReplica> replicaFactory,
                         Consumer<CollaborationSession> onRetired) {
        this.documentId = Objects.requireNonNull(documentId, "documentId");
        this.store = Objects.requireNonNull(store, "store");
        this.updateLog = Objects.requireNonNull(updateLog, "updateLog");
        this.replicaFactory = Objects.requireNonNull(replicaFactory, "replicaFactory");
        this.onRetired = Objects.requireNonNull(onRetired, "onRetired");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "collab-" + documentId);
            t.setDaemon(true);
            return t;
        });
    }

    public String documentId() {
        return documentId;
    }

    public SessionState state() {
        return state;
    }

    /**
     * Add a peer, reconciling first if the session is not live yet.
     *
     * @return future of true once the peer received SYNC, or false if this
     *         session already retired and the caller must use a new one
     */
    public CompletableFuture<Boolean> connect(Peer peer) {
        Objects.requireNonNull(peer, "peer");
        return submit(() -> {
            if (retired) {
                return false;
            }
            if (state == SessionState.DISCONNECTED) {
                try {
                    reconcileNow();
                } catch (RuntimeException e) {
                    if (peers.isEmpty()) {
                        retire();
                    }
                    throw e;
                }
            }
            peers.put(peer.id(), peer);
            peer.send(Frame.sync(replica.encodeState()));
            log.info(() -> "Peer " + peer.id() + " (" + peer.userId() + ") joined " + documentId
                    + ", peers=" + peers.size());
            return true;
        }, false);
    }

    /** Handle one frame from a connected peer. */
    public CompletableFuture<Void> receive(Peer peer, Frame frame) {
        return submit(() -> {
            if (retired || !peers.containsKey(peer.id())) {
                return null;
            }
            switch (frame.type()) {
                case UPDATE -> applyUpdate(peer, frame.body());
                case PRESENCE -> {
                    presence.put(peer.id(), frame.bodyAsText());
                    broadcast(frame, peer.id());
                }
                default -> log.fine(() -> "Ignoring " + frame.type() + " frame from peer " + peer.id());
            }
            return null;
        }, null);
    }

    /** Remove a peer; the last one out retires the session. */
    public CompletableFuture<Void> disconnect(Peer peer) {
        return submit(() -> {
            if (peers.remove(peer.id()) == null) {
                return null;
            }
            presence.remove(peer.id());
            log.info(() -> "Peer " + peer.id() + " left " + documentId + ", peers=" + peers.size());
            if (peers.isEmpty()) {
                retire();
            }
            return null;
        }, null);
    }

    /**
     * The single reconciliation entry point for a running session.
     * A no-op unless the session is LIVE.
     */
    public CompletableFuture<Void> reconcile() {
        return submit(() -> {
            if (!retired && state == SessionState.LIVE) {
                reconcileNow();
            }
            return null;
        }, null);
    }

    public CompletableFuture<List<Participant>> participants() {
        return submit(() -> {
            List<Participant> out = new ArrayList<>(peers.size());
            for (Peer p : peers.values()) {
                out.add(new Participant(p.id(), p.userId(), presence.get(p.id())));
            }
            return List.copyOf(out);
        }, List.of());
    }

    /** Content of the live replica, empty when not live. */
    CompletableFuture<List<ContentBlock>> content() {
        return submit(() -> replica == null ? List.<ContentBlock>of() : replica.content(), List.of());
    }

    void shutdownNow() {
        executor.shutdownNow();
    }

    // ---------- executor-confined internals ----------

    private void reconcileNow() {
        SessionState before = state;
        state = SessionState.RECONCILING;
        try {
            Document row = store.get(documentId).orElseThrow(() -> new DocumentNotFoundException(documentId));
            CrdtReplica replayed = LogReplay.replay(updateLog.replay(documentId), replicaFactory);
            ContentSource source = ReconciliationPolicy.choose(updateLog.tailTimestamp(documentId), row.updatedAt());

            if (source == ContentSource.STORE) {
                CrdtReplica seededReplica = seedFromStore(replayed, row);
                byte[] seeded = seededReplica.encodeState();
                LogEntry baseline = updateLog.appendBaseline(documentId, seeded, row.updatedAt());
                replica = seededReplica;
                log.info(() -> "Stale replica for " + documentId + ": store v" + row.version()
                        + " at " + row.updatedAt() + " is newer than the log; reseeded with baseline #"
                        + baseline.sequenceNo());
                if (before == SessionState.LIVE) {
                    broadcast(Frame.reset(seeded), null);
                }
            } else if (before != SessionState.LIVE) {
                replica = replayed;
                log.fine(() -> "Serving " + documentId + " from its update log");
            }
            state = SessionState.LIVE;
        } catch (RuntimeException e) {
            state = before == SessionState.LIVE ? SessionState.LIVE : SessionState.DISCONNECTED;
            throw e;
        }
    }

    /**
     * Write the store content over the replayed history so it dominates any
     * late update from a peer that has not seen the RESET yet. A replica whose
     * clock is exhausted cannot be written over; the baseline then starts
     * from a fresh replica.
     */
    private CrdtReplica seedFromStore(CrdtReplica replayed, Document row) {
        try {
            replayed.write(row.content(), SERVER_WRITER);
            return replayed;
        } catch (IllegalStateException exhausted) {
            log.warning(() -> "Replica of " + documentId + " cannot be written over (" + exhausted.getMessage()
                    + "), reseeding from an empty replica");
            CrdtReplica fresh = replicaFactory.get();
            fresh.write(row.content(), SERVER_WRITER);
            return fresh;
        }
    }

    private void applyUpdate(Peer from, byte[] delta) {
        try {
            replica.apply(delta);
        } catch (IllegalArgumentException bad) {
            log.warning(() -> "Dropping malformed update from peer " + from.id() + ": " + bad.getMessage());
            return;
        }
        try {
            updateLog.append(documentId, delta);
        } catch (TransientStorageException e) {
            // Not durable: rebuild from the log and make the sender resync.
            log.log(Level.WARNING, "Update log append failed for " + documentId + ", dropping peer " + from.id(), e);
            replica = LogReplay.replay(updateLog.replay(documentId), replicaFactory);
            peers.remove(from.id());
            presence.remove(from.id());
            from.close("update not persisted");
            if (peers.isEmpty()) {
                retire();
            }
            return;
        }
        broadcast(Frame.update(delta), from.id());
    }

    private void broadcast(Frame frame, String exceptPeerId) {
        for (Peer p : peers.values()) {
            if (p.id().equals(exceptPeerId)) continue;
            try {
                p.send(frame);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Send to peer " + p.id() + " failed", e);
            }
        }
    }

    private void retire() {
        retired = true;
        replica = null;
        state = SessionState.DISCONNECTED;
        onRetired.accept(this);
        executor.shutdown();
        log.info(() -> "Session for " + documentId + " retired");
    }

    /** Run on the session thread, or complete with {@code whenRetired} once the executor is gone. */
    private <T> CompletableFuture<T> submit(Supplier<T> task, T whenRetired) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(whenRetired);
        }
    }
}
