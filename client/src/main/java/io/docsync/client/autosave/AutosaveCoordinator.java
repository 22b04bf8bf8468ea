package io.docsync.client.autosave;

import io.docsync.client.DocumentApiClient;
import io.docsync.client.RemoteCallException;
import io.docsync.client.TransportException;
import io.docsync.core.ContentBlock;
import io.docsync.core.WriteRequest;
import io.docsync.core.WriteResult;
import io.docsync.core.error.PermanentWriteFailureException;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client-side save loop for one open document.
 * <p>
 * Every transition runs on the coordinator's {@link TaskScheduler}; public
 * methods only enqueue. Writes are issued from that thread too, so at most
 * one write is in flight and edits made meanwhile are picked up when it
 * completes. A write is never abandoned mid-flight.
 * <p>
 * Write outcomes:
 *  - Accepted:    adopt the new version, SAVED.
 *  - Conflict:    one fast-forward of the current local content onto the
 *                 latest version with a fresh opId; a second conflict parks in
 *                 CONFLICT until {@link #acceptServerVersion()} or
 *                 {@link #forceLocalVersion()}.
 *  - RateLimited: RATE_LIMITED, retry after the server's delay; more than
 *                 maxRetries refusals in a row end in ERROR.
 *  - 5xx:         retry after 2^n seconds, n = attempt, up to maxRetries; then ERROR.
 *  - no answer:   park the write in the {@link OfflineQueue}, OFFLINE. Later
 *                 saves queue behind it until {@link #onReconnect()} drains.
 */
public final class AutosaveCoordinator implements AutoCloseable {
    private static final Logger log = Logger.getLogger(AutosaveCoordinator.class.getName());

    private final String documentId;
    private final Supplier<List<ContentBlock>> localContent;
    private final DocumentApiClient api;
    private final OfflineQueue queue;
    private final DrainGuard drainGuard;
    private final AutosaveOptions options;
    private final AutosaveListener listener;
    private final TaskScheduler scheduler;
    private final Clock clock;

    // confined to scheduler
    private List<ContentBlock> lastSubmitted;
    private TaskScheduler.Cancellable debounceTimer;
    private TaskScheduler.Cancellable maxWaitTimer;
    private TaskScheduler.Cancellable retryTimer;
    private WriteResult.Conflict conflict;
    private boolean draining;

    private volatile long baseVersion;
    private volatile SaveState state = SaveState.IDLE;

    /**
     * @param documentId     document being edited
     * @param initialVersion server version the local content was loaded at
     * @param localContent   reads the editor's current content; called on the scheduler thread
     * @param api            REST client
     * @param queue          this document's offline queue
     * @param drainGuard     raised while the queue drains
     * @param options        timers and retry budget
     * @param listener       state and failure callbacks
     * @param scheduler      the coordinator's single thread
     * @param clock          enqueue and client timestamps
     */
    public AutosaveCoordinator(String documentId,
                               long initialVersion,
                               Supplier<List<ContentBlock>> localContent,
                               DocumentApiClient api,
                               OfflineQueue queue,
                               DrainGuard drainGuard,
                               AutosaveOptions options,
                               AutosaveListener listener,
                               TaskScheduler scheduler,
                               Clock clock) {
        this.documentId = Objects.requireNonNull(documentId, "documentId");
        this.localContent = Objects.requireNonNull(localContent, "localContent");
        this.api = Objects.requireNonNull(api, "api");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.drainGuard = Objects.requireNonNull(drainGuard, "drainGuard");
        this.options = Objects.requireNonNull(options, "options");
        this.listener = listener == null ? AutosaveListener.NONE : listener;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.baseVersion = initialVersion;
        this.lastSubmitted = List.copyOf(localContent.get());
        if (!queue.isEmpty()) {
            this.state = SaveState.OFFLINE;
        }
    }

    // ---------- public API (thread-safe, enqueue only) ----------

    /** The editor changed; (re)arm the debounce and max-wait timers. */
    public void markChanged() {
        run(this::onChanged);
    }

    /** Save right away, skipping the timers. */
    public void saveNow() {
        run(this::flush);
    }

    /** Connectivity is back: replay the offline queue in order. */
    public void onReconnect() {
        run(this::drain);
    }

    /** After ERROR: start over with a fresh retry budget. */
    public void retry() {
        run(() -> {
            if (state != SaveState.ERROR) return;
            Optional<OfflineQueueEntry> head = queue.peek();
            if (head.isPresent()) {
                queue.replaceHead(head.get().withRetryCount(0));
                drain();
            } else {
                lastSubmitted = null;
                flush();
            }
        });
    }

    /**
     * Resolve a conflict by taking the server's copy. Queued local writes
     * for this document are discarded.
     *
     * @return the server content the editor should load
     */
    public CompletableFuture<List<ContentBlock>> acceptServerVersion() {
        CompletableFuture<List<ContentBlock>> out = new CompletableFuture<>();
        run(() -> {
            if (state != SaveState.CONFLICT || conflict == null) {
                out.completeExceptionally(new IllegalStateException("no conflict to resolve"));
                return;
            }
            WriteResult.Conflict c = conflict;
            conflict = null;
            if (!queue.isEmpty()) {
                log.info(() -> "Discarding " + queue.size() + " queued write(s) for " + documentId
                        + " in favour of server v" + c.latestVersion());
                queue.clear();
            }
            baseVersion = c.latestVersion();
            lastSubmitted = c.latestContent();
            setState(SaveState.IDLE);
            out.complete(c.latestContent());
        });
        return out;
    }

    /** Resolve a conflict by writing the local content over the server's latest version. */
    public void forceLocalVersion() {
        run(() -> {
            if (state != SaveState.CONFLICT || conflict == null) return;
            long latest = conflict.latestVersion();
            conflict = null;
            baseVersion = latest;
            Optional<OfflineQueueEntry> head = queue.peek();
            if (head.isPresent()) {
                queue.rebaseAll(latest);
                queue.replaceHead(queue.peek().orElseThrow().rebase(latest, newOpId()));
                drain();
                return;
            }
            List<ContentBlock> content = List.copyOf(localContent.get());
            lastSubmitted = content;
            submit(new WriteRequest(documentId, content, latest, newOpId(), clock.instant()), 0, 0, false);
        });
    }

    public SaveState state() {
        return state;
    }

    public long baseVersion() {
        return baseVersion;
    }

    public int queuedWrites() {
        return queue.size();
    }

    @Override
    public void close() {
        run(this::cancelTimers);
        scheduler.shutdown();
    }

    // ---------- scheduler-confined ----------

    private void onChanged() {
        if (state == SaveState.CONFLICT || draining || retryTimer != null) {
            // picked up after the conflict, drain or retry completes
            return;
        }
        if (List.copyOf(localContent.get()).equals(lastSubmitted)) {
            return;
        }
        setState(SaveState.PENDING);
        if (debounceTimer != null) {
            debounceTimer.cancel();
        }
        debounceTimer = scheduler.schedule(() -> run(this::flush), options.debounce());
        if (maxWaitTimer == null) {
            maxWaitTimer = scheduler.schedule(() -> run(this::flush), options.maxWait());
        }
    }

    private void flush() {
        cancelTimers();
        if (state == SaveState.CONFLICT || draining || retryTimer != null) {
            return;
        }
        List<ContentBlock> content = List.copyOf(localContent.get());
        if (content.equals(lastSubmitted)) {
            if (state == SaveState.PENDING) setState(SaveState.IDLE);
            return;
        }
        lastSubmitted = content;
        var req = new WriteRequest(documentId, content, baseVersion, newOpId(), clock.instant());
        if (!queue.isEmpty()) {
            park(req);
            return;
        }
        submit(req, 0, 0, false);
    }

    /**
     * @param failures      5xx answers already seen for this request
     * @param limited       rate-limit refusals already seen for this request
     * @param fastForwarded whether the one automatic fast-forward is spent
     */
    private void submit(WriteRequest req, int failures, int limited, boolean fastForwarded) {
        setState(SaveState.SAVING);
        WriteResult result;
        try {
            result = api.write(req);
        } catch (TransportException e) {
            log.info(() -> "Offline while saving " + documentId + ": " + e.getMessage());
            park(req);
            return;
        } catch (RuntimeException e) {
            onFailure(req, failures, limited, fastForwarded, e);
            return;
        }

        if (result instanceof WriteResult.Accepted a) {
            baseVersion = a.newVersion();
            setState(SaveState.SAVED);
            log.fine(() -> "Saved " + documentId + " at v" + a.newVersion());
            followUp();
        } else if (result instanceof WriteResult.Conflict c) {
            if (!fastForwarded) {
                log.info(() -> "Conflict on " + documentId + " at base v" + req.baseVersion()
                        + ", fast-forwarding to v" + c.latestVersion());
                baseVersion = c.latestVersion();
                List<ContentBlock> current = List.copyOf(localContent.get());
                lastSubmitted = current;
                var forwarded = new WriteRequest(documentId, current, c.latestVersion(), newOpId(), clock.instant());
                submit(forwarded, failures, limited, true);
            } else {
                enterConflict(c);
            }
        } else if (result instanceof WriteResult.RateLimited rl) {
            int refusals = limited + 1;
            if (refusals > options.maxRetries()) {
                var failure = new PermanentWriteFailureException(documentId, req.opId(), refusals,
                        new IllegalStateException("still rate limited, retry after " + rl.retryAfter()));
                log.warning(failure.getMessage());
                setState(SaveState.ERROR);
                notifyFailed(failure);
                return;
            }
            setState(SaveState.RATE_LIMITED);
            log.info(() -> "Rate limited on " + documentId + ", retrying in " + rl.retryAfter());
            retryTimer = scheduler.schedule(() -> run(() -> {
                retryTimer = null;
                submit(req, failures, refusals, fastForwarded);
            }), rl.retryAfter());
        }
    }

    private void onFailure(WriteRequest req, int failures, int limited, boolean fastForwarded, RuntimeException e) {
        int attempts = failures + 1;
        boolean retryable = e instanceof RemoteCallException rc && rc.retryable();
        if (retryable && attempts <= options.maxRetries()) {
            Duration backoff = backoff(attempts);
            log.info(() -> "Save of " + documentId + " failed (" + e.getMessage() + "), retry "
                    + attempts + "/" + options.maxRetries() + " in " + backoff);
            setState(SaveState.PENDING);
            retryTimer = scheduler.schedule(() -> run(() -> {
                retryTimer = null;
                submit(req, attempts, limited, fastForwarded);
            }), backoff);
            return;
        }
        var failure = new PermanentWriteFailureException(documentId, req.opId(), attempts, e);
        log.log(Level.WARNING, failure.getMessage(), e);
        setState(SaveState.ERROR);
        notifyFailed(failure);
    }

    private void park(WriteRequest req) {
        queue.append(OfflineQueueEntry.of(req, clock.instant()));
        log.info(() -> "Queued write " + req.opId() + " for " + documentId + ", " + queue.size() + " pending");
        setState(SaveState.OFFLINE);
    }

    private void drain() {
        if (draining) {
            return;
        }
        if (queue.isEmpty()) {
            if (state == SaveState.OFFLINE) setState(SaveState.IDLE);
            followUp();
            return;
        }
        cancelTimers();
        draining = true;
        drainGuard.raise();
        log.info(() -> "Draining " + queue.size() + " queued write(s) for " + documentId);
        setState(SaveState.SAVING);
        drainNext(false, 0);
    }

    /**
     * Replay the head of the queue until it is empty or something needs to wait.
     *
     * @param limited rate-limit refusals in a row for the current head
     */
    private void drainNext(boolean fastForwarded, int limited) {
        boolean ff = fastForwarded;
        int refusals = limited;
        while (true) {
            Optional<OfflineQueueEntry> head = queue.peek();
            if (head.isEmpty()) {
                finishDrain(SaveState.SAVED);
                log.info(() -> "Offline queue for " + documentId + " drained at v" + baseVersion);
                followUp();
                return;
            }
            OfflineQueueEntry entry = head.get();
            WriteResult result;
            try {
                result = api.write(entry.toRequest());
            } catch (TransportException e) {
                log.info(() -> "Still offline, " + queue.size() + " write(s) stay queued for " + documentId);
                finishDrain(SaveState.OFFLINE);
                return;
            } catch (RuntimeException e) {
                entryFailed(entry, e);
                return;
            }

            if (result instanceof WriteResult.Accepted a) {
                queue.removeHead();
                baseVersion = a.newVersion();
                queue.rebaseAll(a.newVersion());
                ff = false;
                refusals = 0;
            } else if (result instanceof WriteResult.Conflict c) {
                if (ff) {
                    finishDrain(SaveState.CONFLICT);
                    conflict = c;
                    notifyConflict(c);
                    return;
                }
                log.info(() -> "Queued write " + entry.opId() + " conflicts, fast-forwarding to v" + c.latestVersion());
                queue.replaceHead(entry.rebase(c.latestVersion(), newOpId()));
                ff = true;
            } else if (result instanceof WriteResult.RateLimited rl) {
                int nextRefusals = refusals + 1;
                if (nextRefusals > options.maxRetries()) {
                    var failure = new PermanentWriteFailureException(documentId, entry.opId(), nextRefusals,
                            new IllegalStateException("still rate limited, retry after " + rl.retryAfter()));
                    log.warning(failure.getMessage() + "; entry kept in the offline queue");
                    finishDrain(SaveState.ERROR);
                    notifyFailed(failure);
                    return;
                }
                setState(SaveState.RATE_LIMITED);
                boolean resumeFf = ff;
                retryTimer = scheduler.schedule(() -> run(() -> {
                    retryTimer = null;
                    setState(SaveState.SAVING);
                    drainNext(resumeFf, nextRefusals);
                }), rl.retryAfter());
                return;
            }
        }
    }

    private void entryFailed(OfflineQueueEntry entry, RuntimeException e) {
        OfflineQueueEntry failed = entry.failedOnce();
        queue.replaceHead(failed);
        boolean retryable = e instanceof RemoteCallException rc && rc.retryable();
        if (retryable && failed.retryCount() < options.maxRetries()) {
            Duration backoff = backoff(failed.retryCount());
            log.info(() -> "Queued write " + entry.opId() + " failed (" + e.getMessage() + "), retry in " + backoff);
            setState(SaveState.PENDING);
            retryTimer = scheduler.schedule(() -> run(() -> {
                retryTimer = null;
                setState(SaveState.SAVING);
                drainNext(false, 0);
            }), backoff);
            return;
        }
        var failure = new PermanentWriteFailureException(documentId, entry.opId(), failed.retryCount(), e);
        log.log(Level.WARNING, failure.getMessage() + "; entry kept in the offline queue", e);
        finishDrain(SaveState.ERROR);
        notifyFailed(failure);
    }

    private void finishDrain(SaveState next) {
        draining = false;
        setState(next);
        drainGuard.lower();
    }

    private void enterConflict(WriteResult.Conflict c) {
        log.info(() -> "Second conflict on " + documentId + " (server v" + c.latestVersion()
                + "), manual resolution needed");
        conflict = c;
        setState(SaveState.CONFLICT);
        notifyConflict(c);
    }

    /** Edits made while a write was busy get their own save. */
    private void followUp() {
        if (!List.copyOf(localContent.get()).equals(lastSubmitted)) {
            onChanged();
        }
    }

    private void cancelTimers() {
        if (debounceTimer != null) {
            debounceTimer.cancel();
            debounceTimer = null;
        }
        if (maxWaitTimer != null) {
            maxWaitTimer.cancel();
            maxWaitTimer = null;
        }
    }

    private void setState(SaveState next) {
        if (state == next) return;
        SaveState prev = state;
        state = next;
        log.fine(() -> documentId + ": " + prev + " -> " + next);
        try {
            listener.stateChanged(next);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Autosave listener failed on state " + next, e);
        }
    }

    private void notifyConflict(WriteResult.Conflict c) {
        try {
            listener.conflict(c);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Autosave listener failed on conflict", e);
        }
    }

    private void notifyFailed(PermanentWriteFailureException failure) {
        try {
            listener.failed(failure);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Autosave listener failed on permanent failure", e);
        }
    }

    /** Run on the scheduler; a task that blows up leaves the coordinator in ERROR. */
    private void run(Runnable task) {
        scheduler.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.log(Level.SEVERE, "Autosave task for " + documentId + " failed", e);
                draining = false;
                drainGuard.lower();
                setState(SaveState.ERROR);
            }
        });
    }

    private static Duration backoff(int attempt) {
        return Duration.ofSeconds(1L << attempt);
    }

    private static String newOpId() {
        return UUID.randomUUID().toString();
    }
}
