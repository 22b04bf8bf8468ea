package io.docsync.client.live;

import io.docsync.client.autosave.DrainGuard;
import io.docsync.core.ContentBlock;
import io.docsync.core.crdt.CrdtReplica;
import io.docsync.core.frame.Frame;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Applies collaboration frames to the client's replica of one document.
 * <p>
 * Nothing from the server may overwrite local state while the offline queue
 * is draining local writes. While the {@link DrainGuard} is raised:
 *  - SYNC and RESET carry full state; only the newest is kept, and it
 *    supersedes any UPDATE held back before it.
 *  - UPDATE frames are buffered in arrival order.
 * When the guard drops, the held full state is applied first, then the
 * buffered updates. PRESENCE frames are never held back.
 */
public final class LiveDocumentConsumer {
    private static final Logger log = Logger.getLogger(LiveDocumentConsumer.class.getName());

    private final DrainGuard drainGuard;
    private final Supplier<CrdtReplica> replicaFactory;
    private final Consumer<List<ContentBlock>> onContent;
    private final Consumer<String> onPresence;

    private CrdtReplica replica;
    private Frame deferredFullState;
    private final List<Frame> deferredUpdates = new ArrayList<>();

    public LiveDocumentConsumer(DrainGuard drainGuard,
                                Supplier<CrdtReplica> replicaFactory,
                                Consumer<List<ContentBlock>> onContent,
                                Consumer<String> onPresence) {
        this.drainGuard = Objects.requireNonNull(drainGuard, "drainGuard");
        this.replicaFactory = Objects.requireNonNull(replicaFactory, "replicaFactory");
        this.onContent = Objects.requireNonNull(onContent, "onContent");
        this.onPresence = onPresence == null ? p -> { } : onPresence;
        this.replica = replicaFactory.get();
        drainGuard.onRelease(this::applyDeferred);
    }

    public synchronized void onFrame(Frame frame) {
        if (!drainGuard.isDraining() && heldBack() > 0) {
            // guard dropped but its release hook has not run yet
            applyDeferred();
        }
        switch (frame.type()) {
            case SYNC, RESET -> {
                if (drainGuard.isDraining()) {
                    log.fine(() -> "Holding back " + frame.type() + " while the offline queue drains");
                    deferredFullState = frame;
                    deferredUpdates.clear();
                } else {
                    replaceWith(frame);
                }
            }
            case UPDATE -> {
                if (drainGuard.isDraining()) {
                    deferredUpdates.add(frame);
                } else {
                    applyUpdate(frame);
                }
            }
            case PRESENCE -> onPresence.accept(frame.bodyAsText());
        }
    }

    public synchronized List<ContentBlock> content() {
        return replica.content();
    }

    /** Local edit: returns the delta to send as an UPDATE frame. */
    public synchronized Frame localWrite(List<ContentBlock> content, String writerId) {
        byte[] delta = replica.write(content, writerId);
        return Frame.update(delta);
    }

    /** Frames held back by the drain guard. */
    synchronized int heldBack() {
        return (deferredFullState == null ? 0 : 1) + deferredUpdates.size();
    }

    private synchronized void applyDeferred() {
        Frame full = deferredFullState;
        List<Frame> updates = List.copyOf(deferredUpdates);
        deferredFullState = null;
        deferredUpdates.clear();
        if (full != null) {
            log.fine(() -> "Applying " + full.type() + " held back during drain");
            replaceWith(full);
        }
        for (Frame u : updates) {
            applyUpdate(u);
        }
    }

    private void applyUpdate(Frame update) {
        try {
            replica.apply(update.body());
        } catch (IllegalArgumentException bad) {
            log.warning(() -> "Dropping unreadable update: " + bad.getMessage());
            return;
        }
        onContent.accept(replica.content());
    }

    private void replaceWith(Frame full) {
        CrdtReplica fresh = replicaFactory.get();
        fresh.apply(full.body());
        replica = fresh;
        onContent.accept(replica.content());
    }
}
