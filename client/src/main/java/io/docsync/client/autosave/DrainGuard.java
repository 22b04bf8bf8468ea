package io.docsync.client.autosave;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Flag raised while a document's offline queue drains.
 * <p>
 * Live consumers check it before applying a full-document RESET and register
 * a release hook to apply whatever they held back.
 */
public final class DrainGuard {
    private final AtomicBoolean draining = new AtomicBoolean();
    private final List<Runnable> releaseHooks = new CopyOnWriteArrayList<>();

    public boolean isDraining() {
        return draining.get();
    }

    /** @return false if the flag was already raised */
    public boolean raise() {
        return draining.compareAndSet(false, true);
    }

    public void lower() {
        if (draining.compareAndSet(true, false)) {
            releaseHooks.forEach(Runnable::run);
        }
    }

    public void onRelease(Runnable hook) {
        releaseHooks.add(hook);
    }
}
