package io.docsync.client.autosave;

import io.docsync.core.WriteResult;
import io.docsync.core.error.PermanentWriteFailureException;

/**
 * Callbacks from an {@link AutosaveCoordinator}, always invoked on its
 * scheduler thread. Every method has a no-op default.
 */
public interface AutosaveListener {

    default void stateChanged(SaveState state) {
    }

    /** A second conflict; the user must accept the server copy or force theirs. */
    default void conflict(WriteResult.Conflict conflict) {
    }

    /** Retries exhausted. The content is still held locally (or in the offline queue). */
    default void failed(PermanentWriteFailureException failure) {
    }

    AutosaveListener NONE = new AutosaveListener() {
    };
}
