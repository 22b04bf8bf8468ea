package io.docsync.client.autosave;

/** What the autosave indicator shows for one document. */
public enum SaveState {
    /** Nothing to save. */
    IDLE,
    /** Local edits waiting for the debounce or a retry timer. */
    PENDING,
    /** A write (or an offline drain) is in flight. */
    SAVING,
    /** The last write was accepted and nothing newer is waiting. */
    SAVED,
    /** Fast-forward failed; the user must pick a version. */
    CONFLICT,
    /** The server asked us to wait; one retry is scheduled. */
    RATE_LIMITED,
    /** Writes are parked in the offline queue until reconnect. */
    OFFLINE,
    /** Retries are spent; the failure was handed to the listener. */
    ERROR
}
