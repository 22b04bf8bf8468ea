package io.docsync.core;

/** Which representation of a document is canonical right now. */
public enum ContentSource {
    /** The versioned store row. */
    STORE,
    /** The replica rebuilt from the replicated update log. */
    LOG;

    /** Lower-case wire name ("store" / "log"). */
    public String wireName() {
        return name().toLowerCase();
    }
}
