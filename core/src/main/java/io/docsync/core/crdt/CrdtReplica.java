package io.docsync.core.crdt;

import io.docsync.core.ContentBlock;

import java.util.List;

/**
 * Opaque in-memory replica of a collaboratively edited document.
 * <p>
 * The sync core treats replicas as a black box: it feeds them update bytes
 * (from peers or from log replay), asks for the full state, and reads the
 * current content. Merge semantics belong to the implementation; callers
 * only rely on:
 *  - apply() being idempotent and order-insensitive for the same set of updates,
 *  - encodeState() producing an update that rebuilds this state on an empty replica,
 *  - write() producing an update that dominates everything this replica has seen.
 * <p>
 * Implementations are not thread-safe; one owner (a session actor) drives each instance.
 */
public interface CrdtReplica {

    /**
     * Merge one update into this replica.
     *
     * @throws IllegalArgumentException if the bytes are not a valid update
     */
    void apply(byte[] update);

    /** Full state as a single update. */
    byte[] encodeState();

    /** True until the first non-empty update has been applied. */
    boolean isEmpty();

    /** Current materialized content. */
    List<ContentBlock> content();

    /**
     * Replace the content locally and return the update that carries it.
     *
     * @param content  new full content
     * @param writerId stable identity of the writing replica
     * @throws IllegalStateException if this replica can no longer produce an
     *         update that dominates its state; the owner must start over from
     *         a fresh replica
     */
    byte[] write(List<ContentBlock> content, String writerId);
}
