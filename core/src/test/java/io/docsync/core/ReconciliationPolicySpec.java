package io.docsync.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for the store-vs-log arbitration.
 */
class ReconciliationPolicySpec {

    private static final Instant T100 = Instant.ofEpochSecond(100);
    private static final Instant T150 = Instant.ofEpochSecond(150);

    @Test
    void empty_log_always_uses_store() {
        assertEquals(ContentSource.STORE, ReconciliationPolicy.choose(Optional.empty(), T100));
    }

    @Test
    void store_newer_than_log_tail_uses_store() {
        assertEquals(ContentSource.STORE, ReconciliationPolicy.choose(Optional.of(T100), T150));
    }

    @Test
    void log_tail_newer_than_store_uses_log() {
        assertEquals(ContentSource.LOG, ReconciliationPolicy.choose(Optional.of(T150), T100));
    }

    @Test
    void equal_timestamps_use_log() {
        assertEquals(ContentSource.LOG, ReconciliationPolicy.choose(Optional.of(T150), T150));
    }

    @Test
    void same_inputs_always_give_same_answer() {
        for (int i = 0; i < 1_000; i++) {
            Instant log = Instant.ofEpochMilli(i * 7L);
            Instant store = Instant.ofEpochMilli(3_500L);
            ContentSource first = ReconciliationPolicy.choose(Optional.of(log), store);
            ContentSource second = ReconciliationPolicy.choose(Optional.of(log), store);
            assertEquals(first, second, "choose must be a pure function of its inputs");
        }
    }
}
