package io.docsync.client.autosave;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs for one {@link AutosaveCoordinator}.
 *
 * @param debounce   quiet period after the last edit before saving
 * @param maxWait    longest an edit may wait while edits keep coming
 * @param maxRetries retry budget for 5xx answers and for each offline entry
 */
public record AutosaveOptions(Duration debounce, Duration maxWait, int maxRetries) {

    public AutosaveOptions {
        Objects.requireNonNull(debounce, "debounce");
        Objects.requireNonNull(maxWait, "maxWait");
        if (debounce.isNegative() || maxWait.isNegative()) {
            throw new IllegalArgumentException("timers must not be negative");
        }
        if (maxWait.compareTo(debounce) < 0) {
            throw new IllegalArgumentException("maxWait must be >= debounce");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }

    public static AutosaveOptions defaults() {
        return new AutosaveOptions(Duration.ofMillis(1500), Duration.ofMillis(5000), 3);
    }
}
