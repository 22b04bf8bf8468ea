package io.docsync.storage;

import io.docsync.core.WriteResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * TTL-bounded idempotency cache.
 * <p>
 * Semantics:
 *  - resolve(opId, write):
 *      * returns the recorded result if the opId was seen within the TTL window;
 *      * otherwise runs write and records Accepted / Conflict outcomes.
 *  - setTtl(Duration): updates the retention window for newly recorded opIds.
 * <p>
 * Implementation notes:
 *  - Backed by a ConcurrentHashMap<opId, Entry>. resolve() runs inside
 *    compute(), which is what serializes duplicates of one opId.
 *  - Lazy cleanup: expired entries are removed opportunistically on access,
 *    no background threads.
 */
public final class TtlIdempotencyCache implements IdempotencyCache {

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private record Entry(IdempotencyRecord record, long expireAtMillis) {}

    private final Map<String, Entry> seen = new ConcurrentHashMap<>();
    private final Clock clock;

    /** Volatile so TTL updates are visible across threads. */
    private volatile long ttlMillis;

    public TtlIdempotencyCache(Duration ttl, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        setTtl(ttl);
    }

    public TtlIdempotencyCache() {
        this(DEFAULT_TTL, Clock.systemUTC());
    }

    @Override
    public WriteResult resolve(String opId, Supplier<WriteResult> write) {
        Objects.requireNonNull(opId, "opId");
        Objects.requireNonNull(write, "write");
        WriteResult[] out = new WriteResult[1];
        seen.compute(opId, (k, existing) -> {
            long now = clock.millis();
            if (existing != null && existing.expireAtMillis() >= now) {
                out[0] = existing.record().result();
                return existing;
            }
            WriteResult result = Objects.requireNonNull(write.get(), "write returned null");
            out[0] = result;
            if (result instanceof WriteResult.RateLimited) {
                return null;
            }
            return new Entry(new IdempotencyRecord(opId, result, Instant.ofEpochMilli(now)), now + ttlMillis);
        });
        maybeCleanup(clock.millis());
        return out[0];
    }

    @Override
    public Optional<IdempotencyRecord> lookup(String opId) {
        Entry e = seen.get(opId);
        if (e == null || e.expireAtMillis() < clock.millis()) {
            return Optional.empty();
        }
        return Optional.of(e.record());
    }

    @Override
    public void setTtl(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        this.ttlMillis = ttl.toMillis();
    }

    int size() {
        return seen.size();
    }

    /**
     * Scan a bounded number of entries and drop expired ones. Removal is
     * conditional on the value so a concurrently refreshed entry survives.
     */
    private void maybeCleanup(long now) {
        int scanned = 0;
        int scanLimit = 64;
        for (var it = seen.entrySet().iterator(); it.hasNext() && scanned < scanLimit; scanned++) {
            var e = it.next();
            if (e.getValue().expireAtMillis() < now) {
                seen.remove(e.getKey(), e.getValue());
            }
        }
    }
}
