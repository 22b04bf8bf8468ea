package io.docsync.server.ratelimit;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * The two limits every REST write passes: one per (user, document) and one
 * per user across all documents. A write consumes a slot in both or in
 * neither.
 */
public final class WriteRateLimits {

    /** Key of the per-document limit. */
    public record UserDocument(String userId, String documentId) {
        public UserDocument {
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(documentId, "documentId");
        }
    }

    private final RateLimiter<UserDocument> perDocument;
    private final RateLimiter<String> perUser;

    public WriteRateLimits(RateLimiter<UserDocument> perDocument, RateLimiter<String> perUser) {
        this.perDocument = Objects.requireNonNull(perDocument, "perDocument");
        this.perUser = Objects.requireNonNull(perUser, "perUser");
    }

    /**
     * @return empty if the write is admitted, otherwise the longer of the two waits
     */
    public synchronized Optional<Duration> tryAcquire(String userId, String documentId) {
        var docKey = new UserDocument(userId, documentId);
        Optional<Duration> docWait = perDocument.peek(docKey);
        Optional<Duration> userWait = perUser.peek(userId);
        if (docWait.isPresent() || userWait.isPresent()) {
            Duration d = docWait.orElse(Duration.ZERO);
            Duration u = userWait.orElse(Duration.ZERO);
            return Optional.of(d.compareTo(u) >= 0 ? d : u);
        }
        perDocument.record(docKey);
        perUser.record(userId);
        return Optional.empty();
    }
}
