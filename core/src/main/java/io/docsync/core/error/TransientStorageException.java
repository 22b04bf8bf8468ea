package io.docsync.core.error;

/**
 * Storage was unavailable or an I/O call failed. Retryable with backoff;
 * the write it interrupted may or may not have been applied, which is why
 * retries must reuse the same opId.
 */
public class TransientStorageException extends RuntimeException {
    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
