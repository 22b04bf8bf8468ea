package io.docsync.client;

/**
 * The server answered with a status the caller has no typed outcome for
 * (400, 404, 5xx and so on).
 */
public class RemoteCallException extends RuntimeException {
    private final int status;

    public RemoteCallException(int status, String body) {
        super("HTTP " + status + (body == null || body.isBlank() ? "" : ": " + body));
        this.status = status;
    }

    public int status() {
        return status;
    }

    /** 5xx answers may succeed on a later attempt; 4xx ones will not. */
    public boolean retryable() {
        return status >= 500;
    }
}
