package io.docsync.core.error;

/**
 * A save still failed after the bounded retry budget was spent.
 * Must reach the end user; the content it carried is kept by the caller.
 */
public class PermanentWriteFailureException extends RuntimeException {
    private final String documentId;
    private final String opId;
    private final int attempts;

    public PermanentWriteFailureException(String documentId, String opId, int attempts, Throwable cause) {
        super("write " + opId + " for document " + documentId + " failed after " + attempts + " attempt(s)", cause);
        this.documentId = documentId;
        this.opId = opId;
        this.attempts = attempts;
    }

    public String documentId() { return documentId; }

    public String opId() { return opId; }

    public int attempts() { return attempts; }
}
