package io.docsync.core.error;

public class DocumentExistsException extends RuntimeException {
    public DocumentExistsException(String documentId) {
        super("document already exists: " + documentId);
    }
}
