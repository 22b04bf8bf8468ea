package io.docsync.core.error;

public class DocumentNotFoundException extends RuntimeException {
    public DocumentNotFoundException(String documentId) {
        super("document not found: " + documentId);
    }
}
