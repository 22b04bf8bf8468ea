package io.docsync.client;

/**
 * The request never got an HTTP answer: connection refused, reset, timed out
 * or interrupted. The write may or may not have reached the server.
 */
public class TransportException extends Exception {
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
