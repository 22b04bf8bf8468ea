package io.docsync.server.collab;

import io.docsync.core.frame.Frame;

/**
 * One connected realtime client as seen by a session.
 * <p>
 * send() must not block the session thread for long; transports queue the
 * frame and write it asynchronously.
 */
public interface Peer {

    /** Unique per connection. */
    String id();

    /** Verified user behind the connection. */
    String userId();

    void send(Frame frame);

    /** Drop the connection, e.g. after the session failed to start. */
    void close(String reason);
}
