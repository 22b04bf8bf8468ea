package io.docsync.server.collab;

import io.docsync.core.frame.Frame;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;

import java.nio.ByteBuffer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Peer backed by an Undertow WebSocket channel. Sends are asynchronous.
 */
final class WebSocketPeer implements Peer {
    private static final Logger log = Logger.getLogger(WebSocketPeer.class.getName());

    private final String id;
    private final String userId;
    private final WebSocketChannel channel;

    WebSocketPeer(String id, String userId, WebSocketChannel channel) {
        this.id = id;
        this.userId = userId;
        this.channel = channel;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String userId() {
        return userId;
    }

    @Override
    public void send(Frame frame) {
        WebSockets.sendBinary(ByteBuffer.wrap(frame.encode()), channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                log.log(Level.FINE, "Send to " + id + " failed", throwable);
            }
        });
    }

    @Override
    public void close(String reason) {
        WebSockets.sendClose(CollabWebSocketHandler.CLOSE_INTERNAL_ERROR, reason, channel, null);
    }
}
