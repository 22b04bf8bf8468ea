package io.docsync.server.collab;

import io.docsync.core.error.DocumentNotFoundException;
import io.docsync.core.frame.Frame;
import io.docsync.server.auth.IdentityResolver;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedBinaryMessage;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.xnio.Pooled;

import java.net.URLDecoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * WebSocket endpoint for /collab/{documentId}.
 * <p>
 * Each binary message is one {@link Frame}. Text messages are a protocol
 * error. The connection joins the document's session on open and leaves it
 * on close.
 */
public final class CollabWebSocketHandler implements WebSocketConnectionCallback {
    private static final Logger log = Logger.getLogger(CollabWebSocketHandler.class.getName());

    public static final String PATH_PREFIX = "/collab/";

    static final int CLOSE_UNSUPPORTED_DATA = 1003;
    static final int CLOSE_POLICY_VIOLATION = 1008;
    static final int CLOSE_INTERNAL_ERROR = 1011;

    private final SessionManager sessions;
    private final IdentityResolver identity;
    private final AtomicLong peerSeq = new AtomicLong();

    public CollabWebSocketHandler(SessionManager sessions, IdentityResolver identity) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    @Override
    public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        String documentId = documentIdFrom(exchange.getRequestURI());
        Optional<String> user = identity.resolve(exchange::getRequestHeader);
        if (documentId == null || user.isEmpty()) {
            WebSockets.sendClose(CLOSE_POLICY_VIOLATION, "document id and identity required", channel, null);
            return;
        }

        var peer = new WebSocketPeer("peer-" + peerSeq.incrementAndGet(), user.get(), channel);

        sessions.connect(documentId, peer).whenComplete((ok, err) -> {
            if (err == null) return;
            Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
            if (cause instanceof DocumentNotFoundException) {
                log.info(() -> "Rejecting collab connect for unknown document " + documentId);
                WebSockets.sendClose(CLOSE_POLICY_VIOLATION, "document not found", channel, null);
            } else {
                log.log(Level.WARNING, "Collab connect failed for " + documentId, cause);
                WebSockets.sendClose(CLOSE_INTERNAL_ERROR, "session unavailable", channel, null);
            }
        });

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullBinaryMessage(WebSocketChannel ch, BufferedBinaryMessage message) {
                Pooled<ByteBuffer[]> data = message.getData();
                try {
                    ByteBuffer merged = WebSockets.mergeBuffers(data.getResource());
                    byte[] bytes = new byte[merged.remaining()];
                    merged.get(bytes);
                    onMessage(documentId, peer, bytes);
                } finally {
                    data.free();
                }
            }

            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                WebSockets.sendClose(CLOSE_UNSUPPORTED_DATA, "binary frames only", ch, null);
            }
        });
        channel.addCloseTask(ch -> sessions.disconnect(documentId, peer));
        channel.resumeReceives();
    }

    private void onMessage(String documentId, Peer peer, byte[] bytes) {
        Frame frame;
        try {
            frame = Frame.decode(bytes);
        } catch (IllegalArgumentException bad) {
            log.warning(() -> "Dropping undecodable frame from " + peer.id() + ": " + bad.getMessage());
            return;
        }
        sessions.receive(documentId, peer, frame);
    }

    /**
     * Extract the document id from "/collab/{id}" (query string ignored),
     * or null if the path does not match.
     * <p>
     * The segment is percent-decoded the way REST paths are, so "+" stays a
     * literal plus and "%20" becomes a space.
     */
    static String documentIdFrom(String uri) {
        if (uri == null) return null;
        int q = uri.indexOf('?');
        String path = q >= 0 ? uri.substring(0, q) : uri;
        int at = path.indexOf(PATH_PREFIX);
        if (at < 0) return null;
        String id = path.substring(at + PATH_PREFIX.length());
        if (id.isBlank() || id.contains("/")) return null;
        try {
            String decoded = URLDecoder.decode(id.replace("+", "%2B"), StandardCharsets.UTF_8);
            return decoded.isBlank() ? null : decoded;
        } catch (IllegalArgumentException bad) {
            log.fine(() -> "Bad escape in collab path " + uri + ": " + bad.getMessage());
            return null;
        }
    }
}
