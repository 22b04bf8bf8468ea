package io.docsync.client.live;

import io.docsync.client.HttpDocumentClient;
import io.docsync.core.frame.Frame;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * WebSocket connection to /collab/{documentId} feeding a {@link LiveDocumentConsumer}.
 */
public final class CollabSocket implements AutoCloseable {
    private static final Logger log = Logger.getLogger(CollabSocket.class.getName());

    private final WebSocket ws;

    private CollabSocket(WebSocket ws) {
        this.ws = ws;
    }

    /**
     * @param wsBaseUrl e.g. "ws://localhost:8080"
     */
    public static CompletableFuture<CollabSocket> connect(String wsBaseUrl,
                                                          String documentId,
                                                          String userId,
                                                          LiveDocumentConsumer consumer) {
        Objects.requireNonNull(consumer, "consumer");
        URI uri = collabUri(wsBaseUrl, documentId);
        return HttpClient.newHttpClient().newWebSocketBuilder()
                .header(HttpDocumentClient.USER_HEADER, userId)
                .buildAsync(uri, new FrameListener(consumer))
                .thenApply(CollabSocket::new);
    }

    static URI collabUri(String wsBaseUrl, String documentId) {
        String base = wsBaseUrl.endsWith("/") ? wsBaseUrl.substring(0, wsBaseUrl.length() - 1) : wsBaseUrl;
        return URI.create(base + "/collab/" + HttpDocumentClient.pathSegment(documentId));
    }

    public CompletableFuture<Void> send(Frame frame) {
        return ws.sendBinary(ByteBuffer.wrap(frame.encode()), true).thenApply(w -> null);
    }

    @Override
    public void close() {
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
    }

    /** Reassembles binary messages and hands whole frames to the consumer. */
    private static final class FrameListener implements WebSocket.Listener {
        private final LiveDocumentConsumer consumer;
        private final ByteArrayOutputStream buf = new ByteArrayOutputStream();

        FrameListener(LiveDocumentConsumer consumer) {
            this.consumer = consumer;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            buf.writeBytes(chunk);
            if (last) {
                byte[] message = buf.toByteArray();
                buf.reset();
                try {
                    consumer.onFrame(Frame.decode(message));
                } catch (IllegalArgumentException e) {
                    log.warning(() -> "Dropping undecodable frame: " + e.getMessage());
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info(() -> "Collab socket closed: " + statusCode + " " + reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.log(Level.WARNING, "Collab socket error", error);
        }
    }
}
