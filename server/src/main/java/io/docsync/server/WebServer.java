package io.docsync.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docsync.core.ContentBlock;
import io.docsync.core.Document;
import io.docsync.core.WriteRequest;
import io.docsync.core.WriteResult;
import io.docsync.core.error.DocumentExistsException;
import io.docsync.core.error.DocumentNotFoundException;
import io.docsync.core.error.TransientStorageException;
import io.docsync.server.auth.IdentityResolver;
import io.docsync.server.collab.CollabWebSocketHandler;
import io.docsync.server.collab.SessionManager;
import io.docsync.server.dto.*;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Thin HTTP adapter over DocumentService and SessionManager.
 *
 * Responsibilities:
 *  - Parse HTTP method + path and resolve the caller's identity.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging through RequestLogger.
 *
 * Path layout:
 *   - GET    /documents/{id}                  Canonical content (store or log)
 *   - PATCH  /documents/{id}                  Versioned write (Idempotency-Key header)
 *   - PUT    /documents/{id}                  Materialize a new document
 *   - GET    /documents/{id}/version          Version metadata only
 *   - GET    /documents/{id}/participants     Live peers and presence
 *   - POST   /admin/documents/{id}/reseed     Administrative reseed
 *   - GET    /admin/health                    Basic health check
 *   - WS     /collab/{id}                     Realtime collaboration
 *
 * Blocking work runs on Undertow worker threads; the IO thread only dispatches.
 */
public final class WebServer {
    static final int DEFAULT_MAX_BODY_BYTES = 2 * 1024 * 1024; // 2 MiB

    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private static final String DOCUMENTS = "/documents/";
    private static final String ADMIN_DOCUMENTS = "/admin/documents/";

    private final Undertow server;
    private final ObjectMapper json = Json.mapper();
    private final DocumentService docs;
    private final SessionManager sessions;
    private final IdentityResolver identity;
    private final int maxBodyBytes;

    public WebServer(int port, DocumentService docs, SessionManager sessions, IdentityResolver identity) {
        this(port, docs, sessions, identity, DEFAULT_MAX_BODY_BYTES);
    }

    public WebServer(int port,
                     DocumentService docs,
                     SessionManager sessions,
                     IdentityResolver identity,
                     int maxBodyBytes) {
        this.docs = docs;
        this.sessions = sessions;
        this.identity = identity;
        this.maxBodyBytes = maxBodyBytes;

        HttpHandler collab = Handlers.websocket(new CollabWebSocketHandler(sessions, identity));
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> route(exchange, collab))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex, HttpHandler collab) throws Exception {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        String userId = identity.resolve(ex.getRequestHeaders()::getFirst).orElse(null);

        if (path.startsWith(CollabWebSocketHandler.PATH_PREFIX)) {
            if (userId == null) {
                reject(ex, method, null, 401, "missing user identity");
                return;
            }
            collab.handleRequest(ex);
            return;
        }

        if (ex.isInIoThread()) {
            ex.dispatch(e -> route(e, collab));
            return;
        }
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if ("/admin/health".equals(path)) {
            send(ex, 200, Map.of("status", "ok", "activeSessions", sessions.activeSessions()));
            RequestLogger.logRequest(method, path, userId, 200, 0, -1, null);
            return;
        }

        boolean admin = path.startsWith(ADMIN_DOCUMENTS);
        if (!admin && !path.startsWith(DOCUMENTS)) {
            reject(ex, method, userId, 404, "not found");
            return;
        }
        if (userId == null) {
            reject(ex, method, null, 401, "missing user identity");
            return;
        }

        String[] parts = path.substring(admin ? ADMIN_DOCUMENTS.length() : DOCUMENTS.length()).split("/", -1);
        String id = parts[0];
        if (id.isBlank() || parts.length > 2) {
            reject(ex, method, userId, 400, "document id must not be empty");
            return;
        }
        String sub = parts.length == 2 ? parts[1] : "";

        if (admin) {
            if ("reseed".equals(sub) && "POST".equals(method)) {
                handleReseed(ex, userId, id);
            } else {
                reject(ex, method, userId, 404, "not found");
            }
            return;
        }

        switch (sub) {
            case "" -> {
                switch (method) {
                    case "GET" -> handleGet(ex, userId, id);
                    case "PATCH" -> handlePatch(ex, userId, id);
                    case "PUT" -> handleCreate(ex, userId, id);
                    default -> reject(ex, method, userId, 405, "method not allowed");
                }
            }
            case "version" -> {
                if ("GET".equals(method)) handleVersion(ex, userId, id);
                else reject(ex, method, userId, 405, "method not allowed");
            }
            case "participants" -> {
                if ("GET".equals(method)) handleParticipants(ex, userId, id);
                else reject(ex, method, userId, 405, "method not allowed");
            }
            default -> reject(ex, method, userId, 404, "not found");
        }
    }

    // ---------- handlers ----------

    /** GET /documents/{id} */
    private void handleGet(HttpServerExchange ex, String userId, String id) {
        respond(ex, "GET", userId, serviceMs -> {
            long s = System.nanoTime();
            DocumentService.ReadResult r = docs.read(id);
            serviceMs[0] = elapsedMs(s);

            var dto = new DocumentResponse();
            dto.id = r.row().id();
            dto.content = r.content();
            dto.version = r.row().version();
            dto.updatedAt = r.row().updatedAt();
            dto.updatedBy = r.row().updatedBy();
            dto.contentSource = r.source().wireName();
            send(ex, 200, dto);
        });
    }

    /** PATCH /documents/{id} */
    private void handlePatch(HttpServerExchange ex, String userId, String id) {
        withBody(ex, "PATCH", userId, (data, serviceMs) -> {
            var body = json.readValue(data, PatchDocumentRequest.class);
            String opId = resolveOpId(ex.getRequestHeaders().getFirst(IDEMPOTENCY_KEY), body.opId);
            if (body.baseVersion == null) {
                throw new IllegalArgumentException("baseVersion is required");
            }
            var req = new WriteRequest(id, requireContent(body.content), body.baseVersion, opId, body.clientTimestamp);

            long s = System.nanoTime();
            WriteResult r = docs.write(userId, req);
            serviceMs[0] = elapsedMs(s);

            if (r instanceof WriteResult.Accepted a) {
                var dto = new WriteAcceptedResponse();
                dto.newVersion = a.newVersion();
                dto.updatedAt = a.updatedAt();
                send(ex, 200, dto);
            } else if (r instanceof WriteResult.Conflict c) {
                var dto = new ConflictResponse();
                dto.latestVersion = c.latestVersion();
                dto.latestContent = c.latestContent();
                dto.latestUpdatedAt = c.latestUpdatedAt();
                send(ex, 409, dto);
            } else if (r instanceof WriteResult.RateLimited rl) {
                var dto = new RateLimitedResponse();
                dto.retryAfterSeconds = rl.retryAfterSeconds();
                ex.getResponseHeaders().put(Headers.RETRY_AFTER, Long.toString(rl.retryAfterSeconds()));
                send(ex, 429, dto);
            }
        });
    }

    /** PUT /documents/{id} */
    private void handleCreate(HttpServerExchange ex, String userId, String id) {
        withBody(ex, "PUT", userId, (data, serviceMs) -> {
            var body = json.readValue(data, CreateDocumentRequest.class);
            long s = System.nanoTime();
            Document d = docs.create(userId, id, requireContent(body.content));
            serviceMs[0] = elapsedMs(s);
            send(ex, 201, versionOf(d));
        });
    }

    /** POST /admin/documents/{id}/reseed */
    private void handleReseed(HttpServerExchange ex, String userId, String id) {
        withBody(ex, "POST", userId, (data, serviceMs) -> {
            var body = json.readValue(data, CreateDocumentRequest.class);
            long s = System.nanoTime();
            Document d = docs.reseed(userId, id, requireContent(body.content));
            serviceMs[0] = elapsedMs(s);
            send(ex, 200, versionOf(d));
        });
    }

    /** GET /documents/{id}/version */
    private void handleVersion(HttpServerExchange ex, String userId, String id) {
        respond(ex, "GET", userId, serviceMs -> {
            long s = System.nanoTime();
            Document d = docs.version(id);
            serviceMs[0] = elapsedMs(s);
            send(ex, 200, versionOf(d));
        });
    }

    /** GET /documents/{id}/participants */
    private void handleParticipants(HttpServerExchange ex, String userId, String id) {
        respond(ex, "GET", userId, serviceMs -> {
            long s = System.nanoTime();
            docs.version(id); // 404 for unknown documents
            var dto = new ParticipantsResponse();
            dto.documentId = id;
            dto.participants = sessions.participants(id).get(5, TimeUnit.SECONDS);
            serviceMs[0] = elapsedMs(s);
            send(ex, 200, dto);
        });
    }

    // ---------- shared plumbing ----------

    @FunctionalInterface
    private interface Action {
        void run(long[] serviceMs) throws Exception;
    }

    @FunctionalInterface
    private interface BodyAction {
        void run(byte[] data, long[] serviceMs) throws Exception;
    }

    /** Read the full body, enforce the size limit, then run like {@link #respond}. */
    private void withBody(HttpServerExchange ex, String method, String userId, BodyAction action) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> respond(exchange, method, userId, serviceMs -> {
                    if (data.length > maxBodyBytes) {
                        send(exchange, 413, Map.of("error", "request body too large"));
                        return;
                    }
                    action.run(data, serviceMs);
                }),
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(method, exchange.getRequestPath(), userId, 400, 0, -1, ioEx);
                }
        );
    }

    /** Run a handler body and map exceptions to status codes. */
    private void respond(HttpServerExchange ex, String method, String userId, Action action) {
        long start = System.nanoTime();
        long[] serviceMs = {-1L};
        Throwable error = null;
        try {
            action.run(serviceMs);
        } catch (JsonProcessingException jsonEx) {
            error = jsonEx;
            send(ex, 400, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException bad) {
            error = bad;
            send(ex, 400, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (DocumentNotFoundException nf) {
            error = nf;
            send(ex, 404, Map.of("error", nf.getMessage()));
        } catch (DocumentExistsException exists) {
            error = exists;
            send(ex, 409, Map.of("error", exists.getMessage()));
        } catch (TransientStorageException storage) {
            error = storage;
            ex.getResponseHeaders().put(Headers.RETRY_AFTER, "1");
            send(ex, 503, Map.of("error", "storage unavailable, retry"));
        } catch (Exception e) {
            error = e;
            send(ex, 500, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            RequestLogger.logRequest(method, ex.getRequestPath(), userId, ex.getStatusCode(),
                    elapsedMs(start), serviceMs[0], error);
        }
    }

    private void reject(HttpServerExchange ex, String method, String userId, int status, String message) {
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        send(ex, status, Map.of("error", message));
        RequestLogger.logRequest(method, ex.getRequestPath(), userId, status, 0, -1, null);
    }

    /**
     * The Idempotency-Key header wins over the body opId; both present and
     * different is a client bug.
     */
    static String resolveOpId(String header, String bodyOpId) {
        boolean hasHeader = header != null && !header.isBlank();
        boolean hasBody = bodyOpId != null && !bodyOpId.isBlank();
        if (hasHeader && hasBody && !header.equals(bodyOpId)) {
            throw new IllegalArgumentException("Idempotency-Key header does not match body opId");
        }
        if (hasHeader) return header;
        if (hasBody) return bodyOpId;
        throw new IllegalArgumentException("opId or Idempotency-Key is required");
    }

    private static List<ContentBlock> requireContent(List<ContentBlock> content) {
        if (content == null) {
            throw new IllegalArgumentException("content is required");
        }
        if (content.contains(null)) {
            throw new IllegalArgumentException("content must not contain null blocks");
        }
        return content;
    }

    private static VersionResponse versionOf(Document d) {
        var dto = new VersionResponse();
        dto.id = d.id();
        dto.version = d.version();
        dto.updatedAt = d.updatedAt();
        dto.updatedBy = d.updatedBy();
        return dto;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
