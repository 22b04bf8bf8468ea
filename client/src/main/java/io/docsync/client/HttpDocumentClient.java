package io.docsync.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docsync.core.ContentBlock;
import io.docsync.core.WriteRequest;
import io.docsync.core.WriteResult;
import io.docsync.core.error.DocumentExistsException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link DocumentApiClient} over java.net.http and Jackson.
 *
 * Status mapping for PATCH /documents/{id}:
 *   - 200 -> Accepted
 *   - 409 -> Conflict (latest row from the body)
 *   - 429 -> RateLimited (body retryAfterSeconds, else the Retry-After header, else 1s)
 *   - other -> RemoteCallException
 */
public final class HttpDocumentClient implements DocumentApiClient {
    private static final Logger log = Logger.getLogger(HttpDocumentClient.class.getName());

    public static final String USER_HEADER = "X-User-Id";
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private final ObjectMapper json = ClientJson.mapper();
    private final HttpClient http;
    private final String baseUrl;
    private final String userId;
    private final Duration timeout;

    public HttpDocumentClient(String baseUrl, String userId) {
        this(baseUrl, userId, Duration.ofSeconds(10));
    }

    public HttpDocumentClient(String baseUrl, String userId, Duration timeout) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.userId = Objects.requireNonNull(userId, "userId");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.http = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public WriteResult write(WriteRequest request) throws TransportException {
        var body = new PatchBody();
        body.content = request.content();
        body.baseVersion = request.baseVersion();
        body.opId = request.opId();
        body.clientTimestamp = request.clientTimestamp();

        HttpRequest req = builder(request.documentId())
                .header("Content-Type", "application/json")
                .header(IDEMPOTENCY_KEY, request.opId())
                .method("PATCH", HttpRequest.BodyPublishers.ofByteArray(encode(body)))
                .build();
        HttpResponse<String> resp = send(req);

        switch (resp.statusCode()) {
            case 200 -> {
                var ok = decode(resp, AcceptedBody.class);
                return new WriteResult.Accepted(ok.newVersion, ok.updatedAt);
            }
            case 409 -> {
                var c = decode(resp, ConflictBody.class);
                return new WriteResult.Conflict(c.latestVersion,
                        c.latestContent == null ? List.of() : c.latestContent, c.latestUpdatedAt);
            }
            case 429 -> {
                return new WriteResult.RateLimited(Duration.ofSeconds(retryAfterSeconds(resp)));
            }
            default -> throw new RemoteCallException(resp.statusCode(), resp.body());
        }
    }

    @Override
    public Optional<RemoteDocument> read(String documentId) throws TransportException {
        HttpResponse<String> resp = send(builder(documentId).GET().build());
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (resp.statusCode() != 200) {
            throw new RemoteCallException(resp.statusCode(), resp.body());
        }
        var d = decode(resp, DocumentBody.class);
        return Optional.of(new RemoteDocument(d.id, d.content, d.version, d.updatedAt, d.updatedBy, d.contentSource));
    }

    @Override
    public long create(String documentId, List<ContentBlock> content) throws TransportException {
        var body = new CreateBody();
        body.content = content;
        HttpRequest req = builder(documentId)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofByteArray(encode(body)))
                .build();
        HttpResponse<String> resp = send(req);
        if (resp.statusCode() == 409) {
            throw new DocumentExistsException(documentId);
        }
        if (resp.statusCode() != 201) {
            throw new RemoteCallException(resp.statusCode(), resp.body());
        }
        return decode(resp, VersionBody.class).version;
    }

    // ---------- plumbing ----------

    private HttpRequest.Builder builder(String documentId) {
        String path = "/documents/" + pathSegment(documentId);
        return HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header(USER_HEADER, userId);
    }

    /** Percent-encode a document id as one URL path segment (space is %20, not '+'). */
    public static String pathSegment(String documentId) {
        return URLEncoder.encode(documentId, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpResponse<String> send(HttpRequest req) throws TransportException {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException(req.method() + " " + req.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(req.method() + " " + req.uri() + " interrupted", e);
        }
    }

    private byte[] encode(Object body) {
        try {
            return json.writeValueAsBytes(body);
        } catch (IOException e) {
            throw new IllegalArgumentException("request body not serializable", e);
        }
    }

    private <T> T decode(HttpResponse<String> resp, Class<T> type) {
        try {
            return json.readValue(resp.body(), type);
        } catch (IOException e) {
            throw new RemoteCallException(resp.statusCode(), "unreadable body: " + e.getMessage());
        }
    }

    private long retryAfterSeconds(HttpResponse<String> resp) {
        try {
            long fromBody = json.readValue(resp.body(), RateLimitedBody.class).retryAfterSeconds;
            if (fromBody > 0) return fromBody;
        } catch (IOException e) {
            log.fine(() -> "429 body unreadable, using Retry-After header: " + e.getMessage());
        }
        return resp.headers().firstValue("Retry-After")
                .map(HttpDocumentClient::parseSeconds)
                .orElse(1L);
    }

    private static long parseSeconds(String v) {
        try {
            return Math.max(1L, Long.parseLong(v.trim()));
        } catch (NumberFormatException e) {
            return 1L;
        }
    }

    // ---------- JSON bodies ----------

    static final class PatchBody {
        public List<ContentBlock> content;
        public long baseVersion;
        public String opId;
        public Instant clientTimestamp;
    }

    static final class CreateBody {
        public List<ContentBlock> content;
    }

    static final class AcceptedBody {
        public long newVersion;
        public Instant updatedAt;
    }

    static final class ConflictBody {
        public long latestVersion;
        public List<ContentBlock> latestContent;
        public Instant latestUpdatedAt;
    }

    static final class RateLimitedBody {
        public long retryAfterSeconds;
    }

    static final class VersionBody {
        public String id;
        public long version;
        public Instant updatedAt;
        public String updatedBy;
    }

    static final class DocumentBody {
        public String id;
        public List<ContentBlock> content;
        public long version;
        public Instant updatedAt;
        public String updatedBy;
        public String contentSource;
    }
}
