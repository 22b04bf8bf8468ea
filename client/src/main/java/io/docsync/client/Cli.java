package io.docsync.client;

import io.docsync.client.live.CollabSocket;
import io.docsync.client.live.LiveDocumentConsumer;
import io.docsync.client.autosave.DrainGuard;
import io.docsync.core.ContentBlock;
import io.docsync.core.WriteRequest;
import io.docsync.core.WriteResult;
import io.docsync.core.crdt.LwwBlockReplica;
import io.docsync.core.error.DocumentExistsException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Simple CLI for poking a running DocSync server.
 *
 * Usage:
 *   docsync-cli [--base-url http://host:port] [--user id] get <doc>
 *   docsync-cli [--base-url http://host:port] [--user id] create <doc> <text>
 *   docsync-cli [--base-url http://host:port] [--user id] save <doc> <baseVersion> <text>
 *   docsync-cli [--base-url http://host:port] [--user id] watch <doc>
 *
 * Content on the command line becomes a single "text" block.
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final String DEFAULT_USER = "cli";

    private final HttpDocumentClient api;
    private final String baseUrl;
    private final String user;

    private Cli(String baseUrl, String user) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.user = user;
        this.api = new HttpDocumentClient(this.baseUrl, user);
    }

    public static void main(String[] args) {
        try {
            String baseUrl = DEFAULT_BASE_URL;
            String user = DEFAULT_USER;
            List<String> rest = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--base-url" -> {
                        if (i + 1 >= args.length) usageAndExit("--base-url requires a value");
                        baseUrl = args[++i];
                    }
                    case "--user" -> {
                        if (i + 1 >= args.length) usageAndExit("--user requires a value");
                        user = args[++i];
                    }
                    default -> rest.add(args[i]);
                }
            }
            if (rest.isEmpty()) {
                usageAndExit("missing command");
            }

            Cli cli = new Cli(baseUrl, user);
            String cmd = rest.get(0);
            switch (cmd) {
                case "get" -> {
                    if (rest.size() != 2) usageAndExit("get requires <doc>");
                    cli.get(rest.get(1));
                }
                case "create" -> {
                    if (rest.size() != 3) usageAndExit("create requires <doc> <text>");
                    cli.create(rest.get(1), rest.get(2));
                }
                case "save" -> {
                    if (rest.size() != 4) usageAndExit("save requires <doc> <baseVersion> <text>");
                    cli.save(rest.get(1), parseVersion(rest.get(2)), rest.get(3));
                }
                case "watch" -> {
                    if (rest.size() != 2) usageAndExit("watch requires <doc>");
                    cli.watch(rest.get(1));
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private void get(String doc) throws TransportException {
        Optional<RemoteDocument> d = api.read(doc);
        if (d.isEmpty()) {
            System.out.println("(not found)");
            return;
        }
        RemoteDocument r = d.get();
        System.out.printf("%s v%d (%s, updated %s by %s)%n",
                r.id(), r.version(), r.contentSource(), r.updatedAt(), r.updatedBy());
        for (ContentBlock b : r.content()) {
            System.out.println("  [" + b.type() + "] " + b.payload());
        }
    }

    private void create(String doc, String text) throws TransportException {
        try {
            long v = api.create(doc, textBlock(text));
            System.out.println("created " + doc + " v" + v);
        } catch (DocumentExistsException e) {
            throw new CliException(doc + " already exists");
        }
    }

    private void save(String doc, long baseVersion, String text) throws TransportException {
        var req = new WriteRequest(doc, textBlock(text), baseVersion, UUID.randomUUID().toString(), Instant.now());
        WriteResult r = api.write(req);
        if (r instanceof WriteResult.Accepted a) {
            System.out.println("OK v" + a.newVersion());
        } else if (r instanceof WriteResult.Conflict c) {
            throw new CliException("conflict: server is at v" + c.latestVersion());
        } else if (r instanceof WriteResult.RateLimited rl) {
            throw new CliException("rate limited, retry in " + rl.retryAfterSeconds() + "s");
        }
    }

    /** Print the document every time a collaborator changes it, until Ctrl-C. */
    private void watch(String doc) throws Exception {
        var consumer = new LiveDocumentConsumer(new DrainGuard(), LwwBlockReplica::new,
                content -> {
                    System.out.println("--- " + doc + " ---");
                    content.forEach(b -> System.out.println("  [" + b.type() + "] " + b.payload()));
                },
                presence -> System.out.println("presence: " + presence));
        String wsBase = baseUrl.replaceFirst("^http", "ws");
        try (CollabSocket socket = CollabSocket.connect(wsBase, doc, user, consumer).get(10, TimeUnit.SECONDS)) {
            new CountDownLatch(1).await();
        }
    }

    private static List<ContentBlock> textBlock(String text) {
        return List.of(new ContentBlock("text", text));
    }

    private static long parseVersion(String v) {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new CliException("baseVersion must be a number: " + v);
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  docsync-cli [--base-url http://host:port] [--user id] get <doc>
                  docsync-cli [--base-url http://host:port] [--user id] create <doc> <text>
                  docsync-cli [--base-url http://host:port] [--user id] save <doc> <baseVersion> <text>
                  docsync-cli [--base-url http://host:port] [--user id] watch <doc>
                """);
        System.exit(1);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
