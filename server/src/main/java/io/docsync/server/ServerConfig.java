package io.docsync.server;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:               HTTP + WebSocket port
 *  - dataDir:                root for WAL segments, snapshots and the update log
 *  - idempotencyTtlHours:    how long opId outcomes are remembered
 *  - docRateLimit/Window:    writes per (user, document) per window
 *  - userRateLimit/Window:   writes per user across documents per window
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        long idempotencyTtlHours,
        int docRateLimit,
        long docRateWindowSeconds,
        int userRateLimit,
        long userRateWindowSeconds
) {

    public ServerConfig {
        if (httpPort < 0 || httpPort > 65_535) throw new IllegalArgumentException("httpPort out of range");
        if (dataDir == null || dataDir.isBlank()) throw new IllegalArgumentException("dataDir must not be empty");
        if (idempotencyTtlHours <= 0) throw new IllegalArgumentException("idempotencyTtlHours must be > 0");
        if (docRateLimit <= 0 || userRateLimit <= 0) throw new IllegalArgumentException("rate limits must be > 0");
        if (docRateWindowSeconds <= 0 || userRateWindowSeconds <= 0) {
            throw new IllegalArgumentException("rate windows must be > 0");
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(8080, "./data", 24, 10, 10, 100, 60);
    }

    public Path storeWalDir() {
        return Path.of(dataDir, "store", "wal");
    }

    public Path snapshotDir() {
        return Path.of(dataDir, "store", "snap");
    }

    public Path updateLogDir() {
        return Path.of(dataDir, "log");
    }

    public Duration idempotencyTtl() {
        return Duration.ofHours(idempotencyTtlHours);
    }

    public Duration docRateWindow() {
        return Duration.ofSeconds(docRateWindowSeconds);
    }

    public Duration userRateWindow() {
        return Duration.ofSeconds(userRateWindowSeconds);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path>
     *   --idempotency-ttl-hours <hours>
     *   --doc-rate-limit <n>  --doc-rate-window-seconds <s>
     *   --user-rate-limit <n> --user-rate-window-seconds <s>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        ServerConfig d = defaults();
        int httpPort = d.httpPort();
        String dataDir = d.dataDir();
        long ttlHours = d.idempotencyTtlHours();
        int docLimit = d.docRateLimit();
        long docWindow = d.docRateWindowSeconds();
        int userLimit = d.userRateLimit();
        long userWindow = d.userRateWindowSeconds();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = (int) parseNumber(args, ++i);
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--idempotency-ttl-hours" -> {
                    ensureValue(args, i);
                    ttlHours = parseNumber(args, ++i);
                }

                case "--doc-rate-limit" -> {
                    ensureValue(args, i);
                    docLimit = (int) parseNumber(args, ++i);
                }

                case "--doc-rate-window-seconds" -> {
                    ensureValue(args, i);
                    docWindow = parseNumber(args, ++i);
                }

                case "--user-rate-limit" -> {
                    ensureValue(args, i);
                    userLimit = (int) parseNumber(args, ++i);
                }

                case "--user-rate-window-seconds" -> {
                    ensureValue(args, i);
                    userWindow = parseNumber(args, ++i);
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, dataDir, ttlHours, docLimit, docWindow, userLimit, userWindow);
    }

    private static long parseNumber(String[] args, int i) {
        try {
            return Long.parseLong(args[i]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid value for " + args[i - 1] + ": " + args[i]);
            System.exit(1);
            return -1; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port,      -p       HTTP/WebSocket port (default: 8080)
              --data-dir,       -d       Data directory (default: ./data)
              --idempotency-ttl-hours    How long opId outcomes are kept (default: 24)
              --doc-rate-limit           Writes per user and document per window (default: 10)
              --doc-rate-window-seconds  Window for the per-document limit (default: 10)
              --user-rate-limit          Writes per user per window (default: 100)
              --user-rate-window-seconds Window for the per-user limit (default: 60)
              --help,           -h       Show this help message
            """);
        System.exit(0);
    }
}
