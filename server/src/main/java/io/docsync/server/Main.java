package io.docsync.server;

import io.docsync.core.crdt.LwwBlockReplica;
import io.docsync.server.auth.HeaderIdentityResolver;
import io.docsync.server.collab.SessionManager;
import io.docsync.server.ratelimit.SlidingWindowRateLimiter;
import io.docsync.server.ratelimit.WriteRateLimits;
import io.docsync.storage.DurableDocumentStore;
import io.docsync.storage.DurableUpdateLog;
import io.docsync.storage.FileSnapshotter;
import io.docsync.storage.FileWal;
import io.docsync.storage.TtlIdempotencyCache;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a DocSync server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire together storage components (store WAL, snapshots, update log, idempotency cache).
 *  - Create the session manager, DocumentService and WebServer.
 *  - Compact the update log periodically.
 *  - Start the HTTP/WebSocket listener and register a shutdown hook.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());
    private static final long COMPACT_EVERY_MINUTES = 10;

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);
        var clock = Clock.systemUTC();

        // ------ Storage layer -------
        var storeWal = new FileWal(cfg.storeWalDir(), 64L * 1024 * 1024); // rotate ~64MB
        var store = new DurableDocumentStore(storeWal, new FileSnapshotter(cfg.snapshotDir()), clock);
        var logWal = new FileWal(cfg.updateLogDir(), 64L * 1024 * 1024);
        var updateLog = new DurableUpdateLog(logWal, clock);
        var idempotency = new TtlIdempotencyCache(cfg.idempotencyTtl(), clock);
        ScheduledExecutorService maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "docsync-log-compaction");
            t.setDaemon(true);
            return t;
        });
        maintenance.scheduleWithFixedDelay(() -> compact(updateLog),
                COMPACT_EVERY_MINUTES, COMPACT_EVERY_MINUTES, TimeUnit.MINUTES);

        // ------ Write admission -------
        var limits = new WriteRateLimits(
                new SlidingWindowRateLimiter<>(cfg.docRateLimit(), cfg.docRateWindow(), clock),
                new SlidingWindowRateLimiter<>(cfg.userRateLimit(), cfg.userRateWindow(), clock)
        );

        // ------ Services -------
        var sessions = new SessionManager(store, updateLog, LwwBlockReplica::new);
        var docs = new DocumentService(store, updateLog, idempotency, limits, LwwBlockReplica::new, sessions);

        // ------ HTTP + WebSocket layer ------
        var web = new WebServer(cfg.httpPort(), docs, sessions, new HeaderIdentityResolver());
        web.start();
        log.info(() -> "DocSync listening on http://localhost:" + cfg.httpPort() + " (data: " + cfg.dataDir() + ")");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
                maintenance.shutdownNow();
                sessions.shutdown();
                storeWal.close();
                logWal.close();
            } catch (Exception e) {
                log.log(Level.WARNING, "Shutdown did not complete cleanly", e);
            }
        }));
    }

    private static void compact(DurableUpdateLog updateLog) {
        try {
            if (updateLog.staleRecords() > 0) {
                updateLog.compact();
            }
        } catch (RuntimeException e) {
            // a failed run keeps the old segments; the next run tries again
            log.log(Level.WARNING, "Update log compaction failed", e);
        }
    }

    /** Load the bundled logging.properties unless one was given on the command line. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Could not load bundled logging.properties", e);
        }
    }
}
