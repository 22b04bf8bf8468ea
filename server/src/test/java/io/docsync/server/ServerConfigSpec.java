package io.docsync.server;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigSpec {

    @Test
    void no_flags_gives_local_dev_defaults() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[0]);

        assertEquals(ServerConfig.defaults(), cfg);
        assertEquals(Duration.ofHours(24), cfg.idempotencyTtl());
        assertEquals(Path.of("./data", "log"), cfg.updateLogDir());
    }

    @Test
    void flags_override_defaults() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{
                "-p", "9000", "--data-dir", "/var/docsync",
                "--doc-rate-limit", "5", "--doc-rate-window-seconds", "30",
                "--user-rate-limit", "50", "--user-rate-window-seconds", "120",
                "--idempotency-ttl-hours", "2"
        });

        assertEquals(9000, cfg.httpPort());
        assertEquals(Path.of("/var/docsync", "store", "wal"), cfg.storeWalDir());
        assertEquals(5, cfg.docRateLimit());
        assertEquals(Duration.ofSeconds(30), cfg.docRateWindow());
        assertEquals(Duration.ofSeconds(120), cfg.userRateWindow());
        assertEquals(Duration.ofHours(2), cfg.idempotencyTtl());
    }

    @Test
    void non_positive_limits_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ServerConfig(8080, "./data", 24, 0, 10, 100, 60));
        assertThrows(IllegalArgumentException.class, () -> new ServerConfig(8080, " ", 24, 10, 10, 100, 60));
        assertThrows(IllegalArgumentException.class, () -> new ServerConfig(70_000, "./data", 24, 10, 10, 100, 60));
    }
}
