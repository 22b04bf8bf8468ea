package io.docsync.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place to log method/path/status and latency for every HTTP request.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method        HTTP method
     * @param path          request path
     * @param userId        resolved caller, or null before/without identity
     * @param status        HTTP status code
     * @param totalMillis   wall-clock latency for the whole request
     * @param serviceMillis latency of the DocumentService call, or -1 if not reached
     * @param error         exception behind a failure status, null if none
     */
    public static void logRequest(
            String method,
            String path,
            String userId,
            int status,
            long totalMillis,
            long serviceMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s user=%s -> %d (total=%dms%s)",
                method,
                path,
                userId == null ? "-" : userId,
                status,
                totalMillis,
                serviceMillis >= 0 ? ", service=" + serviceMillis + "ms" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
