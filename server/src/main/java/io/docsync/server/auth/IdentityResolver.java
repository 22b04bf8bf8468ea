package io.docsync.server.auth;

import java.util.Optional;
import java.util.function.Function;

/**
 * Extracts the verified user id of a request.
 * <p>
 * Authentication itself happens upstream; implementations only read what the
 * gateway attached to the request. Both the HTTP and the WebSocket adapters
 * go through this seam, so they see the same identity rules.
 */
@FunctionalInterface
public interface IdentityResolver {

    /**
     * @param header request header lookup by name, returning null when absent
     * @return the user id, or empty when the request carries no identity
     */
    Optional<String> resolve(Function<String, String> header);
}
