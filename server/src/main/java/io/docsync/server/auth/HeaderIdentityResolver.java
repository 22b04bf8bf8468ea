package io.docsync.server.auth;

import java.util.Optional;
import java.util.function.Function;

/**
 * Trusts a user id header set by the fronting gateway.
 */
public final class HeaderIdentityResolver implements IdentityResolver {

    public static final String DEFAULT_HEADER = "X-User-Id";

    private final String headerName;

    public HeaderIdentityResolver() {
        this(DEFAULT_HEADER);
    }

    public HeaderIdentityResolver(String headerName) {
        if (headerName == null || headerName.isBlank()) {
            throw new IllegalArgumentException("headerName must not be blank");
        }
        this.headerName = headerName;
    }

    @Override
    public Optional<String> resolve(Function<String, String> header) {
        String v = header.apply(headerName);
        if (v == null || v.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(v.trim());
    }
}
