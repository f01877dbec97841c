package io.graphqlsse.server.core;

import java.util.Locale;
import java.util.Optional;

/**
 * HTTP methods a framework adapter may forward. Only GET, POST, PUT and DELETE are served.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    HEAD,
    OPTIONS,
    PATCH;

    /**
     * Parse a request method name; unknown names yield empty.
     */
    public static Optional<HttpMethod> parse(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
