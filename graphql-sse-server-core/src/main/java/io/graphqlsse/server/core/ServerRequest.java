package io.graphqlsse.server.core;

import io.graphqlsse.core.Headers;
import io.graphqlsse.core.Protocol;

import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One HTTP request as the handler sees it, independent of the servlet or framework carrying it.
 *
 * @param headers header values by name; lookups through this record ignore case
 * @param body request body, or null when the request has none
 */
public record ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body) {

    public ServerRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(headers, "headers");
    }

    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    /**
     * Reservation token from the {@code X-Event-Stream-Token} header, falling back to the
     * {@code token} query parameter.
     */
    Optional<String> token() {
        Optional<String> header = Headers.eventStreamToken(headers);
        if (header.isPresent()) return header;
        return QueryString.nonBlank(QueryString.parse(uri), Protocol.Q_TOKEN);
    }

    boolean acceptsEventStream() {
        return Headers.acceptsEventStream(headers);
    }
}
