package io.graphqlsse.core;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal helpers for case-insensitive protocol header lookup.
 */
public final class Headers {
    private Headers() {}

    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getKey() == null) continue;
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                Iterable<String> vals = e.getValue();
                if (vals == null) return Optional.empty();
                for (String v : vals) {
                    if (v != null) return Optional.of(v);
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Reads the reservation token header, falling back to the legacy header name.
     */
    public static Optional<String> eventStreamToken(Map<String, ? extends Iterable<String>> headers) {
        Optional<String> token = firstValue(headers, Protocol.H_EVENT_STREAM_TOKEN)
                .or(() -> firstValue(headers, Protocol.H_LEGACY_EVENT_STREAM_TOKEN));
        return token.map(String::trim).filter(t -> !t.isEmpty());
    }

    /**
     * True when any {@code Accept} or {@code Content-Type} value names {@code text/event-stream}.
     */
    public static boolean acceptsEventStream(Map<String, ? extends Iterable<String>> headers) {
        return mentions(headers, Protocol.H_ACCEPT, Protocol.CT_EVENT_STREAM)
                || mentions(headers, Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM);
    }

    private static boolean mentions(Map<String, ? extends Iterable<String>> headers, String name, String mediaType) {
        return firstValue(headers, name)
                .map(v -> v.toLowerCase(Locale.ROOT).contains(mediaType))
                .orElse(false);
    }
}
