package io.graphqlsse.server.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Streams currently open in this process, at most one per token.
 */
final class ActiveStreams {
    private final Map<String, SubscriptionStream> streams = new ConcurrentHashMap<>();

    boolean tryOpen(String token, SubscriptionStream stream) {
        return streams.putIfAbsent(token, stream) == null;
    }

    void release(String token, SubscriptionStream stream) {
        streams.remove(token, stream);
    }

    Optional<SubscriptionStream> get(String token) {
        return Optional.ofNullable(streams.get(token));
    }

    int size() {
        return streams.size();
    }
}
