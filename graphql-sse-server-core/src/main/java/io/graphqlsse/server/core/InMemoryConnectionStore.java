package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.ConnectionStore;
import io.graphqlsse.server.spi.ReservationToken;
import io.graphqlsse.server.spi.SubscriptionDocument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reference in-memory {@link ConnectionStore}.
 *
 * <p>Every operation is a synchronized section, which makes the revoke cascade atomic. State is
 * process-local; use the LMDB store to share reservations between processes.
 */
public final class InMemoryConnectionStore implements ConnectionStore {

    private final Map<String, ReservationToken> tokens = new HashMap<>();
    private final Map<String, Map<String, SubscriptionDocument>> documents = new HashMap<>();

    @Override
    public synchronized boolean insert(ReservationToken token) {
        Objects.requireNonNull(token, "token");
        return tokens.putIfAbsent(token.token(), token) == null;
    }

    @Override
    public synchronized Optional<ReservationToken> find(String token, Instant now) {
        ReservationToken found = tokens.get(token);
        if (found == null || found.isExpired(now)) return Optional.empty();
        return Optional.of(found);
    }

    @Override
    public synchronized boolean revoke(String token) {
        documents.remove(token);
        return tokens.remove(token) != null;
    }

    @Override
    public synchronized int sweep(Instant now) {
        int removed = 0;
        Iterator<ReservationToken> it = tokens.values().iterator();
        while (it.hasNext()) {
            ReservationToken token = it.next();
            if (token.isExpired(now)) {
                it.remove();
                documents.remove(token.token());
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized List<ReservationToken> active(Instant now) {
        List<ReservationToken> out = new ArrayList<>();
        for (ReservationToken token : tokens.values()) {
            if (!token.isExpired(now)) out.add(token);
        }
        out.sort(Comparator.comparing(ReservationToken::createdAt));
        return out;
    }

    @Override
    public synchronized boolean put(SubscriptionDocument document) {
        Objects.requireNonNull(document, "document");
        ReservationToken token = tokens.get(document.token());
        if (token == null || token.isExpired(document.registeredAt())) return false;
        documents.computeIfAbsent(document.token(), k -> new LinkedHashMap<>())
                .put(document.operationId(), document);
        return true;
    }

    @Override
    public synchronized Optional<SubscriptionDocument> get(String token, String operationId) {
        Map<String, SubscriptionDocument> byOperation = documents.get(token);
        return byOperation == null ? Optional.empty() : Optional.ofNullable(byOperation.get(operationId));
    }

    @Override
    public synchronized List<SubscriptionDocument> list(String token) {
        Map<String, SubscriptionDocument> byOperation = documents.get(token);
        if (byOperation == null) return List.of();
        List<SubscriptionDocument> out = new ArrayList<>(byOperation.values());
        out.sort(Comparator.comparing(SubscriptionDocument::registeredAt));
        return out;
    }

    @Override
    public synchronized boolean remove(String token, String operationId) {
        Map<String, SubscriptionDocument> byOperation = documents.get(token);
        if (byOperation == null) return false;
        boolean removed = byOperation.remove(operationId) != null;
        if (byOperation.isEmpty()) documents.remove(token);
        return removed;
    }

    @Override
    public synchronized int count(String token) {
        Map<String, SubscriptionDocument> byOperation = documents.get(token);
        return byOperation == null ? 0 : byOperation.size();
    }

    @Override
    public synchronized int totalCount() {
        int total = 0;
        for (Map<String, SubscriptionDocument> byOperation : documents.values()) {
            total += byOperation.size();
        }
        return total;
    }
}
