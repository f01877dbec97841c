package io.graphqlsse.server.core;

import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.server.spi.ConnectionStore;
import io.graphqlsse.server.spi.ReservationToken;
import io.graphqlsse.server.spi.SubscriptionDocument;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory store whose next token lookup fails once after {@link #failNextFind()}.
 */
final class FailingOnceStore implements ConnectionStore {
    private final InMemoryConnectionStore delegate = new InMemoryConnectionStore();
    private final AtomicBoolean armed = new AtomicBoolean();
    private final AtomicBoolean failed = new AtomicBoolean();

    void failNextFind() {
        armed.set(true);
    }

    boolean failed() {
        return failed.get();
    }

    @Override
    public boolean insert(ReservationToken token) {
        return delegate.insert(token);
    }

    @Override
    public Optional<ReservationToken> find(String token, Instant now) {
        if (armed.compareAndSet(true, false)) {
            failed.set(true);
            throw new GraphQLSseException.StoreError("store unavailable");
        }
        return delegate.find(token, now);
    }

    @Override
    public boolean revoke(String token) {
        return delegate.revoke(token);
    }

    @Override
    public int sweep(Instant now) {
        return delegate.sweep(now);
    }

    @Override
    public List<ReservationToken> active(Instant now) {
        return delegate.active(now);
    }

    @Override
    public boolean put(SubscriptionDocument document) {
        return delegate.put(document);
    }

    @Override
    public Optional<SubscriptionDocument> get(String token, String operationId) {
        return delegate.get(token, operationId);
    }

    @Override
    public List<SubscriptionDocument> list(String token) {
        return delegate.list(token);
    }

    @Override
    public boolean remove(String token, String operationId) {
        return delegate.remove(token, operationId);
    }

    @Override
    public int count(String token) {
        return delegate.count(token);
    }

    @Override
    public int totalCount() {
        return delegate.totalCount();
    }
}
