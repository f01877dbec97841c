package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.EventLog;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Reads an {@link EventLog} with a private id cursor that only moves forward.
 */
final class PollingEventFeed implements EventFeed {
    private final EventLog log;
    private final int batchSize;
    private long cursor;

    PollingEventFeed(EventLog log, long cursor, int batchSize) {
        this.log = Objects.requireNonNull(log, "log");
        this.cursor = cursor;
        this.batchSize = batchSize;
    }

    long cursor() {
        return cursor;
    }

    @Override
    public void refresh(List<RegisteredSubscription> subscriptions) {
        // every event is read; matching happens in the stream
    }

    @Override
    public List<ChangeEvent> next(Duration maxWait) throws InterruptedException {
        List<ChangeEvent> batch = log.after(cursor, batchSize);
        if (batch.isEmpty()) {
            if (maxWait.isZero() || maxWait.isNegative() || !log.await(cursor, maxWait)) {
                return List.of();
            }
            batch = log.after(cursor, batchSize);
        }
        if (!batch.isEmpty()) {
            cursor = Math.max(cursor, batch.get(batch.size() - 1).id());
        }
        return batch;
    }

    @Override
    public void close() {
        // nothing held
    }
}
