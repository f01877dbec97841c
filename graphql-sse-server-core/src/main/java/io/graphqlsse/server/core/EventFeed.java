package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.ChangeEvent;

import java.time.Duration;
import java.util.List;

/**
 * Source of candidate events for one stream, in ascending id order.
 */
interface EventFeed extends AutoCloseable {

    /**
     * Called with the stream's current operations before each wait.
     */
    void refresh(List<RegisteredSubscription> subscriptions);

    /**
     * Next batch of events, waiting up to {@code maxWait} when none is pending.
     *
     * @return an empty list if nothing arrived in time
     */
    List<ChangeEvent> next(Duration maxWait) throws InterruptedException;

    @Override
    void close();
}
