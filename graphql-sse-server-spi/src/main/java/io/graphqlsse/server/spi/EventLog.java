package io.graphqlsse.server.spi;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Ordered, queryable event log backing the poll delivery model.
 *
 * <p>Events are broadcast: every reader sees every event, and retention is independent of delivery.
 * Appends must be atomic and must keep {@code createdAt} non-decreasing in id order.
 */
public interface EventLog extends EventSink {

    /**
     * Events created strictly after {@code timestamp}, oldest first.
     */
    List<ChangeEvent> since(Instant timestamp, int limit);

    /**
     * Events with an id greater than {@code eventId}, oldest first.
     */
    List<ChangeEvent> after(long eventId, int limit);

    /**
     * Highest id ever assigned, or 0 if the log never held an event.
     */
    long latestId();

    /**
     * Block until an event with an id greater than {@code eventId} exists or the timeout elapses.
     *
     * <p>Implementations wake on local appends; writers in other processes are noticed no later
     * than the timeout.
     *
     * @return true if newer events are available
     */
    boolean await(long eventId, Duration timeout) throws InterruptedException;

    /**
     * Delete events created before {@code olderThan}.
     *
     * @return number of events removed
     */
    int purge(Instant olderThan);

    EventLogStats stats(Instant now);
}
