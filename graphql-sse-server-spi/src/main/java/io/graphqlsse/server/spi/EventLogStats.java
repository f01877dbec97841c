package io.graphqlsse.server.spi;

import java.time.Instant;
import java.util.Optional;

/**
 * Queue statistics of an {@link EventLog}.
 *
 * @param totalEvents events currently retained
 * @param recentEvents events created during the last hour
 * @param oldestEvent creation time of the oldest retained event
 * @param newestEvent creation time of the newest retained event
 */
public record EventLogStats(long totalEvents, long recentEvents, Optional<Instant> oldestEvent, Optional<Instant> newestEvent) {

    public static EventLogStats empty() {
        return new EventLogStats(0, 0, Optional.empty(), Optional.empty());
    }
}
