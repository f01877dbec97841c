package io.graphqlsse.server.core;

import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.server.spi.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically sweeps expired reservations and purges events older than the retention window.
 */
public final class MaintenanceTask implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceTask.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_EVENT_RETENTION = Duration.ofHours(24);

    private final TokenService tokens;
    private final Optional<EventLog> eventLog;
    private final Duration retention;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public MaintenanceTask(TokenService tokens, Optional<EventLog> eventLog, Duration retention, Clock clock) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.retention = Objects.requireNonNull(retention, "retention");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param sweptReservations expired reservations removed
     * @param purgedEvents events removed from the log
     */
    public record Result(int sweptReservations, int purgedEvents) {}

    public Result runOnce() {
        int swept = tokens.sweep();
        int purged = eventLog.map(log -> log.purge(clock.instant().minus(retention))).orElse(0);
        if (purged > 0) {
            LOG.info("Purged {} event(s) older than {}", purged, retention);
        }
        return new Result(swept, purged);
    }

    public synchronized void start(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (scheduler != null) throw new IllegalStateException("already started");
        scheduler = StreamExecutors.newScheduled("graphql-sse-maintenance");
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::runSafely, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Maintenance scheduled every {}", interval);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    // an exception would cancel the schedule
    private void runSafely() {
        try {
            runOnce();
        } catch (GraphQLSseException.StoreError e) {
            LOG.warn("Maintenance run failed; retrying at next interval", e);
        } catch (RuntimeException e) {
            LOG.error("Maintenance run failed unexpectedly", e);
        }
    }
}
