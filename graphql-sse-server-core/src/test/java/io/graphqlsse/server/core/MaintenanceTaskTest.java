package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.EventDraft;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class MaintenanceTaskTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final InMemoryConnectionStore store = new InMemoryConnectionStore();
    private final InMemoryEventLog log = new InMemoryEventLog(clock);
    private final TokenService tokens = new TokenService(store, clock);

    @Test
    void sweepsReservationsAndPurgesEvents() {
        tokens.reserve(Duration.ofMinutes(5));
        tokens.reserve(Duration.ofHours(48));
        log.publish(draft());
        clock.advance(Duration.ofHours(25));
        log.publish(draft());

        MaintenanceTask task = new MaintenanceTask(tokens, Optional.of(log), MaintenanceTask.DEFAULT_EVENT_RETENTION, clock);

        assertThat(task.runOnce()).isEqualTo(new MaintenanceTask.Result(1, 1));
        assertThat(task.runOnce()).isEqualTo(new MaintenanceTask.Result(0, 0));
        assertThat(tokens.activeCount()).isEqualTo(1);
        assertThat(log.stats(clock.instant()).totalEvents()).isEqualTo(1);
    }

    @Test
    void brokerDeploymentsOnlySweep() {
        tokens.reserve(Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(6));

        MaintenanceTask task = new MaintenanceTask(tokens, Optional.empty(), MaintenanceTask.DEFAULT_EVENT_RETENTION, clock);

        assertThat(task.runOnce()).isEqualTo(new MaintenanceTask.Result(1, 0));
    }

    @Test
    void scheduledRunsSweep() throws Exception {
        tokens.reserve(Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(6));

        try (MaintenanceTask task = new MaintenanceTask(tokens, Optional.empty(), Duration.ofHours(1), clock)) {
            task.start(Duration.ofMillis(20));
            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (store.active(Instant.MIN).size() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
        }

        assertThat(store.active(Instant.MIN)).isEmpty();
    }

    private static EventDraft draft() {
        return new EventDraft("postUpdated", "1", "1", Map.of(), null, Set.of("graphql:postUpdated"));
    }
}
