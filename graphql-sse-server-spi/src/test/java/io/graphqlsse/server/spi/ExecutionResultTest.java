package io.graphqlsse.server.spi;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionResultTest {

    @Test
    void specificationOmitsEmptySections() {
        Map<String, Object> wire = ExecutionResult.data(Map.of("postUpdated", Map.of("id", "42"))).toSpecification();

        assertThat(wire).containsOnlyKeys("data");
    }

    @Test
    void errorResultHasNoData() {
        Map<String, Object> wire = ExecutionResult.error("boom", "EXECUTION_ERROR")
                .withExtension("subscription", Map.of("event_type", "postUpdated"))
                .toSpecification();

        assertThat(wire).containsOnlyKeys("errors", "extensions");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> errors = (List<Map<String, Object>>) wire.get("errors");
        assertThat(errors).singleElement().satisfies(e -> assertThat(e).containsEntry("message", "boom"));
    }

    @Test
    void reservationExpiresAtItsDeadline() {
        Instant created = Instant.parse("2025-01-01T00:00:00Z");
        ReservationToken token = new ReservationToken("secret-value", created, created.plusSeconds(60));

        assertThat(token.isExpired(created.plusSeconds(59))).isFalse();
        assertThat(token.isExpired(created.plusSeconds(60))).isTrue();
        assertThat(token.toString()).doesNotContain("secret-value");
    }

    @Test
    void eventChannelIntersection() {
        EventDraft draft = new EventDraft("postUpdated", "42", "42", Map.of(), null,
                Set.of("graphql:postUpdated"));
        ChangeEvent event = ChangeEvent.of(draft, 7, Instant.EPOCH);

        assertThat(event.isOnAnyChannel(Set.of("graphql:postUpdated", "other"))).isTrue();
        assertThat(event.isOnAnyChannel(Set.of("graphql:postDeleted"))).isFalse();
        assertThat(event.metadata()).isEmpty();
    }

    @Test
    void draftRequiresRoutingKey() {
        assertThatThrownBy(() -> new EventDraft("postUpdated", "42", null, null, null, Set.of()))
                .isInstanceOf(NullPointerException.class);
    }
}
