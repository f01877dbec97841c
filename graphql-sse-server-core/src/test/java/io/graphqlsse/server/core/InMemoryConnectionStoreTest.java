package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.ReservationToken;
import io.graphqlsse.server.spi.SubscriptionDocument;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryConnectionStoreTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private final InMemoryConnectionStore store = new InMemoryConnectionStore();

    @Test
    void insertRefusesDuplicates() {
        assertThat(store.insert(new ReservationToken("t", T0, T0.plusSeconds(60)))).isTrue();
        assertThat(store.insert(new ReservationToken("t", T0, T0.plusSeconds(120)))).isFalse();
        assertThat(store.find("t", T0)).hasValueSatisfying(r -> assertThat(r.expiresAt()).isEqualTo(T0.plusSeconds(60)));
    }

    @Test
    void putRequiresLiveReservation() {
        store.insert(new ReservationToken("t", T0, T0.plusSeconds(60)));

        assertThat(store.put(document("t", "op1", T0.plusSeconds(10)))).isTrue();
        assertThat(store.put(document("t", "op2", T0.plusSeconds(60)))).isFalse();
        assertThat(store.put(document("unknown", "op1", T0))).isFalse();
        assertThat(store.totalCount()).isEqualTo(1);
    }

    @Test
    void activeExcludesExpired() {
        store.insert(new ReservationToken("old", T0, T0.plusSeconds(10)));
        store.insert(new ReservationToken("new", T0.plusSeconds(1), T0.plusSeconds(100)));

        assertThat(store.active(T0.plusSeconds(20))).extracting(ReservationToken::token).containsExactly("new");
    }

    private static SubscriptionDocument document(String token, String operationId, Instant at) {
        return new SubscriptionDocument(token, operationId, "subscription { postUpdated { id } }", null, Map.of(), at);
    }
}
