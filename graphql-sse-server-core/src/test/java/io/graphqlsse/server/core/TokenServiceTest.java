package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.ReservationToken;
import io.graphqlsse.server.spi.SubscriptionDocument;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TokenServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final InMemoryConnectionStore store = new InMemoryConnectionStore();
    private final TokenService tokens = new TokenService(store, clock);

    @Test
    void validUntilExpiry() {
        ReservationToken token = tokens.reserve(Duration.ofMinutes(5));

        assertThat(tokens.validate(token.token())).isTrue();
        clock.advance(Duration.ofMinutes(5).minusMillis(1));
        assertThat(tokens.validate(token.token())).isTrue();
        clock.advance(Duration.ofMillis(1));
        assertThat(tokens.validate(token.token())).isFalse();
    }

    @Test
    void rejectsUnknownAndBlankTokens() {
        assertThat(tokens.validate("never-issued")).isFalse();
        assertThat(tokens.validate(" ")).isFalse();
        assertThat(tokens.validate(null)).isFalse();
    }

    @Test
    void tokensAreUrlSafeAndUnique() {
        Set<String> issued = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            issued.add(tokens.reserve(TokenService.DEFAULT_TTL).token());
        }

        assertThat(issued).hasSize(200);
        assertThat(issued).allSatisfy(t -> assertThat(t).matches("[A-Za-z0-9_-]{22}"));
    }

    @Test
    void revokeCascadesToDocuments() {
        String token = tokens.reserve(Duration.ofHours(1)).token();
        store.put(new SubscriptionDocument(token, "op1", "subscription { postUpdated { id } }", null, Map.of(), clock.instant()));

        assertThat(tokens.revoke(token)).isTrue();
        assertThat(tokens.validate(token)).isFalse();
        assertThat(store.list(token)).isEmpty();
        assertThat(tokens.revoke(token)).isFalse();
    }

    @Test
    void sweepIsIdempotent() {
        String shortLived = tokens.reserve(Duration.ofMinutes(1)).token();
        String longLived = tokens.reserve(Duration.ofHours(1)).token();
        store.put(new SubscriptionDocument(shortLived, "op1", "subscription { postUpdated { id } }", null, Map.of(), clock.instant()));
        clock.advance(Duration.ofMinutes(2));

        assertThat(tokens.sweep()).isEqualTo(1);
        assertThat(tokens.sweep()).isZero();
        assertThat(store.count(shortLived)).isZero();
        assertThat(tokens.validate(longLived)).isTrue();
        assertThat(tokens.activeCount()).isEqualTo(1);
    }
}
