package io.graphqlsse.server.core;

import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.server.spi.ReservationToken;
import io.graphqlsse.server.spi.TokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * Issues, validates and revokes reservation tokens on top of a {@link TokenStore}.
 *
 * <p>Tokens carry 128 random bits from {@link SecureRandom}, URL-safe Base64 encoded.
 */
public final class TokenService {
    private static final Logger LOG = LoggerFactory.getLogger(TokenService.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    public static final Duration DEFAULT_EPHEMERAL_TTL = Duration.ofMinutes(5);

    private static final int TOKEN_BYTES = 16;
    private static final int MAX_ATTEMPTS = 3;

    private final TokenStore store;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public TokenService(TokenStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Reserve a new token valid for {@code ttl}.
     */
    public ReservationToken reserve(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be positive");

        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            Instant now = clock.instant();
            ReservationToken token = new ReservationToken(nextToken(), now, now.plus(ttl));
            if (store.insert(token)) {
                LOG.debug("Reserved token expiring at {}", token.expiresAt());
                return token;
            }
        }
        throw new GraphQLSseException.StoreError("Could not allocate a unique reservation token");
    }

    public boolean validate(String token) {
        return find(token).isPresent();
    }

    public Optional<ReservationToken> find(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        return store.find(token, clock.instant());
    }

    /**
     * Delete a reservation and its documents.
     */
    public boolean revoke(String token) {
        if (token == null || token.isBlank()) return false;
        boolean removed = store.revoke(token);
        if (removed) {
            LOG.debug("Revoked reservation token");
        }
        return removed;
    }

    /**
     * Delete every expired reservation and its documents.
     *
     * @return number of reservations removed
     */
    public int sweep() {
        int removed = store.sweep(clock.instant());
        if (removed > 0) {
            LOG.info("Swept {} expired reservation(s)", removed);
        }
        return removed;
    }

    public int activeCount() {
        return store.active(clock.instant()).size();
    }

    private String nextToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
