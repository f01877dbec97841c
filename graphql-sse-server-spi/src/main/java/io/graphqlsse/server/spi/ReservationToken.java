package io.graphqlsse.server.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * A reservation: the opaque credential naming one logical streaming connection.
 */
public final class ReservationToken {
    private final String token;
    private final Instant createdAt;
    private final Instant expiresAt;

    public ReservationToken(String token, Instant createdAt, Instant expiresAt) {
        this.token = Objects.requireNonNull(token, "token");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        if (expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("expiresAt must not precede createdAt");
        }
    }

    public String token() {
        return token;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    /**
     * A reservation is valid strictly before its expiry instant.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReservationToken other)) return false;
        return token.equals(other.token) && createdAt.equals(other.createdAt) && expiresAt.equals(other.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token, createdAt, expiresAt);
    }

    @Override
    public String toString() {
        // token value is a credential
        return "ReservationToken{createdAt=" + createdAt + ", expiresAt=" + expiresAt + "}";
    }
}
