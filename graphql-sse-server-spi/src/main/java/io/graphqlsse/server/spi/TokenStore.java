package io.graphqlsse.server.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for reservation tokens.
 *
 * <p>This SPI is intentionally minimal and blocking. Implementations must make every write
 * atomic on their own (transactions or synchronized sections); callers never lock.
 * Failures are reported as {@link io.graphqlsse.core.GraphQLSseException.StoreError}.
 */
public interface TokenStore {

    /**
     * Insert a new reservation.
     *
     * @return false if the token value is already taken
     */
    boolean insert(ReservationToken token);

    /**
     * Look up a reservation that is still valid at {@code now}.
     */
    Optional<ReservationToken> find(String token, Instant now);

    /**
     * Delete a reservation together with every subscription document registered under it.
     *
     * @return true if a reservation was removed
     */
    boolean revoke(String token);

    /**
     * Delete every reservation expired at {@code now}, cascading to their documents.
     *
     * @return number of reservations removed
     */
    int sweep(Instant now);

    /**
     * Reservations still valid at {@code now}.
     */
    List<ReservationToken> active(Instant now);
}
