package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.EventLogStats;

import java.util.Optional;

/**
 * Point-in-time counters of a {@link GraphQLSseHandler}.
 *
 * @param activeReservations reservations that have not expired
 * @param totalSubscriptions registered documents across all tokens
 * @param activeStreams streams open in this process
 * @param eventLog event log statistics, when the poll model is configured
 */
public record ServerStats(int activeReservations, int totalSubscriptions, int activeStreams,
                          Optional<EventLogStats> eventLog) {}
