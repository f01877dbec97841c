/**
 * Storage and collaborator SPI for GraphQL SSE subscription delivery.
 *
 * <p>Reservations and documents live behind {@link io.graphqlsse.server.spi.ConnectionStore};
 * events flow through either an {@link io.graphqlsse.server.spi.EventLog} (poll model) or an
 * {@link io.graphqlsse.server.spi.EventBroker} (push model). Payloads are produced by an
 * {@link io.graphqlsse.server.spi.ExecutionBridge}.
 *
 * <p>All calls are blocking; the server core runs them on its own worker threads.
 */
package io.graphqlsse.server.spi;
