/**
 * Framework-neutral GraphQL SSE server: the HTTP handler, token and subscription services, event
 * emission and routing, matching, and the per-token stream loop.
 *
 * <p>Reference stores live here as well: {@link io.graphqlsse.server.core.InMemoryConnectionStore},
 * {@link io.graphqlsse.server.core.InMemoryEventLog} and
 * {@link io.graphqlsse.server.core.InMemoryEventBroker}. The LMDB store is in the {@code lmdb}
 * subpackage.
 */
package io.graphqlsse.server.core;
