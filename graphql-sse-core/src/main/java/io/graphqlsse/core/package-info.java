/**
 * Protocol-centric core for GraphQL subscriptions over SSE.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants (headers, event types, error codes)</li>
 *   <li>Case-insensitive header helpers</li>
 *   <li>The exception hierarchy shared by stores and the server core</li>
 * </ul>
 *
 * <p>HTTP server bindings and storage live in other modules.
 */
package io.graphqlsse.core;
