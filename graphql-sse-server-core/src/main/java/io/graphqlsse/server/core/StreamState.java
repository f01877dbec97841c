package io.graphqlsse.server.core;

/**
 * Lifecycle of an event stream. {@link #CLOSED} is terminal.
 */
public enum StreamState {
    RESERVED,
    STREAMING,
    CLOSED
}
