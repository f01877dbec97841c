package io.graphqlsse.server.core;

/**
 * How operations are multiplexed onto connections.
 */
public enum StreamMode {
    /** One reserved stream per token carries every operation registered under it. */
    SINGLE_CONNECTION,
    /** Each operation gets a dedicated connection, opened by the POST that carries it. */
    DISTINCT_CONNECTION
}
