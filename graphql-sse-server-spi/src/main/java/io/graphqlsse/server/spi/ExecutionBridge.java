package io.graphqlsse.server.spi;

/**
 * Executes a matched subscription document against the GraphQL engine.
 *
 * <p>The stream controller treats every call as a potentially slow, potentially failing remote
 * call and bounds it with a timeout. Implementations signal lost access by throwing
 * {@link io.graphqlsse.core.GraphQLSseException.AuthorizationError}; any other exception is reported
 * to the client as a non-fatal execution error.
 */
@FunctionalInterface
public interface ExecutionBridge {

    ExecutionResult execute(ExecutionRequest request) throws Exception;
}
