package io.graphqlsse.server.core;

import graphql.ExceptionWhileDataFetching;
import graphql.ExecutionInput;
import graphql.GraphQL;
import graphql.GraphQLError;
import graphql.execution.AsyncExecutionStrategy;
import graphql.schema.GraphQLSchema;
import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.server.spi.ExecutionBridge;
import io.graphqlsse.server.spi.ExecutionRequest;
import io.graphqlsse.server.spi.ExecutionResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ExecutionBridge} backed by graphql-java.
 *
 * <p>The subscription document is executed once per event like a query: the root field resolves
 * from the root value, so its default data fetcher returns the event payload. A data fetcher that
 * throws {@link GraphQLSseException.AuthorizationError} ends the operation.
 */
public final class GraphQLJavaExecutionBridge implements ExecutionBridge {

    /** Context key under which the triggering event is available to data fetchers. */
    public static final String EVENT_CONTEXT_KEY = "graphqlSseEvent";

    private final GraphQL graphQL;

    public GraphQLJavaExecutionBridge(GraphQLSchema schema) {
        this(GraphQL.newGraphQL(Objects.requireNonNull(schema, "schema"))
                .subscriptionExecutionStrategy(new AsyncExecutionStrategy())
                .build());
    }

    /**
     * @param graphQL an engine whose subscription strategy resolves fields like a query strategy
     */
    public GraphQLJavaExecutionBridge(GraphQL graphQL) {
        this.graphQL = Objects.requireNonNull(graphQL, "graphQL");
    }

    @Override
    public ExecutionResult execute(ExecutionRequest request) {
        ExecutionInput input = ExecutionInput.newExecutionInput()
                .query(request.query())
                .operationName(request.operationName().orElse(null))
                .variables(request.variables())
                .root(request.rootValue())
                .graphQLContext(Map.of(EVENT_CONTEXT_KEY, request.event()))
                .build();

        graphql.ExecutionResult result = graphQL.execute(input);

        List<Map<String, Object>> errors = new ArrayList<>();
        for (GraphQLError error : result.getErrors()) {
            if (error instanceof ExceptionWhileDataFetching fetching
                    && fetching.getException() instanceof GraphQLSseException.AuthorizationError denied) {
                throw denied;
            }
            errors.add(error.toSpecification());
        }
        return new ExecutionResult(result.getData(), errors, extensions(result.getExtensions()));
    }

    private static Map<String, Object> extensions(Map<Object, Object> raw) {
        if (raw == null || raw.isEmpty()) return Map.of();
        Map<String, Object> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }
}
