package io.graphqlsse.server.spi;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Input of one {@link ExecutionBridge} call.
 *
 * @param operationId client operation id
 * @param query subscription document text
 * @param operationName selected operation, if the document names several
 * @param variables operation variables
 * @param rootValue root data; maps the subscribed field name to the event payload
 * @param event the triggering event
 */
public record ExecutionRequest(
        String operationId,
        String query,
        Optional<String> operationName,
        Map<String, Object> variables,
        Map<String, Object> rootValue,
        ChangeEvent event
) {
    public ExecutionRequest {
        Objects.requireNonNull(operationId, "operationId");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(operationName, "operationName");
        Objects.requireNonNull(variables, "variables");
        Objects.requireNonNull(rootValue, "rootValue");
        Objects.requireNonNull(event, "event");
    }
}
