package io.graphqlsse.server.core;

import graphql.language.Document;
import graphql.language.Field;
import graphql.language.OperationDefinition;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing a client document and selecting its operation.
 */
public sealed interface ParsedOperation
        permits ParsedOperation.Subscription, ParsedOperation.Invalid, ParsedOperation.NotSubscription {

    /**
     * The selected operation is a subscription.
     */
    record Subscription(Document document, OperationDefinition operation) implements ParsedOperation {
        public Subscription {
            Objects.requireNonNull(document, "document");
            Objects.requireNonNull(operation, "operation");
        }

        /**
         * First top-level field selection; fragment spreads at the root are not followed.
         */
        public Optional<Field> rootField() {
            if (operation.getSelectionSet() == null) return Optional.empty();
            return operation.getSelectionSet().getSelectionsOfType(Field.class).stream()
                    .filter(f -> !f.getName().startsWith("__"))
                    .findFirst();
        }
    }

    /**
     * The text does not parse, or the requested operation does not exist.
     */
    record Invalid(String message) implements ParsedOperation {}

    /**
     * The selected operation is a query or a mutation.
     */
    record NotSubscription(OperationDefinition.Operation operation) implements ParsedOperation {}
}
