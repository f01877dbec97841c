package io.graphqlsse.server.core;

import graphql.language.Field;
import io.graphqlsse.server.spi.SubscriptionDocument;

import java.util.Objects;
import java.util.Optional;

/**
 * A stored {@link SubscriptionDocument} paired with its parsed operation.
 */
public final class RegisteredSubscription {
    private final SubscriptionDocument document;
    private final ParsedOperation.Subscription operation;

    public RegisteredSubscription(SubscriptionDocument document, ParsedOperation.Subscription operation) {
        this.document = Objects.requireNonNull(document, "document");
        this.operation = Objects.requireNonNull(operation, "operation");
    }

    public SubscriptionDocument document() {
        return document;
    }

    public ParsedOperation.Subscription operation() {
        return operation;
    }

    public String operationId() {
        return document.operationId();
    }

    public Optional<Field> rootField() {
        return operation.rootField();
    }

    /**
     * Response key of the subscribed field: its alias if present, else its name.
     */
    public Optional<String> responseKey() {
        return rootField().map(f -> f.getAlias() != null ? f.getAlias() : f.getName());
    }
}
