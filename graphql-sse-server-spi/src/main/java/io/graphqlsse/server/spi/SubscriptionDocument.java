package io.graphqlsse.server.spi;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A subscription operation registered by a client under its reservation token.
 *
 * <p>Unique per ({@code token}, {@code operationId}).
 */
public final class SubscriptionDocument {
    private final String token;
    private final String operationId;
    private final String query;
    private final String operationName;
    private final Map<String, Object> variables;
    private final Instant registeredAt;

    public SubscriptionDocument(String token, String operationId, String query, String operationName,
                                Map<String, Object> variables, Instant registeredAt) {
        this.token = Objects.requireNonNull(token, "token");
        this.operationId = Objects.requireNonNull(operationId, "operationId");
        this.query = Objects.requireNonNull(query, "query");
        this.operationName = operationName;
        this.variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        this.registeredAt = Objects.requireNonNull(registeredAt, "registeredAt");
    }

    public String token() {
        return token;
    }

    public String operationId() {
        return operationId;
    }

    public String query() {
        return query;
    }

    public Optional<String> operationName() {
        return Optional.ofNullable(operationName);
    }

    public Map<String, Object> variables() {
        return variables;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscriptionDocument other)) return false;
        return token.equals(other.token)
                && operationId.equals(other.operationId)
                && query.equals(other.query)
                && Objects.equals(operationName, other.operationName)
                && variables.equals(other.variables)
                && registeredAt.equals(other.registeredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token, operationId, query, operationName, variables, registeredAt);
    }

    @Override
    public String toString() {
        return "SubscriptionDocument{operationId=" + operationId + ", registeredAt=" + registeredAt + "}";
    }
}
