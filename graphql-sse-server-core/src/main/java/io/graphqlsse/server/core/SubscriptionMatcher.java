package io.graphqlsse.server.core;

import graphql.language.Field;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies a registered subscription against an event type and key.
 *
 * <p>The subscribed field is mapped to the event types it listens to (by default only the event
 * type equal to its name). When the field has an {@code id} argument, the argument must resolve to
 * a scalar whose text equals the key; without one the field matches every subject. Anything that
 * cannot be classified does not match.
 *
 * <p>Matching never executes the document and has no side effects.
 */
public final class SubscriptionMatcher {

    public static final String DEFAULT_ID_ARGUMENT = "id";

    private final Map<String, Set<String>> eventTypesByField;
    private final String idArgument;

    public SubscriptionMatcher() {
        this(builder());
    }

    private SubscriptionMatcher(Builder builder) {
        Map<String, Set<String>> copy = new HashMap<>();
        builder.aliases.forEach((field, types) -> copy.put(field, Set.copyOf(types)));
        this.eventTypesByField = Map.copyOf(copy);
        this.idArgument = builder.idArgument;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link SubscriptionMatcher}.
     */
    public static final class Builder {
        private final Map<String, Set<String>> aliases = new HashMap<>();
        private String idArgument = DEFAULT_ID_ARGUMENT;

        private Builder() {}

        /** Makes {@code field} listen to the given event types instead of the type named like it. */
        public Builder mapField(String field, String... eventTypes) {
            Objects.requireNonNull(field, "field");
            Set<String> types = new LinkedHashSet<>();
            for (String t : eventTypes) types.add(Objects.requireNonNull(t, "eventType"));
            aliases.put(field, types);
            return this;
        }

        /** Sets the argument name holding the subject filter. Default: {@code id}. */
        public Builder idArgument(String idArgument) {
            this.idArgument = Objects.requireNonNull(idArgument, "idArgument");
            return this;
        }

        public SubscriptionMatcher build() {
            return new SubscriptionMatcher(this);
        }
    }

    public boolean matches(RegisteredSubscription subscription, String eventType, String key) {
        return match(subscription, eventType, key).isPresent();
    }

    /**
     * @return the matched field, or empty when the subscription does not match
     */
    public Optional<Field> match(RegisteredSubscription subscription, String eventType, String key) {
        if (subscription == null || eventType == null) return Optional.empty();
        Optional<Field> field = subscription.rootField();
        if (field.isEmpty() || !eventTypesFor(field.get().getName()).contains(eventType)) {
            return Optional.empty();
        }
        Optional<Filter> filter = filterOf(subscription);
        if (filter.isEmpty()) return field;
        return filter.get().accepts(key) ? field : Optional.empty();
    }

    /**
     * Event types a field listens to.
     */
    public Set<String> eventTypesFor(String fieldName) {
        return eventTypesByField.getOrDefault(fieldName, Set.of(fieldName));
    }

    /**
     * The subject filter of a subscription, or empty when it listens to every subject.
     */
    public Optional<Filter> filterOf(RegisteredSubscription subscription) {
        Optional<Field> field = subscription.rootField();
        if (field.isEmpty()) return Optional.empty();
        return ArgumentValues.argument(field.get(), idArgument)
                .map(argument -> new Filter(ArgumentValues
                        .resolve(argument.getValue(), subscription.document().variables())
                        .flatMap(ArgumentValues::scalarText)));
    }

    /**
     * A subject filter. An unresolvable filter value never accepts.
     */
    public static final class Filter {
        private final Optional<String> value;

        Filter(Optional<String> value) {
            this.value = value;
        }

        public Optional<String> value() {
            return value;
        }

        public boolean accepts(String key) {
            return key != null && value.isPresent() && value.get().equals(key);
        }
    }
}
