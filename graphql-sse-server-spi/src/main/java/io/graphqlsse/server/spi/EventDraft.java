package io.graphqlsse.server.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A validated, routed change event that has not been assigned an id or timestamp yet.
 *
 * @param eventType event type, e.g. {@code postUpdated}
 * @param subjectId id of the entity that changed
 * @param routingKey id the specific channel is keyed by (usually {@code subjectId})
 * @param payload event payload handed to resolvers as root data
 * @param metadata free-form producer metadata
 * @param channels channels the event is published on, global channel first
 */
public record EventDraft(
        String eventType,
        String subjectId,
        String routingKey,
        Map<String, Object> payload,
        Map<String, Object> metadata,
        Set<String> channels
) {
    public EventDraft {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(routingKey, "routingKey");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        channels = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(channels, "channels")));
    }
}
