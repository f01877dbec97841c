package io.graphqlsse.server.spi;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable change event as stored in an {@link EventLog} or fanned out by an {@link EventBroker}.
 *
 * <p>Ids increase monotonically with creation order within one sink.
 */
public record ChangeEvent(
        long id,
        String eventType,
        String subjectId,
        String routingKey,
        Map<String, Object> payload,
        Map<String, Object> metadata,
        Set<String> channels,
        Instant createdAt
) {
    public ChangeEvent {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(routingKey, "routingKey");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(channels, "channels");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Materialize a draft with the id and timestamp assigned by a sink.
     */
    public static ChangeEvent of(EventDraft draft, long id, Instant createdAt) {
        return new ChangeEvent(id, draft.eventType(), draft.subjectId(), draft.routingKey(),
                draft.payload(), draft.metadata(), draft.channels(), createdAt);
    }

    public boolean isOnAnyChannel(Set<String> wanted) {
        for (String channel : channels) {
            if (wanted.contains(channel)) return true;
        }
        return false;
    }
}
