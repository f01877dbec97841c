package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.EventDraft;
import io.graphqlsse.server.spi.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point for producers: validates, routes and hands events to the configured sink.
 *
 * <p>Works the same against an {@link io.graphqlsse.server.spi.EventLog} and an
 * {@link io.graphqlsse.server.spi.EventBroker}.
 */
public final class EventEmitter {
    private static final Logger LOG = LoggerFactory.getLogger(EventEmitter.class);

    private final EventSink sink;
    private final ChannelRouter router;
    private final NodeEventTypes nodeEventTypes;
    private final Clock clock;

    public EventEmitter(EventSink sink, ChannelRouter router) {
        this(sink, router, NodeEventTypes.defaults(), Clock.systemUTC());
    }

    public EventEmitter(EventSink sink, ChannelRouter router, NodeEventTypes nodeEventTypes, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.router = Objects.requireNonNull(router, "router");
        this.nodeEventTypes = Objects.requireNonNull(nodeEventTypes, "nodeEventTypes");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Emit an event of {@code eventType} about {@code subjectId}.
     *
     * @throws IllegalArgumentException if the event type or subject id is blank
     * @throws io.graphqlsse.core.GraphQLSseException.StoreError if the sink fails
     */
    public ChangeEvent emit(String eventType, String subjectId, Map<String, Object> payload, Map<String, Object> metadata) {
        requireText(eventType, "eventType");
        requireText(subjectId, "subjectId");

        ChannelRouter.Routing routing = router.route(eventType, subjectId, payload);
        ChangeEvent event = sink.publish(new EventDraft(eventType, subjectId, routing.routingKey(),
                payload, metadata, routing.channels()));
        LOG.debug("Emitted {} #{} for subject {} on {}", eventType, event.id(), subjectId, routing.channels());
        return event;
    }

    public ChangeEvent emitChange(String nodeType, String action, String nodeId, Map<String, Object> context) {
        return emitChange(nodeType, action, nodeId, context, Map.of());
    }

    /**
     * Emit a standardized node change event.
     *
     * <p>The payload is {@code {node_type, action, node_id, context, metadata}}; {@code metadata}
     * always carries {@code timestamp} (epoch seconds) and a unique {@code event_id}, merged with
     * the caller's entries.
     *
     * @throws IllegalArgumentException if an argument is blank or the action is not CREATE, UPDATE
     *         or DELETE
     */
    public ChangeEvent emitChange(String nodeType, String action, String nodeId,
                                  Map<String, Object> context, Map<String, Object> metadata) {
        requireText(nodeType, "nodeType");
        requireText(action, "action");
        requireText(nodeId, "nodeId");
        ChangeAction changeAction = ChangeAction.parse(action)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid action '" + action + "'. Must be one of: CREATE, UPDATE, DELETE"));

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("timestamp", clock.instant().getEpochSecond());
        meta.put("event_id", nodeType + "_" + changeAction.name() + "_" + UUID.randomUUID());
        if (metadata != null) meta.putAll(metadata);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("node_type", nodeType);
        payload.put("action", changeAction.name());
        payload.put("node_id", nodeId);
        payload.put("context", context == null ? Map.of() : context);
        payload.put("metadata", meta);

        return emit(nodeEventTypes.eventType(nodeType, changeAction), nodeId, payload, meta);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
