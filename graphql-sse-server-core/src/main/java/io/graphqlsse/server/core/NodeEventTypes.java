package io.graphqlsse.server.core;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps (node type, action) pairs to subscription event types.
 *
 * <p>Unmapped pairs fall back to {@code nodeType + action.suffix()}, e.g. {@code pageUpdated}.
 */
public final class NodeEventTypes {
    private final Map<String, Map<ChangeAction, String>> table;

    private NodeEventTypes(Builder builder) {
        Map<String, Map<ChangeAction, String>> copy = new HashMap<>();
        builder.table.forEach((node, actions) -> copy.put(node, Map.copyOf(actions)));
        this.table = Map.copyOf(copy);
    }

    /**
     * Post, comment and user mappings. Comment creation maps to {@code commentAdded}.
     */
    public static NodeEventTypes defaults() {
        return builder().build();
    }

    /**
     * A builder pre-populated with the {@link #defaults()} table.
     */
    public static Builder builder() {
        return new Builder()
                .map("post", ChangeAction.CREATE, "postCreated")
                .map("post", ChangeAction.UPDATE, "postUpdated")
                .map("post", ChangeAction.DELETE, "postDeleted")
                .map("comment", ChangeAction.CREATE, "commentAdded")
                .map("comment", ChangeAction.UPDATE, "commentUpdated")
                .map("comment", ChangeAction.DELETE, "commentDeleted")
                .map("user", ChangeAction.CREATE, "userCreated")
                .map("user", ChangeAction.UPDATE, "userUpdated")
                .map("user", ChangeAction.DELETE, "userDeleted");
    }

    public String eventType(String nodeType, ChangeAction action) {
        Objects.requireNonNull(nodeType, "nodeType");
        Objects.requireNonNull(action, "action");
        Map<ChangeAction, String> actions = table.get(nodeType);
        String mapped = actions == null ? null : actions.get(action);
        return mapped != null ? mapped : nodeType + action.suffix();
    }

    public static final class Builder {
        private final Map<String, Map<ChangeAction, String>> table = new HashMap<>();

        private Builder() {}

        public Builder map(String nodeType, ChangeAction action, String eventType) {
            table.computeIfAbsent(Objects.requireNonNull(nodeType, "nodeType"), k -> new EnumMap<>(ChangeAction.class))
                    .put(Objects.requireNonNull(action, "action"), Objects.requireNonNull(eventType, "eventType"));
            return this;
        }

        public NodeEventTypes build() {
            return new NodeEventTypes(this);
        }
    }
}
