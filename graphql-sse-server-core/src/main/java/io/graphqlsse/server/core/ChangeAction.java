package io.graphqlsse.server.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of change a node went through.
 */
public enum ChangeAction {
    CREATE("Created"),
    UPDATE("Updated"),
    DELETE("Deleted");

    private final String suffix;

    ChangeAction(String suffix) {
        this.suffix = suffix;
    }

    /** Suffix appended to the node type when no explicit event type is configured. */
    public String suffix() {
        return suffix;
    }

    /**
     * Case-insensitive lookup.
     */
    public static Optional<ChangeAction> parse(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (ChangeAction action : values()) {
            if (action.name().equals(v)) return Optional.of(action);
        }
        return Optional.empty();
    }
}
