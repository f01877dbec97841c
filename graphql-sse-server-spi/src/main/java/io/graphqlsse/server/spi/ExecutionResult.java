package io.graphqlsse.server.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one {@link ExecutionBridge} call, shaped like a GraphQL response.
 */
public final class ExecutionResult {
    private final Object data;
    private final List<Map<String, Object>> errors;
    private final Map<String, Object> extensions;

    public ExecutionResult(Object data, List<Map<String, Object>> errors, Map<String, Object> extensions) {
        this.data = data;
        this.errors = errors == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(errors));
        this.extensions = extensions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    public static ExecutionResult data(Object data) {
        return new ExecutionResult(data, null, null);
    }

    /**
     * A result carrying a single error with an extension code and no data.
     */
    public static ExecutionResult error(String message, String code) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", message);
        error.put("extensions", Map.of("code", code));
        return new ExecutionResult(null, List.of(error), null);
    }

    public Object data() {
        return data;
    }

    public List<Map<String, Object>> errors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Map<String, Object> extensions() {
        return extensions;
    }

    public ExecutionResult withExtension(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(extensions);
        merged.put(key, value);
        return new ExecutionResult(data, errors, merged);
    }

    /**
     * Response map as serialized into a {@code next} payload: {@code data}, then {@code errors} and
     * {@code extensions} when non-empty.
     */
    public Map<String, Object> toSpecification() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (data != null || errors.isEmpty()) {
            out.put("data", data);
        }
        if (!errors.isEmpty()) {
            out.put("errors", errors);
        }
        if (!extensions.isEmpty()) {
            out.put("extensions", extensions);
        }
        return out;
    }
}
