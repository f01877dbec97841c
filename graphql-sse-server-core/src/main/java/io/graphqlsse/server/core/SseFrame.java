package io.graphqlsse.server.core;

import java.util.Objects;

/**
 * Server-Sent Events (SSE) frame.
 *
 * <p>The protocol uses event types "next" and "complete". Keepalives are comment frames, which
 * clients ignore.
 */
public final class SseFrame {
    private final String event; // null for comments
    private final String data;

    public SseFrame(String event, String data) {
        this.event = Objects.requireNonNull(event, "event");
        this.data = data == null ? "" : data;
    }

    private SseFrame(String comment) {
        this.event = null;
        this.data = comment == null ? "" : comment;
    }

    public static SseFrame comment(String text) {
        return new SseFrame(text);
    }

    public boolean isComment() {
        return event == null;
    }

    public String event() {
        return event;
    }

    public String data() {
        return data;
    }

    /**
     * Render as an SSE event block (without HTTP headers).
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        String prefix;
        if (event == null) {
            prefix = ": ";
        } else {
            sb.append("event: ").append(event).append("\n");
            prefix = "data: ";
        }
        // data can include newlines; each line must carry the prefix
        String[] lines = data.split("\r?\n", -1);
        for (String line : lines) {
            sb.append(prefix).append(line).append("\n");
        }
        sb.append("\n");
        return sb.toString();
    }
}
