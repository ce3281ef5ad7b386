package io.mcpcompat.server.core;

import java.util.Objects;

/**
 * Server-Sent Events (SSE) frame: an event with optional id and name, or a comment line.
 */
public final class SseFrame {
    private final String id;
    private final String event;
    private final String data;
    private final String comment;

    private SseFrame(String id, String event, String data, String comment) {
        this.id = id;
        this.event = event;
        this.data = data;
        this.comment = comment;
    }

    public static SseFrame event(String id, String event, String data) {
        return new SseFrame(id, event, data == null ? "" : data, null);
    }

    public static SseFrame event(String event, String data) {
        return event(null, event, data);
    }

    public static SseFrame comment(String comment) {
        return new SseFrame(null, null, null, Objects.requireNonNull(comment, "comment"));
    }

    public String id() {
        return id;
    }

    public String event() {
        return event;
    }

    public String data() {
        return data;
    }

    public boolean isComment() {
        return comment != null;
    }

    /**
     * Render as an SSE event block (without HTTP headers).
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        if (comment != null) {
            sb.append(": ").append(comment).append("\n\n");
            return sb.toString();
        }
        if (id != null) sb.append("id: ").append(id).append("\n");
        if (event != null) sb.append("event: ").append(event).append("\n");
        // data can include newlines; each line must be prefixed with "data:"
        String[] lines = data.split("\r?\n", -1);
        for (String line : lines) {
            sb.append("data: ").append(line).append("\n");
        }
        sb.append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
