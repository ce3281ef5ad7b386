package io.mcpcompat.core;

import java.util.Objects;

/**
 * Identifier of a stored SSE event: the stream scope it was written to plus its sequence number.
 *
 * <p>Rendered as {@code <scope>/<sequence>} in the SSE {@code id:} field and read back from the
 * {@code Last-Event-ID} header on reconnect. Clients treat it as opaque.
 */
public final class EventId implements Comparable<EventId> {

    private static final char SEPARATOR = '/';

    private final String scope;
    private final long sequence;

    public EventId(String scope, long sequence) {
        this.scope = validateScope(scope);
        if (sequence < 0) throw new IllegalArgumentException("sequence must not be negative");
        this.sequence = sequence;
    }

    /**
     * Parses a {@code Last-Event-ID} value.
     *
     * @throws McpCompatException.InvalidEventId if the value is not {@code <scope>/<sequence>}
     */
    public static EventId parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new McpCompatException.InvalidEventId("event id must not be empty");
        }
        int sep = raw.lastIndexOf(SEPARATOR);
        if (sep <= 0 || sep == raw.length() - 1) {
            throw new McpCompatException.InvalidEventId("malformed event id: " + raw);
        }
        long seq;
        try {
            seq = Long.parseLong(raw.substring(sep + 1));
        } catch (NumberFormatException e) {
            throw new McpCompatException.InvalidEventId("malformed event id sequence: " + raw);
        }
        try {
            return new EventId(raw.substring(0, sep), seq);
        } catch (IllegalArgumentException e) {
            throw new McpCompatException.InvalidEventId(e.getMessage());
        }
    }

    public String scope() {
        return scope;
    }

    public long sequence() {
        return sequence;
    }

    public String value() {
        return scope + SEPARATOR + sequence;
    }

    private static String validateScope(String s) {
        Objects.requireNonNull(s, "scope");
        if (s.isEmpty()) throw new IllegalArgumentException("scope must not be empty");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\n' || c == '\r' || c == SEPARATOR) {
                throw new IllegalArgumentException("scope contains forbidden characters: / CR LF");
            }
        }
        return s;
    }

    @Override
    public int compareTo(EventId o) {
        int byScope = scope.compareTo(o.scope);
        return byScope != 0 ? byScope : Long.compare(sequence, o.sequence);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof EventId)) return false;
        EventId that = (EventId) other;
        return sequence == that.sequence && scope.equals(that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, sequence);
    }

    @Override
    public String toString() {
        return value();
    }
}
