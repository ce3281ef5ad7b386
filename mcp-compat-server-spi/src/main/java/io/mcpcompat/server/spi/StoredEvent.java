package io.mcpcompat.server.spi;

import io.mcpcompat.core.EventId;

import java.time.Instant;
import java.util.Objects;

/**
 * An event persisted by a {@link ResumableEventStore}.
 *
 * @param scope stream scope the event was written to
 * @param sequence sequence number assigned at append time
 * @param payload serialized message
 * @param storedAt append time
 */
public record StoredEvent(String scope, long sequence, String payload, Instant storedAt) {
    public StoredEvent {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(storedAt, "storedAt");
    }

    public EventId eventId() {
        return new EventId(scope, sequence);
    }
}
