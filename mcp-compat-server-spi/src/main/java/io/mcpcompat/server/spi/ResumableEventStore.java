package io.mcpcompat.server.spi;

import java.util.List;

/**
 * Append/replay log backing resumable SSE delivery for one Streamable session.
 *
 * <p>A scope is one logical SSE stream of the session (the standalone GET stream, or the stream opened
 * for a POST). Implementations must be thread-safe: appends for one session can race with replays
 * issued by a reconnecting client.
 */
public interface ResumableEventStore {

    /**
     * Append an event.
     *
     * @param scope stream scope (non-empty)
     * @param event serialized event payload
     * @return sequence number, strictly greater than any previously returned for {@code scope}
     */
    long append(String scope, String event);

    /**
     * Replay events written to {@code scope} after {@code lastSeen}.
     *
     * @param scope stream scope
     * @param lastSeen last sequence number the client received
     * @return events with sequence {@code > lastSeen} in append order; empty if none or the scope is unknown
     */
    List<StoredEvent> replayAfter(String scope, long lastSeen);

    /**
     * Drop everything. Called when the owning session closes.
     */
    void purge();
}
