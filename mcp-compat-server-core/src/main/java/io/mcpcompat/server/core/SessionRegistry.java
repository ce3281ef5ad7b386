package io.mcpcompat.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Process-wide map from session id to the live session, shared by the router, the session manager and
 * the shutdown coordinator.
 *
 * <p>Each id maps to at most one session and the mapping never changes family. Insertion is first writer
 * wins; removal is idempotent.
 */
public final class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public Optional<Session> lookup(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(sessions.get(id));
    }

    /**
     * @return false if the id is already registered; the existing entry is kept
     */
    public boolean insert(Session session) {
        Objects.requireNonNull(session, "session");
        Session existing = sessions.putIfAbsent(session.id(), session);
        if (existing != null) {
            log.warn("Refusing duplicate session id {} ({} already registered)", session.id(), existing.family());
            return false;
        }
        log.debug("Registered {} session {}", session.family(), session.id());
        return true;
    }

    /**
     * Remove whatever is registered under {@code id}. No-op if absent.
     */
    public Optional<Session> remove(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(sessions.remove(id));
    }

    /**
     * Remove {@code session} only if its id still maps to it.
     */
    public boolean remove(Session session) {
        Objects.requireNonNull(session, "session");
        return sessions.remove(session.id(), session);
    }

    public List<Session> snapshot() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    public boolean isEmpty() {
        return sessions.isEmpty();
    }

    /**
     * Iterate over a snapshot; the action may mutate the registry.
     */
    public void forEach(Consumer<? super Session> action) {
        snapshot().forEach(action);
    }
}
