package io.mcpcompat.server.spi;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference {@link ResumableEventStore} keeping events in memory.
 *
 * <p>Sequence numbers come from one counter per store, so they increase across all scopes of the owning
 * session. An optional per-scope bound evicts the oldest events first; by default nothing is evicted and
 * events live until {@link #purge()}.
 */
public final class InMemoryEventStore implements ResumableEventStore {

    /** No per-scope limit. */
    public static final int UNBOUNDED = 0;

    private final int maxEventsPerScope;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Deque<StoredEvent>> scopes = new HashMap<>();
    private long lastSequence;

    public InMemoryEventStore() {
        this(UNBOUNDED, Clock.systemUTC());
    }

    public InMemoryEventStore(int maxEventsPerScope) {
        this(maxEventsPerScope, Clock.systemUTC());
    }

    public InMemoryEventStore(int maxEventsPerScope, Clock clock) {
        if (maxEventsPerScope < 0) throw new IllegalArgumentException("maxEventsPerScope must not be negative");
        this.maxEventsPerScope = maxEventsPerScope;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public long append(String scope, String event) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(event, "event");
        if (scope.isEmpty()) throw new IllegalArgumentException("scope must not be empty");

        lock.lock();
        try {
            long seq = ++lastSequence;
            Deque<StoredEvent> events = scopes.computeIfAbsent(scope, s -> new ArrayDeque<>());
            events.addLast(new StoredEvent(scope, seq, event, clock.instant()));
            if (maxEventsPerScope != UNBOUNDED) {
                while (events.size() > maxEventsPerScope) {
                    events.removeFirst();
                }
            }
            return seq;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StoredEvent> replayAfter(String scope, long lastSeen) {
        lock.lock();
        try {
            Deque<StoredEvent> events = scopes.get(scope);
            if (events == null) return List.of();
            List<StoredEvent> out = new ArrayList<>();
            for (StoredEvent e : events) {
                if (e.sequence() > lastSeen) out.add(e);
            }
            return List.copyOf(out);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void purge() {
        lock.lock();
        try {
            scopes.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of events currently retained for {@code scope}.
     */
    public int size(String scope) {
        lock.lock();
        try {
            Deque<StoredEvent> events = scopes.get(scope);
            return events == null ? 0 : events.size();
        } finally {
            lock.unlock();
        }
    }
}
