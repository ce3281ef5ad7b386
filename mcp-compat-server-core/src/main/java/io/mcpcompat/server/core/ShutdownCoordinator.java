package io.mcpcompat.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Closes every registered session when the process stops.
 *
 * <p>Closes run concurrently. A failing close is logged and counted and does not hold up the others; the
 * session is removed from the registry either way.
 */
public final class ShutdownCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /**
     * @param closed sessions whose transport closed cleanly
     * @param failed sessions whose close threw
     */
    public record DrainReport(int closed, int failed) {
    }

    private final SessionRegistry registry;
    private final Duration timeout;

    public ShutdownCoordinator(SessionRegistry registry) {
        this(registry, DEFAULT_TIMEOUT);
    }

    public ShutdownCoordinator(SessionRegistry registry, Duration timeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("timeout must be positive");
    }

    public DrainReport drain() {
        List<Session> sessions = registry.snapshot();
        log.info("Closing {} active sessions", sessions.size());
        if (sessions.isEmpty()) return new DrainReport(0, 0);

        AtomicInteger closed = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        ExecutorService executor = Threads.newExecutor("mcp-shutdown");
        try {
            List<CompletableFuture<Void>> attempts = new ArrayList<>(sessions.size());
            for (Session session : sessions) {
                attempts.add(CompletableFuture.runAsync(() -> closeOne(session, closed, failed), executor));
            }
            CompletableFuture.allOf(attempts.toArray(new CompletableFuture<?>[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Timed out after {} waiting for sessions to close", timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing sessions");
        } catch (ExecutionException e) {
            // closeOne never throws; reaching here means the executor itself failed
            log.error("Session close task failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
        DrainReport report = new DrainReport(closed.get(), failed.get());
        log.info("Session drain finished: {} closed, {} failed", report.closed(), report.failed());
        return report;
    }

    private void closeOne(Session session, AtomicInteger closed, AtomicInteger failed) {
        try {
            log.debug("Closing transport for session {}", session.id());
            session.transport().close();
            closed.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.warn("Error closing transport for session {}", session.id(), e);
        } finally {
            registry.remove(session);
        }
    }
}
