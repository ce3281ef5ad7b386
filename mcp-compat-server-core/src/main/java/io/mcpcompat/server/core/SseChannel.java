package io.mcpcompat.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Push-style SSE publisher backing one open event stream.
 *
 * <p>Frames may be emitted from any thread before or after the HTTP adapter subscribes; they are buffered
 * until there is demand and delivered in emission order. Only one subscriber is accepted. Cancellation
 * (the client went away) drops buffered frames and runs the cancel listeners once.
 */
public final class SseChannel implements Flow.Publisher<SseFrame> {
    private static final Logger log = LoggerFactory.getLogger(SseChannel.class);

    private final Queue<SseFrame> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean subscribed = new AtomicBoolean();
    private volatile Flow.Subscriber<? super SseFrame> subscriber;
    private final AtomicLong demand = new AtomicLong();
    private final AtomicInteger wip = new AtomicInteger();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean terminated = new AtomicBoolean();
    private final List<Runnable> cancelListeners = new CopyOnWriteArrayList<>();
    private volatile boolean completed;

    @Override
    public void subscribe(Flow.Subscriber<? super SseFrame> s) {
        Objects.requireNonNull(s, "subscriber");
        if (!subscribed.compareAndSet(false, true)) {
            s.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                }

                @Override
                public void cancel() {
                }
            });
            s.onError(new IllegalStateException("SSE channel accepts a single subscriber"));
            return;
        }
        s.onSubscribe(new Flow.Subscription() {
            @Override
            public void request(long n) {
                if (n <= 0) {
                    cancelInternal();
                    return;
                }
                demand.getAndAccumulate(n, (current, add) -> {
                    long sum = current + add;
                    return sum < 0 ? Long.MAX_VALUE : sum;
                });
                drain();
            }

            @Override
            public void cancel() {
                cancelInternal();
            }
        });
        // published only after onSubscribe so no signal can overtake it
        subscriber = s;
        drain();
    }

    /**
     * Queue a frame and deliver what demand allows.
     *
     * @return false if the channel is completed or cancelled and the frame was dropped
     */
    public boolean emit(SseFrame frame) {
        if (!offer(frame)) return false;
        drain();
        return true;
    }

    /**
     * Queue a frame without delivering it; pair with {@link #flush()}.
     */
    boolean offer(SseFrame frame) {
        Objects.requireNonNull(frame, "frame");
        if (completed || cancelled.get()) return false;
        queue.offer(frame);
        return true;
    }

    void flush() {
        drain();
    }

    /**
     * Complete the stream once buffered frames have been delivered.
     */
    public void complete() {
        completed = true;
        drain();
    }

    public boolean isOpen() {
        return !completed && !cancelled.get();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Run {@code listener} when the subscriber cancels. Runs immediately if already cancelled.
     */
    public void onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        cancelListeners.add(listener);
        if (cancelled.get() && cancelListeners.remove(listener)) {
            runListener(listener);
        }
    }

    private void cancelInternal() {
        if (!cancelled.compareAndSet(false, true)) return;
        queue.clear();
        for (Runnable listener : cancelListeners) {
            if (cancelListeners.remove(listener)) {
                runListener(listener);
            }
        }
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("SSE cancel listener failed", e);
        }
    }

    private void drain() {
        if (wip.getAndIncrement() != 0) return;
        int missed = 1;
        for (;;) {
            Flow.Subscriber<? super SseFrame> s = subscriber;
            if (s != null && !cancelled.get()) {
                long requested = demand.get();
                long emitted = 0;
                while (emitted != requested && !cancelled.get()) {
                    SseFrame frame = queue.poll();
                    if (frame == null) break;
                    try {
                        s.onNext(frame);
                    } catch (RuntimeException e) {
                        log.debug("SSE subscriber failed in onNext, cancelling", e);
                        cancelInternal();
                        break;
                    }
                    emitted++;
                }
                if (emitted != 0 && requested != Long.MAX_VALUE) {
                    demand.addAndGet(-emitted);
                }
                if (completed && queue.isEmpty() && !cancelled.get() && terminated.compareAndSet(false, true)) {
                    s.onComplete();
                }
            }
            missed = wip.addAndGet(-missed);
            if (missed == 0) break;
        }
    }
}
