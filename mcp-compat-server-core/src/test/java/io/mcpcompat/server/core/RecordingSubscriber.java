package io.mcpcompat.server.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

/**
 * Collects SSE frames with unbounded demand.
 */
final class RecordingSubscriber implements Flow.Subscriber<SseFrame> {
    private final List<SseFrame> frames = new CopyOnWriteArrayList<>();
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile Flow.Subscription subscription;
    private volatile Throwable error;
    private volatile boolean completed;

    @Override
    public void onSubscribe(Flow.Subscription s) {
        this.subscription = s;
        s.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(SseFrame item) {
        frames.add(item);
    }

    @Override
    public void onError(Throwable throwable) {
        error = throwable;
        done.countDown();
    }

    @Override
    public void onComplete() {
        completed = true;
        done.countDown();
    }

    void cancel() {
        subscription.cancel();
    }

    List<SseFrame> frames() {
        return new ArrayList<>(frames);
    }

    List<SseFrame> messages() {
        List<SseFrame> out = new ArrayList<>();
        for (SseFrame f : frames) {
            if (!f.isComment()) out.add(f);
        }
        return out;
    }

    boolean isCompleted() {
        return completed;
    }

    Throwable error() {
        return error;
    }

    boolean awaitTermination(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    List<SseFrame> awaitMessages(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (messages().size() < count && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        return messages();
    }
}
