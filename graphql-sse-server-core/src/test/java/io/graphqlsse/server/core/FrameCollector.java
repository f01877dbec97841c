package io.graphqlsse.server.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Test subscriber recording the frames of an SSE publisher.
 */
final class FrameCollector implements Flow.Subscriber<SseFrame> {
    private final BlockingQueue<SseFrame> frames = new LinkedBlockingQueue<>();
    private final List<SseFrame> seen = new ArrayList<>();
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile Flow.Subscription subscription;
    private volatile Throwable error;
    private final long initialDemand;

    private FrameCollector(long initialDemand) {
        this.initialDemand = initialDemand;
    }

    static FrameCollector subscribe(ServerResponse response) {
        return subscribe(response, Long.MAX_VALUE);
    }

    static FrameCollector subscribe(ServerResponse response, long initialDemand) {
        FrameCollector collector = new FrameCollector(initialDemand);
        ((ResponseBody.Sse) response.body()).publisher().subscribe(collector);
        return collector;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        if (initialDemand > 0) subscription.request(initialDemand);
    }

    void request(long n) {
        subscription.request(n);
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
        done.countDown();
    }

    /**
     * Wait for the next frame matching {@code filter}, skipping others.
     */
    SseFrame await(Predicate<SseFrame> filter, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) throw new AssertionError("no matching frame within " + timeout + "; seen " + seen);
            SseFrame frame = frames.poll(remaining, TimeUnit.NANOSECONDS);
            if (frame == null) continue;
            seen.add(frame);
            if (filter.test(frame)) return frame;
        }
    }

    SseFrame awaitEvent(String event, Duration timeout) throws InterruptedException {
        return await(f -> event.equals(f.event()), timeout);
    }

    /**
     * Frames that arrived within {@code window}, comments excluded.
     */
    List<SseFrame> drainEvents(Duration window) throws InterruptedException {
        Thread.sleep(window.toMillis());
        List<SseFrame> out = new ArrayList<>();
        SseFrame frame;
        while ((frame = frames.poll()) != null) {
            seen.add(frame);
            if (!frame.isComment()) out.add(frame);
        }
        return out;
    }

    boolean awaitTermination(Duration timeout) throws InterruptedException {
        return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    Throwable error() {
        return error;
    }

    void cancel() {
        subscription.cancel();
    }
}
