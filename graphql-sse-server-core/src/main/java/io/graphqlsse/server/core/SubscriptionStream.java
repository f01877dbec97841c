package io.graphqlsse.server.core;

import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.core.Protocol;
import io.graphqlsse.json.spi.JsonException;
import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Flow;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event stream of one reservation token (or one dedicated operation), published as SSE frames.
 *
 * <p>Each tick waits for candidate events, reconciles the token's operations (sending
 * {@code complete} for every operation that disappeared), matches and executes, and writes a
 * keepalive comment when the connection was idle for the keepalive interval. The stream closes
 * when the client cancels, the token becomes invalid, the last operation is stopped, an
 * authorization error occurs, or the maximum stream duration elapses.
 */
final class SubscriptionStream implements Flow.Publisher<SseFrame> {
    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionStream.class);

    static final String KEEPALIVE = "keepalive";

    private final StreamContext ctx;
    private final String token;
    private final StreamMode mode;
    private final EventFeed feed;
    private final RegisteredSubscription pinned; // distinct mode only
    private final Map<String, RegisteredSubscription> known = new LinkedHashMap<>();
    private final AtomicBoolean subscribed = new AtomicBoolean(false);
    private volatile StreamState state = StreamState.RESERVED;

    SubscriptionStream(StreamContext ctx, String token, StreamMode mode, EventFeed feed,
                       List<RegisteredSubscription> initial) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.token = Objects.requireNonNull(token, "token");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.feed = Objects.requireNonNull(feed, "feed");
        for (RegisteredSubscription subscription : initial) {
            known.put(subscription.operationId(), subscription);
        }
        if (mode == StreamMode.DISTINCT_CONNECTION) {
            if (initial.size() != 1) throw new IllegalArgumentException("distinct streams carry exactly one operation");
            this.pinned = initial.get(0);
        } else {
            this.pinned = null;
        }
    }

    StreamState state() {
        return state;
    }

    StreamMode mode() {
        return mode;
    }

    @Override
    public void subscribe(Flow.Subscriber<? super SseFrame> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        if (!subscribed.compareAndSet(false, true)) {
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                }

                @Override
                public void cancel() {
                }
            });
            subscriber.onError(new IllegalStateException("Stream already has a subscriber"));
            return;
        }
        Sub sub = new Sub(subscriber);
        subscriber.onSubscribe(sub);
        try {
            ctx.streamPool().execute(sub);
        } catch (RejectedExecutionException e) {
            release();
            subscriber.onError(e);
        }
    }

    /**
     * Release the stream slot and, where configured, the reservation. Runs once per stream.
     */
    private void release() {
        state = StreamState.CLOSED;
        feed.close();
        ctx.activeStreams().release(token, this);
        if (mode == StreamMode.DISTINCT_CONNECTION || ctx.revokeOnDisconnect()) {
            try {
                ctx.tokens().revoke(token);
            } catch (GraphQLSseException.StoreError e) {
                LOG.warn("Could not revoke reservation after stream close; it expires on its own", e);
            }
        }
    }

    private final class Sub implements Flow.Subscription, Runnable {
        private final Flow.Subscriber<? super SseFrame> sub;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition demanded = lock.newCondition();
        private long demand;
        private Instant lastWrite;
        // batch taken from the feed but not yet delivered; kept across a failed store read
        private List<ChangeEvent> pending = List.of();

        Sub(Flow.Subscriber<? super SseFrame> sub) {
            this.sub = sub;
        }

        @Override
        public void request(long n) {
            if (n <= 0) return;
            lock.lock();
            try {
                long next = demand + n;
                demand = next < 0 ? Long.MAX_VALUE : next;
                demanded.signalAll();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void cancel() {
            cancelled.set(true);
            lock.lock();
            try {
                demanded.signalAll();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void run() {
            state = StreamState.STREAMING;
            Instant started = ctx.clock().instant();
            lastWrite = started;
            LOG.info("Stream opened in {} mode with {} operation(s)", mode, known.size());
            String reason = "client disconnected";
            Throwable failure = null;
            try {
                while (!cancelled.get()) {
                    Instant now = ctx.clock().instant();
                    Optional<Duration> max = ctx.maxStreamDuration();
                    if (max.isPresent() && !now.isBefore(started.plus(max.get()))) {
                        if (mode == StreamMode.DISTINCT_CONNECTION) completeAll();
                        reason = "maximum duration reached";
                        break;
                    }
                    try {
                        Optional<String> closing = tick(started);
                        if (closing.isPresent()) {
                            reason = closing.get();
                            break;
                        }
                    } catch (GraphQLSseException.StoreError e) {
                        LOG.warn("Store read failed, retrying on next tick", e);
                        Thread.sleep(ctx.pollInterval().toMillis());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                reason = "interrupted";
            } catch (Throwable t) {
                failure = t;
                reason = "failure";
                LOG.error("Stream failed", t);
            } finally {
                release();
                LOG.info("Stream closed: {}", reason);
            }
            if (failure != null) {
                sub.onError(failure);
            } else if (!cancelled.get()) {
                sub.onComplete();
            }
        }

        /**
         * One wait-reconcile-deliver round.
         *
         * @return the close reason when the stream must end
         */
        private Optional<String> tick(Instant started) throws InterruptedException {
            if (pending.isEmpty()) {
                pending = feed.next(waitTime(started));
            }
            List<ChangeEvent> events = pending;
            if (cancelled.get()) return Optional.of("client disconnected");

            List<RegisteredSubscription> current;
            if (pinned != null) {
                current = List.of(pinned);
            } else {
                if (!ctx.tokens().validate(token)) {
                    completeAll();
                    return Optional.of("reservation revoked or expired");
                }
                current = ctx.registry().list(token);
                if (!reconcile(current)) {
                    return Optional.of("all operations stopped");
                }
            }

            for (ChangeEvent event : events) {
                for (RegisteredSubscription subscription : current) {
                    if (cancelled.get()) return Optional.of("client disconnected");
                    if (event.createdAt().isBefore(subscription.document().registeredAt())) continue;
                    if (!ctx.matcher().matches(subscription, event.eventType(), event.routingKey())) continue;
                    LOG.debug("Event #{} {} matched operation {}", event.id(), event.eventType(), subscription.operationId());

                    OperationExecutor.Outcome outcome = ctx.executor().execute(subscription, event);
                    emit(new SseFrame(Protocol.EVENT_NEXT, nextData(subscription.operationId(), outcome.result())));
                    if (outcome instanceof OperationExecutor.Forbidden) {
                        completeAll();
                        return Optional.of("authorization lost");
                    }
                }
            }
            pending = List.of();

            if (pinned == null) feed.refresh(current);

            if (!ctx.clock().instant().isBefore(lastWrite.plus(ctx.keepAliveInterval()))) {
                emit(SseFrame.comment(KEEPALIVE));
            }
            return Optional.empty();
        }

        /**
         * Track the token's operations; every operation that disappeared gets a {@code complete}.
         *
         * @return false when the last operation was stopped
         */
        private boolean reconcile(List<RegisteredSubscription> current) throws InterruptedException {
            boolean hadOperations = !known.isEmpty();
            Set<String> present = new HashSet<>();
            for (RegisteredSubscription subscription : current) {
                present.add(subscription.operationId());
            }
            for (String operationId : new ArrayList<>(known.keySet())) {
                if (!present.contains(operationId)) {
                    known.remove(operationId);
                    emit(new SseFrame(Protocol.EVENT_COMPLETE, completeData(operationId)));
                }
            }
            for (RegisteredSubscription subscription : current) {
                known.put(subscription.operationId(), subscription);
            }
            return !(hadOperations && known.isEmpty());
        }

        private void completeAll() throws InterruptedException {
            for (String operationId : new ArrayList<>(known.keySet())) {
                emit(new SseFrame(Protocol.EVENT_COMPLETE, completeData(operationId)));
            }
            known.clear();
        }

        private Duration waitTime(Instant started) {
            Instant now = ctx.clock().instant();
            Duration wait = ctx.pollInterval();
            Duration untilKeepAlive = Duration.between(now, lastWrite.plus(ctx.keepAliveInterval()));
            if (untilKeepAlive.compareTo(wait) < 0) wait = untilKeepAlive;
            Optional<Duration> max = ctx.maxStreamDuration();
            if (max.isPresent()) {
                Duration untilEnd = Duration.between(now, started.plus(max.get()));
                if (untilEnd.compareTo(wait) < 0) wait = untilEnd;
            }
            return wait.isNegative() ? Duration.ZERO : wait;
        }

        private void emit(SseFrame frame) throws InterruptedException {
            lock.lock();
            try {
                while (demand <= 0) {
                    if (cancelled.get()) return;
                    demanded.await(ctx.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
                }
                if (demand != Long.MAX_VALUE) demand--;
            } finally {
                lock.unlock();
            }
            if (cancelled.get()) return;
            sub.onNext(frame);
            lastWrite = ctx.clock().instant();
        }
    }

    private String nextData(String operationId, ExecutionResult result) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("id", operationId);
        message.put("payload", result.toSpecification());
        try {
            return ctx.json().writeString(message);
        } catch (JsonException e) {
            LOG.warn("Could not serialize result of operation {}", operationId, e);
            message.put("payload", ExecutionResult.error("Result could not be serialized", Protocol.CODE_EXECUTION_ERROR)
                    .toSpecification());
            return write(message);
        }
    }

    private String completeData(String operationId) {
        return write(Map.of("id", operationId));
    }

    private String write(Map<String, Object> message) {
        try {
            return ctx.json().writeString(message);
        } catch (JsonException e) {
            throw new IllegalStateException("Failed to serialize stream message", e);
        }
    }
}
