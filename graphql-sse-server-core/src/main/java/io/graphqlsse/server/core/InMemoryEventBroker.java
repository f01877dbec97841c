package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.EventBroker;
import io.graphqlsse.server.spi.EventDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * In-process {@link EventBroker}.
 *
 * <p>Events are delivered in publish order on a single dispatcher thread. Only listeners of the
 * same JVM receive them.
 */
public final class InMemoryEventBroker implements EventBroker {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryEventBroker.class);

    private final Map<String, List<Registration>> listeners = new ConcurrentHashMap<>();
    private final ExecutorService dispatcher = StreamExecutors.newSingleThread("graphql-sse-broker");
    private final Clock clock;

    private long lastId;
    private Instant lastCreatedAt = Instant.MIN;

    public InMemoryEventBroker() {
        this(Clock.systemUTC());
    }

    public InMemoryEventBroker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ChangeEvent publish(EventDraft draft) {
        Objects.requireNonNull(draft, "draft");
        ChangeEvent event;
        synchronized (this) {
            Instant now = clock.instant();
            Instant createdAt = now.isBefore(lastCreatedAt) ? lastCreatedAt : now;
            event = ChangeEvent.of(draft, ++lastId, createdAt);
            lastCreatedAt = createdAt;
            try {
                // submitted under the lock so dispatch order equals id order
                dispatcher.execute(() -> dispatch(event));
            } catch (RejectedExecutionException e) {
                throw new IllegalStateException("Broker is closed", e);
            }
        }
        return event;
    }

    @Override
    public BrokerSubscription subscribe(String channel, Consumer<ChangeEvent> listener) {
        Registration registration = new Registration(channel, listener);
        listeners.compute(channel, (k, registrations) -> {
            List<Registration> list = registrations != null ? registrations : new CopyOnWriteArrayList<>();
            list.add(registration);
            return list;
        });
        return registration;
    }

    @Override
    public void close() {
        dispatcher.shutdownNow();
        listeners.clear();
    }

    int channelCount() {
        return listeners.size();
    }

    int listenerCount(String channel) {
        List<Registration> registrations = listeners.get(channel);
        return registrations == null ? 0 : registrations.size();
    }

    private void dispatch(ChangeEvent event) {
        for (String channel : event.channels()) {
            List<Registration> registrations = listeners.get(channel);
            if (registrations == null) continue;
            for (Registration registration : registrations) {
                registration.deliver(event);
            }
        }
    }

    private final class Registration implements BrokerSubscription {
        private final String channel;
        private final Consumer<ChangeEvent> listener;
        private final AtomicBoolean cancelled = new AtomicBoolean();

        private Registration(String channel, Consumer<ChangeEvent> listener) {
            this.channel = Objects.requireNonNull(channel, "channel");
            this.listener = Objects.requireNonNull(listener, "listener");
        }

        @Override
        public String channel() {
            return channel;
        }

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                listeners.computeIfPresent(channel, (k, registrations) -> {
                    registrations.remove(this);
                    return registrations.isEmpty() ? null : registrations;
                });
            }
        }

        void deliver(ChangeEvent event) {
            if (cancelled.get()) return;
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                LOG.warn("Listener on {} failed for event #{}", channel, event.id(), e);
            }
        }
    }
}
