package io.graphqlsse.broker.redis;

import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.json.spi.JsonCodec;
import io.graphqlsse.json.spi.JsonException;
import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.EventBroker;
import io.graphqlsse.server.spi.EventDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPubSub;
import redis.clients.jedis.exceptions.JedisException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * {@link EventBroker} on Redis pub/sub, for deployments where emitters and streams run in
 * different processes.
 *
 * <p>Ids come from a shared {@code INCR} counter. Each event is published as one JSON message on
 * every channel of its draft. A single connection per broker pattern-subscribes to the channel
 * prefix on first use and fans received messages out to the local listeners of their channel.
 * Timestamps are taken from the publishing process' clock.
 */
public final class JedisEventBroker implements EventBroker {
    private static final Logger LOG = LoggerFactory.getLogger(JedisEventBroker.class);

    public static final String DEFAULT_CHANNEL_PREFIX = "graphql:";
    public static final String DEFAULT_SEQUENCE_KEY = "graphql-sse:event_seq";

    private static final Duration RECONNECT_DELAY = Duration.ofSeconds(1);

    private final JedisPool pool;
    private final JsonCodec json;
    private final Clock clock;
    private final String channelPattern;
    private final String sequenceKey;
    private final Map<String, List<Registration>> listeners = new ConcurrentHashMap<>();
    private final AtomicBoolean listening = new AtomicBoolean();
    private volatile Listener current;
    private volatile boolean closed;

    public JedisEventBroker(JedisPool pool, JsonCodec json) {
        this(pool, json, DEFAULT_CHANNEL_PREFIX);
    }

    public JedisEventBroker(JedisPool pool, JsonCodec json, String channelPrefix) {
        this(pool, json, Clock.systemUTC(), channelPrefix, DEFAULT_SEQUENCE_KEY);
    }

    /**
     * @param channelPrefix prefix of every channel the router produces, e.g. {@code graphql:}
     * @param sequenceKey key of the shared event id counter
     */
    public JedisEventBroker(JedisPool pool, JsonCodec json, Clock clock, String channelPrefix, String sequenceKey) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.json = Objects.requireNonNull(json, "json");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (Objects.requireNonNull(channelPrefix, "channelPrefix").isEmpty()) {
            throw new IllegalArgumentException("channelPrefix must not be empty");
        }
        this.channelPattern = channelPrefix + "*";
        this.sequenceKey = Objects.requireNonNull(sequenceKey, "sequenceKey");
    }

    @Override
    public ChangeEvent publish(EventDraft draft) {
        Objects.requireNonNull(draft, "draft");
        if (closed) throw new IllegalStateException("Broker is closed");
        try (Jedis jedis = pool.getResource()) {
            long id = jedis.incr(sequenceKey);
            ChangeEvent event = ChangeEvent.of(draft, id, clock.instant());
            String message = json.writeString(encode(event));
            for (String channel : event.channels()) {
                jedis.publish(channel, message);
            }
            LOG.debug("Published event #{} {} on {} channel(s)", id, event.eventType(), event.channels().size());
            return event;
        } catch (JsonException e) {
            throw new IllegalArgumentException("Event payload is not serializable", e);
        } catch (JedisException e) {
            throw new GraphQLSseException.StoreError("Failed to publish event to Redis", e);
        }
    }

    @Override
    public BrokerSubscription subscribe(String channel, Consumer<ChangeEvent> listener) {
        if (closed) throw new IllegalStateException("Broker is closed");
        Registration registration = new Registration(channel, listener);
        listeners.compute(channel, (k, registrations) -> {
            List<Registration> list = registrations != null ? registrations : new CopyOnWriteArrayList<>();
            list.add(registration);
            return list;
        });
        if (listening.compareAndSet(false, true)) {
            Thread thread = new Thread(this::listen, "graphql-sse-redis-subscriber");
            thread.setDaemon(true);
            thread.start();
        }
        return registration;
    }

    @Override
    public void close() {
        closed = true;
        Listener listener = current;
        if (listener != null && listener.isSubscribed()) {
            listener.punsubscribe();
        }
        listeners.clear();
    }

    int channelCount() {
        return listeners.size();
    }

    int listenerCount(String channel) {
        List<Registration> registrations = listeners.get(channel);
        return registrations == null ? 0 : registrations.size();
    }

    /**
     * Hand one received message to the listeners of its channel. Undecodable messages are dropped.
     */
    void deliver(String channel, String message) {
        List<Registration> registrations = listeners.get(channel);
        if (registrations == null || registrations.isEmpty()) return;
        ChangeEvent event;
        try {
            event = decode(json.readObject(message.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonException | RuntimeException e) {
            LOG.error("Dropping undecodable message on {}", channel, e);
            return;
        }
        for (Registration registration : registrations) {
            registration.deliver(event);
        }
    }

    private void listen() {
        while (!closed) {
            Listener listener = new Listener();
            current = listener;
            try (Jedis jedis = pool.getResource()) {
                LOG.info("Subscribing to Redis channels {}", channelPattern);
                jedis.psubscribe(listener, channelPattern);
            } catch (JedisException e) {
                if (closed) break;
                LOG.warn("Redis subscription lost, reconnecting in {}", RECONNECT_DELAY, e);
            }
            if (closed) break;
            try {
                Thread.sleep(RECONNECT_DELAY.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        LOG.info("Redis subscriber stopped");
    }

    private static Map<String, Object> encode(ChangeEvent event) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", event.id());
        out.put("event_type", event.eventType());
        out.put("subject_id", event.subjectId());
        out.put("routing_key", event.routingKey());
        out.put("payload", event.payload());
        out.put("metadata", event.metadata());
        out.put("channels", new ArrayList<>(event.channels()));
        out.put("created_at", event.createdAt().toString());
        return out;
    }

    @SuppressWarnings("unchecked")
    private static ChangeEvent decode(Map<String, Object> in) {
        Object id = in.get("id");
        if (!(id instanceof Number number)) {
            throw new IllegalArgumentException("message has no numeric id");
        }
        Instant createdAt;
        try {
            createdAt = Instant.parse(String.valueOf(in.get("created_at")));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("message has no valid created_at", e);
        }
        Object channels = in.get("channels");
        return new ChangeEvent(
                number.longValue(),
                (String) in.get("event_type"),
                (String) in.get("subject_id"),
                (String) in.get("routing_key"),
                in.get("payload") instanceof Map<?, ?> p ? (Map<String, Object>) p : Map.of(),
                in.get("metadata") instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of(),
                channels instanceof List<?> list ? new LinkedHashSet<>((List<String>) list) : new LinkedHashSet<>(),
                createdAt);
    }

    private final class Listener extends JedisPubSub {
        @Override
        public void onPMessage(String pattern, String channel, String message) {
            deliver(channel, message);
        }

        @Override
        public void onPSubscribe(String pattern, int subscribedChannels) {
            LOG.debug("Subscribed to {}", pattern);
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
