package io.graphqlsse.broker.redis;

import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.json.jackson.JacksonJsonCodec;
import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.EventBroker;
import io.graphqlsse.server.spi.EventDraft;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPubSub;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JedisEventBrokerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    JedisPool pool;

    @Mock
    Jedis jedis;

    private final CountDownLatch released = new CountDownLatch(1);
    private JedisEventBroker broker;

    @BeforeEach
    void setUp() {
        lenient().when(pool.getResource()).thenReturn(jedis);
        lenient().doAnswer(inv -> {
            released.await(5, TimeUnit.SECONDS);
            return null;
        }).when(jedis).psubscribe(any(JedisPubSub.class), any(String[].class));
        broker = new JedisEventBroker(pool, new JacksonJsonCodec(), Clock.fixed(NOW, ZoneOffset.UTC),
                JedisEventBroker.DEFAULT_CHANNEL_PREFIX, JedisEventBroker.DEFAULT_SEQUENCE_KEY);
    }

    @AfterEach
    void tearDown() {
        broker.close();
        released.countDown();
    }

    @Test
    void publishAssignsSharedIdAndFansOut() {
        when(jedis.incr(JedisEventBroker.DEFAULT_SEQUENCE_KEY)).thenReturn(7L);

        ChangeEvent event = broker.publish(draft());

        assertThat(event.id()).isEqualTo(7);
        assertThat(event.createdAt()).isEqualTo(NOW);
        verify(jedis).publish(eq("graphql:postUpdated"), any(String.class));
        verify(jedis).publish(eq("graphql:postUpdated.42"), any(String.class));
        verify(jedis).close();
    }

    @Test
    void receivedMessagesReachListenersOfTheirChannel() {
        when(jedis.incr(JedisEventBroker.DEFAULT_SEQUENCE_KEY)).thenReturn(3L);
        ChangeEvent published = broker.publish(draft());
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(jedis).publish(eq("graphql:postUpdated.42"), message.capture());

        List<ChangeEvent> specific = new ArrayList<>();
        List<ChangeEvent> global = new ArrayList<>();
        broker.subscribe("graphql:postUpdated.42", specific::add);
        broker.subscribe("graphql:postUpdated", global::add);
        verify(jedis, timeout(2000)).psubscribe(any(JedisPubSub.class), eq("graphql:*"));

        broker.deliver("graphql:postUpdated.42", message.getValue());

        assertThat(specific).containsExactly(published);
        assertThat(global).isEmpty();
    }

    @Test
    void cancelledAndUndecodableAreDropped() {
        List<ChangeEvent> received = new ArrayList<>();
        EventBroker.BrokerSubscription subscription = broker.subscribe("graphql:postUpdated", received::add);

        broker.deliver("graphql:postUpdated", "not json");
        broker.deliver("graphql:postUpdated", "{\"event_type\":\"postUpdated\"}");
        subscription.cancel();

        assertThat(received).isEmpty();
        assertThat(broker.listenerCount("graphql:postUpdated")).isZero();
        assertThat(broker.channelCount()).isZero();
    }

    @Test
    void redisFailureIsAStoreError() {
        when(jedis.incr(JedisEventBroker.DEFAULT_SEQUENCE_KEY)).thenThrow(new JedisConnectionException("connection refused"));

        assertThatThrownBy(() -> broker.publish(draft()))
                .isInstanceOf(GraphQLSseException.StoreError.class)
                .hasCauseInstanceOf(JedisConnectionException.class);
    }

    private static EventDraft draft() {
        LinkedHashSet<String> channels = new LinkedHashSet<>(List.of("graphql:postUpdated", "graphql:postUpdated.42"));
        return new EventDraft("postUpdated", "42", "42", Map.of("id", "42", "title", "Hello"),
                Map.of("event_id", "post_UPDATE_1"), channels);
    }
}
