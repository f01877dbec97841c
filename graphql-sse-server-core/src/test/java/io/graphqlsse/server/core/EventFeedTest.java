package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.ChangeEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventFeedTest {

    private final InMemoryConnectionStore store = new InMemoryConnectionStore();
    private final TokenService tokens = new TokenService(store, Clock.systemUTC());
    private final SubscriptionRegistry registry = new SubscriptionRegistry(store, Clock.systemUTC());
    private final SubscriptionMatcher matcher = new SubscriptionMatcher();
    private final ChannelRouter router = new ChannelRouter();
    private final InMemoryEventBroker broker = new InMemoryEventBroker();

    @AfterEach
    void close() {
        broker.close();
    }

    @Test
    void pollingFeedAdvancesCursor() throws Exception {
        InMemoryEventLog log = new InMemoryEventLog();
        EventEmitter emitter = new EventEmitter(log, router);
        emitter.emit("postUpdated", "1", Map.of(), null);
        PollingEventFeed feed = new PollingEventFeed(log, log.latestId(), 2);

        assertThat(feed.next(Duration.ofMillis(10))).isEmpty();

        emitter.emit("postUpdated", "2", Map.of(), null);
        emitter.emit("postUpdated", "3", Map.of(), null);
        emitter.emit("postUpdated", "4", Map.of(), null);

        assertThat(feed.next(Duration.ofMillis(10))).extracting(ChangeEvent::subjectId).containsExactly("2", "3");
        assertThat(feed.next(Duration.ofMillis(10))).extracting(ChangeEvent::subjectId).containsExactly("4");
        assertThat(feed.cursor()).isEqualTo(log.latestId());
    }

    @Test
    void brokerFeedQueuesEachEventOnce() throws Exception {
        String token = tokens.reserve(Duration.ofMinutes(5)).token();
        List<RegisteredSubscription> operations = List.of(
                registry.register(token, "all", "subscription { postUpdated { id } }", Map.of(), null),
                registry.register(token, "one", "subscription { postUpdated(id: 42) { id } }", Map.of(), null));
        BrokerEventFeed feed = new BrokerEventFeed(broker, router, matcher, 10);
        feed.refresh(operations);

        assertThat(feed.channels()).containsExactlyInAnyOrder("graphql:postUpdated", "graphql:postUpdated.42");

        new EventEmitter(broker, router).emit("postUpdated", "42", Map.of(), null);

        List<ChangeEvent> batch = feed.next(Duration.ofSeconds(2));
        assertThat(batch).hasSize(1);
        assertThat(feed.next(Duration.ofMillis(100))).isEmpty();
        feed.close();
    }

    @Test
    void brokerFeedDropsOldestWhenBehind() throws Exception {
        String token = tokens.reserve(Duration.ofMinutes(5)).token();
        RegisteredSubscription all = registry.register(token, "all", "subscription { postUpdated { id } }", Map.of(), null);
        BrokerEventFeed feed = new BrokerEventFeed(broker, router, matcher, 2);
        feed.refresh(List.of(all));
        int capacity = 2 * BrokerEventFeed.QUEUE_BATCHES;

        EventEmitter emitter = new EventEmitter(broker, router);
        ChangeEvent last = null;
        for (int i = 0; i < capacity + 60; i++) {
            last = emitter.emit("postUpdated", String.valueOf(i), Map.of(), null);
        }

        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (feed.dropped() < 60 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(feed.dropped()).isEqualTo(60);
        assertThat(feed.pending()).isEqualTo(capacity);

        List<ChangeEvent> batch = feed.next(Duration.ofMillis(100));
        assertThat(batch).extracting(ChangeEvent::id).containsExactly(last.id() - capacity + 1, last.id() - capacity + 2);
        feed.close();
    }

    @Test
    void brokerFeedFollowsOperationChanges() {
        String token = tokens.reserve(Duration.ofMinutes(5)).token();
        RegisteredSubscription created = registry.register(token, "a", "subscription { postCreated { id } }", Map.of(), null);
        RegisteredSubscription deleted = registry.register(token, "b", "subscription { postDeleted(id: \"7\") { id } }", Map.of(), null);
        BrokerEventFeed feed = new BrokerEventFeed(broker, router, matcher, 10);

        feed.refresh(List.of(created));
        assertThat(feed.channels()).containsExactly("graphql:postCreated");

        feed.refresh(List.of(deleted));
        assertThat(feed.channels()).containsExactly("graphql:postDeleted.7");
        assertThat(broker.listenerCount("graphql:postCreated")).isZero();

        feed.close();
        assertThat(broker.listenerCount("graphql:postDeleted.7")).isZero();
    }
}
