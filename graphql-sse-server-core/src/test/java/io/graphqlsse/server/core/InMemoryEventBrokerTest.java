package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.EventBroker;
import io.graphqlsse.server.spi.EventDraft;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEventBrokerTest {

    private final InMemoryEventBroker broker = new InMemoryEventBroker();

    @AfterEach
    void close() {
        broker.close();
    }

    @Test
    void deliversOnEveryPublishedChannel() throws Exception {
        List<ChangeEvent> global = new CopyOnWriteArrayList<>();
        List<ChangeEvent> specific = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(2);
        broker.subscribe("graphql:postUpdated", e -> { global.add(e); latch.countDown(); });
        broker.subscribe("graphql:postUpdated.42", e -> { specific.add(e); latch.countDown(); });

        ChangeEvent event = broker.publish(draft("42"));

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(global).containsExactly(event);
        assertThat(specific).containsExactly(event);
    }

    @Test
    void cancelledListenersReceiveNothing() throws Exception {
        List<ChangeEvent> received = new CopyOnWriteArrayList<>();
        EventBroker.BrokerSubscription subscription = broker.subscribe("graphql:postUpdated", received::add);
        subscription.cancel();
        subscription.cancel();

        CountDownLatch marker = new CountDownLatch(1);
        broker.subscribe("graphql:postUpdated", e -> marker.countDown());
        broker.publish(draft("1"));

        assertThat(marker.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(received).isEmpty();
        assertThat(broker.listenerCount("graphql:postUpdated")).isEqualTo(1);
    }

    @Test
    void cancellingLastListenerForgetsChannel() {
        EventBroker.BrokerSubscription first = broker.subscribe("graphql:postUpdated.7", e -> { });
        EventBroker.BrokerSubscription second = broker.subscribe("graphql:postUpdated.7", e -> { });
        broker.subscribe("graphql:postUpdated", e -> { });
        assertThat(broker.channelCount()).isEqualTo(2);

        first.cancel();
        assertThat(broker.listenerCount("graphql:postUpdated.7")).isEqualTo(1);
        second.cancel();

        assertThat(broker.listenerCount("graphql:postUpdated.7")).isZero();
        assertThat(broker.channelCount()).isEqualTo(1);
    }

    @Test
    void failingListenerDoesNotStopDelivery() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        broker.subscribe("graphql:postUpdated", e -> {
            throw new IllegalStateException("boom");
        });
        broker.subscribe("graphql:postUpdated", e -> latch.countDown());

        broker.publish(draft("1"));

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
    }

    private static EventDraft draft(String id) {
        LinkedHashSet<String> channels = new LinkedHashSet<>(List.of("graphql:postUpdated", "graphql:postUpdated." + id));
        return new EventDraft("postUpdated", id, id, Map.of(), null, channels);
    }
}
