package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.EventBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Receives events pushed by an {@link EventBroker} on the channels of the stream's operations.
 *
 * <p>An event published on several subscribed channels is queued once. The queue holds at most
 * {@value #QUEUE_BATCHES} batches; when a slow stream falls further behind, the oldest events are
 * dropped.
 */
final class BrokerEventFeed implements EventFeed {
    private static final Logger LOG = LoggerFactory.getLogger(BrokerEventFeed.class);

    private static final int RECENT_IDS = 4096;
    static final int QUEUE_BATCHES = 20;

    private final EventBroker broker;
    private final ChannelRouter router;
    private final SubscriptionMatcher matcher;
    private final int batchSize;
    private final LinkedBlockingQueue<ChangeEvent> queue;
    private final AtomicLong dropped = new AtomicLong();
    private final Map<String, EventBroker.BrokerSubscription> subscriptions = new HashMap<>();
    private final Map<Long, Boolean> recentIds = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<Long, Boolean> eldest) {
            return size() > RECENT_IDS;
        }
    };

    BrokerEventFeed(EventBroker broker, ChannelRouter router, SubscriptionMatcher matcher, int batchSize) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.router = Objects.requireNonNull(router, "router");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.batchSize = batchSize;
        this.queue = new LinkedBlockingQueue<>(Math.multiplyExact(batchSize, QUEUE_BATCHES));
    }

    int pending() {
        return queue.size();
    }

    long dropped() {
        return dropped.get();
    }

    Set<String> channels() {
        synchronized (subscriptions) {
            return Set.copyOf(subscriptions.keySet());
        }
    }

    @Override
    public void refresh(List<RegisteredSubscription> operations) {
        Set<String> wanted = new LinkedHashSet<>();
        for (RegisteredSubscription operation : operations) {
            wanted.addAll(router.channelsFor(operation, matcher));
        }
        synchronized (subscriptions) {
            Iterator<Map.Entry<String, EventBroker.BrokerSubscription>> it = subscriptions.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, EventBroker.BrokerSubscription> entry = it.next();
                if (!wanted.contains(entry.getKey())) {
                    entry.getValue().cancel();
                    it.remove();
                }
            }
            for (String channel : wanted) {
                if (!subscriptions.containsKey(channel)) {
                    subscriptions.put(channel, broker.subscribe(channel, this::onEvent));
                    LOG.debug("Listening on {}", channel);
                }
            }
        }
    }

    @Override
    public List<ChangeEvent> next(Duration maxWait) throws InterruptedException {
        ChangeEvent first = maxWait.isNegative() || maxWait.isZero()
                ? queue.poll()
                : queue.poll(maxWait.toNanos(), TimeUnit.NANOSECONDS);
        if (first == null) return List.of();
        List<ChangeEvent> batch = new ArrayList<>();
        batch.add(first);
        queue.drainTo(batch, batchSize - 1);
        batch.sort(Comparator.comparingLong(ChangeEvent::id));
        return batch;
    }

    @Override
    public void close() {
        synchronized (subscriptions) {
            subscriptions.values().forEach(EventBroker.BrokerSubscription::cancel);
            subscriptions.clear();
        }
        queue.clear();
    }

    private void onEvent(ChangeEvent event) {
        synchronized (recentIds) {
            if (recentIds.put(event.id(), Boolean.TRUE) != null) return;
        }
        while (!queue.offer(event)) {
            ChangeEvent oldest = queue.poll();
            if (oldest != null && (dropped.incrementAndGet() - 1) % batchSize == 0) {
                LOG.warn("Stream is behind, dropped event #{} ({} dropped so far)", oldest.id(), dropped.get());
            }
        }
    }
}
