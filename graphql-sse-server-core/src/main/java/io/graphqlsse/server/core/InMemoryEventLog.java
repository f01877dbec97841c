package io.graphqlsse.server.core;

import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.EventDraft;
import io.graphqlsse.server.spi.EventLog;
import io.graphqlsse.server.spi.EventLogStats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference in-memory {@link EventLog}.
 *
 * <p>Appends signal a condition, so {@link #await(long, Duration)} wakes without polling.
 */
public final class InMemoryEventLog implements EventLog {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();
    private final List<ChangeEvent> events = new ArrayList<>();
    private final Clock clock;

    private long lastId;
    private Instant lastCreatedAt = Instant.MIN;

    public InMemoryEventLog() {
        this(Clock.systemUTC());
    }

    public InMemoryEventLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ChangeEvent publish(EventDraft draft) {
        Objects.requireNonNull(draft, "draft");
        lock.lock();
        try {
            Instant now = clock.instant();
            // createdAt must not go backwards in id order
            Instant createdAt = now.isBefore(lastCreatedAt) ? lastCreatedAt : now;
            ChangeEvent event = ChangeEvent.of(draft, ++lastId, createdAt);
            events.add(event);
            lastCreatedAt = createdAt;
            appended.signalAll();
            return event;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ChangeEvent> since(Instant timestamp, int limit) {
        lock.lock();
        try {
            List<ChangeEvent> out = new ArrayList<>();
            for (ChangeEvent event : events) {
                if (out.size() >= limit) break;
                if (event.createdAt().isAfter(timestamp)) out.add(event);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ChangeEvent> after(long eventId, int limit) {
        lock.lock();
        try {
            List<ChangeEvent> out = new ArrayList<>();
            for (int i = firstIndexAfter(eventId); i < events.size() && out.size() < limit; i++) {
                out.add(events.get(i));
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long latestId() {
        lock.lock();
        try {
            return lastId;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean await(long eventId, Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            if (lastId > eventId) return true;
            long nanos = timeout.toNanos();
            while (nanos > 0) {
                nanos = appended.awaitNanos(nanos);
                if (lastId > eventId) return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int purge(Instant olderThan) {
        lock.lock();
        try {
            int n = 0;
            while (n < events.size() && events.get(n).createdAt().isBefore(olderThan)) n++;
            events.subList(0, n).clear();
            return n;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public EventLogStats stats(Instant now) {
        lock.lock();
        try {
            if (events.isEmpty()) return EventLogStats.empty();
            Instant hourAgo = now.minus(Duration.ofHours(1));
            long recent = events.stream().filter(e -> e.createdAt().isAfter(hourAgo)).count();
            return new EventLogStats(events.size(), recent,
                    Optional.of(events.get(0).createdAt()),
                    Optional.of(events.get(events.size() - 1).createdAt()));
        } finally {
            lock.unlock();
        }
    }

    // ids are strictly increasing, so binary search for the first id > eventId
    private int firstIndexAfter(long eventId) {
        int lo = 0;
        int hi = events.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (events.get(mid).id() <= eventId) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }
}
