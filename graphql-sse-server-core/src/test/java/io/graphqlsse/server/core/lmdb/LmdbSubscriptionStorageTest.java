package io.graphqlsse.server.core.lmdb;

import io.graphqlsse.json.jackson.JacksonJsonCodec;
import io.graphqlsse.server.core.MutableClock;
import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.EventDraft;
import io.graphqlsse.server.spi.EventLogStats;
import io.graphqlsse.server.spi.ReservationToken;
import io.graphqlsse.server.spi.SubscriptionDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LmdbSubscriptionStorageTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private LmdbSubscriptionStorage storage;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        storage = new LmdbSubscriptionStorage(tempDir, new JacksonJsonCodec(), clock);
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    @Test
    void testInsertAndFindReservation() {
        assertTrue(storage.insert(new ReservationToken("abc", T0, T0.plusSeconds(60))));
        assertFalse(storage.insert(new ReservationToken("abc", T0, T0.plusSeconds(600))));

        Optional<ReservationToken> found = storage.find("abc", T0.plusSeconds(30));
        assertTrue(found.isPresent());
        assertEquals(T0.plusSeconds(60), found.get().expiresAt());
        assertTrue(storage.find("abc", T0.plusSeconds(60)).isEmpty());
        assertTrue(storage.find("missing", T0).isEmpty());
        assertTrue(storage.find("", T0).isEmpty());
    }

    @Test
    void testRevokeCascadesToDocuments() {
        storage.insert(new ReservationToken("a", T0, T0.plusSeconds(60)));
        storage.insert(new ReservationToken("ab", T0, T0.plusSeconds(60)));
        assertTrue(storage.put(document("a", "op1", T0)));
        assertTrue(storage.put(document("ab", "op1", T0)));

        assertTrue(storage.revoke("a"));
        assertFalse(storage.revoke("a"));

        assertEquals(0, storage.count("a"));
        assertEquals(1, storage.count("ab"));
        assertEquals(1, storage.totalCount());
    }

    @Test
    void testSweepRemovesExpiredOnly() {
        storage.insert(new ReservationToken("old", T0, T0.plusSeconds(10)));
        storage.insert(new ReservationToken("new", T0, T0.plusSeconds(100)));
        storage.put(document("old", "op1", T0));

        assertEquals(1, storage.sweep(T0.plusSeconds(20)));
        assertEquals(0, storage.sweep(T0.plusSeconds(20)));
        assertEquals(0, storage.totalCount());
        assertEquals(List.of("new"), storage.active(T0.plusSeconds(20)).stream().map(ReservationToken::token).toList());
    }

    @Test
    void testPutRefusedWithoutLiveReservation() {
        storage.insert(new ReservationToken("t", T0, T0.plusSeconds(60)));

        assertFalse(storage.put(document("unknown", "op1", T0)));
        assertFalse(storage.put(document("t", "op1", T0.plusSeconds(60))));
        assertTrue(storage.get("t", "op1").isEmpty());
    }

    @Test
    void testDocumentsListedInRegistrationOrder() {
        storage.insert(new ReservationToken("t", T0, T0.plusSeconds(60)));
        storage.put(document("t", "zeta", T0));
        storage.put(document("t", "alpha", T0.plusSeconds(1)));

        List<SubscriptionDocument> docs = storage.list("t");
        assertEquals(List.of("zeta", "alpha"), docs.stream().map(SubscriptionDocument::operationId).toList());
        assertEquals(Map.of("id", "42"), docs.get(0).variables());
        assertEquals(Optional.of("OnPost"), docs.get(0).operationName());

        assertTrue(storage.remove("t", "zeta"));
        assertFalse(storage.remove("t", "zeta"));
        assertEquals(1, storage.count("t"));
    }

    @Test
    void testEventsReadableByIdAndTime() {
        ChangeEvent first = storage.publish(draft("1"));
        clock.advance(Duration.ofSeconds(5));
        ChangeEvent second = storage.publish(draft("2"));

        assertEquals(1, first.id());
        assertEquals(2, second.id());
        assertEquals(List.of(second), storage.after(first.id(), 10));
        assertEquals(List.of(second), storage.since(first.createdAt(), 10));
        assertEquals(2, storage.latestId());
        assertEquals(Map.of("id", "2"), storage.after(1, 10).get(0).payload());
        assertEquals(second.channels(), storage.after(1, 10).get(0).channels());
    }

    @Test
    void testPurgeKeepsSequence() {
        storage.publish(draft("1"));
        clock.advance(Duration.ofHours(2));
        storage.publish(draft("2"));

        assertEquals(1, storage.purge(clock.instant().minus(Duration.ofHours(1))));
        assertEquals(3, storage.publish(draft("3")).id());

        EventLogStats stats = storage.stats(clock.instant());
        assertEquals(2, stats.totalEvents());
        assertEquals(2, stats.recentEvents());
    }

    @Test
    void testAwaitWakesOnPublish() throws Exception {
        long cursor = storage.latestId();
        CompletableFuture<Boolean> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return storage.await(cursor, Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });
        Thread.sleep(50);
        storage.publish(draft("1"));

        assertTrue(waiting.get(2, TimeUnit.SECONDS));
        assertFalse(storage.await(storage.latestId(), Duration.ofMillis(20)));
    }

    @Test
    void testStatePersistsAcrossReopen() {
        storage.insert(new ReservationToken("t", T0, T0.plusSeconds(60)));
        storage.put(document("t", "op1", T0));
        storage.publish(draft("1"));
        storage.close();

        storage = new LmdbSubscriptionStorage(tempDir, new JacksonJsonCodec(), clock);
        assertTrue(storage.find("t", T0).isPresent());
        assertEquals(1, storage.count("t"));
        assertEquals(1, storage.latestId());
        assertEquals(2, storage.publish(draft("2")).id());
    }

    private static SubscriptionDocument document(String token, String operationId, Instant at) {
        return new SubscriptionDocument(token, operationId,
                "subscription OnPost($id: ID) { postUpdated(id: $id) { id } }", "OnPost", Map.of("id", "42"), at);
    }

    private static EventDraft draft(String id) {
        LinkedHashSet<String> channels = new LinkedHashSet<>(List.of("graphql:postUpdated", "graphql:postUpdated." + id));
        return new EventDraft("postUpdated", id, id, Map.of("id", id), Map.of("source", "test"), channels);
    }
}
