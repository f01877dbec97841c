package io.graphqlsse.server.core.lmdb;

import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.json.spi.JsonCodec;
import io.graphqlsse.json.spi.JsonException;
import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.ConnectionStore;
import io.graphqlsse.server.spi.EventDraft;
import io.graphqlsse.server.spi.EventLog;
import io.graphqlsse.server.spi.EventLogStats;
import io.graphqlsse.server.spi.ReservationToken;
import io.graphqlsse.server.spi.SubscriptionDocument;
import org.lmdbjava.Cursor;
import org.lmdbjava.Dbi;
import org.lmdbjava.DbiFlags;
import org.lmdbjava.Env;
import org.lmdbjava.GetOp;
import org.lmdbjava.LmdbException;
import org.lmdbjava.PutFlags;
import org.lmdbjava.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * LMDB-backed {@link ConnectionStore} and {@link EventLog}.
 *
 * <p>Every write is one LMDB write transaction, so the revoke and sweep cascades are atomic and
 * several processes on one host can share the environment. Event keys are big-endian ids, which
 * LMDB orders numerically; the id sequence lives in its own database so purging never reuses ids.
 *
 * <p>{@link #await(long, Duration)} is signalled by appends made through this instance and checks
 * the environment every {@code crossProcessPoll} for appends made by other processes.
 */
public final class LmdbSubscriptionStorage implements ConnectionStore, EventLog, Closeable {
    private static final Logger LOG = LoggerFactory.getLogger(LmdbSubscriptionStorage.class);

    private static final int MAX_KEY_SIZE = 511;
    private static final int MAX_DBS = 4;
    private static final long DEFAULT_MAP_SIZE = 256L * 1024 * 1024;
    private static final Duration DEFAULT_CROSS_PROCESS_POLL = Duration.ofMillis(250);
    private static final char KEY_SEPARATOR = '\u0000';

    private static final String SEQUENCE_KEY = "event_seq";
    private static final String LAST_CREATED_KEY = "event_last_created";

    private final Env<ByteBuffer> env;
    private final Dbi<ByteBuffer> tokens;
    private final Dbi<ByteBuffer> documents;
    private final Dbi<ByteBuffer> events;
    private final Dbi<ByteBuffer> meta;
    private final JsonCodec json;
    private final Clock clock;
    private final Duration crossProcessPoll;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition appended = lock.newCondition();

    public LmdbSubscriptionStorage(Path baseDir, JsonCodec json) {
        this(baseDir, DEFAULT_MAP_SIZE, json, Clock.systemUTC(), DEFAULT_CROSS_PROCESS_POLL);
    }

    public LmdbSubscriptionStorage(Path baseDir, JsonCodec json, Clock clock) {
        this(baseDir, DEFAULT_MAP_SIZE, json, clock, DEFAULT_CROSS_PROCESS_POLL);
    }

    public LmdbSubscriptionStorage(Path baseDir, long mapSize, JsonCodec json, Clock clock, Duration crossProcessPoll) {
        Objects.requireNonNull(baseDir, "baseDir");
        if (mapSize <= 0) {
            throw new IllegalArgumentException("mapSize must be positive");
        }
        this.json = Objects.requireNonNull(json, "json");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.crossProcessPoll = Objects.requireNonNull(crossProcessPoll, "crossProcessPoll");
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create LMDB directory", e);
        }
        this.env = Env.create()
                .setMapSize(mapSize)
                .setMaxDbs(MAX_DBS)
                .open(baseDir.toFile());
        this.tokens = env.openDbi("tokens", DbiFlags.MDB_CREATE);
        this.documents = env.openDbi("documents", DbiFlags.MDB_CREATE);
        this.events = env.openDbi("events", DbiFlags.MDB_CREATE);
        this.meta = env.openDbi("meta", DbiFlags.MDB_CREATE);
        LOG.info("Opened LMDB subscription storage at {}", baseDir);
    }

    // ===== Tokens =====

    @Override
    public boolean insert(ReservationToken token) {
        Objects.requireNonNull(token, "token");
        return write("insert reservation", txn ->
                tokens.put(txn, key(token.token()), encodeToken(token), PutFlags.MDB_NOOVERWRITE));
    }

    @Override
    public Optional<ReservationToken> find(String token, Instant now) {
        if (token == null || token.isEmpty() || utf8Length(token) > MAX_KEY_SIZE) return Optional.empty();
        return read("read reservation", txn -> {
            ByteBuffer value = tokens.get(txn, key(token));
            if (value == null) return Optional.<ReservationToken>empty();
            ReservationToken found = decodeToken(token, value);
            return found.isExpired(now) ? Optional.<ReservationToken>empty() : Optional.of(found);
        });
    }

    @Override
    public boolean revoke(String token) {
        if (token == null || token.isEmpty() || utf8Length(token) > MAX_KEY_SIZE) return false;
        return write("revoke reservation", txn -> {
            deleteDocuments(txn, token);
            return tokens.delete(txn, key(token));
        });
    }

    @Override
    public int sweep(Instant now) {
        return write("sweep reservations", txn -> {
            List<String> expired = new ArrayList<>();
            try (Cursor<ByteBuffer> c = tokens.openCursor(txn)) {
                boolean found = c.first();
                while (found) {
                    String token = decodeUtf8(c.key());
                    if (decodeToken(token, c.val()).isExpired(now)) {
                        expired.add(token);
                        c.delete();
                    }
                    found = c.next();
                }
            }
            for (String token : expired) {
                deleteDocuments(txn, token);
            }
            return expired.size();
        });
    }

    @Override
    public List<ReservationToken> active(Instant now) {
        return read("list reservations", txn -> {
            List<ReservationToken> out = new ArrayList<>();
            try (Cursor<ByteBuffer> c = tokens.openCursor(txn)) {
                boolean found = c.first();
                while (found) {
                    ReservationToken token = decodeToken(decodeUtf8(c.key()), c.val());
                    if (!token.isExpired(now)) out.add(token);
                    found = c.next();
                }
            }
            out.sort(Comparator.comparing(ReservationToken::createdAt));
            return out;
        });
    }

    // ===== Documents =====

    @Override
    public boolean put(SubscriptionDocument document) {
        Objects.requireNonNull(document, "document");
        ByteBuffer documentKey = key(document.token() + KEY_SEPARATOR + document.operationId());
        return write("store subscription", txn -> {
            ByteBuffer token = tokens.get(txn, key(document.token()));
            if (token == null || decodeToken(document.token(), token).isExpired(document.registeredAt())) {
                return false;
            }
            documents.put(txn, documentKey, encodeDocument(document));
            return true;
        });
    }

    @Override
    public Optional<SubscriptionDocument> get(String token, String operationId) {
        ByteBuffer documentKey = key(token + KEY_SEPARATOR + operationId);
        return read("read subscription", txn -> {
            ByteBuffer value = documents.get(txn, documentKey);
            return value == null ? Optional.<SubscriptionDocument>empty() : Optional.of(decodeDocument(value));
        });
    }

    @Override
    public List<SubscriptionDocument> list(String token) {
        return read("list subscriptions", txn -> {
            List<SubscriptionDocument> out = new ArrayList<>();
            String prefix = token + KEY_SEPARATOR;
            try (Cursor<ByteBuffer> c = documents.openCursor(txn)) {
                boolean found = c.get(key(prefix), GetOp.MDB_SET_RANGE);
                while (found && decodeUtf8(c.key()).startsWith(prefix)) {
                    out.add(decodeDocument(c.val()));
                    found = c.next();
                }
            }
            out.sort(Comparator.comparing(SubscriptionDocument::registeredAt));
            return out;
        });
    }

    @Override
    public boolean remove(String token, String operationId) {
        ByteBuffer documentKey = key(token + KEY_SEPARATOR + operationId);
        return write("remove subscription", txn -> documents.delete(txn, documentKey));
    }

    @Override
    public int count(String token) {
        return read("count subscriptions", txn -> {
            int n = 0;
            String prefix = token + KEY_SEPARATOR;
            try (Cursor<ByteBuffer> c = documents.openCursor(txn)) {
                boolean found = c.get(key(prefix), GetOp.MDB_SET_RANGE);
                while (found && decodeUtf8(c.key()).startsWith(prefix)) {
                    n++;
                    found = c.next();
                }
            }
            return n;
        });
    }

    @Override
    public int totalCount() {
        return read("count subscriptions", txn -> (int) documents.stat(txn).entries);
    }

    // ===== Events =====

    @Override
    public ChangeEvent publish(EventDraft draft) {
        Objects.requireNonNull(draft, "draft");
        ChangeEvent event = write("append event", txn -> {
            ByteBuffer seq = meta.get(txn, key(SEQUENCE_KEY));
            long id = (seq == null ? 0L : seq.duplicate().getLong()) + 1;
            ByteBuffer last = meta.get(txn, key(LAST_CREATED_KEY));
            Instant now = clock.instant();
            Instant createdAt = now;
            if (last != null) {
                Instant lastCreated = readInstant(last.duplicate());
                if (now.isBefore(lastCreated)) createdAt = lastCreated;
            }
            ChangeEvent stored = ChangeEvent.of(draft, id, createdAt);
            events.put(txn, idKey(id), encodeEvent(stored));
            meta.put(txn, key(SEQUENCE_KEY), longValue(id));
            meta.put(txn, key(LAST_CREATED_KEY), new RecordWriter().instant(createdAt).toDirect());
            return stored;
        });
        lock.lock();
        try {
            appended.signalAll();
        } finally {
            lock.unlock();
        }
        return event;
    }

    @Override
    public List<ChangeEvent> since(Instant timestamp, int limit) {
        return read("read events", txn -> {
            List<ChangeEvent> out = new ArrayList<>();
            try (Cursor<ByteBuffer> c = events.openCursor(txn)) {
                boolean found = c.first();
                while (found && out.size() < limit) {
                    ChangeEvent event = decodeEvent(c.key(), c.val());
                    if (event.createdAt().isAfter(timestamp)) out.add(event);
                    found = c.next();
                }
            }
            return out;
        });
    }

    @Override
    public List<ChangeEvent> after(long eventId, int limit) {
        if (eventId == Long.MAX_VALUE) return List.of();
        return read("read events", txn -> {
            List<ChangeEvent> out = new ArrayList<>();
            try (Cursor<ByteBuffer> c = events.openCursor(txn)) {
                boolean found = c.get(idKey(Math.max(0L, eventId + 1)), GetOp.MDB_SET_RANGE);
                while (found && out.size() < limit) {
                    out.add(decodeEvent(c.key(), c.val()));
                    found = c.next();
                }
            }
            return out;
        });
    }

    @Override
    public long latestId() {
        return read("read event sequence", txn -> {
            ByteBuffer seq = meta.get(txn, key(SEQUENCE_KEY));
            return seq == null ? 0L : seq.duplicate().getLong();
        });
    }

    @Override
    public boolean await(long eventId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                if (latestId() > eventId) return true;
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) return false;
                appended.await(Math.min(remaining, crossProcessPoll.toNanos()), TimeUnit.NANOSECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int purge(Instant olderThan) {
        return write("purge events", txn -> {
            int removed = 0;
            try (Cursor<ByteBuffer> c = events.openCursor(txn)) {
                boolean found = c.first();
                while (found) {
                    Instant createdAt = readInstant(c.val().duplicate());
                    if (!createdAt.isBefore(olderThan)) break;
                    c.delete();
                    removed++;
                    found = c.next();
                }
            }
            return removed;
        });
    }

    @Override
    public EventLogStats stats(Instant now) {
        Instant hourAgo = now.minus(Duration.ofHours(1));
        return read("read event statistics", txn -> {
            long total = 0;
            long recent = 0;
            Instant oldest = null;
            Instant newest = null;
            try (Cursor<ByteBuffer> c = events.openCursor(txn)) {
                boolean found = c.first();
                while (found) {
                    Instant createdAt = readInstant(c.val().duplicate());
                    if (oldest == null) oldest = createdAt;
                    newest = createdAt;
                    total++;
                    if (createdAt.isAfter(hourAgo)) recent++;
                    found = c.next();
                }
            }
            return new EventLogStats(total, recent, Optional.ofNullable(oldest), Optional.ofNullable(newest));
        });
    }

    @Override
    public void close() {
        tokens.close();
        documents.close();
        events.close();
        meta.close();
        env.close();
    }

    // ===== Transactions =====

    @FunctionalInterface
    private interface TxnWork<T> {
        T apply(Txn<ByteBuffer> txn) throws JsonException;
    }

    private <T> T read(String action, TxnWork<T> work) {
        try (Txn<ByteBuffer> txn = env.txnRead()) {
            return work.apply(txn);
        } catch (LmdbException | JsonException e) {
            throw new GraphQLSseException.StoreError("Failed to " + action, e);
        }
    }

    private <T> T write(String action, TxnWork<T> work) {
        try (Txn<ByteBuffer> txn = env.txnWrite()) {
            T result = work.apply(txn);
            txn.commit();
            return result;
        } catch (LmdbException | JsonException e) {
            throw new GraphQLSseException.StoreError("Failed to " + action, e);
        }
    }

    private void deleteDocuments(Txn<ByteBuffer> txn, String token) {
        String prefix = token + KEY_SEPARATOR;
        try (Cursor<ByteBuffer> c = documents.openCursor(txn)) {
            boolean found = c.get(key(prefix), GetOp.MDB_SET_RANGE);
            while (found && decodeUtf8(c.key()).startsWith(prefix)) {
                c.delete();
                found = c.next();
            }
        }
    }

    // ===== Encoding =====

    private static ByteBuffer key(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_KEY_SIZE) {
            throw new IllegalArgumentException("Key is too long for LMDB");
        }
        ByteBuffer buffer = ByteBuffer.allocateDirect(bytes.length);
        buffer.put(bytes).flip();
        return buffer;
    }

    private static int utf8Length(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }

    private static ByteBuffer idKey(long id) {
        return longValue(id);
    }

    private static ByteBuffer longValue(long value) {
        ByteBuffer buffer = ByteBuffer.allocateDirect(Long.BYTES);
        buffer.putLong(value).flip();
        return buffer;
    }

    private static String decodeUtf8(ByteBuffer buffer) {
        ByteBuffer b = buffer.duplicate();
        byte[] bytes = new byte[b.remaining()];
        b.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static ByteBuffer encodeToken(ReservationToken token) {
        return new RecordWriter().instant(token.createdAt()).instant(token.expiresAt()).toDirect();
    }

    private static ReservationToken decodeToken(String token, ByteBuffer value) {
        ByteBuffer b = value.duplicate();
        return new ReservationToken(token, readInstant(b), readInstant(b));
    }

    private ByteBuffer encodeDocument(SubscriptionDocument document) throws JsonException {
        return new RecordWriter()
                .instant(document.registeredAt())
                .string(document.token())
                .string(document.operationId())
                .string(document.query())
                .string(document.operationName().orElse(null))
                .bytes(json.writeBytes(document.variables()))
                .toDirect();
    }

    private SubscriptionDocument decodeDocument(ByteBuffer value) throws JsonException {
        ByteBuffer b = value.duplicate();
        Instant registeredAt = readInstant(b);
        String token = readString(b);
        String operationId = readString(b);
        String query = readString(b);
        String operationName = readString(b);
        Map<String, Object> variables = json.readObject(readBytes(b));
        return new SubscriptionDocument(token, operationId, query, operationName, variables, registeredAt);
    }

    private ByteBuffer encodeEvent(ChangeEvent event) throws JsonException {
        RecordWriter writer = new RecordWriter()
                .instant(event.createdAt())
                .string(event.eventType())
                .string(event.subjectId())
                .string(event.routingKey())
                .integer(event.channels().size());
        for (String channel : event.channels()) {
            writer.string(channel);
        }
        return writer
                .bytes(json.writeBytes(event.payload()))
                .bytes(json.writeBytes(event.metadata()))
                .toDirect();
    }

    private ChangeEvent decodeEvent(ByteBuffer key, ByteBuffer value) throws JsonException {
        long id = key.duplicate().getLong();
        ByteBuffer b = value.duplicate();
        Instant createdAt = readInstant(b);
        String eventType = readString(b);
        String subjectId = readString(b);
        String routingKey = readString(b);
        int channelCount = b.getInt();
        Set<String> channels = new LinkedHashSet<>();
        for (int i = 0; i < channelCount; i++) {
            channels.add(readString(b));
        }
        Map<String, Object> payload = json.readObject(readBytes(b));
        Map<String, Object> metadata = json.readObject(readBytes(b));
        return ChangeEvent.of(new EventDraft(eventType, subjectId, routingKey, payload, metadata, channels), id, createdAt);
    }

    private static Instant readInstant(ByteBuffer b) {
        long seconds = b.getLong();
        int nanos = b.getInt();
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private static String readString(ByteBuffer b) {
        byte[] bytes = readBytes(b);
        return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0) return null;
        byte[] bytes = new byte[len];
        b.get(bytes);
        return bytes;
    }

    /**
     * Accumulates length-prefixed fields, then copies them into one direct buffer.
     */
    private static final class RecordWriter {
        private final List<byte[]> parts = new ArrayList<>();
        private int size;

        RecordWriter instant(Instant instant) {
            ByteBuffer b = ByteBuffer.allocate(Long.BYTES + Integer.BYTES);
            b.putLong(instant.getEpochSecond()).putInt(instant.getNano());
            return add(b.array());
        }

        RecordWriter integer(int value) {
            return add(ByteBuffer.allocate(Integer.BYTES).putInt(value).array());
        }

        RecordWriter string(String value) {
            return bytes(value == null ? null : value.getBytes(StandardCharsets.UTF_8));
        }

        RecordWriter bytes(byte[] value) {
            integer(value == null ? -1 : value.length);
            return value == null ? this : add(value);
        }

        private RecordWriter add(byte[] part) {
            parts.add(part);
            size += part.length;
            return this;
        }

        ByteBuffer toDirect() {
            ByteBuffer buffer = ByteBuffer.allocateDirect(size);
            for (byte[] part : parts) {
                buffer.put(part);
            }
            buffer.flip();
            return buffer;
        }
    }
}
