package io.graphqlsse.server.core;

import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.core.Protocol;
import io.graphqlsse.server.spi.SubscriptionDocument;
import io.graphqlsse.server.spi.SubscriptionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registers subscription documents per reservation token and serves them back with their parsed AST.
 *
 * <p>Stores only hold query text, so documents written by another process are parsed on first
 * read; parsed operations are kept in a bounded LRU cache keyed by query text and operation name.
 */
public final class SubscriptionRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionRegistry.class);

    static final int DEFAULT_CACHE_SIZE = 1024;

    private final SubscriptionStore store;
    private final OperationParser parser;
    private final Clock clock;
    private final Map<String, ParsedOperation.Subscription> parsed;

    public SubscriptionRegistry(SubscriptionStore store, Clock clock) {
        this(store, new OperationParser(), clock, DEFAULT_CACHE_SIZE);
    }

    public SubscriptionRegistry(SubscriptionStore store, OperationParser parser, Clock clock, int cacheSize) {
        this.store = Objects.requireNonNull(store, "store");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (cacheSize <= 0) throw new IllegalArgumentException("cacheSize must be > 0");
        this.parsed = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ParsedOperation.Subscription> eldest) {
                return size() > cacheSize;
            }
        };
    }

    /**
     * Validate and store a document, replacing any document with the same operation id.
     *
     * @throws GraphQLSseException.MalformedRequest if the query does not parse
     * @throws GraphQLSseException.UnsupportedOperation if the operation is not a subscription
     * @throws GraphQLSseException.InvalidToken if the token is unknown or expired
     */
    public RegisteredSubscription register(String token, String operationId, String query,
                                           Map<String, Object> variables, String operationName) {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(operationId, "operationId");

        ParsedOperation.Subscription operation = validate(query, Optional.ofNullable(operationName));
        SubscriptionDocument document = new SubscriptionDocument(token, operationId, query, operationName, variables, clock.instant());
        if (!store.put(document)) {
            throw new GraphQLSseException.InvalidToken("reservation token is unknown or expired");
        }
        remember(query, operationName, operation);
        LOG.debug("Registered operation {} for field {}", operationId,
                operation.rootField().map(f -> f.getName()).orElse("<none>"));
        return new RegisteredSubscription(document, operation);
    }

    /**
     * Parse a document and require a subscription operation, without storing it.
     */
    public ParsedOperation.Subscription validate(String query, Optional<String> operationName) {
        ParsedOperation result = parser.parse(query, operationName);
        if (result instanceof ParsedOperation.Subscription subscription) {
            return subscription;
        }
        if (result instanceof ParsedOperation.NotSubscription notSubscription) {
            throw new GraphQLSseException.UnsupportedOperation(
                    "Only subscription operations are supported, got " + notSubscription.operation().name().toLowerCase(Locale.ROOT));
        }
        throw new GraphQLSseException.MalformedRequest(Protocol.CODE_PARSE_FAILED, ((ParsedOperation.Invalid) result).message());
    }

    public Optional<RegisteredSubscription> get(String token, String operationId) {
        return store.get(token, operationId).flatMap(this::attach);
    }

    public List<RegisteredSubscription> list(String token) {
        List<RegisteredSubscription> out = new ArrayList<>();
        for (SubscriptionDocument document : store.list(token)) {
            attach(document).ifPresent(out::add);
        }
        return out;
    }

    public boolean remove(String token, String operationId) {
        return store.remove(token, operationId);
    }

    public int count(String token) {
        return store.count(token);
    }

    public int totalCount() {
        return store.totalCount();
    }

    private Optional<RegisteredSubscription> attach(SubscriptionDocument document) {
        String name = document.operationName().orElse(null);
        ParsedOperation.Subscription operation = cached(document.query(), name);
        if (operation == null) {
            ParsedOperation result = parser.parse(document.query(), document.operationName());
            if (!(result instanceof ParsedOperation.Subscription subscription)) {
                LOG.warn("Ignoring stored operation {} that no longer parses as a subscription", document.operationId());
                return Optional.empty();
            }
            operation = subscription;
            remember(document.query(), name, operation);
        }
        return Optional.of(new RegisteredSubscription(document, operation));
    }

    private ParsedOperation.Subscription cached(String query, String operationName) {
        synchronized (parsed) {
            return parsed.get(cacheKey(query, operationName));
        }
    }

    private void remember(String query, String operationName, ParsedOperation.Subscription operation) {
        synchronized (parsed) {
            parsed.put(cacheKey(query, operationName), operation);
        }
    }

    private static String cacheKey(String query, String operationName) {
        return operationName == null ? query : operationName + '\u0000' + query;
    }
}
