package io.graphqlsse.server.core;

import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.core.Protocol;
import io.graphqlsse.json.spi.JsonCodec;
import io.graphqlsse.json.spi.JsonCodecs;
import io.graphqlsse.json.spi.JsonException;
import io.graphqlsse.server.spi.ConnectionStore;
import io.graphqlsse.server.spi.EventBroker;
import io.graphqlsse.server.spi.EventLog;
import io.graphqlsse.server.spi.EventSink;
import io.graphqlsse.server.spi.ExecutionBridge;
import io.graphqlsse.server.spi.ReservationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Framework-neutral HTTP handler implementing GraphQL subscriptions over Server-Sent Events.
 *
 * <p>Single-connection mode: {@code PUT} reserves a token, {@code POST} registers operations under
 * it, {@code GET} opens the token's event stream and {@code DELETE} stops an operation.
 * Distinct-connections mode: a {@code POST} with {@code Accept: text/event-stream} and no token
 * streams its operation on the same response.
 *
 * <p>Use {@link #builder(ConnectionStore)} to create instances:
 * <pre>{@code
 * GraphQLSseHandler handler = GraphQLSseHandler.builder(new InMemoryConnectionStore())
 *     .eventLog(new InMemoryEventLog())
 *     .executionBridge(new GraphQLJavaExecutionBridge(graphQL))
 *     .keepAliveInterval(Duration.ofSeconds(15))
 *     .build();
 * }</pre>
 */
public final class GraphQLSseHandler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GraphQLSseHandler.class);

    public static final int DEFAULT_BATCH_SIZE = 50;

    private final TokenService tokens;
    private final SubscriptionRegistry registry;
    private final SubscriptionMatcher matcher;
    private final ChannelRouter router;
    private final EventLog eventLog;
    private final EventBroker eventBroker;
    private final EventEmitter emitter;
    private final JsonCodec json;
    private final Clock clock;
    private final Duration reservationTtl;
    private final Duration ephemeralReservationTtl;
    private final int batchSize;
    private final ExecutorService streamPool;
    private final ExecutorService executionPool;
    private final ActiveStreams activeStreams = new ActiveStreams();
    private final StreamContext streamContext;

    public static Builder builder(ConnectionStore store) {
        return new Builder(store);
    }

    private GraphQLSseHandler(Builder builder) {
        if ((builder.eventLog == null) == (builder.eventBroker == null)) {
            throw new IllegalStateException("Configure exactly one of eventLog or eventBroker");
        }
        ExecutionBridge bridge = Objects.requireNonNull(builder.executionBridge, "executionBridge");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.json = builder.json != null ? builder.json : JsonCodecs.load();
        this.matcher = builder.matcher != null ? builder.matcher : new SubscriptionMatcher();
        this.router = builder.router != null ? builder.router : new ChannelRouter();
        this.eventLog = builder.eventLog;
        this.eventBroker = builder.eventBroker;
        this.tokens = new TokenService(builder.store, clock);
        this.registry = new SubscriptionRegistry(builder.store, clock);
        EventSink sink = eventLog != null ? eventLog : eventBroker;
        this.emitter = new EventEmitter(sink, router,
                builder.nodeEventTypes != null ? builder.nodeEventTypes : NodeEventTypes.defaults(), clock);
        this.reservationTtl = builder.reservationTtl != null ? builder.reservationTtl : TokenService.DEFAULT_TTL;
        this.ephemeralReservationTtl = builder.ephemeralReservationTtl != null
                ? builder.ephemeralReservationTtl : TokenService.DEFAULT_EPHEMERAL_TTL;
        this.batchSize = builder.batchSize > 0 ? builder.batchSize : DEFAULT_BATCH_SIZE;
        Duration executionTimeout = builder.executionTimeout != null ? builder.executionTimeout : Duration.ofSeconds(10);

        this.streamPool = StreamExecutors.newCachedPool("graphql-sse-stream");
        this.executionPool = StreamExecutors.newCachedPool("graphql-sse-exec");
        this.streamContext = new StreamContext(
                tokens,
                registry,
                matcher,
                new OperationExecutor(bridge, executionPool, executionTimeout),
                json,
                clock,
                streamPool,
                activeStreams,
                builder.keepAliveInterval != null ? builder.keepAliveInterval : Duration.ofSeconds(15),
                builder.pollInterval != null ? builder.pollInterval : Duration.ofSeconds(1),
                Optional.ofNullable(builder.maxStreamDuration),
                builder.revokeOnDisconnect);
    }

    /**
     * Builder for {@link GraphQLSseHandler}.
     */
    public static final class Builder {
        private final ConnectionStore store;
        private EventLog eventLog;
        private EventBroker eventBroker;
        private ExecutionBridge executionBridge;
        private JsonCodec json;
        private SubscriptionMatcher matcher;
        private ChannelRouter router;
        private NodeEventTypes nodeEventTypes;
        private Duration reservationTtl;
        private Duration ephemeralReservationTtl;
        private Duration keepAliveInterval;
        private Duration pollInterval;
        private Duration executionTimeout;
        private Duration maxStreamDuration;
        private int batchSize;
        private boolean revokeOnDisconnect;
        private Clock clock = Clock.systemUTC();

        private Builder(ConnectionStore store) {
            this.store = Objects.requireNonNull(store, "store");
        }

        /** Poll model: streams read this log. */
        public Builder eventLog(EventLog eventLog) {
            this.eventLog = eventLog;
            return this;
        }

        /** Push model: streams subscribe to channels on this broker. */
        public Builder eventBroker(EventBroker eventBroker) {
            this.eventBroker = eventBroker;
            return this;
        }

        /** Sets the engine that resolves matched operations. Required. */
        public Builder executionBridge(ExecutionBridge executionBridge) {
            this.executionBridge = executionBridge;
            return this;
        }

        /** Sets the JSON codec. Default: the first {@code JsonCodecProvider} on the class path. */
        public Builder jsonCodec(JsonCodec json) {
            this.json = json;
            return this;
        }

        public Builder matcher(SubscriptionMatcher matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder channelRouter(ChannelRouter router) {
            this.router = router;
            return this;
        }

        /** Sets the node change event type table used by {@link #emitter()}. */
        public Builder nodeEventTypes(NodeEventTypes nodeEventTypes) {
            this.nodeEventTypes = nodeEventTypes;
            return this;
        }

        /** Sets the lifetime of reservations made with {@code PUT}. Default: 24 hours. */
        public Builder reservationTtl(Duration reservationTtl) {
            this.reservationTtl = reservationTtl;
            return this;
        }

        /** Sets the lifetime of the reservation behind a distinct-connection stream. Default: 5 minutes. */
        public Builder ephemeralReservationTtl(Duration ephemeralReservationTtl) {
            this.ephemeralReservationTtl = ephemeralReservationTtl;
            return this;
        }

        /** Sets the idle time after which a keepalive comment is written. Default: 15 seconds. */
        public Builder keepAliveInterval(Duration keepAliveInterval) {
            this.keepAliveInterval = keepAliveInterval;
            return this;
        }

        /** Sets the longest wait between two checks of the stores. Default: 1 second. */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        /** Sets the time budget of one execution. Default: 10 seconds. */
        public Builder executionTimeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
            return this;
        }

        /** Sets the maximum lifetime of a stream. Default: unlimited. */
        public Builder maxStreamDuration(Duration maxStreamDuration) {
            this.maxStreamDuration = maxStreamDuration;
            return this;
        }

        /** Sets the maximum number of events handled per tick. Default: 50. */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /** Revoke the token and its documents when its stream closes. Default: false. */
        public Builder revokeOnDisconnect(boolean revokeOnDisconnect) {
            this.revokeOnDisconnect = revokeOnDisconnect;
            return this;
        }

        /** Sets the clock for time-based operations. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public GraphQLSseHandler build() {
            return new GraphQLSseHandler(this);
        }
    }

    public TokenService tokens() {
        return tokens;
    }

    public SubscriptionRegistry registry() {
        return registry;
    }

    /**
     * Emitter publishing to this handler's event log or broker.
     */
    public EventEmitter emitter() {
        return emitter;
    }

    public ServerStats stats() {
        return new ServerStats(
                tokens.activeCount(),
                registry.totalCount(),
                activeStreams.size(),
                eventLog == null ? Optional.empty() : Optional.of(eventLog.stats(clock.instant())));
    }

    /**
     * A maintenance task over this handler's reservations and, in the poll model, its event log.
     * The caller owns the task and starts and closes it.
     */
    public MaintenanceTask maintenance(Duration eventRetention) {
        return new MaintenanceTask(tokens, Optional.ofNullable(eventLog), eventRetention, clock);
    }

    public ServerResponse handle(ServerRequest req) {
        try {
            return switch (req.method()) {
                case PUT -> handleReserve();
                case POST -> handlePost(req);
                case GET -> handleStream(req);
                case DELETE -> handleStop(req);
                default -> methodNotAllowed();
            };
        } catch (GraphQLSseException.InvalidToken e) {
            return error(401, e.code(), e.getMessage());
        } catch (GraphQLSseException.MalformedRequest | GraphQLSseException.InvalidOperation e) {
            return error(400, e.code(), e.getMessage());
        } catch (IllegalArgumentException e) {
            return error(400, Protocol.CODE_BAD_REQUEST, e.getMessage());
        } catch (GraphQLSseException.StoreError e) {
            LOG.error("Store failure handling {} request", req.method(), e);
            return error(500, e.code(), "Internal server error");
        } catch (Exception e) {
            LOG.error("Unexpected failure handling {} request", req.method(), e);
            return error(500, Protocol.CODE_INTERNAL_ERROR, "Internal server error");
        }
    }

    /**
     * Response for methods outside GET, POST, PUT and DELETE.
     */
    public ServerResponse methodNotAllowed() {
        return error(405, Protocol.CODE_METHOD_NOT_ALLOWED, "Method not allowed")
                .header(Protocol.H_ALLOW, Protocol.ALLOWED_METHODS);
    }

    @Override
    public void close() {
        streamPool.shutdownNow();
        executionPool.shutdownNow();
    }

    private ServerResponse handleReserve() {
        ReservationToken token = tokens.reserve(reservationTtl);
        LOG.info("Reserved event stream token expiring at {}", token.expiresAt());
        return ServerResponse.bytes(201, token.token().getBytes(StandardCharsets.UTF_8), Protocol.CT_TEXT)
                .header(Protocol.H_CACHE_CONTROL, "no-store");
    }

    private ServerResponse handlePost(ServerRequest req) {
        Optional<String> token = req.token();
        if (token.isEmpty() && req.acceptsEventStream()) {
            return handleDistinct(req);
        }
        String t = requireValidToken(token);
        OperationRequest op = OperationRequest.parse(readBody(req.body()));
        String operationId = op.operationId()
                .orElseThrow(() -> new GraphQLSseException.MalformedRequest("Missing extensions.operationId"));

        registry.register(t, operationId, op.query(), op.variables(), op.operationName().orElse(null));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_OPERATION_ID, operationId);
        return json(202, body);
    }

    private ServerResponse handleDistinct(ServerRequest req) {
        OperationRequest op = OperationRequest.parse(readBody(req.body()));
        registry.validate(op.query(), op.operationName());
        String operationId = op.operationId().orElseGet(() -> UUID.randomUUID().toString());

        ReservationToken reservation = tokens.reserve(ephemeralReservationTtl);
        RegisteredSubscription subscription;
        try {
            subscription = registry.register(reservation.token(), operationId, op.query(), op.variables(),
                    op.operationName().orElse(null));
        } catch (RuntimeException e) {
            tokens.revoke(reservation.token());
            throw e;
        }
        return openStream(reservation.token(), StreamMode.DISTINCT_CONNECTION, List.of(subscription));
    }

    private ServerResponse handleStream(ServerRequest req) {
        String token = requireValidToken(req.token());
        return openStream(token, StreamMode.SINGLE_CONNECTION, registry.list(token));
    }

    private ServerResponse openStream(String token, StreamMode mode, List<RegisteredSubscription> initial) {
        EventFeed feed = eventLog != null
                ? new PollingEventFeed(eventLog, eventLog.latestId(), batchSize)
                : new BrokerEventFeed(eventBroker, router, matcher, batchSize);
        SubscriptionStream stream = new SubscriptionStream(streamContext, token, mode, feed, initial);
        if (!activeStreams.tryOpen(token, stream)) {
            feed.close();
            return error(409, Protocol.CODE_STREAM_CONFLICT, "An event stream is already open for this token");
        }
        try {
            feed.refresh(initial);
        } catch (RuntimeException e) {
            activeStreams.release(token, stream);
            feed.close();
            throw e;
        }
        return ServerResponse.eventStream(stream)
                .header(Protocol.H_CACHE_CONTROL, "no-cache")
                .header(Protocol.H_CONNECTION, "keep-alive")
                .header(Protocol.H_ACCEL_BUFFERING, "no");
    }

    private ServerResponse handleStop(ServerRequest req) {
        String token = requireValidToken(req.token());
        String operationId = QueryString.nonBlank(QueryString.parse(req.uri()), Protocol.Q_OPERATION_ID)
                .orElseThrow(() -> new GraphQLSseException.MalformedRequest("Missing operationId"));
        if (!registry.remove(token, operationId)) {
            return error(404, Protocol.CODE_OPERATION_NOT_FOUND, "Unknown operation " + operationId);
        }
        LOG.debug("Stopped operation {}", operationId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stopped", operationId);
        return json(200, body);
    }

    private String requireValidToken(Optional<String> token) {
        if (token.isEmpty()) {
            throw new GraphQLSseException.InvalidToken("Missing event stream token");
        }
        if (!tokens.validate(token.get())) {
            throw new GraphQLSseException.InvalidToken("Invalid or expired event stream token");
        }
        return token.get();
    }

    private Map<String, Object> readBody(InputStream body) {
        if (body == null) throw new GraphQLSseException.MalformedRequest("Missing request body");
        try {
            Map<String, Object> parsed = json.readObject(body);
            if (parsed == null) throw new GraphQLSseException.MalformedRequest("Request body must be a JSON object");
            return parsed;
        } catch (JsonException e) {
            throw new GraphQLSseException.MalformedRequest("Request body is not valid JSON");
        }
    }

    private ServerResponse json(int status, Map<String, Object> body) {
        try {
            return ServerResponse.bytes(status, json.writeBytes(body), Protocol.CT_JSON)
                    .header(Protocol.H_CACHE_CONTROL, "no-store");
        } catch (JsonException e) {
            LOG.error("Failed to serialize response body", e);
            return ServerResponse.empty(500)
                    .header(Protocol.H_CACHE_CONTROL, "no-store")
                    .header(Protocol.H_ERROR, Protocol.CODE_INTERNAL_ERROR);
        }
    }

    private ServerResponse error(int status, String code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", message);
        error.put("extensions", Map.of("code", code));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("errors", List.of(error));
        ServerResponse response;
        try {
            response = ServerResponse.bytes(status, json.writeBytes(body), Protocol.CT_JSON);
        } catch (JsonException e) {
            LOG.error("Failed to serialize error body", e);
            response = ServerResponse.empty(status);
        }
        return response
                .header(Protocol.H_CACHE_CONTROL, "no-store")
                .header(Protocol.H_ERROR, code);
    }

    /**
     * Validated GraphQL-over-HTTP request body.
     */
    record OperationRequest(String query, Map<String, Object> variables, Optional<String> operationName,
                            Optional<String> operationId) {

        @SuppressWarnings("unchecked")
        static OperationRequest parse(Map<String, Object> body) {
            Object query = body.get(Protocol.F_QUERY);
            if (!(query instanceof String q) || q.isBlank()) {
                throw new GraphQLSseException.MalformedRequest("Missing query");
            }
            Object variables = body.get(Protocol.F_VARIABLES);
            if (variables != null && !(variables instanceof Map)) {
                throw new GraphQLSseException.MalformedRequest("variables must be an object");
            }
            Object operationName = body.get(Protocol.F_OPERATION_NAME);
            if (operationName != null && !(operationName instanceof String)) {
                throw new GraphQLSseException.MalformedRequest("operationName must be a string");
            }
            Object extensions = body.get(Protocol.F_EXTENSIONS);
            if (extensions != null && !(extensions instanceof Map)) {
                throw new GraphQLSseException.MalformedRequest("extensions must be an object");
            }
            Object operationId = extensions == null ? null : ((Map<String, Object>) extensions).get(Protocol.F_OPERATION_ID);
            if (operationId != null && !(operationId instanceof String)) {
                throw new GraphQLSseException.MalformedRequest("extensions.operationId must be a string");
            }
            return new OperationRequest(
                    (String) query,
                    variables == null ? Map.of() : (Map<String, Object>) variables,
                    Optional.ofNullable((String) operationName).filter(s -> !s.isBlank()),
                    Optional.ofNullable((String) operationId).filter(s -> !s.isBlank()));
        }
    }
}
