package io.graphqlsse.server.core;

import io.graphqlsse.core.GraphQLSseException;
import io.graphqlsse.core.Protocol;
import io.graphqlsse.server.spi.ChangeEvent;
import io.graphqlsse.server.spi.ExecutionBridge;
import io.graphqlsse.server.spi.ExecutionRequest;
import io.graphqlsse.server.spi.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs matched operations through the {@link ExecutionBridge} on a separate pool, bounded by a
 * timeout, and decorates results with event metadata.
 */
final class OperationExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(OperationExecutor.class);

    private final ExecutionBridge bridge;
    private final ExecutorService pool;
    private final Duration timeout;

    OperationExecutor(ExecutionBridge bridge, ExecutorService pool, Duration timeout) {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    sealed interface Outcome permits Delivered, Forbidden {
        ExecutionResult result();
    }

    /** The result goes out as a {@code next} and the operation stays active. */
    record Delivered(ExecutionResult result) implements Outcome {}

    /** Access was lost: the result goes out, then the stream completes. */
    record Forbidden(ExecutionResult result) implements Outcome {}

    Outcome execute(RegisteredSubscription subscription, ChangeEvent event) throws InterruptedException {
        ExecutionRequest request = new ExecutionRequest(
                subscription.operationId(),
                subscription.document().query(),
                subscription.document().operationName(),
                subscription.document().variables(),
                rootValue(subscription, event),
                event);

        Future<ExecutionResult> future = pool.submit(() -> bridge.execute(request));
        try {
            ExecutionResult result = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (result == null) {
                result = ExecutionResult.error("Execution produced no result", Protocol.CODE_EXECUTION_ERROR);
            }
            return new Delivered(decorate(result, event));
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Execution of operation {} for event #{} timed out after {}",
                    subscription.operationId(), event.id(), timeout);
            return new Delivered(decorate(ExecutionResult.error(
                    "Execution timed out after " + timeout.toMillis() + "ms", Protocol.CODE_EXECUTION_TIMEOUT), event));
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof GraphQLSseException.AuthorizationError denied) {
                LOG.info("Operation {} lost access: {}", subscription.operationId(), denied.getMessage());
                return new Forbidden(decorate(ExecutionResult.error(denied.getMessage(), denied.code()), event));
            }
            String code = cause instanceof GraphQLSseException g ? g.code() : Protocol.CODE_EXECUTION_ERROR;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            LOG.debug("Execution of operation {} failed", subscription.operationId(), cause);
            return new Delivered(decorate(ExecutionResult.error(message, code), event));
        }
    }

    static Map<String, Object> rootValue(RegisteredSubscription subscription, ChangeEvent event) {
        Map<String, Object> root = new LinkedHashMap<>();
        subscription.rootField().ifPresent(field -> root.put(field.getName(), event.payload()));
        return root;
    }

    static ExecutionResult decorate(ExecutionResult result, ChangeEvent event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("event_type", event.eventType());
        meta.put("node_id", event.subjectId());
        meta.put("event_id", event.id());
        meta.put("timestamp", event.createdAt().toString());
        return result.withExtension("subscription", meta);
    }
}
