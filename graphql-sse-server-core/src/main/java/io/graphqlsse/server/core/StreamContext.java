package io.graphqlsse.server.core;

import io.graphqlsse.json.spi.JsonCodec;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Collaborators and settings shared by every stream of one handler.
 */
record StreamContext(
        TokenService tokens,
        SubscriptionRegistry registry,
        SubscriptionMatcher matcher,
        OperationExecutor executor,
        JsonCodec json,
        Clock clock,
        ExecutorService streamPool,
        ActiveStreams activeStreams,
        Duration keepAliveInterval,
        Duration pollInterval,
        Optional<Duration> maxStreamDuration,
        boolean revokeOnDisconnect
) {}
