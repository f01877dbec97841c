package io.graphqlsse.server.core;

import java.util.concurrent.Flow;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.Sse {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}

    /**
     * A long-lived event stream. The adapter subscribes once, writes each rendered frame and
     * flushes, and cancels the subscription when the client goes away.
     */
    record Sse(Flow.Publisher<SseFrame> publisher) implements ResponseBody {}
}
