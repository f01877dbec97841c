package io.graphqlsse.server.core;

import io.graphqlsse.core.Protocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Flow;

/**
 * Status, headers and body produced by {@link GraphQLSseHandler}. Adapters copy the headers in
 * insertion order and write the body according to its kind.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    private ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = Objects.requireNonNull(body, "body");
    }

    static ServerResponse empty(int status) {
        return new ServerResponse(status, new ResponseBody.Empty());
    }

    static ServerResponse bytes(int status, byte[] content, String contentType) {
        return new ServerResponse(status, new ResponseBody.Bytes(content))
                .header(Protocol.H_CONTENT_TYPE, contentType);
    }

    static ServerResponse eventStream(Flow.Publisher<SseFrame> publisher) {
        return new ServerResponse(200, new ResponseBody.Sse(publisher))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM);
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public ResponseBody body() {
        return body;
    }

    ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }
}
