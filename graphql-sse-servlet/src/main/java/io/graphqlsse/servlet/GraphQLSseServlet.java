package io.graphqlsse.servlet;

import io.graphqlsse.core.Protocol;
import io.graphqlsse.server.core.GraphQLSseHandler;
import io.graphqlsse.server.core.HttpMethod;
import io.graphqlsse.server.core.ResponseBody;
import io.graphqlsse.server.core.ServerRequest;
import io.graphqlsse.server.core.ServerResponse;
import io.graphqlsse.server.core.SseFrame;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Jakarta Servlet adapter for {@link GraphQLSseHandler}.
 *
 * <p>Event streams are written through an {@link AsyncContext} without timeout, one flushed frame
 * at a time. The servlet must be registered with async support enabled.
 */
public final class GraphQLSseServlet extends HttpServlet {
    private static final Logger LOG = LoggerFactory.getLogger(GraphQLSseServlet.class);

    private final transient GraphQLSseHandler handler;

    public GraphQLSseServlet(GraphQLSseHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        ServerResponse engineResp;
        Optional<HttpMethod> method = HttpMethod.parse(req.getMethod());
        if (method.isEmpty()) {
            engineResp = handler.methodNotAllowed();
        } else {
            ServerRequest engineReq;
            try {
                engineReq = toEngineRequest(req, method.get(), readBody(req));
            } catch (URISyntaxException e) {
                LOG.debug("Rejecting request with malformed URI", e);
                resp.setStatus(400);
                resp.setHeader(Protocol.H_ERROR, Protocol.CODE_BAD_REQUEST);
                return;
            }
            engineResp = handler.handle(engineReq);
        }

        resp.setStatus(engineResp.status());
        engineResp.headers().forEach((k, vals) -> vals.forEach(v -> resp.addHeader(k, v)));

        ResponseBody body = engineResp.body();
        if (body instanceof ResponseBody.Bytes bytes) {
            resp.getOutputStream().write(bytes.bytes());
        } else if (body instanceof ResponseBody.Sse sse) {
            stream(req, resp, sse.publisher());
        }
    }

    private static void stream(HttpServletRequest req, HttpServletResponse resp, Flow.Publisher<SseFrame> publisher)
            throws IOException {
        resp.setCharacterEncoding("UTF-8");
        // commit headers before the first event
        resp.flushBuffer();

        AsyncContext async = req.startAsync();
        async.setTimeout(0);
        AtomicBoolean completed = new AtomicBoolean(false);

        publisher.subscribe(new Flow.Subscriber<>() {
            private Flow.Subscription subscription;

            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                this.subscription = subscription;
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(SseFrame item) {
                try {
                    resp.getOutputStream().write(item.render().getBytes(StandardCharsets.UTF_8));
                    resp.getOutputStream().flush();
                } catch (IOException e) {
                    LOG.debug("Client went away, cancelling stream", e);
                    subscription.cancel();
                    complete();
                }
            }

            @Override
            public void onError(Throwable throwable) {
                LOG.warn("Event stream failed", throwable);
                complete();
            }

            @Override
            public void onComplete() {
                complete();
            }

            private void complete() {
                if (completed.compareAndSet(false, true)) {
                    async.complete();
                }
            }
        });
    }

    private static ServerRequest toEngineRequest(HttpServletRequest req, HttpMethod method, byte[] bodyBytes)
            throws URISyntaxException {
        URI uri = new URI(req.getRequestURL().toString() + (req.getQueryString() == null ? "" : "?" + req.getQueryString()));

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }

        ByteArrayInputStream body = (bodyBytes == null || bodyBytes.length == 0) ? null : new ByteArrayInputStream(bodyBytes);
        return new ServerRequest(method, uri, headers, body);
    }

    private static byte[] readBody(HttpServletRequest req) throws IOException {
        if (req.getContentLengthLong() == 0) {
            return new byte[0];
        }
        try (InputStream in = req.getInputStream()) {
            if (in == null) return new byte[0];
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buf = new byte[8192];
            int r;
            while ((r = in.read(buf)) >= 0) {
                out.write(buf, 0, r);
            }
            return out.toByteArray();
        }
    }
}
