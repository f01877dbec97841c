package io.graphqlsse.core;

/**
 * GraphQL over SSE protocol constants (query keys, header names, event types and error codes).
 *
 * <p>This module intentionally contains no HTTP server bindings and no storage dependencies.
 * It only models protocol-level concerns that are shared across the server modules.
 */
public final class Protocol {
    private Protocol() {}

    // Query parameter keys
    public static final String Q_TOKEN = "token";
    public static final String Q_OPERATION_ID = "operationId";

    // Request/response headers
    public static final String H_EVENT_STREAM_TOKEN = "X-Event-Stream-Token";
    /** Header name used by earlier clients; accepted on requests, never sent. */
    public static final String H_LEGACY_EVENT_STREAM_TOKEN = "X-GraphQL-Event-Stream-Token";
    public static final String H_ERROR = "X-Error";
    public static final String H_ACCEL_BUFFERING = "X-Accel-Buffering";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ACCEPT = "Accept";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_CONNECTION = "Connection";
    public static final String H_ALLOW = "Allow";

    // Content types
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_JSON = "application/json; charset=utf-8";
    public static final String CT_TEXT = "text/plain; charset=utf-8";

    // SSE event types
    public static final String EVENT_NEXT = "next";
    public static final String EVENT_COMPLETE = "complete";

    // Request body keys
    public static final String F_QUERY = "query";
    public static final String F_VARIABLES = "variables";
    public static final String F_OPERATION_NAME = "operationName";
    public static final String F_EXTENSIONS = "extensions";
    public static final String F_OPERATION_ID = "operationId";

    // Error codes carried in GraphQL error extensions and the X-Error header
    public static final String CODE_INVALID_TOKEN = "INVALID_TOKEN";
    public static final String CODE_BAD_REQUEST = "BAD_REQUEST";
    public static final String CODE_PARSE_FAILED = "GRAPHQL_PARSE_FAILED";
    public static final String CODE_OPERATION_NOT_SUPPORTED = "OPERATION_NOT_SUPPORTED";
    public static final String CODE_OPERATION_NOT_FOUND = "OPERATION_NOT_FOUND";
    public static final String CODE_STREAM_CONFLICT = "STREAM_ALREADY_OPEN";
    public static final String CODE_METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
    public static final String CODE_INTERNAL_ERROR = "INTERNAL_ERROR";
    public static final String CODE_EXECUTION_ERROR = "EXECUTION_ERROR";
    public static final String CODE_EXECUTION_TIMEOUT = "EXECUTION_TIMEOUT";
    public static final String CODE_FORBIDDEN = "FORBIDDEN";

    /** Methods answered by the stream endpoint, as sent in {@code Allow}. */
    public static final String ALLOWED_METHODS = "GET, POST, PUT, DELETE";
}
