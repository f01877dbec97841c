package io.graphqlsse.core;

/**
 * Base class for GraphQL SSE related exceptions.
 *
 * <p>Each subclass carries the wire code reported to clients in GraphQL error extensions.
 * Subclasses preserve the original cause when applicable.
 */
public abstract class GraphQLSseException extends RuntimeException {

    private final String code;

    protected GraphQLSseException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected GraphQLSseException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Raised when a reservation token is missing, unknown or expired.
     */
    public static class InvalidToken extends GraphQLSseException {
        public InvalidToken(String message) {
            super(Protocol.CODE_INVALID_TOKEN, message);
        }
    }

    /**
     * Raised when a request body or query document cannot be understood.
     */
    public static class MalformedRequest extends GraphQLSseException {
        public MalformedRequest(String message) {
            super(Protocol.CODE_BAD_REQUEST, message);
        }

        public MalformedRequest(String code, String message) {
            super(code, message);
        }
    }

    /**
     * Raised when a document parses but cannot be registered as a subscription.
     */
    public static class InvalidOperation extends GraphQLSseException {
        public InvalidOperation(String code, String message) {
            super(code, message);
        }
    }

    /**
     * Raised when the selected operation is a query or mutation rather than a subscription.
     */
    public static class UnsupportedOperation extends InvalidOperation {
        public UnsupportedOperation(String message) {
            super(Protocol.CODE_OPERATION_NOT_SUPPORTED, message);
        }
    }

    /**
     * Raised by an execution bridge when resolving a payload failed.
     */
    public static class ExecutionError extends GraphQLSseException {
        public ExecutionError(String message) {
            super(Protocol.CODE_EXECUTION_ERROR, message);
        }

        public ExecutionError(String message, Throwable cause) {
            super(Protocol.CODE_EXECUTION_ERROR, message, cause);
        }
    }

    /**
     * Raised by an execution bridge when the subscriber no longer has access to the operation.
     * The stream delivers a final error and completes the operation.
     */
    public static class AuthorizationError extends GraphQLSseException {
        public AuthorizationError(String message) {
            super(Protocol.CODE_FORBIDDEN, message);
        }
    }

    /**
     * Raised when a token, document or event store fails.
     */
    public static class StoreError extends GraphQLSseException {
        public StoreError(String message) {
            super(Protocol.CODE_INTERNAL_ERROR, message);
        }

        public StoreError(String message, Throwable cause) {
            super(Protocol.CODE_INTERNAL_ERROR, message, cause);
        }
    }
}
