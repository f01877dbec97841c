package io.graphqlsse.json.spi;

/**
 * A request body, stored document or event payload could not be read or written as JSON.
 *
 * <p>Checked, so each caller decides whether the failure is the client's (a 400) or the
 * store's ({@code StoreError}).
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
