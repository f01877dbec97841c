package io.graphqlsse.server.spi;

import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for registered subscription documents, scoped by reservation token.
 */
public interface SubscriptionStore {

    /**
     * Insert or replace the document keyed by its token and operation id.
     *
     * <p>The write is refused, atomically with the check, when no reservation valid at
     * {@link SubscriptionDocument#registeredAt()} holds the document's token.
     *
     * @return true if stored; false if the token is unknown or expired
     */
    boolean put(SubscriptionDocument document);

    Optional<SubscriptionDocument> get(String token, String operationId);

    /**
     * Documents of one token, ordered by registration time.
     */
    List<SubscriptionDocument> list(String token);

    /**
     * @return true if a document was removed
     */
    boolean remove(String token, String operationId);

    int count(String token);

    int totalCount();
}
