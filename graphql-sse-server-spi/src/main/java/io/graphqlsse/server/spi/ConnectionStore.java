package io.graphqlsse.server.spi;

/**
 * A backend holding both reservations and their documents, so that revocation and expiry
 * cascade inside a single transaction.
 */
public interface ConnectionStore extends TokenStore, SubscriptionStore {
}
