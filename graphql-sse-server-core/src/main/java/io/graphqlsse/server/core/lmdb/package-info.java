/**
 * LMDB persistence for reservations, subscription documents and the event log.
 */
package io.graphqlsse.server.core.lmdb;
