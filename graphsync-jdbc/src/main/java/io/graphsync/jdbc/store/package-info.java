/**
 * JDBC implementations of {@link io.graphsync.spi.OutboxStore} and their ServiceLoader registry.
 */
package io.graphsync.jdbc.store;
