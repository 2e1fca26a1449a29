/**
 * JDBC {@link io.graphsync.spi.AggregateReader} over the customer and household tables.
 */
package io.graphsync.jdbc.reader;
