/**
 * Micrometer bridge for {@link io.graphsync.spi.MetricsExporter}.
 */
package io.graphsync.micrometer;
