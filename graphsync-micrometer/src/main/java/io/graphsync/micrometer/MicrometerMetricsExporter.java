package io.graphsync.micrometer;

import io.graphsync.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code graphsync.events.claimed} - events returned by claims</li>
 *   <li>{@code graphsync.events.projected} - aggregates written to the graph</li>
 *   <li>{@code graphsync.events.tombstoned} - deletions applied to the graph</li>
 *   <li>{@code graphsync.events.skipped} - events whose source row was missing</li>
 *   <li>{@code graphsync.events.unroutable} - events with an unknown aggregate type</li>
 *   <li>{@code graphsync.events.retried} - failed events returned to pending</li>
 *   <li>{@code graphsync.events.failed} - events moved to failed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code graphsync.lag.oldest.ms} - age of the oldest event in the latest claim</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code graphsync.projection.duration.ms} - load plus graph write time per event</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter claimed;
    private final Counter projected;
    private final Counter tombstoned;
    private final Counter skipped;
    private final Counter unroutable;
    private final Counter retried;
    private final Counter failed;
    private final Gauge lagGauge;
    private final DistributionSummary projectionDuration;

    private final AtomicLong oldestLagMs = new AtomicLong();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "graphsync"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "graphsync");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "crm.graphsync"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.claimed = counter(namePrefix + ".events.claimed", "Events returned by claims");
        this.projected = counter(namePrefix + ".events.projected", "Aggregates projected into the graph");
        this.tombstoned = counter(namePrefix + ".events.tombstoned", "Deletions applied to the graph");
        this.skipped = counter(namePrefix + ".events.skipped", "Events skipped because the source row was missing");
        this.unroutable = counter(namePrefix + ".events.unroutable", "Events acknowledged without a handler");
        this.retried = counter(namePrefix + ".events.retried", "Failed events returned to pending");
        this.failed = counter(namePrefix + ".events.failed", "Events moved to failed");

        this.lagGauge = Gauge.builder(namePrefix + ".lag.oldest.ms", oldestLagMs, AtomicLong::get)
                .description("Age of the oldest event in the latest claim")
                .register(registry);

        this.projectionDuration = DistributionSummary.builder(namePrefix + ".projection.duration.ms")
                .description("Aggregate load and graph write time in milliseconds")
                .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    @Override
    public void incrementClaimed(int count) {
        if (closed) return;
        claimed.increment(count);
    }

    @Override
    public void incrementProjected() {
        if (closed) return;
        projected.increment();
    }

    @Override
    public void incrementTombstoned() {
        if (closed) return;
        tombstoned.increment();
    }

    @Override
    public void incrementSkipped() {
        if (closed) return;
        skipped.increment();
    }

    @Override
    public void incrementUnroutable() {
        if (closed) return;
        unroutable.increment();
    }

    @Override
    public void incrementRetried() {
        if (closed) return;
        retried.increment();
    }

    @Override
    public void incrementFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void recordOldestLagMs(long lagMs) {
        if (closed) return;
        this.oldestLagMs.set(lagMs);
    }

    @Override
    public void recordProjectionDurationMs(long durationMs) {
        if (closed) return;
        projectionDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the consumer is closed to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(claimed, projected, tombstoned, skipped, unroutable,
                retried, failed, lagGauge, projectionDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
