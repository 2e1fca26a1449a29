package io.graphsync.spi;

/**
 * Observability hook for exporting consumer counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Adds the number of events returned by a claim.
     */
    void incrementClaimed(int count);

    /**
     * Increments the count of aggregates projected into the graph.
     */
    void incrementProjected();

    /**
     * Increments the count of deletions applied to the graph.
     */
    void incrementTombstoned();

    /**
     * Increments the count of events skipped because the source row was missing.
     */
    void incrementSkipped();

    /**
     * Increments the count of events acknowledged without a handler for their type.
     */
    void incrementUnroutable();

    /**
     * Increments the count of failed events returned to PENDING for another attempt.
     */
    void incrementRetried();

    /**
     * Increments the count of events moved to FAILED.
     */
    void incrementFailed();

    /**
     * Records the age (in milliseconds) of the oldest event in the latest claim.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    void recordOldestLagMs(long lagMs);

    /**
     * Records the time spent loading and writing one aggregate.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordProjectionDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementClaimed(int count) {
        }

        @Override
        public void incrementProjected() {
        }

        @Override
        public void incrementTombstoned() {
        }

        @Override
        public void incrementSkipped() {
        }

        @Override
        public void incrementUnroutable() {
        }

        @Override
        public void incrementRetried() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void recordOldestLagMs(long lagMs) {
        }
    }
}
