package io.graphsync.consumer;

import io.graphsync.dispatch.AggregateDispatcher;
import io.graphsync.dispatch.ProcessingOutcome;
import io.graphsync.model.OutboxEvent;
import io.graphsync.spi.ClaimFilter;
import io.graphsync.spi.ConnectionProvider;
import io.graphsync.spi.MetricsExporter;
import io.graphsync.spi.OutboxStore;
import io.graphsync.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Long-running consumer that claims outbox events and routes them through an
 * {@link AggregateDispatcher}.
 *
 * <p>Each cycle claims up to {@code batchSize} events in one transaction, then handles
 * them one at a time in claim order. Every event is acknowledged or negatively
 * acknowledged on its own, so a failing event never aborts the rest of the batch. A full
 * batch is followed immediately by another claim; a partial or empty one waits for the
 * poll interval.
 *
 * <p>Claims left in PROCESSING for longer than {@code processingTimeout} (for example
 * after a crash between claim and acknowledgement) become claimable again. Those that
 * already used their last attempt are moved to FAILED instead.
 *
 * <p>{@link #close()} lets the in-flight event finish, releases the rest of the batch
 * back to PENDING and waits up to {@code drainTimeout} for the loop to exit.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized to prevent concurrent lifecycle transitions.
 */
public final class OutboxConsumer implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(OutboxConsumer.class.getName());

    private final ConnectionProvider connectionProvider;
    private final OutboxStore outboxStore;
    private final AggregateDispatcher dispatcher;
    private final int batchSize;
    private final int maxAttempts;
    private final long pollIntervalMs;
    private final Duration processingTimeout;
    private final Duration drainTimeout;
    private final ClaimFilter filter;
    private final String ownerId;
    private final MetricsExporter metrics;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private OutboxConsumer(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        Duration pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        Duration processingTimeout = Objects.requireNonNull(builder.processingTimeout, "processingTimeout");
        if (processingTimeout.isNegative()) {
            throw new IllegalArgumentException("processingTimeout must be >= 0");
        }
        Duration drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must be >= 0");
        }

        this.batchSize = builder.batchSize;
        this.maxAttempts = builder.maxAttempts;
        this.pollIntervalMs = pollInterval.toMillis();
        this.processingTimeout = processingTimeout;
        this.drainTimeout = drainTimeout;
        this.filter = new ClaimFilter(builder.maxAttempts, builder.watchedTables, builder.watchedAggregateTypes);
        this.ownerId = builder.ownerId != null
            ? builder.ownerId
            : "graphsync-" + UUID.randomUUID().toString().substring(0, 8);
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Identifier written to {@code locked_by} for this consumer's claims.
     */
    public String ownerId() {
        return ownerId;
    }

    /**
     * Starts the polling loop on a daemon thread. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("OutboxConsumer has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("graphsync-consumer-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::runCycle, 0L, pollIntervalMs, TimeUnit.MILLISECONDS);
        logger.info("Outbox consumer " + ownerId + " started (batchSize=" + batchSize
            + ", maxAttempts=" + maxAttempts + ", pollIntervalMs=" + pollIntervalMs + ")");
    }

    private void runCycle() {
        try {
            int claimed;
            do {
                claimed = pollOnce();
            } while (claimed >= batchSize && !closed);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Consumer cycle failed", t);
        }
    }

    /**
     * Claims one batch and handles every event in it. Called by the polling loop, but may
     * also be invoked directly.
     *
     * @return the number of events claimed
     */
    public int pollOnce() {
        if (closed) {
            return 0;
        }
        Instant now = Instant.now();
        List<OutboxEvent> events = claim(now);
        if (events.isEmpty()) {
            metrics.recordOldestLagMs(0L);
            return 0;
        }
        metrics.incrementClaimed(events.size());
        long lagMs = Duration.between(events.get(0).createdAt(), now).toMillis();
        metrics.recordOldestLagMs(Math.max(0L, lagMs));

        for (int i = 0; i < events.size(); i++) {
            if (closed) {
                release(events.subList(i, events.size()));
                break;
            }
            process(events.get(i));
        }
        return events.size();
    }

    private List<OutboxEvent> claim(Instant now) {
        Instant staleBefore = processingTimeout.isZero() ? null : now.minus(processingTimeout);
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (staleBefore != null) {
                    int exhausted = outboxStore.failExhaustedClaims(conn, staleBefore, maxAttempts);
                    for (int i = 0; i < exhausted; i++) {
                        metrics.incrementFailed();
                    }
                    if (exhausted > 0) {
                        logger.warning("Moved " + exhausted + " abandoned claim(s) with no attempts left to FAILED");
                    }
                }
                List<OutboxEvent> claimed = outboxStore.claimPending(conn, ownerId, now, staleBefore, batchSize, filter);
                conn.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to claim outbox events", e);
            return List.of();
        }
    }

    private void process(OutboxEvent event) {
        long start = System.nanoTime();
        ProcessingOutcome outcome;
        try {
            outcome = dispatcher.dispatch(event);
        } catch (Exception e) {
            handleFailure(event, e);
            return;
        }
        switch (outcome) {
            case PROJECTED -> metrics.incrementProjected();
            case TOMBSTONED -> metrics.incrementTombstoned();
            case SKIPPED_MISSING -> metrics.incrementSkipped();
            case UNROUTABLE -> metrics.incrementUnroutable();
        }
        if (outcome == ProcessingOutcome.PROJECTED || outcome == ProcessingOutcome.TOMBSTONED) {
            metrics.recordProjectionDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }
        if (withConnection(conn -> outboxStore.markProcessed(conn, event.id(), ownerId),
            "Failed to acknowledge eventId=" + event.id()) == 0) {
            logClaimLost(event, "acknowledge");
        }
    }

    private void handleFailure(OutboxEvent event, Exception failure) {
        boolean terminal = event.attempts() >= maxAttempts;
        if (terminal) {
            metrics.incrementFailed();
            logger.log(Level.SEVERE, "Event failed permanently after " + event.attempts()
                + " attempt(s): eventId=" + event.id() + ", " + event.aggregateType()
                + " " + event.aggregateId(), failure);
        } else {
            metrics.incrementRetried();
            logger.log(Level.WARNING, "Event failed, will retry (attempt " + event.attempts()
                + " of " + maxAttempts + "): eventId=" + event.id(), failure);
        }
        if (withConnection(conn -> outboxStore.markFailed(conn, event.id(), ownerId, describe(failure), maxAttempts),
            "Failed to record failure for eventId=" + event.id()) == 0) {
            logClaimLost(event, "record failure for");
        }
    }

    private void release(List<OutboxEvent> unstarted) {
        int released = 0;
        for (OutboxEvent event : unstarted) {
            int updated = withConnection(conn -> outboxStore.releaseClaim(conn, event.id(), ownerId),
                "Failed to release eventId=" + event.id());
            if (updated > 0) {
                released++;
            } else if (updated == 0) {
                logClaimLost(event, "release");
            }
        }
        logger.info("Released " + released + " unstarted event(s) on shutdown");
    }

    /**
     * Runs a status update in its own auto-commit connection.
     *
     * @return the number of rows updated, or {@code -1} if the update failed
     */
    private int withConnection(SqlAction action, String failureMessage) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return action.execute(conn);
        } catch (SQLException | RuntimeException e) {
            // the claim stays in PROCESSING and is recovered once it goes stale
            logger.log(Level.SEVERE, failureMessage, e);
            return -1;
        }
    }

    private void logClaimLost(OutboxEvent event, String action) {
        logger.warning("Could not " + action + " eventId=" + event.id() + ": claim is no longer held by "
            + ownerId);
    }

    private static String describe(Throwable failure) {
        String text = failure.toString();
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root == failure ? text : text + "; caused by " + root;
    }

    /**
     * Stops claiming, lets the in-flight event finish and waits up to the drain timeout
     * for the loop thread to exit.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warning("Outbox consumer " + ownerId + " did not drain within " + drainTimeout
                        + "; interrupting");
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            logger.info("Outbox consumer " + ownerId + " stopped");
        }
    }

    @FunctionalInterface
    private interface SqlAction {
        int execute(Connection conn) throws SQLException;
    }

    /**
     * Builder for {@link OutboxConsumer}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private OutboxStore outboxStore;
        private AggregateDispatcher dispatcher;
        private int batchSize = 50;
        private int maxAttempts = 5;
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration processingTimeout = Duration.ofMinutes(15);
        private Duration drainTimeout = Duration.ofSeconds(30);
        private Set<String> watchedTables = Set.of();
        private Set<String> watchedAggregateTypes = Set.of();
        private String ownerId;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * <b>Required.</b> Source of connections for claims and status updates.
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b> The outbox table adapter.
         */
        public Builder outboxStore(OutboxStore outboxStore) {
            this.outboxStore = outboxStore;
            return this;
        }

        /**
         * <b>Required.</b> Routes each claimed event to its handler.
         */
        public Builder dispatcher(AggregateDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * Maximum events claimed per cycle. Defaults to {@code 50}; must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Claims allowed per event before it becomes FAILED. Defaults to {@code 5}; must be &gt; 0.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sleep between cycles that found less than a full batch. Defaults to 5 seconds.
         */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * Age after which a PROCESSING claim is considered abandoned and may be claimed
         * again. Defaults to 15 minutes; {@link Duration#ZERO} disables reclaiming.
         */
        public Builder processingTimeout(Duration processingTimeout) {
            this.processingTimeout = processingTimeout;
            return this;
        }

        /**
         * Maximum time {@link OutboxConsumer#close()} waits for the in-flight event.
         * Defaults to 30 seconds.
         */
        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        /**
         * Restricts claims to events from these source tables. Empty (the default) claims
         * events from every table.
         */
        public Builder watchedTables(Set<String> watchedTables) {
            this.watchedTables = Objects.requireNonNull(watchedTables, "watchedTables");
            return this;
        }

        /**
         * Restricts claims to these aggregate type codes. Empty (the default) claims every type.
         */
        public Builder watchedAggregateTypes(Set<String> watchedAggregateTypes) {
            this.watchedAggregateTypes = Objects.requireNonNull(watchedAggregateTypes, "watchedAggregateTypes");
            return this;
        }

        /**
         * Identifier of this consumer instance (e.g. hostname or pod name). Defaults to a
         * random {@code graphsync-xxxxxxxx} id.
         */
        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        /**
         * Metrics exporter. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the consumer. Call {@link OutboxConsumer#start()} to begin polling.
         *
         * @throws NullPointerException     if a required collaborator is missing
         * @throws IllegalArgumentException if a numeric setting or duration is out of range
         */
        public OutboxConsumer build() {
            return new OutboxConsumer(this);
        }
    }
}
