package io.graphsync.failed;

import io.graphsync.model.OutboxEvent;
import io.graphsync.spi.ConnectionProvider;
import io.graphsync.spi.OutboxStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Operator facade for querying, counting, and replaying FAILED events.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}. Replayed
 * events return to PENDING with a fresh attempt budget.
 *
 * @see OutboxStore#queryFailed
 * @see OutboxStore#replayFailed
 * @see OutboxStore#countFailed
 */
public final class FailedEventManager {
    private static final Logger logger = Logger.getLogger(FailedEventManager.class.getName());

    private final ConnectionProvider connectionProvider;
    private final OutboxStore outboxStore;

    public FailedEventManager(ConnectionProvider connectionProvider, OutboxStore outboxStore) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
    }

    /**
     * Queries FAILED events.
     *
     * @param aggregateType optional aggregate type filter ({@code null} for all)
     * @param limit         maximum number of events to return
     * @return failed events, oldest first
     */
    public List<OutboxEvent> query(String aggregateType, int limit) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return outboxStore.queryFailed(conn, aggregateType, limit);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query failed events", e);
        }
    }

    /**
     * Counts FAILED events.
     *
     * @param aggregateType optional aggregate type filter ({@code null} for all)
     */
    public int count(String aggregateType) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return outboxStore.countFailed(conn, aggregateType);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count failed events", e);
        }
    }

    /**
     * Replays a single FAILED event.
     *
     * @return {@code true} if the event was reset, {@code false} if it is missing or not FAILED
     */
    public boolean replay(long eventId) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            boolean replayed = outboxStore.replayFailed(conn, eventId) > 0;
            if (replayed) {
                logger.info("Replayed failed eventId=" + eventId);
            }
            return replayed;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to replay failed event: " + eventId, e);
        }
    }

    /**
     * Replays all FAILED events of an aggregate type, in batches.
     *
     * @param aggregateType optional aggregate type filter ({@code null} for all)
     * @param batchSize     number of events per batch
     * @return total number of events replayed
     */
    public int replayAll(String aggregateType, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        int totalReplayed = 0;
        List<OutboxEvent> batch;
        do {
            int batchReplayed = 0;
            try (Connection conn = connectionProvider.getConnection()) {
                conn.setAutoCommit(true);
                batch = outboxStore.queryFailed(conn, aggregateType, batchSize);
                for (OutboxEvent event : batch) {
                    if (outboxStore.replayFailed(conn, event.id()) > 0) {
                        batchReplayed++;
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to replay failed events; replayed "
                    + totalReplayed + " so far", e);
            }
            totalReplayed += batchReplayed;
            if (!batch.isEmpty() && batchReplayed == 0) {
                break; // nothing in this batch could be reset; stop instead of looping
            }
        } while (batch.size() >= batchSize);
        if (totalReplayed > 0) {
            logger.info("Replayed " + totalReplayed + " failed event(s)");
        }
        return totalReplayed;
    }
}
