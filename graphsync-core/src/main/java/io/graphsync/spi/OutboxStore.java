package io.graphsync.spi;

import io.graphsync.model.ChangeOp;
import io.graphsync.model.OutboxEvent;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for outbox events, managing status transitions through the
 * lifecycle: PENDING → PROCESSING → PROCESSED, PROCESSING → PENDING (retry), or
 * PROCESSING → FAILED.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code graphsync-jdbc} module.
 *
 * @see io.graphsync.jdbc.store.AbstractJdbcOutboxStore
 */
public interface OutboxStore {

    /**
     * Appends a new PENDING event.
     *
     * @param conn          the JDBC connection (typically the upstream write transaction)
     * @param tableName     the source table whose row changed
     * @param aggregateType the aggregate type code
     * @param aggregateId   id of the aggregate root
     * @param op            the operation applied to the row
     * @param createdAt     creation time, which defines processing order
     * @return the generated event id
     */
    long insert(Connection conn, String tableName, String aggregateType, String aggregateId,
                ChangeOp op, Instant createdAt);

    /**
     * Claims up to {@code limit} eligible events for {@code ownerId}, moving them to
     * PROCESSING and incrementing their attempt count.
     *
     * <p>Eligible events are PENDING (or PROCESSING with a claim older than
     * {@code staleBefore}), have fewer than {@link ClaimFilter#maxAttempts()} attempts and
     * match the filter's tables and aggregate types. The returned list is ordered by
     * creation time, then id.
     *
     * <p>Must run inside a transaction. Implementations guarantee that an event returned
     * to one caller is not returned to a concurrent caller.
     *
     * @param conn        the JDBC connection, with auto-commit disabled
     * @param ownerId     identifier of the claiming consumer
     * @param now         claim timestamp
     * @param staleBefore claims older than this are considered abandoned; {@code null}
     *                    disables reclaiming
     * @param limit       maximum number of events to claim
     * @param filter      eligibility filter
     * @return the claimed events, oldest first
     */
    List<OutboxEvent> claimPending(Connection conn, String ownerId, Instant now,
                                   Instant staleBefore, int limit, ClaimFilter filter);

    /**
     * Moves abandoned PROCESSING events that have no attempts left to FAILED.
     *
     * @param conn        the JDBC connection
     * @param staleBefore claims older than this are considered abandoned
     * @param maxAttempts the attempt budget
     * @return the number of rows updated
     */
    int failExhaustedClaims(Connection conn, Instant staleBefore, int maxAttempts);

    /**
     * Acknowledges an event: PROCESSING → PROCESSED.
     *
     * <p>Only applies while {@code ownerId} still holds the claim. A claim that went stale
     * and was taken over by another consumer is left untouched.
     *
     * @param conn    the JDBC connection
     * @param eventId the event to update
     * @param ownerId the consumer that claimed the event
     * @return the number of rows updated (0 or 1)
     */
    int markProcessed(Connection conn, long eventId, String ownerId);

    /**
     * Negatively acknowledges an event. The event returns to PENDING while its attempt
     * count is below {@code maxAttempts}, otherwise it becomes FAILED. Only applies while
     * {@code ownerId} still holds the claim.
     *
     * @param conn        the JDBC connection
     * @param eventId     the event to update
     * @param ownerId     the consumer that claimed the event
     * @param error       error text from the failed attempt (may be {@code null})
     * @param maxAttempts the attempt budget
     * @return the number of rows updated (0 or 1)
     */
    int markFailed(Connection conn, long eventId, String ownerId, String error, int maxAttempts);

    /**
     * Returns a claimed event that was never started to PENDING and gives back the
     * attempt its claim consumed. Only applies while {@code ownerId} still holds the claim.
     *
     * @param conn    the JDBC connection
     * @param eventId the event to release
     * @param ownerId the consumer that claimed the event
     * @return the number of rows updated (0 or 1)
     */
    int releaseClaim(Connection conn, long eventId, String ownerId);

    /**
     * Looks up an event by id, whatever its status.
     */
    Optional<OutboxEvent> findById(Connection conn, long eventId);

    /**
     * Queries FAILED events.
     *
     * @param conn          the JDBC connection
     * @param aggregateType optional aggregate type filter ({@code null} for all)
     * @param limit         maximum number of events to return
     * @return failed events, oldest first
     */
    List<OutboxEvent> queryFailed(Connection conn, String aggregateType, int limit);

    /**
     * Counts FAILED events.
     *
     * @param conn          the JDBC connection
     * @param aggregateType optional aggregate type filter ({@code null} for all)
     * @return the number of failed events
     */
    int countFailed(Connection conn, String aggregateType);

    /**
     * Resets a FAILED event to PENDING with zero attempts. Events in any other status are
     * left untouched.
     *
     * @param conn    the JDBC connection
     * @param eventId the event to replay
     * @return the number of rows updated (0 or 1)
     */
    int replayFailed(Connection conn, long eventId);
}
