package io.graphsync.model;

import java.time.Instant;

/**
 * Read-only record representing a persisted outbox event row, as returned by a claim.
 *
 * <p>{@code attempts} already includes the claim that returned the row.
 *
 * @see io.graphsync.spi.OutboxStore#claimPending
 */
public record OutboxEvent(
    long id,
    String tableName,
    String aggregateType,
    String aggregateId,
    ChangeOp op,
    EventStatus status,
    int attempts,
    String lastError,
    Instant createdAt
) {}
