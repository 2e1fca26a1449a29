package io.graphsync.jdbc.store;

import io.graphsync.jdbc.JdbcTemplate;
import io.graphsync.model.EventStatus;
import io.graphsync.model.OutboxEvent;
import io.graphsync.spi.ClaimFilter;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL outbox store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip
 * claim: concurrent consumers skip each other's rows instead of waiting on them.
 */
public final class PostgresOutboxStore extends AbstractJdbcOutboxStore {

    public PostgresOutboxStore() {
        super();
    }

    public PostgresOutboxStore(String tableName) {
        super(tableName);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public AbstractJdbcOutboxStore withTableName(String tableName) {
        return new PostgresOutboxStore(tableName);
    }

    @Override
    public List<OutboxEvent> claimPending(Connection conn, String ownerId, Instant now,
                                          Instant staleBefore, int limit, ClaimFilter filter) {
        Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
        List<Object> params = new ArrayList<>();
        params.add(EventStatus.PROCESSING.code());
        params.add(ownerId);
        params.add(Timestamp.from(nowMs));
        String eligible = eligibleCondition(staleBefore, filter, params);
        params.add(limit);

        String sql = "UPDATE " + tableName() +
            " SET status=?, attempts=attempts+1, locked_by=?, locked_at=?" +
            " WHERE id IN (SELECT id FROM " + tableName() + " WHERE " + eligible +
            " ORDER BY created_at, id LIMIT ? FOR UPDATE SKIP LOCKED)" +
            " RETURNING " + EVENT_COLUMNS;
        List<OutboxEvent> claimed = JdbcTemplate.updateReturning(conn, sql, EVENT_ROW_MAPPER, params.toArray());
        // RETURNING does not preserve the subquery order
        return claimed.stream()
            .sorted(Comparator.comparing(OutboxEvent::createdAt).thenComparingLong(OutboxEvent::id))
            .toList();
    }
}
