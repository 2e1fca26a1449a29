package io.graphsync.jdbc.store;

import io.graphsync.jdbc.JdbcTemplate;
import io.graphsync.model.ChangeOp;
import io.graphsync.model.EventStatus;
import io.graphsync.model.OutboxEvent;
import io.graphsync.spi.ClaimFilter;
import io.graphsync.spi.OutboxStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC outbox store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimPending} to provide database-specific claim
 * strategies. Register custom implementations via
 * {@code META-INF/services/io.graphsync.jdbc.store.AbstractJdbcOutboxStore}.
 *
 * <p>Expected table layout:
 * <pre>
 * id             BIGINT generated, primary key
 * table_name     source table of the change
 * aggregate_type aggregate type code
 * aggregate_id   id of the aggregate root
 * op             INSERT / UPDATE / DELETE
 * status         pending / processing / processed / failed
 * attempts       number of claims so far
 * last_error     error text of the latest failed attempt
 * locked_by      owner of the current claim
 * locked_at      time of the current claim
 * created_at     creation time, defines processing order
 * processed_at   acknowledgement time
 * </pre>
 *
 * @see JdbcOutboxStores
 */
public abstract class AbstractJdbcOutboxStore implements OutboxStore {
    protected static final String DEFAULT_TABLE = "outbox_events";
    private static final int MAX_ERROR_LENGTH = 4000;

    protected static final String EVENT_COLUMNS =
        "id, table_name, aggregate_type, aggregate_id, op, status, attempts, last_error, created_at";

    protected static final JdbcTemplate.RowMapper<OutboxEvent> EVENT_ROW_MAPPER = rs -> new OutboxEvent(
        rs.getLong("id"),
        rs.getString("table_name"),
        rs.getString("aggregate_type"),
        rs.getString("aggregate_id"),
        ChangeOp.fromCode(rs.getString("op")),
        EventStatus.fromCode(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getString("last_error"),
        rs.getTimestamp("created_at").toInstant());

    private final String tableName;

    protected AbstractJdbcOutboxStore() {
        this(DEFAULT_TABLE);
    }

    protected AbstractJdbcOutboxStore(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        this.tableName = tableName;
    }

    /**
     * Unique identifier for this outbox store (e.g., "postgresql", "h2").
     */
    public abstract String name();

    /**
     * JDBC URL prefixes this outbox store handles (e.g., "jdbc:postgresql:").
     */
    public abstract List<String> jdbcUrlPrefixes();

    /**
     * Returns a store of the same kind bound to another table.
     */
    public abstract AbstractJdbcOutboxStore withTableName(String tableName);

    public String tableName() {
        return tableName;
    }

    @Override
    public long insert(Connection conn, String tableName, String aggregateType, String aggregateId,
                       ChangeOp op, Instant createdAt) {
        String sql = "INSERT INTO " + tableName() +
            " (table_name, aggregate_type, aggregate_id, op, status, attempts, created_at)" +
            " VALUES (?,?,?,?,?,0,?)";
        return JdbcTemplate.insertReturningKey(conn, sql,
            tableName, aggregateType, aggregateId, op.name(), EventStatus.PENDING.code(),
            Timestamp.from(createdAt));
    }

    @Override
    public List<OutboxEvent> claimPending(Connection conn, String ownerId, Instant now,
                                          Instant staleBefore, int limit, ClaimFilter filter) {
        // Truncate to millis so the stored value matches the phase-2 lookup
        Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
        List<Object> params = new ArrayList<>();
        params.add(EventStatus.PROCESSING.code());
        params.add(ownerId);
        params.add(Timestamp.from(nowMs));
        String eligible = eligibleCondition(staleBefore, filter, params);
        params.add(limit);
        String guard = statusCondition(staleBefore, params);
        params.add(filter.maxAttempts());

        // Phase 1: UPDATE with subquery. The outer guard re-checks rows a concurrent claim
        // has already taken while this statement waited for their locks.
        String claimSql = "UPDATE " + tableName() +
            " SET status=?, attempts=attempts+1, locked_by=?, locked_at=?" +
            " WHERE id IN (SELECT id FROM " + tableName() + " WHERE " + eligible +
            " ORDER BY created_at, id LIMIT ?)" +
            " AND " + guard + " AND attempts < ?";
        int updated = JdbcTemplate.update(conn, claimSql, params.toArray());
        if (updated == 0) {
            return List.of();
        }
        // Phase 2: SELECT rows claimed in this cycle
        return selectClaimed(conn, ownerId, nowMs);
    }

    /**
     * Selects rows claimed by the given owner at the given lock timestamp. Shared by
     * subclasses that use a two-phase claim (UPDATE then SELECT).
     */
    protected List<OutboxEvent> selectClaimed(Connection conn, String ownerId, Instant lockedAt) {
        String sql = "SELECT " + EVENT_COLUMNS + " FROM " + tableName() +
            " WHERE locked_by=? AND locked_at=? AND status=? ORDER BY created_at, id";
        return JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER,
            ownerId, Timestamp.from(lockedAt), EventStatus.PROCESSING.code());
    }

    /**
     * Builds the WHERE clause selecting claimable rows and appends its parameters.
     */
    protected String eligibleCondition(Instant staleBefore, ClaimFilter filter, List<Object> params) {
        StringBuilder sql = new StringBuilder(statusCondition(staleBefore, params));
        sql.append(" AND attempts < ?");
        params.add(filter.maxAttempts());
        appendIn(sql, "table_name", filter.tableNames(), params);
        appendIn(sql, "aggregate_type", filter.aggregateTypes(), params);
        return sql.toString();
    }

    /**
     * PENDING rows, plus PROCESSING rows whose claim is older than {@code staleBefore}.
     */
    protected String statusCondition(Instant staleBefore, List<Object> params) {
        params.add(EventStatus.PENDING.code());
        if (staleBefore == null) {
            return "status=?";
        }
        params.add(EventStatus.PROCESSING.code());
        params.add(Timestamp.from(staleBefore));
        return "(status=? OR (status=? AND locked_at < ?))";
    }

    private static void appendIn(StringBuilder sql, String column, Collection<String> values, List<Object> params) {
        if (values.isEmpty()) {
            return;
        }
        sql.append(" AND ").append(column).append(" IN (");
        int i = 0;
        for (String value : values) {
            sql.append(i++ == 0 ? "?" : ",?");
            params.add(value);
        }
        sql.append(')');
    }

    @Override
    public int failExhaustedClaims(Connection conn, Instant staleBefore, int maxAttempts) {
        String sql = "UPDATE " + tableName() +
            " SET status=?, last_error=COALESCE(last_error, ?), locked_by=NULL, locked_at=NULL" +
            " WHERE status=? AND locked_at < ? AND attempts >= ?";
        return JdbcTemplate.update(conn, sql,
            EventStatus.FAILED.code(), "claim abandoned after final attempt",
            EventStatus.PROCESSING.code(), Timestamp.from(staleBefore), maxAttempts);
    }

    @Override
    public int markProcessed(Connection conn, long eventId, String ownerId) {
        String sql = "UPDATE " + tableName() +
            " SET status=?, processed_at=?, locked_by=NULL, locked_at=NULL" +
            " WHERE id=? AND status=? AND locked_by=?";
        return JdbcTemplate.update(conn, sql,
            EventStatus.PROCESSED.code(), Timestamp.from(Instant.now()), eventId, EventStatus.PROCESSING.code(),
            ownerId);
    }

    @Override
    public int markFailed(Connection conn, long eventId, String ownerId, String error, int maxAttempts) {
        String sql = "UPDATE " + tableName() +
            " SET status=CASE WHEN attempts >= ? THEN ? ELSE ? END," +
            " last_error=?, locked_by=NULL, locked_at=NULL" +
            " WHERE id=? AND status=? AND locked_by=?";
        return JdbcTemplate.update(conn, sql,
            maxAttempts, EventStatus.FAILED.code(), EventStatus.PENDING.code(),
            truncateError(error), eventId, EventStatus.PROCESSING.code(), ownerId);
    }

    @Override
    public int releaseClaim(Connection conn, long eventId, String ownerId) {
        String sql = "UPDATE " + tableName() +
            " SET status=?, attempts=CASE WHEN attempts > 0 THEN attempts - 1 ELSE 0 END," +
            " locked_by=NULL, locked_at=NULL" +
            " WHERE id=? AND status=? AND locked_by=?";
        return JdbcTemplate.update(conn, sql,
            EventStatus.PENDING.code(), eventId, EventStatus.PROCESSING.code(), ownerId);
    }

    @Override
    public Optional<OutboxEvent> findById(Connection conn, long eventId) {
        String sql = "SELECT " + EVENT_COLUMNS + " FROM " + tableName() + " WHERE id=?";
        return JdbcTemplate.queryOne(conn, sql, EVENT_ROW_MAPPER, eventId);
    }

    @Override
    public List<OutboxEvent> queryFailed(Connection conn, String aggregateType, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + EVENT_COLUMNS + " FROM " + tableName() +
            " WHERE status=?");
        List<Object> params = new ArrayList<>();
        params.add(EventStatus.FAILED.code());
        if (aggregateType != null) {
            sql.append(" AND aggregate_type=?");
            params.add(aggregateType);
        }
        sql.append(" ORDER BY created_at, id LIMIT ?");
        params.add(limit);
        return JdbcTemplate.query(conn, sql.toString(), EVENT_ROW_MAPPER, params.toArray());
    }

    @Override
    public int countFailed(Connection conn, String aggregateType) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM " + tableName() + " WHERE status=?");
        List<Object> params = new ArrayList<>();
        params.add(EventStatus.FAILED.code());
        if (aggregateType != null) {
            sql.append(" AND aggregate_type=?");
            params.add(aggregateType);
        }
        return JdbcTemplate.query(conn, sql.toString(), rs -> rs.getInt(1), params.toArray()).get(0);
    }

    @Override
    public int replayFailed(Connection conn, long eventId) {
        String sql = "UPDATE " + tableName() +
            " SET status=?, attempts=0, last_error=NULL, locked_by=NULL, locked_at=NULL, processed_at=NULL" +
            " WHERE id=? AND status=?";
        return JdbcTemplate.update(conn, sql,
            EventStatus.PENDING.code(), eventId, EventStatus.FAILED.code());
    }

    protected static String truncateError(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
