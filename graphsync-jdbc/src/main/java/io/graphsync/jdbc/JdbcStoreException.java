package io.graphsync.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the outbox stores and the aggregate
 * reader of this module.
 */
public final class JdbcStoreException extends RuntimeException {
    public JdbcStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
