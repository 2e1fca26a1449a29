package io.graphsync.projection;

/**
 * Unchecked exception raised when a graph transaction fails. The transaction has been
 * rolled back when this is thrown.
 */
public final class GraphWriteException extends RuntimeException {
    public GraphWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
