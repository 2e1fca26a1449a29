package io.graphsync.dispatch;

/**
 * Result of handling one event successfully. Every outcome acknowledges the event;
 * failures are reported by throwing instead.
 */
public enum ProcessingOutcome {
    /** The aggregate was written to the graph. */
    PROJECTED,
    /** The aggregate row was deleted and its node was removed from the graph. */
    TOMBSTONED,
    /** The aggregate row was missing on a non-delete event; the graph was left untouched. */
    SKIPPED_MISSING,
    /** No handler is registered for the event's aggregate type. */
    UNROUTABLE
}
