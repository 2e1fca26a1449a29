package io.graphsync.dispatch;

import io.graphsync.model.OutboxEvent;

/**
 * Processes the events of one aggregate kind.
 */
@FunctionalInterface
public interface AggregateHandler {

    /**
     * Brings the graph in line with the current state of the event's aggregate.
     *
     * @param event the claimed event
     * @return the outcome, always followed by an acknowledgement
     * @throws RuntimeException if the event should be retried or failed
     */
    ProcessingOutcome handle(OutboxEvent event);
}
