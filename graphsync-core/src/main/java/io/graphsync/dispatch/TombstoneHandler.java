package io.graphsync.dispatch;

import io.graphsync.model.ChangeOp;
import io.graphsync.model.OutboxEvent;
import io.graphsync.projection.NodeLabel;
import io.graphsync.spi.GraphWriter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handles events whose aggregate root row no longer exists.
 *
 * <p>A {@code DELETE} removes the node together with its relationships and owned nodes.
 * Any other operation means the row vanished after the event was written, so the event
 * is skipped and the graph is left as is.
 */
public final class TombstoneHandler {
    private static final Logger logger = Logger.getLogger(TombstoneHandler.class.getName());

    private final GraphWriter graphWriter;

    public TombstoneHandler(GraphWriter graphWriter) {
        this.graphWriter = Objects.requireNonNull(graphWriter, "graphWriter");
    }

    public ProcessingOutcome onMissing(OutboxEvent event, NodeLabel label) {
        if (event.op() == ChangeOp.DELETE) {
            int deleted = graphWriter.detachDelete(label, event.aggregateId());
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Tombstoned " + label.graphName() + " id=" + event.aggregateId()
                    + " nodesDeleted=" + deleted);
            }
            return ProcessingOutcome.TOMBSTONED;
        }
        logger.warning("Skipping eventId=" + event.id() + ": " + event.aggregateType() + " "
            + event.aggregateId() + " not found for op " + event.op());
        return ProcessingOutcome.SKIPPED_MISSING;
    }
}
