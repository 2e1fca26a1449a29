package io.graphsync.dispatch;

import io.graphsync.aggregate.AggregateLoader;
import io.graphsync.model.AggregateKind;
import io.graphsync.model.OutboxEvent;
import io.graphsync.projection.GraphProjector;
import io.graphsync.projection.NodeLabel;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Routes events to the handler registered for their aggregate type.
 *
 * <p>Events whose aggregate type has no handler are logged and reported as
 * {@link ProcessingOutcome#UNROUTABLE}; they are acknowledged, not failed.
 *
 * <p>Register handlers before the consumer starts; the registry is not synchronized.
 */
public final class AggregateDispatcher {
    private static final Logger logger = Logger.getLogger(AggregateDispatcher.class.getName());

    private final Map<AggregateKind, AggregateHandler> handlers = new EnumMap<>(AggregateKind.class);

    /**
     * Creates a dispatcher with projection handlers for every {@link AggregateKind}.
     */
    public static AggregateDispatcher standard(AggregateLoader loader, GraphProjector projector,
                                               TombstoneHandler tombstones) {
        return new AggregateDispatcher()
            .register(AggregateKind.PRIMARY_PERSON, new ProjectionHandler(
                AggregateKind.PRIMARY_PERSON, NodeLabel.B2C_CUSTOMER, loader, projector, tombstones))
            .register(AggregateKind.BUSINESS_PERSON, new ProjectionHandler(
                AggregateKind.BUSINESS_PERSON, NodeLabel.B2B_CUSTOMER, loader, projector, tombstones))
            .register(AggregateKind.GROUP, new ProjectionHandler(
                AggregateKind.GROUP, NodeLabel.HOUSEHOLD, loader, projector, tombstones));
    }

    /**
     * Registers (or replaces) the handler for a kind.
     *
     * @return this dispatcher
     */
    public AggregateDispatcher register(AggregateKind kind, AggregateHandler handler) {
        handlers.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(handler, "handler"));
        return this;
    }

    /**
     * Handles one event.
     *
     * @throws RuntimeException propagated from the handler when the event must be retried
     */
    public ProcessingOutcome dispatch(OutboxEvent event) {
        Optional<AggregateKind> kind = AggregateKind.fromCode(event.aggregateType());
        AggregateHandler handler = kind.map(handlers::get).orElse(null);
        if (handler == null) {
            logger.warning("No handler for aggregate type '" + event.aggregateType()
                + "', acknowledging eventId=" + event.id());
            return ProcessingOutcome.UNROUTABLE;
        }
        return handler.handle(event);
    }
}
