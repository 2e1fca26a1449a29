package io.graphsync.dispatch;

import io.graphsync.aggregate.AggregateLoader;
import io.graphsync.aggregate.AggregateSnapshot;
import io.graphsync.model.AggregateKind;
import io.graphsync.model.OutboxEvent;
import io.graphsync.projection.GraphProjector;
import io.graphsync.projection.NodeLabel;

import java.util.Objects;
import java.util.Optional;

/**
 * Default handler: loads the aggregate and projects it, or hands the event to the
 * {@link TombstoneHandler} when the root row is gone.
 *
 * <p>The event only names the aggregate; its operation matters solely when the row is
 * missing, so inserts and updates both take the upsert path.
 */
public final class ProjectionHandler implements AggregateHandler {
    private final AggregateKind kind;
    private final NodeLabel rootLabel;
    private final AggregateLoader loader;
    private final GraphProjector projector;
    private final TombstoneHandler tombstones;

    public ProjectionHandler(AggregateKind kind, NodeLabel rootLabel, AggregateLoader loader,
                             GraphProjector projector, TombstoneHandler tombstones) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.rootLabel = Objects.requireNonNull(rootLabel, "rootLabel");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.projector = Objects.requireNonNull(projector, "projector");
        this.tombstones = Objects.requireNonNull(tombstones, "tombstones");
    }

    @Override
    public ProcessingOutcome handle(OutboxEvent event) {
        Optional<AggregateSnapshot> snapshot = loader.load(kind, event.aggregateId());
        if (snapshot.isEmpty()) {
            return tombstones.onMissing(event, rootLabel);
        }
        projector.project(snapshot.get());
        return ProcessingOutcome.PROJECTED;
    }
}
