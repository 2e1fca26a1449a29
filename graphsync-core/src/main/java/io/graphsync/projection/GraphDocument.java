package io.graphsync.projection;

import java.util.List;
import java.util.Objects;

/**
 * Structured input of {@link io.graphsync.spi.GraphWriter#upsert}: everything one
 * aggregate contributes to the graph.
 *
 * <p>The primary node is always written with {@link MergeMode#OVERWRITE}.
 *
 * @param parent        the grouping node, or {@code null} when the aggregate has none
 * @param relationships relationship sets to replace, applied in order
 */
public record GraphDocument(GraphNode primary, ParentLink parent, List<RelationshipSet> relationships) {

    public GraphDocument {
        Objects.requireNonNull(primary, "primary");
        relationships = List.copyOf(Objects.requireNonNull(relationships, "relationships"));
    }
}
