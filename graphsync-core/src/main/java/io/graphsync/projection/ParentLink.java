package io.graphsync.projection;

import java.util.Objects;

/**
 * The grouping node a primary node belongs to. A primary node belongs to at most one
 * parent per relationship type.
 */
public record ParentLink(GraphNode node, RelationshipType type, MergeMode merge) {

    public ParentLink {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(merge, "merge");
    }
}
