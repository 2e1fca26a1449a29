package io.graphsync.projection;

import java.util.List;
import java.util.Objects;

/**
 * The complete current set of one relationship type from one owner node.
 *
 * <p>Applying a set replaces whatever edges of {@code type} the owner has towards
 * {@code targetLabel} nodes. An empty set therefore removes them all.
 *
 * @param targetMerge merge mode used when upserting the target nodes
 */
public record RelationshipSet(
    NodeLabel ownerLabel,
    String ownerId,
    RelationshipType type,
    NodeLabel targetLabel,
    MergeMode targetMerge,
    List<GraphEdge> edges
) {

    public RelationshipSet {
        Objects.requireNonNull(ownerLabel, "ownerLabel");
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(targetLabel, "targetLabel");
        Objects.requireNonNull(targetMerge, "targetMerge");
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
        for (GraphEdge edge : edges) {
            if (edge.target().label() != targetLabel) {
                throw new IllegalArgumentException("edge target " + edge.target().label()
                    + " does not match " + targetLabel);
            }
        }
    }

    /**
     * Ids of the target nodes, in edge order.
     */
    public List<String> targetIds() {
        return edges.stream().map(edge -> edge.target().id()).toList();
    }
}
