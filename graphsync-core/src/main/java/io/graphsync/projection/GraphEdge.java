package io.graphsync.projection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One edge of a {@link RelationshipSet}: the target node and the edge's own properties.
 */
public record GraphEdge(GraphNode target, Map<String, Object> properties) {

    public GraphEdge {
        Objects.requireNonNull(target, "target");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(properties, "properties")));
    }
}
