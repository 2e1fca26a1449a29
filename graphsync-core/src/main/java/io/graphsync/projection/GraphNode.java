package io.graphsync.projection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node to upsert, identified by label and id.
 *
 * @param properties scalar properties; values may be {@code null}
 */
public record GraphNode(NodeLabel label, String id, Map<String, Object> properties) {

    public GraphNode {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(id, "id");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(
            Objects.requireNonNull(properties, "properties")));
    }

    /**
     * Returns the properties to write under the given merge mode.
     */
    public Map<String, Object> propertiesFor(MergeMode mode) {
        if (mode == MergeMode.OVERWRITE) {
            return properties;
        }
        Map<String, Object> present = new LinkedHashMap<>();
        properties.forEach((key, value) -> {
            if (value != null) {
                present.put(key, value);
            }
        });
        return Collections.unmodifiableMap(present);
    }
}
