package io.graphsync.neo4j;

import io.graphsync.projection.NodeLabel;
import io.graphsync.projection.RelationshipType;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Cypher statements used by {@link Neo4jGraphWriter}.
 *
 * <p>Labels and relationship types come from closed enums and are inlined; all values
 * are bound as parameters. Node identity is the {@code id} property.
 */
final class CypherTemplates {

    private static final String OWNED_TYPES = Arrays.stream(RelationshipType.values())
        .filter(RelationshipType::ownsTarget)
        .map(RelationshipType::name)
        .collect(Collectors.joining("|"));

    private CypherTemplates() {
    }

    /**
     * Uniqueness constraint on {@code id} for one label. Concurrent MERGEs of the same id
     * only converge on one node while this constraint exists.
     */
    static String uniqueIdConstraint(NodeLabel label) {
        return "CREATE CONSTRAINT " + constraintName(label) + " IF NOT EXISTS" +
            " FOR (n:" + label(label) + ") REQUIRE n.id IS UNIQUE";
    }

    static String constraintName(NodeLabel label) {
        return "graphsync_" + label.name().toLowerCase(Locale.ROOT) + "_id";
    }

    /**
     * Upserts one node. {@code $props} holds the properties to write; a {@code null} value
     * removes the stored property.
     */
    static String mergeNode(NodeLabel label) {
        return "MERGE (n:" + label(label) + " {id: $id}) SET n += $props";
    }

    /**
     * Removes edges of {@code type} from the child to parents other than {@code $parentId}.
     */
    static String unlinkOtherParents(NodeLabel child, RelationshipType type, NodeLabel parent) {
        return "MATCH (c:" + label(child) + " {id: $id})-[r:" + type.name() + "]->(p:" + label(parent) + ")" +
            " WHERE p.id <> $parentId DELETE r";
    }

    static String linkParent(NodeLabel child, RelationshipType type, NodeLabel parent) {
        return "MATCH (c:" + label(child) + " {id: $id}), (p:" + label(parent) + " {id: $parentId})" +
            " MERGE (c)-[:" + type.name() + "]->(p)";
    }

    /**
     * Deletes owned targets that are no longer in {@code $keep}.
     */
    static String deleteDroppedTargets(NodeLabel owner, RelationshipType type, NodeLabel target) {
        return "MATCH (o:" + label(owner) + " {id: $ownerId})-[:" + type.name() + "]->(t:" + label(target) + ")" +
            " WHERE NOT t.id IN $keep DETACH DELETE t";
    }

    static String deleteEdges(NodeLabel owner, RelationshipType type, NodeLabel target) {
        return "MATCH (o:" + label(owner) + " {id: $ownerId})-[r:" + type.name() + "]->(:" + label(target) + ")" +
            " DELETE r";
    }

    /**
     * Merges every target in {@code $edges} (maps of {@code id}, {@code props}, {@code rel})
     * and one edge per distinct target.
     */
    static String createEdges(NodeLabel owner, RelationshipType type, NodeLabel target) {
        return "MATCH (o:" + label(owner) + " {id: $ownerId})" +
            " UNWIND $edges AS edge" +
            " MERGE (t:" + label(target) + " {id: edge.id})" +
            " SET t += edge.props" +
            " MERGE (o)-[r:" + type.name() + "]->(t)" +
            " SET r += edge.rel";
    }

    /**
     * Detach-deletes a node together with the nodes it owns. Returns no row when the node
     * does not exist.
     */
    static String detachDelete(NodeLabel label) {
        return "MATCH (n:" + label(label) + " {id: $id})" +
            " OPTIONAL MATCH (n)-[:" + OWNED_TYPES + "]->(owned)" +
            " WITH n, collect(DISTINCT owned) AS owned" +
            " FOREACH (o IN owned | DETACH DELETE o)" +
            " DETACH DELETE n" +
            " RETURN size(owned) + 1 AS deleted";
    }

    private static String label(NodeLabel label) {
        return "`" + label.graphName() + "`";
    }
}
