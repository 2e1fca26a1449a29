package io.graphsync.spi;

import io.graphsync.projection.GraphDocument;
import io.graphsync.projection.NodeLabel;

/**
 * Write access to the graph store.
 *
 * <p>Each call is one atomic graph transaction: either every step becomes visible or
 * none does. Failures are reported as {@link io.graphsync.projection.GraphWriteException}.
 *
 * @see io.graphsync.neo4j.Neo4jGraphWriter
 */
public interface GraphWriter {

    /**
     * Applies a projection document: upserts the primary and parent nodes, links the
     * primary node to its parent, then replaces every relationship set in the document.
     *
     * <p>Replacing a set deletes all existing edges of that type from the owner to nodes
     * of the set's target label before creating the document's edges. Targets owned by
     * the relationship ({@link io.graphsync.projection.RelationshipType#ownsTarget()})
     * that are no longer referenced are deleted.
     *
     * @param document the document to apply
     */
    void upsert(GraphDocument document);

    /**
     * Deletes a node, all of its relationships, and the nodes it owns.
     *
     * @param label node label
     * @param id    node id
     * @return the number of nodes deleted, including owned nodes
     */
    int detachDelete(NodeLabel label, String id);
}
