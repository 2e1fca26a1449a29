package io.graphsync.neo4j;

import io.graphsync.projection.GraphDocument;
import io.graphsync.projection.GraphEdge;
import io.graphsync.projection.GraphNode;
import io.graphsync.projection.GraphWriteException;
import io.graphsync.projection.NodeLabel;
import io.graphsync.projection.ParentLink;
import io.graphsync.projection.RelationshipSet;
import io.graphsync.spi.GraphWriter;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.exceptions.Neo4jException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link GraphWriter} backed by the Neo4j Java driver.
 *
 * <p>Each call runs in one managed write transaction, so a document is applied
 * completely or not at all, and transient errors are retried by the driver.
 */
public final class Neo4jGraphWriter implements GraphWriter {
    private static final Logger logger = Logger.getLogger(Neo4jGraphWriter.class.getName());

    private final Driver driver;
    private final SessionConfig sessionConfig;

    public Neo4jGraphWriter(Driver driver) {
        this(driver, null);
    }

    /**
     * @param database target database, or {@code null} for the server default
     */
    public Neo4jGraphWriter(Driver driver, String database) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.sessionConfig = database == null || database.isBlank()
            ? SessionConfig.defaultConfig()
            : SessionConfig.forDatabase(database);
    }

    /**
     * Creates the {@code id} uniqueness constraint of every {@link NodeLabel} that does not
     * have one yet. Run once before the first write; consumers sharing a graph rely on it
     * to never create the same node twice.
     *
     * @throws GraphWriteException if a constraint cannot be created
     */
    public void ensureConstraints() {
        try (Session session = driver.session(sessionConfig)) {
            for (NodeLabel label : NodeLabel.values()) {
                session.executeWriteWithoutResult(tx -> tx.run(CypherTemplates.uniqueIdConstraint(label)).consume());
            }
        } catch (Neo4jException e) {
            throw new GraphWriteException("Failed to create graph constraints", e);
        }
        logger.info("Ensured id uniqueness constraints for " + NodeLabel.values().length + " node labels");
    }

    @Override
    public void upsert(GraphDocument document) {
        Objects.requireNonNull(document, "document");
        GraphNode primary = document.primary();
        try (Session session = driver.session(sessionConfig)) {
            session.executeWriteWithoutResult(tx -> apply(tx, document));
        } catch (Neo4jException e) {
            throw new GraphWriteException("Failed to upsert " + primary.label().graphName()
                + " " + primary.id(), e);
        }
    }

    @Override
    public int detachDelete(NodeLabel label, String id) {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(id, "id");
        try (Session session = driver.session(sessionConfig)) {
            int deleted = session.executeWrite(tx -> {
                Result result = tx.run(CypherTemplates.detachDelete(label), Map.of("id", id));
                return result.hasNext() ? result.next().get("deleted").asInt() : 0;
            });
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Detach-deleted " + label.graphName() + " " + id + " nodes=" + deleted);
            }
            return deleted;
        } catch (Neo4jException e) {
            throw new GraphWriteException("Failed to delete " + label.graphName() + " " + id, e);
        }
    }

    private void apply(TransactionContext tx, GraphDocument document) {
        GraphNode primary = document.primary();
        mergeNode(tx, primary, primary.properties());

        ParentLink parent = document.parent();
        if (parent != null) {
            GraphNode node = parent.node();
            mergeNode(tx, node, node.propertiesFor(parent.merge()));
            Map<String, Object> params = Map.of("id", primary.id(), "parentId", node.id());
            tx.run(CypherTemplates.unlinkOtherParents(primary.label(), parent.type(), node.label()), params).consume();
            tx.run(CypherTemplates.linkParent(primary.label(), parent.type(), node.label()), params).consume();
        }

        for (RelationshipSet set : document.relationships()) {
            replace(tx, set);
        }
    }

    private static void replace(TransactionContext tx, RelationshipSet set) {
        if (set.type().ownsTarget()) {
            tx.run(CypherTemplates.deleteDroppedTargets(set.ownerLabel(), set.type(), set.targetLabel()),
                Map.of("ownerId", set.ownerId(), "keep", set.targetIds())).consume();
        }
        tx.run(CypherTemplates.deleteEdges(set.ownerLabel(), set.type(), set.targetLabel()),
            Map.of("ownerId", set.ownerId())).consume();
        if (set.edges().isEmpty()) {
            return;
        }

        List<Map<String, Object>> edges = new ArrayList<>(set.edges().size());
        for (GraphEdge edge : set.edges()) {
            Map<String, Object> entry = new HashMap<>();
            entry.put("id", edge.target().id());
            entry.put("props", new HashMap<>(edge.target().propertiesFor(set.targetMerge())));
            entry.put("rel", new HashMap<>(edge.properties()));
            edges.add(entry);
        }
        Map<String, Object> params = new HashMap<>();
        params.put("ownerId", set.ownerId());
        params.put("edges", edges);
        tx.run(CypherTemplates.createEdges(set.ownerLabel(), set.type(), set.targetLabel()), params).consume();
    }

    private static void mergeNode(TransactionContext tx, GraphNode node, Map<String, Object> properties) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", node.id());
        params.put("props", new HashMap<>(properties));
        tx.run(CypherTemplates.mergeNode(node.label()), params).consume();
    }
}
