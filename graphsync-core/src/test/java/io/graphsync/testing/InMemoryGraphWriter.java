package io.graphsync.testing;

import io.graphsync.projection.GraphDocument;
import io.graphsync.projection.GraphEdge;
import io.graphsync.projection.GraphNode;
import io.graphsync.projection.GraphWriteException;
import io.graphsync.projection.MergeMode;
import io.graphsync.projection.NodeLabel;
import io.graphsync.projection.ParentLink;
import io.graphsync.projection.RelationshipSet;
import io.graphsync.projection.RelationshipType;
import io.graphsync.spi.GraphWriter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * GraphWriter double that applies documents to an in-memory property graph with the same
 * MERGE / SET semantics as the Neo4j writer. Every call is atomic: a failure leaves the
 * graph unchanged.
 */
public final class InMemoryGraphWriter implements GraphWriter {

  /** A directed relationship. */
  public record Edge(RelationshipType type, NodeLabel fromLabel, String fromId,
                     NodeLabel toLabel, String toId, Map<String, Object> properties) {}

  private Map<NodeLabel, Map<String, Map<String, Object>>> nodes = new EnumMap<>(NodeLabel.class);
  private List<Edge> edges = new ArrayList<>();
  private RuntimeException nextFailure;
  private final AtomicInteger upserts = new AtomicInteger();

  /** Makes the next write fail with a {@link GraphWriteException} once its primary and parent nodes are merged. */
  public synchronized void failNextWrite(String message) {
    this.nextFailure = new GraphWriteException(message, new IllegalStateException(message));
  }

  public int upsertCount() {
    return upserts.get();
  }

  @Override
  public synchronized void upsert(GraphDocument document) {
    Map<NodeLabel, Map<String, Map<String, Object>>> savedNodes = copyNodes();
    List<Edge> savedEdges = new ArrayList<>(edges);
    try {
      mergeNode(document.primary(), MergeMode.OVERWRITE);
      ParentLink parent = document.parent();
      if (parent != null) {
        mergeNode(parent.node(), parent.merge());
        GraphNode primary = document.primary();
        edges.removeIf(e -> e.type() == parent.type()
            && e.fromLabel() == primary.label() && e.fromId().equals(primary.id())
            && e.toLabel() == parent.node().label() && !e.toId().equals(parent.node().id()));
        mergeEdge(parent.type(), primary, parent.node(), Map.of());
      }
      for (RelationshipSet set : document.relationships()) {
        checkFailure();
        replace(set);
      }
      upserts.incrementAndGet();
    } catch (RuntimeException e) {
      nodes = savedNodes;
      edges = savedEdges;
      throw e;
    }
  }

  @Override
  public synchronized int detachDelete(NodeLabel label, String id) {
    checkFailure();
    if (!nodes.getOrDefault(label, Map.of()).containsKey(id)) {
      return 0;
    }
    int deleted = 0;
    for (Edge edge : List.copyOf(edges)) {
      if (edge.type().ownsTarget() && edge.fromLabel() == label && edge.fromId().equals(id)) {
        deleted += deleteNode(edge.toLabel(), edge.toId());
      }
    }
    return deleted + deleteNode(label, id);
  }

  private void replace(RelationshipSet set) {
    if (!nodes.getOrDefault(set.ownerLabel(), Map.of()).containsKey(set.ownerId())) {
      return; // MATCH on a missing owner matches nothing
    }
    List<Edge> existing = edges.stream()
        .filter(e -> e.type() == set.type() && e.fromLabel() == set.ownerLabel()
            && e.fromId().equals(set.ownerId()) && e.toLabel() == set.targetLabel())
        .toList();
    edges.removeAll(existing);
    if (set.type().ownsTarget()) {
      Set<String> keep = new HashSet<>(set.targetIds());
      for (Edge edge : existing) {
        if (!keep.contains(edge.toId())) {
          deleteNode(edge.toLabel(), edge.toId());
        }
      }
    }
    GraphNode owner = new GraphNode(set.ownerLabel(), set.ownerId(), Map.of());
    for (GraphEdge edge : set.edges()) {
      mergeNode(edge.target(), set.targetMerge());
      mergeEdge(set.type(), owner, edge.target(), edge.properties());
    }
  }

  private void mergeNode(GraphNode node, MergeMode mode) {
    Map<String, Object> props = nodes.computeIfAbsent(node.label(), l -> new LinkedHashMap<>())
        .computeIfAbsent(node.id(), id -> {
          Map<String, Object> created = new LinkedHashMap<>();
          created.put("id", id);
          return created;
        });
    node.propertiesFor(mode).forEach((key, value) -> {
      if (value == null) {
        props.remove(key);
      } else {
        props.put(key, value);
      }
    });
  }

  private void mergeEdge(RelationshipType type, GraphNode from, GraphNode to, Map<String, Object> properties) {
    edges.removeIf(e -> e.type() == type && e.fromLabel() == from.label() && e.fromId().equals(from.id())
        && e.toLabel() == to.label() && e.toId().equals(to.id()));
    Map<String, Object> props = new LinkedHashMap<>();
    properties.forEach((key, value) -> {
      if (value != null) {
        props.put(key, value);
      }
    });
    edges.add(new Edge(type, from.label(), from.id(), to.label(), to.id(), props));
  }

  private int deleteNode(NodeLabel label, String id) {
    Map<String, Map<String, Object>> byId = nodes.get(label);
    if (byId == null || byId.remove(id) == null) {
      return 0;
    }
    edges.removeIf(e -> (e.fromLabel() == label && e.fromId().equals(id))
        || (e.toLabel() == label && e.toId().equals(id)));
    return 1;
  }

  private void checkFailure() {
    RuntimeException failure = nextFailure;
    if (failure != null) {
      nextFailure = null;
      throw failure;
    }
  }

  private Map<NodeLabel, Map<String, Map<String, Object>>> copyNodes() {
    Map<NodeLabel, Map<String, Map<String, Object>>> copy = new EnumMap<>(NodeLabel.class);
    nodes.forEach((label, byId) -> {
      Map<String, Map<String, Object>> ids = new LinkedHashMap<>();
      byId.forEach((id, props) -> ids.put(id, new LinkedHashMap<>(props)));
      copy.put(label, ids);
    });
    return copy;
  }

  // --- queries ---

  public synchronized Optional<Map<String, Object>> node(NodeLabel label, String id) {
    Map<String, Object> props = nodes.getOrDefault(label, Map.of()).get(id);
    return props == null ? Optional.empty() : Optional.of(Map.copyOf(props));
  }

  public synchronized int nodeCount(NodeLabel label) {
    return nodes.getOrDefault(label, Map.of()).size();
  }

  public synchronized int nodeCount() {
    return nodes.values().stream().mapToInt(Map::size).sum();
  }

  public synchronized List<Edge> edgesFrom(NodeLabel label, String id, RelationshipType type) {
    return edges.stream()
        .filter(e -> e.type() == type && e.fromLabel() == label && e.fromId().equals(id))
        .toList();
  }

  public synchronized List<String> targetIds(NodeLabel label, String id, RelationshipType type) {
    return edgesFrom(label, id, type).stream().map(Edge::toId).sorted().toList();
  }

  public synchronized int edgeCount() {
    return edges.size();
  }

  /** Full graph state, for comparing two points in time. */
  public synchronized String dump() {
    List<String> lines = new ArrayList<>();
    nodes.forEach((label, byId) -> byId.forEach((id, props) -> lines.add(label + " " + new TreeMap<>(props))));
    edges.forEach(e -> lines.add(e.fromLabel() + ":" + e.fromId() + " -" + e.type() + "-> "
        + e.toLabel() + ":" + e.toId() + " " + new TreeMap<>(e.properties())));
    lines.sort(null);
    return String.join("\n", lines);
  }
}
