package io.graphsync.projection;

import io.graphsync.aggregate.BusinessPersonSnapshot;
import io.graphsync.aggregate.GroupSnapshot;
import io.graphsync.aggregate.HealthAssociations;
import io.graphsync.aggregate.PrimaryPersonSnapshot;
import io.graphsync.testing.InMemoryGraphWriter;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static io.graphsync.testing.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphProjectorTest {

  private final InMemoryGraphWriter graph = new InMemoryGraphWriter();
  private final GraphProjector projector = new GraphProjector(graph);

  private static PrimaryPersonSnapshot person(HealthAssociations health) {
    return new PrimaryPersonSnapshot(primaryPerson("p1", "h1"), household("h1"), health,
        List.of(preference("pref-1", "cuisine", "italian")), List.of(budget("b1", "150.50")));
  }

  private static HealthAssociations health(List<io.graphsync.aggregate.ConditionLink> conditions) {
    return new HealthAssociations(profile("hp1"), conditions,
        List.of(allergen("a1", "peanut")), List.of(diet("d1", "vegan")));
  }

  @Test
  void projectsPrimaryPersonDocument() {
    projector.project(person(health(List.of(condition("c1", "diabetes")))));

    Map<String, Object> node = graph.node(NodeLabel.B2C_CUSTOMER, "p1").orElseThrow();
    assertEquals("Alex Smith", node.get("full_name"));
    assertEquals(true, node.get("is_profile_owner"));
    assertEquals(OffsetDateTime.of(2024, 3, 1, 10, 15, 30, 0, ZoneOffset.UTC), node.get("created_at"));
    assertFalse(node.containsKey("phone"));

    assertEquals(List.of("h1"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p1", RelationshipType.BELONGS_TO_HOUSEHOLD));
    assertEquals(List.of("hp1"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p1", RelationshipType.HAS_PROFILE));
    assertEquals(List.of("c1"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p1", RelationshipType.HAS_CONDITION));
    assertEquals(List.of("a1"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p1", RelationshipType.ALLERGIC_TO));
    assertEquals(List.of("d1"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p1", RelationshipType.FOLLOWS_DIET));
    assertEquals(List.of("pref-1"), graph.targetIds(NodeLabel.HOUSEHOLD, "h1", RelationshipType.HAS_PREFERENCE));
    assertEquals(List.of("b1"), graph.targetIds(NodeLabel.HOUSEHOLD, "h1", RelationshipType.HAS_BUDGET));

    assertEquals(150.5, graph.node(NodeLabel.HOUSEHOLD_BUDGET, "b1").orElseThrow().get("amount"));
    assertEquals("moderate", graph.edgesFrom(NodeLabel.B2C_CUSTOMER, "p1", RelationshipType.HAS_CONDITION)
        .get(0).properties().get("severity"));
  }

  @Test
  void replayingTheSameSnapshotIsIdempotent() {
    PrimaryPersonSnapshot snapshot = person(health(List.of(condition("c1", "diabetes"))));

    projector.project(snapshot);
    String first = graph.dump();
    projector.project(snapshot);

    assertEquals(first, graph.dump());
  }

  @Test
  void relationshipSetsAreReplacedNotMerged() {
    projector.project(person(health(List.of(condition("c1", "diabetes"), condition("c2", "hypertension")))));
    projector.project(person(health(List.of(condition("c1", "diabetes")))));

    assertEquals(List.of("c1"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p1", RelationshipType.HAS_CONDITION));
    // catalog nodes are shared and never deleted
    assertEquals(2, graph.nodeCount(NodeLabel.HEALTH_CONDITION));
  }

  @Test
  void missingProfileRemovesLinkAndProfileNode() {
    projector.project(person(health(List.of())));
    assertEquals(1, graph.nodeCount(NodeLabel.B2C_HEALTH_PROFILE));

    projector.project(person(new HealthAssociations(null, List.of(), List.of(), List.of())));

    assertTrue(graph.targetIds(NodeLabel.B2C_CUSTOMER, "p1", RelationshipType.HAS_PROFILE).isEmpty());
    assertEquals(0, graph.nodeCount(NodeLabel.B2C_HEALTH_PROFILE));
    assertTrue(graph.targetIds(NodeLabel.B2C_CUSTOMER, "p1", RelationshipType.FOLLOWS_DIET).isEmpty());
  }

  @Test
  void catalogNodesKeepExistingNameWhenSnapshotHasNone() {
    projector.project(person(health(List.of(condition("c1", "diabetes")))));
    projector.project(person(health(List.of(condition("c1", null)))));

    assertEquals("diabetes", graph.node(NodeLabel.HEALTH_CONDITION, "c1").orElseThrow().get("name"));
  }

  @Test
  void movingPersonToAnotherHouseholdDropsOldParentEdge() {
    projector.project(person(HealthAssociations.none()));
    projector.project(new PrimaryPersonSnapshot(primaryPerson("p1", "h2"), household("h2"),
        HealthAssociations.none(), List.of(), List.of()));

    assertEquals(List.of("h2"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p1", RelationshipType.BELONGS_TO_HOUSEHOLD));
    assertTrue(graph.node(NodeLabel.HOUSEHOLD, "h1").isPresent());
  }

  @Test
  void projectsBusinessPersonUnderVendor() {
    BusinessPersonSnapshot snapshot = new BusinessPersonSnapshot(businessPerson("bp1", "v1"), vendor("v1"),
        new HealthAssociations(profile("bhp1"), List.of(condition("c1", "diabetes")), List.of(), List.of()));

    GraphDocument document = projector.toDocument(snapshot);
    assertEquals(RelationshipType.BELONGS_TO_VENDOR, document.parent().type());
    assertEquals(MergeMode.KEEP_EXISTING, document.parent().merge());

    projector.project(snapshot);
    assertEquals(List.of("v1"), graph.targetIds(NodeLabel.B2B_CUSTOMER, "bp1", RelationshipType.BELONGS_TO_VENDOR));
    assertEquals(List.of("bhp1"), graph.targetIds(NodeLabel.B2B_CUSTOMER, "bp1", RelationshipType.HAS_PROFILE));
    assertTrue(graph.node(NodeLabel.B2B_HEALTH_PROFILE, "bhp1").isPresent());
    assertEquals("EXT-42", graph.node(NodeLabel.B2B_CUSTOMER, "bp1").orElseThrow().get("external_id"));
  }

  @Test
  void groupDocumentHasNoParentAndReplacesOwnedNodes() {
    projector.project(new GroupSnapshot(household("h1"),
        List.of(preference("pref-1", "cuisine", "italian"), preference("pref-2", "cuisine", "thai")),
        List.of(budget("b1", "100"))));
    projector.project(new GroupSnapshot(household("h1"),
        List.of(preference("pref-2", "cuisine", "thai")), List.of()));

    assertNull(projector.toDocument(new GroupSnapshot(household("h1"), List.of(), List.of())).parent());
    assertEquals(List.of("pref-2"), graph.targetIds(NodeLabel.HOUSEHOLD, "h1", RelationshipType.HAS_PREFERENCE));
    assertEquals(1, graph.nodeCount(NodeLabel.HOUSEHOLD_PREFERENCE));
    assertEquals(0, graph.nodeCount(NodeLabel.HOUSEHOLD_BUDGET));
  }

  @Test
  void failedWriteLeavesGraphUnchanged() {
    projector.project(person(health(List.of(condition("c1", "diabetes")))));
    String before = graph.dump();

    graph.failNextWrite("neo4j unavailable");
    assertThrows(GraphWriteException.class,
        () -> projector.project(person(health(List.of(condition("c2", "hypertension"))))));

    assertEquals(before, graph.dump());
  }

  @Test
  void relationshipSetRejectsMismatchedTargetLabel() {
    GraphEdge edge = new GraphEdge(new GraphNode(NodeLabel.ALLERGEN, "a1", Map.of()), Map.of());
    assertThrows(IllegalArgumentException.class, () -> new RelationshipSet(NodeLabel.B2C_CUSTOMER, "p1",
        RelationshipType.HAS_CONDITION, NodeLabel.HEALTH_CONDITION, MergeMode.KEEP_EXISTING, List.of(edge)));
  }
}
