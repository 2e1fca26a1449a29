package io.graphsync.jdbc;

import io.graphsync.aggregate.AggregateLoader;
import io.graphsync.consumer.OutboxConsumer;
import io.graphsync.dispatch.AggregateDispatcher;
import io.graphsync.dispatch.TombstoneHandler;
import io.graphsync.failed.FailedEventManager;
import io.graphsync.jdbc.reader.JdbcAggregateReader;
import io.graphsync.jdbc.store.H2OutboxStore;
import io.graphsync.model.ChangeOp;
import io.graphsync.model.EventStatus;
import io.graphsync.model.OutboxEvent;
import io.graphsync.projection.GraphProjector;
import io.graphsync.projection.NodeLabel;
import io.graphsync.projection.RelationshipType;
import io.graphsync.testing.InMemoryGraphWriter;
import io.graphsync.testing.RecordingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the consumer against H2 source tables and an in-memory graph.
 */
class ConsumerProjectionTest {

  private DataSource dataSource;
  private H2OutboxStore store;
  private SeedData seed;
  private InMemoryGraphWriter graph;
  private RecordingMetrics metrics;
  private OutboxConsumer consumer;

  @BeforeEach
  void setUp() {
    dataSource = TestDatabases.h2();
    store = new H2OutboxStore();
    seed = new SeedData(dataSource);
    graph = new InMemoryGraphWriter();
    metrics = new RecordingMetrics();

    DataSourceConnectionProvider connections = new DataSourceConnectionProvider(dataSource);
    AggregateLoader loader = new AggregateLoader(connections, new JdbcAggregateReader());
    AggregateDispatcher dispatcher = AggregateDispatcher.standard(
        loader, new GraphProjector(graph), new TombstoneHandler(graph));
    consumer = OutboxConsumer.builder()
        .connectionProvider(connections)
        .outboxStore(store)
        .dispatcher(dispatcher)
        .metrics(metrics)
        .maxAttempts(3)
        .pollInterval(Duration.ofMillis(50))
        .ownerId("it-consumer")
        .build();

    seed.household("h-1", "The Smiths")
        .primaryPerson("p-1", "h-1", "Alex Smith")
        .catalog("health_conditions", "c-diabetes", "Type 2 Diabetes")
        .catalog("health_conditions", "c-hypertension", "Hypertension")
        .catalog("dietary_preferences", "d-vegan", "Vegan")
        .profile("b2c_customer", "hp-1", "p-1", 70.0)
        .condition("b2c_customer", "p-1", "c-diabetes", "moderate")
        .diet("b2c_customer", "p-1", "d-vegan");
  }

  private long emit(String table, String type, String id, ChangeOp op) throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      return store.insert(conn, table, type, id, op, Instant.now());
    }
  }

  private OutboxEvent event(long id) throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      return store.findById(conn, id).orElseThrow();
    }
  }

  @Test
  void projectsPersonAndFollowsHealthChanges() throws Exception {
    long first = emit("b2c_customers", "b2c_customer", "p-1", ChangeOp.INSERT);

    assertEquals(1, consumer.pollOnce());

    assertEquals(EventStatus.PROCESSED, event(first).status());
    Map<String, Object> person = graph.node(NodeLabel.B2C_CUSTOMER, "p-1").orElseThrow();
    assertEquals("Alex Smith", person.get("full_name"));
    assertEquals(List.of("h-1"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p-1", RelationshipType.BELONGS_TO_HOUSEHOLD));
    assertEquals(List.of("c-diabetes"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p-1", RelationshipType.HAS_CONDITION));
    assertEquals(List.of("d-vegan"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p-1", RelationshipType.FOLLOWS_DIET));
    assertEquals(List.of("hp-1"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p-1", RelationshipType.HAS_PROFILE));

    seed.condition("b2c_customer", "p-1", "c-hypertension", "mild");
    TestDatabases.execute(dataSource,
        "DELETE FROM b2c_customer_dietary_preferences WHERE b2c_customer_id = ?", "p-1");
    emit("b2c_customer_health_conditions", "b2c_customer", "p-1", ChangeOp.INSERT);

    assertEquals(1, consumer.pollOnce());

    assertEquals(List.of("c-diabetes", "c-hypertension"),
        graph.targetIds(NodeLabel.B2C_CUSTOMER, "p-1", RelationshipType.HAS_CONDITION));
    assertTrue(graph.targetIds(NodeLabel.B2C_CUSTOMER, "p-1", RelationshipType.FOLLOWS_DIET).isEmpty());
    assertEquals("Vegan", graph.node(NodeLabel.DIETARY_PREFERENCE, "d-vegan").orElseThrow().get("name"));
    assertEquals(1, graph.nodeCount(NodeLabel.B2C_CUSTOMER));
    assertEquals(2, metrics.projected.get());
  }

  @Test
  void addedConditionKeepsExistingConditionAndDiet() throws Exception {
    emit("b2c_customers", "b2c_customer", "p-1", ChangeOp.INSERT);
    assertEquals(1, consumer.pollOnce());
    assertEquals(1, graph.nodeCount(NodeLabel.HEALTH_CONDITION));

    seed.condition("b2c_customer", "p-1", "c-hypertension", "mild");
    long update = emit("b2c_customer_health_conditions", "b2c_customer", "p-1", ChangeOp.UPDATE);

    assertEquals(1, consumer.pollOnce());

    assertEquals(EventStatus.PROCESSED, event(update).status());
    List<InMemoryGraphWriter.Edge> conditions =
        graph.edgesFrom(NodeLabel.B2C_CUSTOMER, "p-1", RelationshipType.HAS_CONDITION);
    assertEquals(2, conditions.size());
    assertEquals(List.of("c-diabetes", "c-hypertension"),
        graph.targetIds(NodeLabel.B2C_CUSTOMER, "p-1", RelationshipType.HAS_CONDITION));
    assertEquals(2, graph.nodeCount(NodeLabel.HEALTH_CONDITION));
    assertEquals("Type 2 Diabetes", graph.node(NodeLabel.HEALTH_CONDITION, "c-diabetes").orElseThrow().get("name"));
    assertEquals(List.of("d-vegan"), graph.targetIds(NodeLabel.B2C_CUSTOMER, "p-1", RelationshipType.FOLLOWS_DIET));
    assertEquals(1, graph.nodeCount(NodeLabel.DIETARY_PREFERENCE));
  }

  @Test
  void deletedPersonIsRemovedFromTheGraph() throws Exception {
    emit("b2c_customers", "b2c_customer", "p-1", ChangeOp.INSERT);
    consumer.pollOnce();
    assertTrue(graph.node(NodeLabel.B2C_HEALTH_PROFILE, "hp-1").isPresent());

    TestDatabases.execute(dataSource, "DELETE FROM b2c_customer_health_profiles WHERE b2c_customer_id = ?", "p-1");
    TestDatabases.execute(dataSource, "DELETE FROM b2c_customers WHERE id = ?", "p-1");
    long delete = emit("b2c_customers", "b2c_customer", "p-1", ChangeOp.DELETE);

    assertEquals(1, consumer.pollOnce());

    assertEquals(EventStatus.PROCESSED, event(delete).status());
    assertTrue(graph.node(NodeLabel.B2C_CUSTOMER, "p-1").isEmpty());
    assertTrue(graph.node(NodeLabel.B2C_HEALTH_PROFILE, "hp-1").isEmpty());
    assertTrue(graph.node(NodeLabel.HOUSEHOLD, "h-1").isPresent());
    assertTrue(graph.node(NodeLabel.HEALTH_CONDITION, "c-diabetes").isPresent());
    assertEquals(1, metrics.tombstoned.get());
  }

  @Test
  void updateForMissingRowIsAcknowledgedWithoutWriting() throws Exception {
    long update = emit("b2c_customers", "b2c_customer", "p-unknown", ChangeOp.UPDATE);

    assertEquals(1, consumer.pollOnce());

    assertEquals(EventStatus.PROCESSED, event(update).status());
    assertEquals(0, graph.nodeCount());
    assertEquals(1, metrics.skipped.get());
  }

  @Test
  void graphOutageRetriesThenFailsAndCanBeReplayed() throws Exception {
    long id = emit("households", "household", "h-1", ChangeOp.UPDATE);
    FailedEventManager failed = new FailedEventManager(new DataSourceConnectionProvider(dataSource), store);

    for (int attempt = 1; attempt <= 3; attempt++) {
      graph.failNextWrite("graph unavailable");
      assertEquals(1, consumer.pollOnce());
    }

    OutboxEvent exhausted = event(id);
    assertEquals(EventStatus.FAILED, exhausted.status());
    assertEquals(3, exhausted.attempts());
    assertTrue(exhausted.lastError().contains("graph unavailable"));
    assertEquals(0, consumer.pollOnce());
    assertEquals(1, failed.count("household"));

    assertTrue(failed.replay(id));
    assertEquals(1, consumer.pollOnce());
    assertEquals(EventStatus.PROCESSED, event(id).status());
    assertEquals("The Smiths", graph.node(NodeLabel.HOUSEHOLD, "h-1").orElseThrow().get("household_name"));
  }

  @Test
  void unknownAggregateTypeIsAcknowledged() throws Exception {
    long id = emit("invoices", "invoice", "inv-1", ChangeOp.INSERT);

    assertEquals(1, consumer.pollOnce());

    assertEquals(EventStatus.PROCESSED, event(id).status());
    assertEquals(0, graph.nodeCount());
  }
}
