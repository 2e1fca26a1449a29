package io.graphsync.jdbc.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOutboxStoresTest {

  @Test
  void allReturnsBuiltInOutboxStores() {
    List<AbstractJdbcOutboxStore> stores = JdbcOutboxStores.all();

    assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
    assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertEquals("postgresql", JdbcOutboxStores.get("PostgreSQL").name());
    assertEquals("h2", JdbcOutboxStores.get("H2").name());
  }

  @Test
  void getByNameThrowsForUnknown() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcOutboxStores.get("oracle"));
    assertTrue(ex.getMessage().contains("Unknown outbox store"));
    assertTrue(ex.getMessage().contains("oracle"));
  }

  @Test
  void detectFromJdbcUrl() {
    assertEquals("postgresql", JdbcOutboxStores.detect("jdbc:postgresql://localhost:5432/app").name());
    assertEquals("h2", JdbcOutboxStores.detect("jdbc:h2:mem:test").name());
    assertEquals("h2", JdbcOutboxStores.detect("JDBC:H2:mem:upper").name());
  }

  @Test
  void detectFromJdbcUrlThrowsForUnsupportedDatabase() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcOutboxStores.detect("jdbc:mysql://localhost:3306/app"));
    assertTrue(ex.getMessage().contains("No outbox store found"));
    assertTrue(ex.getMessage().contains("jdbc:postgresql:"));
  }

  @Test
  void detectFromJdbcUrlThrowsForNullOrEmpty() {
    assertThrows(IllegalArgumentException.class, () -> JdbcOutboxStores.detect((String) null));
    assertThrows(IllegalArgumentException.class, () -> JdbcOutboxStores.detect(""));
  }

  @Test
  void detectWithDefaultTableReturnsRegisteredInstance() {
    AbstractJdbcOutboxStore registered = JdbcOutboxStores.detect("jdbc:h2:mem:test");

    assertSame(registered, JdbcOutboxStores.detect("jdbc:h2:mem:test", "outbox_events"));
    assertEquals("outbox_events", registered.tableName());
  }

  @Test
  void detectWithCustomTableBindsNewInstance() {
    AbstractJdbcOutboxStore store = JdbcOutboxStores.detect("jdbc:postgresql://db/app", "graph_outbox");

    assertInstanceOf(PostgresOutboxStore.class, store);
    assertEquals("graph_outbox", store.tableName());
    assertNotSame(JdbcOutboxStores.get("postgresql"), store);
  }

  @Test
  void detectWithInvalidTableNameFails() {
    assertThrows(IllegalArgumentException.class,
        () -> JdbcOutboxStores.detect("jdbc:h2:mem:test", "outbox events"));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:store_detect;DB_CLOSE_DELAY=-1");

    assertEquals("h2", JdbcOutboxStores.detect(ds).name());
    assertEquals("custom_outbox", JdbcOutboxStores.detect(ds, "custom_outbox").tableName());
  }

  @Test
  void detectFromUnreachableDataSourceThrowsIllegalState() {
    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> JdbcOutboxStores.detect(new UnreachableDataSource()));
    assertInstanceOf(SQLException.class, ex.getCause());
  }

  private static final class UnreachableDataSource implements DataSource {
    @Override
    public Connection getConnection() throws SQLException {
      throw new SQLException("connection refused");
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
      return getConnection();
    }

    @Override
    public PrintWriter getLogWriter() {
      return null;
    }

    @Override
    public void setLogWriter(PrintWriter out) {
    }

    @Override
    public void setLoginTimeout(int seconds) {
    }

    @Override
    public int getLoginTimeout() {
      return 0;
    }

    @Override
    public Logger getParentLogger() {
      return null;
    }

    @Override
    public <T> T unwrap(Class<T> iface) {
      return null;
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) {
      return false;
    }
  }
}
