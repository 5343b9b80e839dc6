package replay.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import replay.ConnectionPoolException;
import replay.ErrorScope;
import replay.IdempotentOutcomeException;
import replay.LoadContext;
import replay.retry.RetryPolicy;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionPoolTest {

  @Test
  void opensOneConnectionPerWorker() {
    H2Provider provider = new H2Provider();

    try (ConnectionPool pool = ConnectionPool.builder()
        .connectionProvider(provider)
        .name("loader")
        .sourceId("src")
        .workerCount(4)
        .build()) {
      assertEquals(4, pool.size());
      assertEquals(4, provider.opened());
      Set<Connection> handles = new HashSet<>();
      for (DbConnection conn : pool.connections()) {
        assertEquals("loader", conn.name());
        assertEquals("src", conn.sourceId());
        handles.add(conn.handle());
      }
      assertEquals(4, handles.size());
      assertThrows(UnsupportedOperationException.class, () -> pool.connections().clear());
    }
    assertTrue(provider.closed);
  }

  @Test
  void failedConnectionReleasesEverything() throws SQLException {
    H2Provider provider = new H2Provider();
    provider.refuseAfter = 2;

    ConnectionPoolException e = assertThrows(ConnectionPoolException.class, () ->
        ConnectionPool.builder().connectionProvider(provider).workerCount(4).build());

    assertEquals(ErrorScope.DOWNSTREAM, e.scope());
    assertEquals("connection refused", e.getCause().getMessage());
    assertEquals(2, provider.forceClosed.get());
    for (Connection conn : provider.handedOut) {
      assertTrue(conn.isClosed());
    }
    assertTrue(provider.closed);
  }

  @Test
  void closeReleasesConnectionsAndIsIdempotent() throws SQLException {
    H2Provider provider = new H2Provider();
    ConnectionPool pool = ConnectionPool.builder().connectionProvider(provider).workerCount(2).build();

    pool.close();
    pool.close();

    for (Connection conn : provider.handedOut) {
      assertTrue(conn.isClosed());
    }
    for (DbConnection conn : pool.connections()) {
      assertEquals(ErrorScope.NOT_SET, conn.scope());
    }
  }

  @Test
  void createTableTwiceIsIdempotentOutcome() {
    TargetConfig target = TargetConfig.builder(
        "jdbc:h2:mem:pool_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1").build();

    try (ConnectionPool pool = ConnectionPool.create(target, "loader", "src", 2)) {
      assertEquals(2, pool.size());
      DbConnection first = pool.connection(0);
      DbConnection second = pool.connection(1);
      first.execute(LoadContext.background(), List.of("CREATE TABLE t (id INT PRIMARY KEY)"));

      IdempotentOutcomeException e = assertThrows(IdempotentOutcomeException.class, () ->
          second.execute(LoadContext.background(), List.of("CREATE TABLE t (id INT PRIMARY KEY)")));

      assertEquals(1, e.attempts());
      assertEquals(ErrorScope.DOWNSTREAM, e.scope());
    }
  }

  @Test
  void recoversThroughHikariAfterConnectionClosed() throws SQLException {
    TargetConfig target = TargetConfig.builder(
        "jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1").build();
    RecordingMetrics metrics = new RecordingMetrics();

    try (ConnectionPool pool = ConnectionPool.builder()
        .target(target)
        .workerCount(2)
        .metrics(metrics)
        .queryRetryPolicy(RetryPolicy.stable(3, Duration.ofMillis(1)))
        .build()) {
      assertInstanceOf(HikariDataSource.class,
          ((DataSourceConnectionProvider) pool.base()).dataSource());
      DbConnection conn = pool.connection(0);
      conn.handle().close();

      int one = conn.query(LoadContext.background(), "SELECT 1", rs -> rs.getInt(1)).get(0);

      assertEquals(1, one);
      assertEquals(1, metrics.resets.get());
      assertFalse(conn.handle().isClosed());
    }
  }

  @Test
  void unreachableTargetFailsConstruction() {
    TargetConfig target = TargetConfig.builder("jdbc:h2:tcp://127.0.0.1:1/nowhere")
        .connectTimeout(Duration.ofMillis(500))
        .build();

    ConnectionPoolException e = assertThrows(ConnectionPoolException.class, () ->
        ConnectionPool.create(target, "loader", "src", 1));

    assertEquals(ErrorScope.DOWNSTREAM, e.scope());
  }

  @Test
  void builderValidation() {
    H2Provider provider = new H2Provider();
    TargetConfig target = TargetConfig.builder("jdbc:h2:mem:x").build();

    assertThrows(IllegalArgumentException.class, () -> ConnectionPool.builder().build());
    assertThrows(IllegalArgumentException.class, () ->
        ConnectionPool.builder().target(target).connectionProvider(provider).build());
    assertThrows(IllegalArgumentException.class, () ->
        ConnectionPool.builder().connectionProvider(provider).workerCount(0).build());

    ConnectionPool.Builder builder = ConnectionPool.builder().connectionProvider(provider).workerCount(1);
    builder.build().close();
    assertThrows(IllegalStateException.class, builder::build);
  }
}
