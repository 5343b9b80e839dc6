package replay.jdbc;

import replay.LoadContext;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTemplateTest {
  private Connection conn;

  @BeforeEach
  void setup() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:tpl_" + UUID.randomUUID());
    conn = ds.getConnection();
    conn.createStatement().execute("CREATE TABLE t (id BIGINT PRIMARY KEY, payload VARBINARY(16))");
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  @Test
  void executeBatchCommitsAndCountsRows() throws SQLException {
    int affected = JdbcTemplate.executeBatch(LoadContext.background(), conn,
        List.of("INSERT INTO t VALUES (?, ?)", "INSERT INTO t VALUES (?, ?)"),
        List.of(List.of(1L, new byte[] {1}), List.of(2L, new byte[] {2})));

    assertEquals(2, affected);
    assertTrue(conn.getAutoCommit());
    assertEquals(List.of(1L, 2L), JdbcTemplate.query(LoadContext.background(), conn,
        "SELECT id FROM t ORDER BY id", rs -> rs.getLong(1)));
  }

  @Test
  void executeBatchRollsBackOnFailure() throws SQLException {
    assertThrows(SQLException.class, () -> JdbcTemplate.executeBatch(LoadContext.background(), conn,
        List.of("INSERT INTO t VALUES (1, NULL)", "INSERT INTO t VALUES (1, NULL)"), List.of()));

    assertTrue(conn.getAutoCommit());
    assertEquals(List.of(0L), JdbcTemplate.query(LoadContext.background(), conn,
        "SELECT COUNT(*) FROM t", rs -> rs.getLong(1)));
  }

  @Test
  void keepsCallerTransactionMode() throws SQLException {
    conn.setAutoCommit(false);

    JdbcTemplate.executeBatch(LoadContext.background(), conn, List.of("INSERT INTO t VALUES (1, NULL)"),
        List.of());

    assertFalse(conn.getAutoCommit());
  }

  @Test
  void queryRunsUnderContextDeadline() throws SQLException {
    LoadContext ctx = LoadContext.withTimeout(Duration.ofSeconds(30));

    List<Integer> one = JdbcTemplate.query(ctx, conn, "SELECT ?", rs -> rs.getInt(1), 1);

    assertEquals(List.of(1), one);
  }

  @Test
  void argumentListsMustMatchStatements() {
    assertThrows(IllegalArgumentException.class, () -> JdbcTemplate.executeBatch(
        LoadContext.background(), conn, List.of("SELECT 1"), List.of(List.of(), List.of())));
  }
}
