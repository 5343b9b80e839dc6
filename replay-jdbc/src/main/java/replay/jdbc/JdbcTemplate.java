package replay.jdbc;

import replay.LoadContext;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight JDBC helper for single attempts of a replayed statement.
 *
 * <p>Every statement is bounded by the remaining deadline of the {@link LoadContext} and
 * cancelled through {@link Statement#cancel()} when the context is cancelled while the
 * statement runs. Errors are propagated as raw {@link SQLException}s so the retry loop
 * can classify them.
 */
public final class JdbcTemplate {
  private static final Logger logger = Logger.getLogger(JdbcTemplate.class.getName());

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(LoadContext ctx, Connection conn, String sql,
      RowMapper<T> mapper, Object... params) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql);
         LoadContext.Registration ignored = ctx.onCancel(() -> cancelStatement(ps))) {
      applyTimeout(ctx, ps);
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    }
  }

  /**
   * Executes {@code statements} in one transaction. The transaction is rolled back if
   * any statement fails; a failed rollback is attached to the original error as
   * suppressed.
   *
   * @param args bind arguments per statement; empty when no statement takes arguments,
   *             otherwise one entry per statement
   * @return total number of rows affected
   */
  public static int executeBatch(LoadContext ctx, Connection conn, List<String> statements,
      List<List<Object>> args) throws SQLException {
    if (!args.isEmpty() && args.size() != statements.size()) {
      throw new IllegalArgumentException("Expected " + statements.size()
          + " argument lists, got: " + args.size());
    }
    boolean autoCommit = conn.getAutoCommit();
    if (autoCommit) {
      conn.setAutoCommit(false);
    }
    try {
      int affected = 0;
      for (int i = 0; i < statements.size(); i++) {
        Object[] params = args.isEmpty() ? new Object[0] : args.get(i).toArray();
        affected += update(ctx, conn, statements.get(i), params);
      }
      conn.commit();
      return affected;
    } catch (SQLException | RuntimeException e) {
      try {
        conn.rollback();
      } catch (SQLException re) {
        e.addSuppressed(re);
      }
      throw e;
    } finally {
      if (autoCommit) {
        restoreAutoCommit(conn);
      }
    }
  }

  /** Execute UPDATE, return rows affected. */
  public static int update(LoadContext ctx, Connection conn, String sql, Object... params)
      throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql);
         LoadContext.Registration ignored = ctx.onCancel(() -> cancelStatement(ps))) {
      applyTimeout(ctx, ps);
      bindParams(ps, params);
      return ps.executeUpdate();
    }
  }

  private static void applyTimeout(LoadContext ctx, Statement st) throws SQLException {
    Optional<Duration> left = ctx.remaining();
    if (left.isPresent()) {
      long seconds = (left.get().toMillis() + 999) / 1000;
      st.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, Math.max(1L, seconds)));
    }
  }

  private static void cancelStatement(Statement st) {
    try {
      st.cancel();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Statement cancel failed", e);
    }
  }

  private static void restoreAutoCommit(Connection conn) {
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      // the connection is broken; the next attempt recovers it
      logger.log(Level.FINE, "Failed to restore auto-commit", e);
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else if (param instanceof byte[] bytes) {
        ps.setBytes(i + 1, bytes);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
