package replay.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import replay.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} backed by a {@link DataSource}.
 *
 * <p>When the data source is a {@link HikariDataSource}, {@link #forceClose(Connection)}
 * evicts the connection from the Hikari pool so a broken physical connection is never
 * handed out again; otherwise the connection is simply closed.
 *
 * <p>Only data sources opened through {@link #open(TargetConfig, int)} are closed by
 * {@link #close()}; a data source passed to the constructor stays owned by the caller.
 *
 * @see ConnectionProvider
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;
  private final boolean owned;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this(dataSource, false);
  }

  private DataSourceConnectionProvider(DataSource dataSource, boolean owned) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.owned = owned;
  }

  /**
   * Opens a HikariCP pool for {@code target}, sized for {@code workerCount} workers.
   *
   * @throws RuntimeException if the pool cannot be initialized
   */
  public static DataSourceConnectionProvider open(TargetConfig target, int workerCount) {
    Objects.requireNonNull(target, "target");
    return new DataSourceConnectionProvider(new HikariDataSource(target.toHikariConfig(workerCount)), true);
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  @Override
  public void forceClose(Connection connection) throws SQLException {
    Objects.requireNonNull(connection, "connection");
    if (dataSource instanceof HikariDataSource hikari) {
      hikari.evictConnection(connection);
      return;
    }
    connection.close();
  }

  @Override
  public void close() throws SQLException {
    if (!owned) {
      return;
    }
    if (dataSource instanceof HikariDataSource hikari) {
      hikari.close();
    } else if (dataSource instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (SQLException e) {
        throw e;
      } catch (Exception e) {
        throw new SQLException("Failed to close data source", e);
      }
    }
  }
}
