package replay.jdbc;

import replay.ConnectionPoolException;
import replay.jdbc.dialect.Dialects;
import replay.retry.RetryPolicy;
import replay.spi.ConnectionProvider;
import replay.spi.ErrorClassifier;
import replay.spi.FaultInjector;
import replay.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed set of {@link DbConnection}s opened from one shared {@link ConnectionProvider},
 * one per loader worker.
 *
 * <p>Construction is all-or-nothing: either exactly {@code workerCount} connections are
 * opened, or everything opened so far is released and a {@link ConnectionPoolException}
 * is thrown. The pool never grows or shrinks afterwards.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (ConnectionPool pool = ConnectionPool.builder()
 *     .target(TargetConfig.builder("jdbc:mysql://tidb:4000/").user("root").build())
 *     .name("loader")
 *     .sourceId("mysql-replica-01")
 *     .workerCount(16)
 *     .build()) {
 *   DbConnection conn = pool.connection(0);
 *   conn.execute(ctx, List.of("CREATE TABLE t (id INT PRIMARY KEY)"));
 * }
 * }</pre>
 */
public final class ConnectionPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionPool.class.getName());

  private final ConnectionProvider base;
  private final List<DbConnection> connections;
  private final AtomicBoolean closed = new AtomicBoolean();

  private ConnectionPool(ConnectionProvider base, List<DbConnection> connections) {
    this.base = base;
    this.connections = Collections.unmodifiableList(connections);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Opens a pool against {@code target} with the default policies and no metrics.
   *
   * @throws ConnectionPoolException if the target or any connection cannot be opened
   */
  public static ConnectionPool create(TargetConfig target, String name, String sourceId, int workerCount) {
    return builder()
        .target(target)
        .name(name)
        .sourceId(sourceId)
        .workerCount(workerCount)
        .build();
  }

  /** All connections, in worker order. */
  public List<DbConnection> connections() {
    return connections;
  }

  public DbConnection connection(int index) {
    return connections.get(index);
  }

  public int size() {
    return connections.size();
  }

  ConnectionProvider base() {
    return base;
  }

  /**
   * Closes every connection, then the shared provider. Failures are logged and do not
   * stop the remaining releases. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (DbConnection conn : connections) {
      try {
        conn.close();
      } catch (SQLException | RuntimeException e) {
        logger.log(Level.WARNING, "Failed to close connection " + conn.name(), e);
      }
    }
    closeQuietly(base);
  }

  private static void closeQuietly(ConnectionProvider base) {
    try {
      base.close();
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close base connection provider", e);
    }
  }

  /** Replaces a broken connection with a fresh one from the shared provider. */
  private static final class ProviderRecovery implements ConnectionRecovery {
    private final ConnectionProvider base;

    ProviderRecovery(ConnectionProvider base) {
      this.base = base;
    }

    @Override
    public Connection recover(Connection current) throws SQLException {
      if (current != null) {
        try {
          base.forceClose(current);
        } catch (SQLException | RuntimeException e) {
          logger.log(Level.WARNING, "Failed to close connection during reset", e);
        }
      }
      return base.getConnection();
    }
  }

  /**
   * Builder for {@link ConnectionPool}. Exactly one of {@link #target(TargetConfig)} and
   * {@link #connectionProvider(ConnectionProvider)} must be set.
   */
  public static final class Builder {
    private TargetConfig target;
    private ConnectionProvider connectionProvider;
    private String name = "loader";
    private String sourceId = "";
    private int workerCount = 16;
    private ErrorClassifier errorClassifier;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private FaultInjector faultInjector = FaultInjector.NONE;
    private RetryPolicy queryRetryPolicy = RetryPolicy.QUERY_DEFAULT;
    private RetryPolicy executeRetryPolicy = RetryPolicy.EXECUTE_DEFAULT;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Sets the target database; the pool opens and owns a HikariCP data source for it.
     */
    public Builder target(TargetConfig target) {
      this.target = target;
      return this;
    }

    /**
     * Sets an existing connection source. The pool closes it on {@link ConnectionPool#close()};
     * a {@link DataSourceConnectionProvider} wrapping a caller-owned data source leaves that
     * data source open.
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** Display name used in logs and metric tags. Defaults to {@code "loader"}. */
    public Builder name(String name) {
      this.name = Objects.requireNonNull(name, "name");
      return this;
    }

    /** Migration source id used in logs and metric tags. Defaults to empty. */
    public Builder sourceId(String sourceId) {
      this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
      return this;
    }

    /** Number of connections to open. Defaults to 16. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the error classifier.
     *
     * <p>Optional. Defaults to the classifier of the dialect matching the target URL, or
     * the generic classifier.
     */
    public Builder errorClassifier(ErrorClassifier errorClassifier) {
      this.errorClassifier = errorClassifier;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    /** Test hook. Defaults to {@link FaultInjector#NONE}. */
    public Builder faultInjector(FaultInjector faultInjector) {
      this.faultInjector = Objects.requireNonNull(faultInjector, "faultInjector");
      return this;
    }

    public Builder queryRetryPolicy(RetryPolicy queryRetryPolicy) {
      this.queryRetryPolicy = Objects.requireNonNull(queryRetryPolicy, "queryRetryPolicy");
      return this;
    }

    public Builder executeRetryPolicy(RetryPolicy executeRetryPolicy) {
      this.executeRetryPolicy = Objects.requireNonNull(executeRetryPolicy, "executeRetryPolicy");
      return this;
    }

    /**
     * Opens the pool.
     *
     * @throws ConnectionPoolException  if the target or any connection cannot be opened
     * @throws IllegalArgumentException if the configuration is invalid
     * @throws IllegalStateException    if build() was already called on this builder
     */
    public ConnectionPool build() {
      if ((target == null) == (connectionProvider == null)) {
        throw new IllegalArgumentException("Exactly one of target and connectionProvider must be set");
      }
      if (workerCount < 1) {
        throw new IllegalArgumentException("workerCount must be >= 1, got: " + workerCount);
      }
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }

      ErrorClassifier classifier = errorClassifier;
      if (classifier == null) {
        classifier = Dialects.classifierFor(target != null ? target.jdbcUrl() : null);
      }
      ConnectionSettings settings = new ConnectionSettings(classifier, metrics, faultInjector,
          queryRetryPolicy, executeRetryPolicy);

      ConnectionProvider base = connectionProvider;
      if (base == null) {
        try {
          base = DataSourceConnectionProvider.open(target, workerCount);
        } catch (RuntimeException e) {
          throw new ConnectionPoolException("failed to open target database " + target.jdbcUrl(), e);
        }
      }

      ConnectionRecovery recovery = new ProviderRecovery(base);
      List<DbConnection> connections = new ArrayList<>(workerCount);
      for (int i = 0; i < workerCount; i++) {
        Connection handle;
        try {
          handle = base.getConnection();
        } catch (SQLException | RuntimeException e) {
          discard(base, connections);
          throw new ConnectionPoolException(
              "failed to open connection " + (i + 1) + " of " + workerCount, e);
        }
        connections.add(new DbConnection(name, sourceId, handle, recovery, settings));
      }
      return new ConnectionPool(base, connections);
    }

    private static void discard(ConnectionProvider base, List<DbConnection> opened) {
      for (DbConnection conn : opened) {
        Connection handle = conn.handle();
        try {
          base.forceClose(handle);
        } catch (SQLException | RuntimeException e) {
          logger.log(Level.WARNING, "Failed to close connection " + conn.name(), e);
        }
      }
      closeQuietly(base);
    }
  }
}
