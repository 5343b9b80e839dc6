package replay.jdbc;

import replay.ErrorKind;
import replay.ErrorScope;
import replay.InvalidConnectionException;
import replay.LoadContext;
import replay.OperationCancelledException;
import replay.ReplayException;
import replay.fault.FaultPoints;
import replay.retry.Retrier;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static replay.util.Truncation.truncate;
import static replay.util.Truncation.truncateValue;

/**
 * One long-lived target-database connection, owned by a single worker.
 *
 * <p>{@link #query} and {@link #execute} run under the pool's retry policies. A lost
 * connection is replaced in place through the pool's {@link ConnectionRecovery}; the
 * replacement is used by the remaining attempts and by every later call.
 *
 * <p>Not thread-safe: each instance must be used by one thread at a time.
 *
 * @see ConnectionPool
 */
public final class DbConnection {
  private static final Logger logger = Logger.getLogger(DbConnection.class.getName());

  /** Successful attempts slower than this are logged at WARNING. */
  static final Duration SLOW_THRESHOLD = Duration.ofSeconds(1);

  private final String name;
  private final String sourceId;
  private final ConnectionRecovery recovery;
  private final ConnectionSettings settings;
  private Connection handle;

  DbConnection(String name, String sourceId, Connection handle, ConnectionRecovery recovery,
      ConnectionSettings settings) {
    this.name = Objects.requireNonNull(name, "name");
    this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
    this.handle = handle;
    this.recovery = Objects.requireNonNull(recovery, "recovery");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public String name() {
    return name;
  }

  public String sourceId() {
    return sourceId;
  }

  /**
   * @return {@link ErrorScope#DOWNSTREAM} for a live connection, {@link ErrorScope#NOT_SET}
   *     once it is closed or if it was never opened
   */
  public ErrorScope scope() {
    return handle == null ? ErrorScope.NOT_SET : ErrorScope.DOWNSTREAM;
  }

  Connection handle() {
    return handle;
  }

  /**
   * Runs a query and maps every row, retrying under the query policy.
   *
   * @return mapped rows of the first successful attempt
   * @throws InvalidConnectionException         if the connection is not open
   * @throws replay.StatementFailedException    if the query failed terminally
   * @throws replay.ResetFailureException       if a lost connection could not be replaced
   * @throws OperationCancelledException        if {@code ctx} was cancelled
   */
  public <T> List<T> query(LoadContext ctx, String sql, JdbcTemplate.RowMapper<T> mapper,
      Object... args) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(mapper, "mapper");
    requireOpen();

    Retrier retrier = new Retrier(settings.queryPolicy(), settings.classifier(), ErrorScope.DOWNSTREAM);
    LoggingListener listener = new LoggingListener("query statement", sql, args, false);
    try {
      return retrier.call(ctx, c -> {
        long start = System.nanoTime();
        List<T> rows = JdbcTemplate.query(c, handle, sql, mapper, args);
        Duration cost = Duration.ofNanos(System.nanoTime() - start);
        settings.metrics().recordQueryLatency(name, sourceId, cost);
        if (cost.compareTo(SLOW_THRESHOLD) > 0) {
          logger.warning("query statement too slow: name=" + name + " source_id=" + sourceId
              + " cost=" + cost.toMillis() + "ms query=" + truncate(sql)
              + " arguments=" + truncateValue(args));
        }
        return rows;
      }, this::reset, listener);
    } catch (ReplayException e) {
      listener.logTerminal(e);
      throw e;
    }
  }

  /** Executes statements without bind arguments. */
  public void execute(LoadContext ctx, List<String> statements) {
    execute(ctx, statements, List.of());
  }

  /**
   * Executes {@code statements} as one transaction, retrying the whole batch under the
   * execute policy. An empty batch returns immediately.
   *
   * @param args bind arguments per statement; empty, or one entry per statement
   * @throws InvalidConnectionException         if the connection is not open
   * @throws replay.IdempotentOutcomeException  if the batch hit an "already exists" error
   * @throws replay.StatementFailedException    if the batch failed terminally
   * @throws replay.ResetFailureException       if a lost connection could not be replaced
   * @throws OperationCancelledException        if {@code ctx} was cancelled
   */
  public void execute(LoadContext ctx, List<String> statements, List<List<Object>> args) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(statements, "statements");
    Objects.requireNonNull(args, "args");
    if (statements.isEmpty()) {
      return;
    }
    if (!args.isEmpty() && args.size() != statements.size()) {
      throw new IllegalArgumentException("Expected " + statements.size()
          + " argument lists, got: " + args.size());
    }
    requireOpen();

    Retrier retrier = new Retrier(settings.executePolicy(), settings.classifier(), ErrorScope.DOWNSTREAM);
    LoggingListener listener = new LoggingListener("execute statements", String.join("; ", statements),
        args, true);
    try {
      retrier.call(ctx, c -> {
        long start = System.nanoTime();
        Optional<SQLException> injected = settings.faultInjector()
            .inject(FaultPoints.LOAD_EXEC_FAILED, statements);
        if (injected.isPresent()) {
          throw injected.get();
        }
        JdbcTemplate.executeBatch(c, handle, statements, args);
        Duration cost = Duration.ofNanos(System.nanoTime() - start);
        settings.metrics().recordExecuteLatency(name, sourceId, cost);
        if (cost.compareTo(SLOW_THRESHOLD) > 0) {
          logger.warning("execute transaction too slow: name=" + name + " source_id=" + sourceId
              + " cost=" + cost.toMillis() + "ms statements=" + truncateValue(statements));
        }
        return null;
      }, this::reset, listener);
    } catch (ReplayException e) {
      listener.logTerminal(e);
      throw e;
    }
  }

  private void requireOpen() {
    if (handle == null) {
      throw new InvalidConnectionException("database connection not valid");
    }
  }

  private void reset(LoadContext ctx) throws SQLException {
    Connection replacement;
    try {
      replacement = recovery.recover(handle);
    } catch (SQLException | RuntimeException e) {
      settings.metrics().incrementConnectionReset(name, sourceId, false);
      throw e;
    }
    settings.metrics().incrementConnectionReset(name, sourceId, true);
    handle = replacement;
  }

  /**
   * Returns the underlying connection to its source. Later operations fail with
   * {@link InvalidConnectionException}.
   */
  void close() throws SQLException {
    Connection current = handle;
    handle = null;
    if (current != null) {
      current.close();
    }
  }

  @Override
  public String toString() {
    return "DbConnection{name=" + name + ", sourceId=" + sourceId + ", open=" + (handle != null) + '}';
  }

  private final class LoggingListener implements Retrier.Listener {
    private final String operation;
    private final String sql;
    private final Object args;
    private final boolean countErrors;

    LoggingListener(String operation, String sql, Object args, boolean countErrors) {
      this.operation = operation;
      this.sql = sql;
      this.args = args;
      this.countErrors = countErrors;
    }

    @Override
    public void onAttemptFailed(int attempts, SQLException error) {
      if (countErrors) {
        settings.metrics().incrementExecutionError(name, sourceId);
      }
    }

    @Override
    public void onRetry(int attempts, ErrorKind kind, SQLException error) {
      logger.warning(operation + " retry: name=" + name + " source_id=" + sourceId
          + " retry=" + attempts + " kind=" + kind + " query=" + truncate(sql)
          + " arguments=" + truncateValue(args) + " error=" + error.getMessage());
    }

    @Override
    public void onRecoveryFailed(int attempts, Exception error) {
      logger.log(Level.SEVERE, "reset connection failed: name=" + name + " source_id=" + sourceId
          + " retry=" + attempts + " query=" + truncate(sql), error);
    }

    void logTerminal(ReplayException e) {
      String msg = operation + " failed: name=" + name + " source_id=" + sourceId
          + " query=" + truncate(sql) + " arguments=" + truncateValue(args);
      if (e instanceof OperationCancelledException) {
        logger.log(Level.FINE, msg, e);
      } else {
        logger.log(Level.SEVERE, msg, e);
      }
    }
  }
}
