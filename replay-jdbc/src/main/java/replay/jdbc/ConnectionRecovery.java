package replay.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Capability to replace a broken connection, supplied by the {@link ConnectionPool} to
 * each {@link DbConnection}.
 */
@FunctionalInterface
public interface ConnectionRecovery {

  /**
   * Discards {@code current} and obtains a replacement. Failing to close {@code current}
   * is not an error; failing to obtain the replacement is.
   *
   * @param current the connection presumed broken; may be {@code null}
   * @return a fresh connection
   * @throws SQLException if no replacement could be obtained
   */
  Connection recover(Connection current) throws SQLException;
}
