package replay.jdbc.dialect;

import replay.ErrorKind;

import java.sql.SQLException;
import java.util.Map;

/**
 * Error classifier for MySQL, TiDB and MariaDB, keyed on the vendor error code.
 */
public final class MySqlErrorClassifier extends GenericErrorClassifier {

  private static final Map<Integer, ErrorKind> CODES = Map.ofEntries(
      // connection
      Map.entry(MySqlErrorCodes.ER_SERVER_SHUTDOWN, ErrorKind.CONNECTION_LOST),
      Map.entry(MySqlErrorCodes.ER_NET_READ_ERROR, ErrorKind.CONNECTION_LOST),
      Map.entry(MySqlErrorCodes.ER_NET_WRITE_ERROR, ErrorKind.CONNECTION_LOST),
      Map.entry(MySqlErrorCodes.ER_CONNECTION_KILLED, ErrorKind.CONNECTION_LOST),
      Map.entry(MySqlErrorCodes.CR_SERVER_GONE_ERROR, ErrorKind.CONNECTION_LOST),
      Map.entry(MySqlErrorCodes.CR_SERVER_LOST, ErrorKind.CONNECTION_LOST),
      // transient statement conditions
      Map.entry(MySqlErrorCodes.ER_LOCK_WAIT_TIMEOUT, ErrorKind.RETRYABLE),
      Map.entry(MySqlErrorCodes.ER_LOCK_DEADLOCK, ErrorKind.RETRYABLE),
      Map.entry(MySqlErrorCodes.ER_QUERY_INTERRUPTED, ErrorKind.RETRYABLE),
      Map.entry(MySqlErrorCodes.TIDB_PD_SERVER_TIMEOUT, ErrorKind.RETRYABLE),
      Map.entry(MySqlErrorCodes.TIDB_TIKV_SERVER_TIMEOUT, ErrorKind.RETRYABLE),
      Map.entry(MySqlErrorCodes.TIDB_TIKV_SERVER_BUSY, ErrorKind.RETRYABLE),
      Map.entry(MySqlErrorCodes.TIDB_RESOLVE_LOCK_TIMEOUT, ErrorKind.RETRYABLE),
      Map.entry(MySqlErrorCodes.TIDB_REGION_UNAVAILABLE, ErrorKind.RETRYABLE),
      Map.entry(MySqlErrorCodes.TIDB_WRITE_CONFLICT, ErrorKind.RETRYABLE),
      Map.entry(MySqlErrorCodes.TIDB_INFO_SCHEMA_EXPIRED, ErrorKind.RETRYABLE),
      Map.entry(MySqlErrorCodes.TIDB_INFO_SCHEMA_CHANGED, ErrorKind.RETRYABLE),
      Map.entry(MySqlErrorCodes.TIDB_WRITE_CONFLICT_IN_TIDB, ErrorKind.RETRYABLE),
      // already applied
      Map.entry(MySqlErrorCodes.ER_DB_CREATE_EXISTS, ErrorKind.IDEMPOTENT),
      Map.entry(MySqlErrorCodes.ER_TABLE_EXISTS, ErrorKind.IDEMPOTENT),
      Map.entry(MySqlErrorCodes.ER_DUP_KEYNAME, ErrorKind.IDEMPOTENT),
      Map.entry(MySqlErrorCodes.ER_DUP_ENTRY, ErrorKind.IDEMPOTENT));

  @Override
  protected ErrorKind classifyVendor(SQLException error) {
    return CODES.get(error.getErrorCode());
  }
}
