package replay.jdbc.dialect;

import java.sql.SQLException;

/**
 * MySQL and TiDB vendor error codes, plus helpers for callers that treat
 * "already exists" outcomes of replayed DDL and inserts as success.
 */
public final class MySqlErrorCodes {

  public static final int ER_DB_CREATE_EXISTS = 1007;
  public static final int ER_TABLE_EXISTS = 1050;
  public static final int ER_SERVER_SHUTDOWN = 1053;
  public static final int ER_DUP_KEYNAME = 1061;
  public static final int ER_DUP_ENTRY = 1062;
  public static final int ER_NET_READ_ERROR = 1158;
  public static final int ER_NET_WRITE_ERROR = 1160;
  public static final int ER_LOCK_WAIT_TIMEOUT = 1205;
  public static final int ER_LOCK_DEADLOCK = 1213;
  public static final int ER_QUERY_INTERRUPTED = 1317;
  public static final int ER_CONNECTION_KILLED = 1927;
  public static final int CR_SERVER_GONE_ERROR = 2006;
  public static final int CR_SERVER_LOST = 2013;

  public static final int TIDB_WRITE_CONFLICT_IN_TIDB = 8005;
  public static final int TIDB_INFO_SCHEMA_EXPIRED = 8027;
  public static final int TIDB_INFO_SCHEMA_CHANGED = 8028;
  public static final int TIDB_PD_SERVER_TIMEOUT = 9001;
  public static final int TIDB_TIKV_SERVER_TIMEOUT = 9002;
  public static final int TIDB_TIKV_SERVER_BUSY = 9003;
  public static final int TIDB_RESOLVE_LOCK_TIMEOUT = 9004;
  public static final int TIDB_REGION_UNAVAILABLE = 9005;
  public static final int TIDB_WRITE_CONFLICT = 9007;

  private MySqlErrorCodes() {
  }

  /** {@code true} if {@code error} or one of its causes is "database exists". */
  public static boolean isDatabaseExists(Throwable error) {
    return hasCode(error, ER_DB_CREATE_EXISTS);
  }

  /** {@code true} if {@code error} or one of its causes is "table exists". */
  public static boolean isTableExists(Throwable error) {
    return hasCode(error, ER_TABLE_EXISTS);
  }

  /** {@code true} if {@code error} or one of its causes is "duplicate entry". */
  public static boolean isDuplicateEntry(Throwable error) {
    return hasCode(error, ER_DUP_ENTRY);
  }

  private static boolean hasCode(Throwable error, int code) {
    if (error == null) {
      return false;
    }
    for (Throwable t : GenericErrorClassifier.chain(error)) {
      if (t instanceof SQLException sql && sql.getErrorCode() == code) {
        return true;
      }
    }
    return false;
  }
}
