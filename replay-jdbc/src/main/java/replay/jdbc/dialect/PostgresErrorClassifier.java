package replay.jdbc.dialect;

import replay.ErrorKind;

import java.sql.SQLException;
import java.util.Map;

/**
 * Error classifier for PostgreSQL, keyed on the SQLState (the driver reports no vendor
 * codes).
 */
public final class PostgresErrorClassifier extends GenericErrorClassifier {

  private static final Map<String, ErrorKind> STATES = Map.ofEntries(
      Map.entry("57P01", ErrorKind.CONNECTION_LOST), // admin_shutdown
      Map.entry("57P02", ErrorKind.CONNECTION_LOST), // crash_shutdown
      Map.entry("57P03", ErrorKind.CONNECTION_LOST), // cannot_connect_now
      Map.entry("40001", ErrorKind.RETRYABLE),
      Map.entry("40P01", ErrorKind.RETRYABLE),
      Map.entry("55P03", ErrorKind.RETRYABLE), // lock_not_available
      Map.entry("42P04", ErrorKind.IDEMPOTENT), // duplicate_database
      Map.entry("42P06", ErrorKind.IDEMPOTENT), // duplicate_schema
      Map.entry("42P07", ErrorKind.IDEMPOTENT), // duplicate_table
      Map.entry("42710", ErrorKind.IDEMPOTENT), // duplicate_object
      Map.entry("23505", ErrorKind.IDEMPOTENT));

  @Override
  protected ErrorKind classifyVendor(SQLException error) {
    String state = error.getSQLState();
    return state == null ? null : STATES.get(state);
  }
}
