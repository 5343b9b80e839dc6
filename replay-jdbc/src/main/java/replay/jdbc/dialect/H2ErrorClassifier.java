package replay.jdbc.dialect;

import replay.ErrorKind;

import java.sql.SQLException;
import java.util.Map;

/**
 * Error classifier for H2, keyed on the vendor error code.
 */
public final class H2ErrorClassifier extends GenericErrorClassifier {

  private static final Map<Integer, ErrorKind> CODES = Map.ofEntries(
      Map.entry(90007, ErrorKind.CONNECTION_LOST), // object closed
      Map.entry(90028, ErrorKind.CONNECTION_LOST), // IO exception
      Map.entry(90031, ErrorKind.CONNECTION_LOST), // IO exception
      Map.entry(90067, ErrorKind.CONNECTION_LOST), // connection broken
      Map.entry(90098, ErrorKind.CONNECTION_LOST), // database closed
      Map.entry(90121, ErrorKind.CONNECTION_LOST), // database called at shutdown
      Map.entry(40001, ErrorKind.RETRYABLE), // deadlock
      Map.entry(50200, ErrorKind.RETRYABLE), // lock timeout
      Map.entry(90131, ErrorKind.RETRYABLE), // concurrent update
      Map.entry(42101, ErrorKind.IDEMPOTENT), // table exists
      Map.entry(42111, ErrorKind.IDEMPOTENT), // index exists
      Map.entry(90078, ErrorKind.IDEMPOTENT), // schema exists
      Map.entry(23505, ErrorKind.IDEMPOTENT)); // duplicate key

  @Override
  protected ErrorKind classifyVendor(SQLException error) {
    return CODES.get(error.getErrorCode());
  }
}
