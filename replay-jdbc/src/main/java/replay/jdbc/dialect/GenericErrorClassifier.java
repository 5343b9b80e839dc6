package replay.jdbc.dialect;

import replay.ErrorKind;
import replay.spi.ErrorClassifier;

import java.io.EOFException;
import java.net.SocketException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransactionRollbackException;
import java.sql.SQLTransientConnectionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifier based on the {@code java.sql} exception hierarchy and standard SQLStates.
 *
 * <p>The error, its causes and chained {@link SQLException#getNextException() next
 * exceptions} are inspected in order. For every {@link SQLException}, the
 * vendor-specific {@link #classifyVendor(SQLException)} hook is consulted first, then
 * the standard rules. Anything unmatched is {@link ErrorKind#FATAL}.
 *
 * <p>Used as-is for databases without a registered dialect.
 */
public class GenericErrorClassifier implements ErrorClassifier {
  private static final int MAX_CHAIN = 32;

  private static final List<String> CONNECTION_MARKERS = List.of(
      "connection reset",
      "broken pipe",
      "bad connection",
      "communications link failure",
      "connection is closed",
      "connection has been closed",
      "no operations allowed after connection closed");

  @Override
  public final ErrorKind classify(Throwable error) {
    for (Throwable t : chain(error)) {
      if (t instanceof SQLException sql) {
        ErrorKind kind = classifyVendor(sql);
        if (kind == null) {
          kind = classifyStandard(sql);
        }
        if (kind != null) {
          return kind;
        }
      }
      if (t instanceof SocketException || t instanceof EOFException
          || hasConnectionMarker(t.getMessage())) {
        return ErrorKind.CONNECTION_LOST;
      }
    }
    return ErrorKind.FATAL;
  }

  /**
   * Vendor-specific rules, consulted before the standard ones.
   *
   * @return the kind, or {@code null} to fall through to the standard rules
   */
  protected ErrorKind classifyVendor(SQLException error) {
    return null;
  }

  private static ErrorKind classifyStandard(SQLException error) {
    if (error instanceof SQLRecoverableException
        || error instanceof SQLNonTransientConnectionException
        || error instanceof SQLTransientConnectionException) {
      return ErrorKind.CONNECTION_LOST;
    }
    String state = error.getSQLState();
    if (state != null && state.startsWith("08")) {
      return ErrorKind.CONNECTION_LOST;
    }
    if (error instanceof SQLTransactionRollbackException
        || "40001".equals(state) || "40P01".equals(state)) {
      return ErrorKind.RETRYABLE;
    }
    if ("23505".equals(state) || "42S01".equals(state)) {
      return ErrorKind.IDEMPOTENT;
    }
    return null;
  }

  private static boolean hasConnectionMarker(String message) {
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (String marker : CONNECTION_MARKERS) {
      if (lower.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  static List<Throwable> chain(Throwable error) {
    List<Throwable> out = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    List<Throwable> pending = new ArrayList<>();
    pending.add(error);
    while (!pending.isEmpty() && out.size() < MAX_CHAIN) {
      Throwable t = pending.remove(0);
      if (t == null || !seen.add(t)) {
        continue;
      }
      out.add(t);
      if (t instanceof SQLException sql && sql.getNextException() != null) {
        pending.add(sql.getNextException());
      }
      pending.add(t.getCause());
    }
    return out;
  }
}
