package replay.util;

import java.util.Arrays;

/**
 * Shortens SQL text and bind arguments before they are written to logs.
 */
public final class Truncation {

  /** Default length limit applied to logged values. */
  public static final int DEFAULT_LIMIT = 1024;

  private static final String ELLIPSIS = "...";

  private Truncation() {
  }

  /** Truncates {@code s} to {@link #DEFAULT_LIMIT} characters. */
  public static String truncate(String s) {
    return truncate(s, DEFAULT_LIMIT);
  }

  /**
   * Truncates {@code s} to at most {@code limit} characters, marking the cut with
   * {@code "..."}. A negative limit selects {@link #DEFAULT_LIMIT}.
   */
  public static String truncate(String s, int limit) {
    if (s == null) {
      return "null";
    }
    int max = limit < 0 ? DEFAULT_LIMIT : limit;
    if (s.length() <= max) {
      return s;
    }
    return s.substring(0, max) + ELLIPSIS;
  }

  /**
   * Renders {@code value} (arrays and nested arrays included) and truncates the result
   * to {@link #DEFAULT_LIMIT} characters.
   */
  public static String truncateValue(Object value) {
    String rendered;
    if (value instanceof Object[] array) {
      rendered = Arrays.deepToString(array);
    } else {
      rendered = String.valueOf(value);
    }
    return truncate(rendered, DEFAULT_LIMIT);
  }
}
