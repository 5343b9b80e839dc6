package replay.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TruncationTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("SELECT 1", Truncation.truncate("SELECT 1"));
    assertEquals("null", Truncation.truncate(null));
  }

  @Test
  void longValuesAreCut() {
    String sql = "x".repeat(Truncation.DEFAULT_LIMIT + 10);

    String truncated = Truncation.truncate(sql);

    assertEquals(Truncation.DEFAULT_LIMIT + 3, truncated.length());
    assertTrue(truncated.endsWith("..."));
    assertEquals("abc...", Truncation.truncate("abcdef", 3));
  }

  @Test
  void arraysAreRenderedDeeply() {
    Object[] args = {1, "a", new Object[] {2, "b"}};

    assertEquals("[1, a, [2, b]]", Truncation.truncateValue(args));
  }
}
