package ca.gc.cra.photonic.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsHeadAndMarksLength() {
    assertEquals("short", Logs.truncate("short", 10));
    assertEquals("abcd... (truncated, 4 of 10 bytes)", Logs.truncate("abcdefghij", 4));
    assertEquals("<null>", Logs.truncate(null, 4));
  }

  @Test
  void truncateDropsSplitCodePoint() {
    // 'é' is two bytes in UTF-8
    assertEquals("a... (truncated, 2 of 5 bytes)", Logs.truncate("a\u00e9\u00e9", 2));
  }

  @Test
  void tailKeepsLastBytes() {
    assertEquals("... ghij", Logs.tail("abcdefghij", 4));
    assertEquals("abc", Logs.tail("abc", 4));
    assertEquals("", Logs.tail(null, 4));
  }

  @Test
  void tailStartsOnCodePointBoundary() {
    assertEquals("... b", Logs.tail("a\u00e9b", 2));
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.tail("x", 0));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", -1));
  }
}
