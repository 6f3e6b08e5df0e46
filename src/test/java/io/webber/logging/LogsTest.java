package io.webber.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("https://example.com", Logs.truncate("https://example.com", 64));
    assertEquals("<null>", Logs.truncate(null, 64));
  }

  @Test
  void longValuesAreCutAndMarked() {
    assertEquals("abcd... (truncated, 4 of 10)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void cutNeverSplitsMultiByteCharacters() {
    // "é" is two bytes in UTF-8
    assertEquals("a... (truncated, 2 of 5)", Logs.truncate("aéé", 2));
  }

  @Test
  void nonPositiveBudgetThrows() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
