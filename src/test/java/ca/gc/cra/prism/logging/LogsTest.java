package ca.gc.cra.prism.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateLeavesShortValues() {
    assertEquals("/healthcheck", Logs.truncate("/healthcheck", 64));
  }

  @Test
  void truncateReportsOriginalSize() {
    assertEquals("abcd... (truncated, 4 of 10 bytes)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void truncateDoesNotSplitMultiByteCharacters() {
    assertEquals("é... (truncated, 3 of 4 bytes)", Logs.truncate("éé", 3));
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void redactHidesSecrets() {
    assertEquals("[REDACTED]", Logs.redact("s3cret"));
    assertEquals("<unset>", Logs.redact(""));
    assertEquals("<unset>", Logs.redact(null));
  }
}
