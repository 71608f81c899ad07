package ca.gc.cra.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigValuesTest {

  @Test
  void coerceIntegerParsesDecimal() {
    assertEquals(Optional.of(12L), ConfigValues.coerceInteger(" 12 "));
  }

  @Test
  void coerceIntegerKeepsValuesBeyondIntRange() {
    assertEquals(Optional.of(2147483648L), ConfigValues.coerceInteger("2147483648"));
    assertEquals(Optional.of(-1L), ConfigValues.coerceInteger("-1"));
  }

  @Test
  void coerceIntegerReturnsEmptyForPathsAndBlanks() {
    assertTrue(ConfigValues.coerceInteger("/tmp/prism.sock").isEmpty());
    assertTrue(ConfigValues.coerceInteger("").isEmpty());
    assertTrue(ConfigValues.coerceInteger(null).isEmpty());
    assertTrue(ConfigValues.coerceInteger("99999999999999999999").isEmpty());
  }

  @Test
  void coerceBooleanAcceptsCommonSpellings() {
    assertEquals(Optional.of(true), ConfigValues.coerceBoolean("Yes"));
    assertEquals(Optional.of(false), ConfigValues.coerceBoolean("0"));
    assertTrue(ConfigValues.coerceBoolean("maybe").isEmpty());
  }

  @Test
  void splitListDropsEmptyEntries() {
    assertEquals(List.of("a.com", "b.com"), ConfigValues.splitList(" a.com, ,b.com,"));
    assertTrue(ConfigValues.splitList("  ").isEmpty());
  }
}
