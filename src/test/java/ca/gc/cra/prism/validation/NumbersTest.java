package ca.gc.cra.prism.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(8888, Numbers.requireRange("port", 8888, 0, 65535));
  }

  @Test
  void requireRangeRejectsValuesAboveMaximum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("port", 65536, 0, 65535));
  }

  @Test
  void parseInRangeTrimsInput() {
    assertEquals(42, Numbers.parseInRange("quality", " 42 ", 0, 100));
  }

  @Test
  void parseInRangeRejectsNonNumeric() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> Numbers.parseInRange("port", "eighty", 0, 65535));
    assertEquals("port must be numeric (was eighty)", ex.getMessage());
  }
}
