package ca.gc.cra.photonic.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("workers", 10, 1, 64));
    assertEquals(0.5d, Numbers.requireRange("percentile", 0.5d, 0d, 1d));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 65, 1, 64));
    assertEquals("workers must be between 1 and 64 (was 65)", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 0, 1, 64));
  }

  @Test
  void requireRangeRejectsNonFiniteDoubles() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("sigma", Double.NaN, 0d, 10d));
  }

  @Test
  void parseIntNamesTheOption() {
    assertEquals(12, Numbers.parseInt("fps", " 12 "));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("fps", "twelve"));
    assertEquals("fps must be an integer (was twelve)", ex.getMessage());
  }

  @Test
  void parseDoubleRejectsInfinity() {
    assertEquals(2.5d, Numbers.parseDouble("kappa", "2.5"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("kappa", "Infinity"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("kappa", "abc"));
  }
}
