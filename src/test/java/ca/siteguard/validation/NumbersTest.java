package ca.siteguard.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueInsideBounds() {
    assertEquals(3L, Numbers.requireRange("remote.maxConcurrent", 3L, 1L, 64L));
    assertEquals(0.3d, Numbers.requireRange("iou", 0.3d, 0d, 1d));
  }

  @Test
  void requireRangeNamesTheValueOnFailure() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("remote.maxConcurrent", 65L, 1L, 64L));
    assertTrue(ex.getMessage().startsWith("remote.maxConcurrent must be between 1 and 64"));
  }

  @Test
  void unitIntervalRejectsNonFiniteValues() {
    assertEquals(1d, Numbers.requireUnitInterval("confidence", 1d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireUnitInterval("confidence", Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireUnitInterval("confidence", 1.01d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireUnitInterval("confidence", -0.01d));
  }

  @Test
  void requirePositiveRejectsZero() {
    assertEquals(0.7d, Numbers.requirePositive("weight", 0.7d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("weight", 0d));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requirePositive("weight", Double.POSITIVE_INFINITY));
  }
}
