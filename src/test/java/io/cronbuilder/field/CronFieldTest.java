package io.cronbuilder.field;

import static org.junit.jupiter.api.Assertions.*;

import io.cronbuilder.CronBuilderException;
import io.cronbuilder.ErrorKind;
import org.junit.jupiter.api.Test;

/** Tests for CronField bounds and rendering. */
public class CronFieldTest {

  @Test
  void testBounds() {
    assertEquals(0, CronField.SECOND.min());
    assertEquals(59, CronField.SECOND.max());
    assertEquals(0, CronField.MINUTE.min());
    assertEquals(59, CronField.MINUTE.max());
    assertEquals(0, CronField.HOUR.min());
    assertEquals(23, CronField.HOUR.max());
    assertEquals(1, CronField.DAY_OF_MONTH.min());
    assertEquals(31, CronField.DAY_OF_MONTH.max());
    assertEquals(1, CronField.MONTH.min());
    assertEquals(12, CronField.MONTH.max());
  }

  @Test
  void testExactAcceptsEveryValueInRange() {
    for (CronField field : CronField.values()) {
      for (int v = field.min(); v <= field.max(); v++) {
        assertEquals(String.valueOf(v), field.exact(v, "value"));
      }
    }
  }

  @Test
  void testExactRejectsNeighbours() {
    for (CronField field : CronField.values()) {
      CronBuilderException low =
          assertThrows(CronBuilderException.class, () -> field.exact(field.min() - 1, "value"));
      assertEquals(ErrorKind.RANGE, low.kind());
      assertThrows(CronBuilderException.class, () -> field.exact(field.max() + 1, "value"));
    }
  }

  @Test
  void testStep() {
    assertEquals("*/1", CronField.HOUR.step(1, "interval"));
    assertEquals("*/23", CronField.HOUR.step(23, "interval"));
    assertEquals("*/12", CronField.MONTH.step(12, "interval"));
    assertThrows(CronBuilderException.class, () -> CronField.HOUR.step(0, "interval"));
    assertThrows(CronBuilderException.class, () -> CronField.HOUR.step(24, "interval"));
  }

  @Test
  void testParameterNameInMessage() {
    CronBuilderException e =
        assertThrows(CronBuilderException.class, () -> CronField.MONTH.exact(13, "month"));
    assertEquals("month must be between 1 and 12, got 13", e.getMessage());
  }
}
