package ca.gc.cra.linelog.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LevelTest {

  @Test
  void definedLevelsCarryTheirSeverities() {
    assertEquals(-4, Level.DEBUG.severity());
    assertEquals(0, Level.INFO.severity());
    assertEquals(4, Level.WARN.severity());
    assertEquals(8, Level.ERROR.severity());
  }

  @Test
  void labelsAreUpperCaseNames() {
    assertEquals("DEBUG", Level.DEBUG.label());
    assertEquals("INFO", Level.INFO.label());
    assertEquals("WARN", Level.WARN.label());
    assertEquals("ERROR", Level.ERROR.label());
    assertEquals("WARN", Level.WARN.toString());
  }

  @Test
  void otherSeveritiesAreUnknown() {
    assertEquals("unknown", Level.of(1).label());
    assertEquals("unknown", Level.of(-100).label());
    assertEquals("unknown", Level.of(Integer.MAX_VALUE).label());
    assertFalse(Level.of(1).isDefined());
    assertTrue(Level.of(8).isDefined());
  }

  @Test
  void ofReturnsCanonicalConstants() {
    assertSame(Level.DEBUG, Level.of(-4));
    assertSame(Level.ERROR, Level.of(8));
    assertEquals(new Level(6), Level.of(6));
  }

  @Test
  void parseAcceptsNamesAliasesAndNumbers() {
    assertSame(Level.DEBUG, Level.parse("debug"));
    assertSame(Level.INFO, Level.parse(" INFO "));
    assertSame(Level.WARN, Level.parse("warning"));
    assertSame(Level.ERROR, Level.parse("Error"));
    assertSame(Level.WARN, Level.parse("4"));
    assertEquals(Level.of(-8), Level.parse("-8"));
  }

  @Test
  void parseRejectsGarbage() {
    assertThrows(IllegalArgumentException.class, () -> Level.parse("loud"));
    assertThrows(IllegalArgumentException.class, () -> Level.parse(" "));
    assertThrows(IllegalArgumentException.class, () -> Level.parse(null));
  }

  @Test
  void orderingFollowsSeverity() {
    assertTrue(Level.DEBUG.compareTo(Level.INFO) < 0);
    assertTrue(Level.ERROR.compareTo(Level.WARN) > 0);
    assertEquals(0, Level.of(0).compareTo(Level.INFO));
  }

  @Test
  void isEnabledAgreesWithGate() {
    assertTrue(Level.ERROR.isEnabled(Level.WARN));
    assertFalse(Level.DEBUG.isEnabled(Level.INFO));
  }
}
