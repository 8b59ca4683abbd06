package ca.gc.cra.linelog.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class LevelGateTest {

  @Test
  void emitsWhenAttemptedIsAtLeastConfigured() {
    List<Level> levels = List.of(Level.DEBUG, Level.INFO, Level.WARN, Level.ERROR);
    for (Level configured : levels) {
      for (Level attempted : levels) {
        boolean expected = attempted.severity() >= configured.severity();
        assertEquals(expected, LevelGate.shouldEmit(configured, attempted),
            () -> "configured=" + configured + " attempted=" + attempted);
      }
    }
  }

  @Test
  void undefinedLevelsAreComparedNumerically() {
    assertTrue(LevelGate.shouldEmit(Level.INFO, Level.of(1)));
    assertFalse(LevelGate.shouldEmit(Level.INFO, Level.of(-1)));
    assertTrue(LevelGate.shouldEmit(Level.of(-10), Level.DEBUG));
    assertFalse(LevelGate.shouldEmit(Level.of(9), Level.ERROR));
  }
}
