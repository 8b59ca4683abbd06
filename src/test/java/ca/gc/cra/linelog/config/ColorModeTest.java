package ca.gc.cra.linelog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.linelog.application.port.Styler;
import ca.gc.cra.linelog.infrastructure.style.AnsiStyler;
import org.junit.jupiter.api.Test;

class ColorModeTest {

  @Test
  void parseAcceptsAliases() {
    assertEquals(ColorMode.AUTO, ColorMode.parse("auto"));
    assertEquals(ColorMode.ALWAYS, ColorMode.parse("Always"));
    assertEquals(ColorMode.ALWAYS, ColorMode.parse("force"));
    assertEquals(ColorMode.NEVER, ColorMode.parse(" off "));
    assertEquals(ColorMode.NEVER, ColorMode.parse("none"));
  }

  @Test
  void parseRejectsUnknownModes() {
    assertThrows(IllegalArgumentException.class, () -> ColorMode.parse("rainbow"));
    assertThrows(IllegalArgumentException.class, () -> ColorMode.parse(""));
  }

  @Test
  void explicitModesPickFixedStylers() {
    assertSame(AnsiStyler.forced(), ColorMode.ALWAYS.styler());
    assertSame(Styler.NONE, ColorMode.NEVER.styler());
  }
}
