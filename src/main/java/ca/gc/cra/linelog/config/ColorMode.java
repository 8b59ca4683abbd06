package ca.gc.cra.linelog.config;

import ca.gc.cra.linelog.application.port.Styler;
import ca.gc.cra.linelog.infrastructure.style.AnsiStyler;
import java.util.Locale;

/**
 * When terminal styling is applied to log lines.
 */
public enum ColorMode {
  /** Style when the environment supports it. */
  AUTO,
  /** Always emit escape sequences. */
  ALWAYS,
  /** Never emit escape sequences. */
  NEVER;

  /**
   * Parses {@code auto}, {@code always} or {@code never} (case-insensitive).
   *
   * @param value text to parse
   * @return matching mode
   * @throws IllegalArgumentException for any other value
   */
  public static ColorMode parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("color must be auto, always or never");
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "auto" -> AUTO;
      case "always", "force" -> ALWAYS;
      case "never", "none", "off" -> NEVER;
      default -> throw new IllegalArgumentException("color must be auto, always or never (was '" + value + "')");
    };
  }

  /**
   * Returns the styler implementing this mode.
   */
  public Styler styler() {
    return switch (this) {
      case AUTO -> AnsiStyler.auto();
      case ALWAYS -> AnsiStyler.forced();
      case NEVER -> Styler.NONE;
    };
  }
}
