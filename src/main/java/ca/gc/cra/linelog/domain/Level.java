package ca.gc.cra.linelog.domain;

import java.util.Locale;

/**
 * <strong>What:</strong> Ordered log severity backed by a signed integer.
 * <p><strong>Why:</strong> Values are spaced four apart so new severities can be slotted between the
 * defined ones without renumbering existing configuration.</p>
 * <p><strong>Role:</strong> Domain value consumed by {@link LevelGate} and every emit call.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 * <p><strong>Performance:</strong> Comparisons are a single integer compare.</p>
 *
 * @param severity numeric severity; larger is more severe
 * @since 0.1.0
 */
public record Level(int severity) implements Comparable<Level> {
  /** Verbose output intended for debugging or {@code --verbose} modes. */
  public static final Level DEBUG = new Level(-4);
  /** Default level; progress updates and informational messages. */
  public static final Level INFO = new Level(0);
  /** Recoverable issues worth flagging, such as a missing optional config file. */
  public static final Level WARN = new Level(4);
  /** Non-recoverable errors, typically followed by program exit. */
  public static final Level ERROR = new Level(8);

  /** Label rendered for severities outside the four defined levels. */
  public static final String UNKNOWN_LABEL = "unknown";

  /**
   * Returns the level for the given severity, reusing the shared constants where possible.
   *
   * @param severity numeric severity
   * @return matching level; undefined severities yield a level whose label is {@code unknown}
   */
  public static Level of(int severity) {
    return switch (severity) {
      case -4 -> DEBUG;
      case 0 -> INFO;
      case 4 -> WARN;
      case 8 -> ERROR;
      default -> new Level(severity);
    };
  }

  /**
   * Parses a level name ({@code debug}, {@code info}, {@code warn}/{@code warning}, {@code error})
   * or a signed integer severity.
   *
   * @param text level text; surrounding whitespace ignored
   * @return parsed level
   * @throws IllegalArgumentException when {@code text} is blank or unrecognized
   */
  public static Level parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("level must not be blank");
    }
    String normalized = text.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "debug":
        return DEBUG;
      case "info":
        return INFO;
      case "warn":
      case "warning":
        return WARN;
      case "error":
        return ERROR;
      default:
        break;
    }
    try {
      return of(Integer.parseInt(normalized));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("unknown level: " + text.trim(), ex);
    }
  }

  /**
   * Returns the plain upper-case label, or {@code unknown} for undefined severities.
   *
   * @return label text without styling
   */
  public String label() {
    return switch (severity) {
      case -4 -> "DEBUG";
      case 0 -> "INFO";
      case 4 -> "WARN";
      case 8 -> "ERROR";
      default -> UNKNOWN_LABEL;
    };
  }

  /**
   * Indicates whether this is one of the four defined levels.
   *
   * @return {@code true} for DEBUG, INFO, WARN or ERROR
   */
  public boolean isDefined() {
    return severity == -4 || severity == 0 || severity == 4 || severity == 8;
  }

  /**
   * Indicates whether a call at this level passes a logger configured at {@code configured}.
   *
   * @param configured minimum level of the logger
   * @return {@code true} when this level is at or above {@code configured}
   */
  public boolean isEnabled(Level configured) {
    return LevelGate.shouldEmit(configured, this);
  }

  @Override
  public int compareTo(Level other) {
    return Integer.compare(severity, other.severity);
  }

  @Override
  public String toString() {
    return label();
  }
}
