package ca.gc.cra.linelog.application.port;

import ca.gc.cra.linelog.domain.Level;

/**
 * Semantic roles a {@link Styler} is asked to render.
 */
public enum StyleRole {
  /** Line timestamp. */
  TIMESTAMP,
  /** Optional logger prefix. */
  PREFIX,
  /** Attribute keys. */
  KEY,
  /** DEBUG level label. */
  DEBUG,
  /** INFO level label. */
  INFO,
  /** WARN level label. */
  WARN,
  /** ERROR level label. */
  ERROR;

  /**
   * Returns the role used for a level label.
   *
   * @param level level being rendered
   * @return matching role, or {@code null} for levels outside the defined four
   */
  public static StyleRole forLevel(Level level) {
    return switch (level.severity()) {
      case -4 -> DEBUG;
      case 0 -> INFO;
      case 4 -> WARN;
      case 8 -> ERROR;
      default -> null;
    };
  }
}
