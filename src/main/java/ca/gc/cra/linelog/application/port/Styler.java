package ca.gc.cra.linelog.application.port;

/**
 * <strong>What:</strong> Port that decorates text for a semantic {@link StyleRole}.
 * <p><strong>Role:</strong> Loggers call it for the timestamp, level label, prefix and every attribute key;
 * messages and values are never styled.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or otherwise thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.linelog.infrastructure.style.AnsiStyler
 */
@FunctionalInterface
public interface Styler {
  /**
   * Returns {@code text} decorated for {@code role}, or unchanged when styling is off.
   *
   * @param role semantic role of the text
   * @param text text to decorate
   * @return styled text
   */
  String apply(StyleRole role, String text);

  /** Styler that never decorates. */
  Styler NONE = (role, text) -> text;
}
