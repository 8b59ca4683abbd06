package ca.gc.cra.linelog.application;

import ca.gc.cra.linelog.application.port.Styler;
import ca.gc.cra.linelog.application.port.TimeSource;
import ca.gc.cra.linelog.domain.Level;
import ca.gc.cra.linelog.infrastructure.buffer.BufferPool;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Configuration applied when a {@link Logger} is created.
 *
 * <pre>{@code
 * Logger logger = Logger.create(System.err,
 *     LoggerOption.level(Level.DEBUG),
 *     LoggerOption.timeFormat(TimeFormats.KITCHEN));
 * }</pre>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LoggerOption {

  /**
   * Applies this option to the settings of a logger under construction.
   *
   * @param settings mutable settings
   */
  void applyTo(Logger.Settings settings);

  /**
   * Sets the minimum level that is emitted. Defaults to {@link Level#INFO}.
   */
  static LoggerOption level(Level level) {
    Objects.requireNonNull(level, "level");
    return settings -> settings.level = level;
  }

  /**
   * Sets the timestamp layout from a name understood by {@link TimeFormats#resolve(String)} or a
   * {@link DateTimeFormatter} pattern. Defaults to {@link TimeFormats#RFC3339}.
   *
   * @throws IllegalArgumentException when the pattern is invalid
   */
  static LoggerOption timeFormat(String layout) {
    DateTimeFormatter formatter = TimeFormats.resolve(layout);
    return settings -> settings.timeFormat = formatter;
  }

  /**
   * Sets the timestamp layout.
   */
  static LoggerOption timeFormat(DateTimeFormatter formatter) {
    Objects.requireNonNull(formatter, "formatter");
    return settings -> settings.timeFormat = formatter;
  }

  /**
   * Overrides the time source. Defaults to {@link TimeSource#SYSTEM_UTC}.
   */
  static LoggerOption timeSource(TimeSource timeSource) {
    Objects.requireNonNull(timeSource, "timeSource");
    return settings -> settings.timeSource = timeSource;
  }

  /**
   * Sets the initial prefix shown between the level and the message. Defaults to none.
   */
  static LoggerOption prefix(String prefix) {
    String value = prefix == null ? "" : prefix;
    return settings -> settings.prefix = value;
  }

  /**
   * Sets the styler. Defaults to {@link ca.gc.cra.linelog.infrastructure.style.AnsiStyler#auto()}.
   */
  static LoggerOption styler(Styler styler) {
    Objects.requireNonNull(styler, "styler");
    return settings -> settings.styler = styler;
  }

  /**
   * Sets the buffer pool. Defaults to the process-wide
   * {@link ca.gc.cra.linelog.infrastructure.buffer.BufferPools#lineBuffers()}.
   */
  static LoggerOption bufferPool(BufferPool pool) {
    Objects.requireNonNull(pool, "pool");
    return settings -> settings.bufferPool = pool;
  }
}
