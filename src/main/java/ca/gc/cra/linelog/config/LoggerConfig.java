package ca.gc.cra.linelog.config;

import ca.gc.cra.linelog.application.LoggerOption;
import ca.gc.cra.linelog.application.TimeFormats;
import ca.gc.cra.linelog.domain.Level;
import ca.gc.cra.linelog.validation.Strings;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable logger configuration built by layering settings over {@link #defaults()}.
 * <p><strong>Why:</strong> Lets CLIs expose {@code level=}, {@code timeFormat=}, {@code prefix=} and {@code color=}
 * knobs, from the command line or a config file, without each one re-implementing parsing.</p>
 * <p><strong>Role:</strong> Configuration record consumed by CLI composition code.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param level minimum level emitted
 * @param timeFormat named layout or {@link java.time.format.DateTimeFormatter} pattern
 * @param prefix initial prefix; empty for none
 * @param color styling mode
 * @since 0.1.0
 */
public record LoggerConfig(Level level, String timeFormat, String prefix, ColorMode color) {
  /** Key holding the minimum level. */
  public static final String KEY_LEVEL = "level";
  /** Key holding the time layout. */
  public static final String KEY_TIME_FORMAT = "timeFormat";
  /** Key holding the prefix. */
  public static final String KEY_PREFIX = "prefix";
  /** Key holding the colour mode. */
  public static final String KEY_COLOR = "color";

  /** Every recognised setting, in the order they are documented. */
  public static final List<String> SETTING_KEYS = List.of(KEY_LEVEL, KEY_TIME_FORMAT, KEY_PREFIX, KEY_COLOR);

  private static final int MAX_PREFIX_LENGTH = 64;

  public LoggerConfig {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(timeFormat, "timeFormat");
    Objects.requireNonNull(color, "color");
    prefix = prefix == null ? "" : prefix;
  }

  /**
   * Provides defaults: INFO, RFC3339 timestamps, no prefix, automatic colour.
   *
   * @return default configuration
   */
  public static LoggerConfig defaults() {
    return new LoggerConfig(Level.INFO, "rfc3339", "", ColorMode.AUTO);
  }

  /**
   * Returns a copy with one setting replaced.
   *
   * <p>Values may be text, as typed on a command line, or the scalars a YAML document produces: an integer
   * level such as {@code -4}, or a boolean colour where {@code true} means always and {@code false} never. A
   * {@code null} value leaves the setting unchanged; a blank prefix clears it.</p>
   *
   * @param key one of {@link #SETTING_KEYS}
   * @param value new value
   * @return updated configuration
   * @throws IllegalArgumentException when the key is unknown or the value invalid
   */
  public LoggerConfig withSetting(String key, Object value) {
    if (value == null) {
      return this;
    }
    if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
      throw new IllegalArgumentException(key + " must be a single value");
    }
    String name = key == null ? "" : key;
    return switch (name) {
      case KEY_LEVEL -> withLevel(levelOf(value));
      case KEY_TIME_FORMAT -> new LoggerConfig(level, timeFormatOf(value), prefix, color);
      case KEY_PREFIX -> new LoggerConfig(level, timeFormat, prefixOf(value), color);
      case KEY_COLOR -> new LoggerConfig(level, timeFormat, prefix, colorOf(value));
      default -> throw new IllegalArgumentException("unknown logger setting: " + key);
    };
  }

  /**
   * Applies {@code settings} in iteration order through {@link #withSetting(String, Object)}.
   *
   * @param settings settings to layer over this configuration; {@code null} is treated as empty
   * @return updated configuration
   * @throws IllegalArgumentException when any key is unknown or value invalid
   */
  public LoggerConfig withSettings(Map<String, ?> settings) {
    LoggerConfig result = this;
    if (settings != null) {
      for (Map.Entry<String, ?> entry : settings.entrySet()) {
        result = result.withSetting(entry.getKey(), entry.getValue());
      }
    }
    return result;
  }

  /**
   * Returns a copy with the level replaced.
   */
  public LoggerConfig withLevel(Level newLevel) {
    return new LoggerConfig(newLevel, timeFormat, prefix, color);
  }

  /**
   * Translates this configuration into logger options.
   *
   * @return options for {@link ca.gc.cra.linelog.application.Logger#create}
   */
  public LoggerOption[] toOptions() {
    return new LoggerOption[] {
      LoggerOption.level(level),
      LoggerOption.timeFormat(timeFormat),
      LoggerOption.prefix(prefix),
      LoggerOption.styler(color.styler())
    };
  }

  private static Level levelOf(Object value) {
    if (value instanceof Integer || value instanceof Long) {
      long number = ((Number) value).longValue();
      if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
        throw new IllegalArgumentException("level out of range: " + number);
      }
      return Level.of((int) number);
    }
    if (value instanceof String text) {
      return Level.parse(text);
    }
    throw new IllegalArgumentException("level must be a name or an integer (was " + value + ")");
  }

  private static String timeFormatOf(Object value) {
    String layout = String.valueOf(value).trim();
    // an offset timestamp must print, so a bad layout fails here and not on the first log call
    TimeFormats.requireRenderable(TimeFormats.resolve(layout));
    return layout;
  }

  private static String prefixOf(Object value) {
    String text = String.valueOf(value);
    if (text.isBlank()) {
      return "";
    }
    return Strings.requirePrintable(KEY_PREFIX, text, MAX_PREFIX_LENGTH);
  }

  private static ColorMode colorOf(Object value) {
    if (value instanceof Boolean enabled) {
      return enabled ? ColorMode.ALWAYS : ColorMode.NEVER;
    }
    return ColorMode.parse(String.valueOf(value));
  }
}
