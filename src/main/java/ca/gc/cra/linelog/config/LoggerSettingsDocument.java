package ca.gc.cra.linelog.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bean bound by SnakeYAML from a logger settings file.
 *
 * <p>Top-level settings apply to every scenario; {@code scenarios} holds per-scenario sections with the same
 * settings. Values stay untyped so a level may be written as {@code debug} or {@code -4} and a colour as
 * {@code never} or {@code false}.</p>
 */
public class LoggerSettingsDocument {
  private Object level;
  private Object timeFormat;
  private Object prefix;
  private Object color;
  private Map<String, LoggerSettingsDocument> scenarios;

  public Object getLevel() {
    return level;
  }

  public void setLevel(Object level) {
    this.level = level;
  }

  public Object getTimeFormat() {
    return timeFormat;
  }

  public void setTimeFormat(Object timeFormat) {
    this.timeFormat = timeFormat;
  }

  public Object getPrefix() {
    return prefix;
  }

  public void setPrefix(Object prefix) {
    this.prefix = prefix;
  }

  public Object getColor() {
    return color;
  }

  public void setColor(Object color) {
    this.color = color;
  }

  public Map<String, LoggerSettingsDocument> getScenarios() {
    return scenarios;
  }

  public void setScenarios(Map<String, LoggerSettingsDocument> scenarios) {
    this.scenarios = scenarios;
  }

  /**
   * Returns the settings present in this section, keyed as {@link LoggerConfig#withSetting} expects.
   */
  Map<String, Object> settings() {
    Map<String, Object> settings = new LinkedHashMap<>();
    putIfPresent(settings, LoggerConfig.KEY_LEVEL, level);
    putIfPresent(settings, LoggerConfig.KEY_TIME_FORMAT, timeFormat);
    putIfPresent(settings, LoggerConfig.KEY_PREFIX, prefix);
    putIfPresent(settings, LoggerConfig.KEY_COLOR, color);
    return settings;
  }

  private static void putIfPresent(Map<String, Object> settings, String key, Object value) {
    if (value != null) {
      settings.put(key, value);
    }
  }

  @Override
  public String toString() {
    return "LoggerSettingsDocument{" + settings() + ", scenarios=" + (scenarios == null ? "{}" : scenarios.keySet())
        + '}';
  }
}
