package ca.gc.cra.linelog.api;

import ca.gc.cra.linelog.config.LoggerConfig;
import ca.gc.cra.linelog.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Arguments of one {@code linelog} invocation: the scenario to run and the logger settings to run it with.
 *
 * <p>Parsing never throws. Anything that is not a known flag, the scenario name, {@code config=PATH} or a logger
 * setting from {@link LoggerConfig#SETTING_KEYS} is collected in {@link #problems()}.</p>
 *
 * @param command scenario name, or {@code null} when none was given
 * @param settings logger settings in command-line order, keyed by their canonical name
 * @param configPath settings file path, or {@code null}
 * @param verbose {@code --verbose} or {@code -v} was given
 * @param help {@code --help} or {@code -h} was given
 * @param problems human-readable descriptions of rejected arguments
 */
record ScenarioArgs(
    String command,
    Map<String, String> settings,
    String configPath,
    boolean verbose,
    boolean help,
    List<String> problems) {
  private static final String CONFIG_KEY = "config";

  static ScenarioArgs parse(String[] args) {
    String command = null;
    Map<String, String> settings = new LinkedHashMap<>();
    String configPath = null;
    boolean verbose = false;
    boolean help = false;
    List<String> problems = new ArrayList<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      switch (arg.toLowerCase(Locale.ROOT)) {
        case "--help", "-h" -> help = true;
        case "--verbose", "-v" -> verbose = true;
        default -> {
          int eq = arg.indexOf('=');
          if (eq < 0 && arg.startsWith("-")) {
            problems.add("unknown flag: " + arg);
          } else if (eq < 0) {
            if (command == null) {
              command = arg;
            } else {
              problems.add("unexpected argument: " + arg);
            }
          } else {
            String key = arg.substring(0, eq).trim();
            String value = arg.substring(eq + 1).trim();
            String setting = canonicalKey(key);
            if (Strings.containsControl(value)) {
              problems.add(key + " must not contain control characters");
            } else if (setting == null) {
              problems.add("unknown setting: " + key);
            } else if (setting.equals(CONFIG_KEY)) {
              configPath = value.isEmpty() ? null : value;
            } else {
              settings.put(setting, value);
            }
          }
        }
      }
    }
    return new ScenarioArgs(
        command,
        Collections.unmodifiableMap(settings),
        configPath,
        verbose,
        help,
        List.copyOf(problems));
  }

  private static String canonicalKey(String key) {
    String name = key.startsWith("--") ? key.substring(2) : key;
    if (name.equalsIgnoreCase(CONFIG_KEY)) {
      return CONFIG_KEY;
    }
    for (String setting : LoggerConfig.SETTING_KEYS) {
      if (setting.equalsIgnoreCase(name)) {
        return setting;
      }
    }
    return null;
  }
}
