package ca.gc.cra.linelog.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads logger settings from a YAML file and layers them over an existing {@link LoggerConfig}.
 *
 * <pre>
 * level: info
 * color: never
 * scenarios:
 *   demo:
 *     level: -4
 *     timeFormat: kitchen
 *   prefix:
 *     prefix: http
 * </pre>
 *
 * <p>Top-level settings apply first, then the section under {@code scenarios} whose name matches the running
 * scenario (case-insensitive). Unknown keys are rejected.</p>
 */
public final class LoggerConfigFile {
  private static final Logger log = LoggerFactory.getLogger(LoggerConfigFile.class);

  private LoggerConfigFile() {}

  /**
   * Applies the settings in {@code path} for {@code scenario} on top of {@code base}.
   *
   * @param path YAML file to read
   * @param scenario name of the running scenario
   * @param base configuration the file's settings are layered over
   * @return resulting configuration; {@code base} when the document is empty
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a settings mapping or a setting is invalid
   */
  public static LoggerConfig apply(Path path, String scenario, LoggerConfig base) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(scenario, "scenario");
    Objects.requireNonNull(base, "base");
    LoggerSettingsDocument document = read(path);
    if (document == null) {
      log.debug("Settings file {} is empty", path);
      return base;
    }
    LoggerConfig config = base.withSettings(document.settings());
    LoggerSettingsDocument section = section(document, scenario);
    if (section != null) {
      if (section.getScenarios() != null) {
        throw new IllegalArgumentException("scenario section '" + scenario + "' cannot declare scenarios");
      }
      config = config.withSettings(section.settings());
    }
    log.debug("Loaded {} for scenario {}: {}", path, scenario, document);
    return config;
  }

  private static LoggerSettingsDocument read(Path path) throws IOException {
    Yaml yaml = new Yaml(new Constructor(LoggerSettingsDocument.class, new LoaderOptions()));
    try (InputStream in = Files.newInputStream(path)) {
      return yaml.load(in);
    } catch (YAMLException | ClassCastException ex) {
      throw new IllegalArgumentException("Failed to parse logger settings at " + path + ": " + ex.getMessage(), ex);
    }
  }

  private static LoggerSettingsDocument section(LoggerSettingsDocument document, String scenario) {
    Map<String, LoggerSettingsDocument> scenarios = document.getScenarios();
    if (scenarios == null) {
      return null;
    }
    for (Map.Entry<String, LoggerSettingsDocument> entry : scenarios.entrySet()) {
      if (String.valueOf(entry.getKey()).trim().equalsIgnoreCase(scenario.trim())) {
        return entry.getValue();
      }
    }
    return null;
  }
}
