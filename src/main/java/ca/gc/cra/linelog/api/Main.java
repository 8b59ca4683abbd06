package ca.gc.cra.linelog.api;

import ca.gc.cra.linelog.application.Logger;
import ca.gc.cra.linelog.config.LoggerConfig;
import ca.gc.cra.linelog.config.LoggerConfigFile;
import ca.gc.cra.linelog.domain.Level;
import ca.gc.cra.linelog.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.LoggerFactory;

/**
 * linelog CLI dispatcher that runs one of the bundled logging scenarios against stderr.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: linelog <demo|keys|prefix> [level=LEVEL] [timeFormat=LAYOUT] [prefix=TEXT] "
          + "[color=auto|always|never] [config=PATH] [--verbose] [--help]";
  private static final String HELP_TEXT = """
      linelog scenario runner

      Usage:
        linelog <command> [options]

      Commands:
      %s
      Options:
        level=debug|info|warn|error  Minimum level emitted (default info)
        timeFormat=LAYOUT            rfc3339, rfc3339nano, kitchen, datetime, timeonly or a pattern
        prefix=TEXT                  Initial logger prefix
        color=auto|always|never      Colour mode (default auto; honours NO_COLOR and FORCE_COLOR)
        config=PATH                  YAML settings file; top-level keys plus scenarios.<command>

      Global flags:
        --help      Show this message
        --verbose   Emit debug lines and enable DEBUG diagnostics
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs a scenario against stderr, printing usage to stdout, and returns its exit code without terminating the
   * JVM.
   *
   * @param args dispatcher arguments (first bare token is the command)
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, System.err, System.out);
  }

  /**
   * Runs a scenario against the supplied sink.
   *
   * @param args dispatcher arguments (first bare token is the command)
   * @param sink destination for log lines
   * @param out destination for help and usage text
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args, OutputStream sink, PrintStream out) {
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(out, "out");
    ScenarioArgs parsed = ScenarioArgs.parse(args);
    if (parsed.help()) {
      out.println(helpText());
      return ExitCode.SUCCESS;
    }
    if (parsed.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (!parsed.problems().isEmpty()) {
      log.error("Invalid arguments: {}", parsed.problems());
      out.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (parsed.command() == null) {
      log.error("Missing command");
      out.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Optional<Example> example = Example.fromCommand(parsed.command());
    if (example.isEmpty()) {
      log.error("Unknown command: {}", parsed.command());
      out.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = example.get().command();

    LoggerConfig config = LoggerConfig.defaults();
    if (parsed.configPath() != null) {
      Path settingsFile = Path.of(parsed.configPath());
      if (!Files.isRegularFile(settingsFile)) {
        log.error("Configuration file does not exist: {}", settingsFile);
        out.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        config = LoggerConfigFile.apply(settingsFile, command, config);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid configuration file {}: {}", settingsFile, ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", settingsFile, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Logger logger;
    try {
      config = config.withSettings(parsed.settings());
      if (parsed.verbose()) {
        config = config.withLevel(Level.DEBUG);
      }
      log.debug("Running {} with level={} timeFormat={} color={}",
          command, config.level(), config.timeFormat(), config.color());
      logger = Logger.create(sink, config.toOptions());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid logger configuration: {}", ex.getMessage());
      out.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }
    example.get().run(logger);
    return ExitCode.SUCCESS;
  }

  private static String helpText() {
    StringBuilder commands = new StringBuilder();
    for (Example example : Example.values()) {
      commands.append(String.format("  %-10s  %s%n", example.command(), example.summary()));
    }
    return String.format(HELP_TEXT, commands).stripTrailing();
  }
}
