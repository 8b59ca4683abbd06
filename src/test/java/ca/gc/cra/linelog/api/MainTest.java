package ca.gc.cra.linelog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class MainTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Logger root;
  private Level originalLevel;
  private Level originalRootLevel;
  private boolean originalAdditive;
  private ByteArrayOutputStream printed;
  private ByteArrayOutputStream sink;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(Main.class);
    root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    originalLevel = logger.getLevel();
    originalRootLevel = root.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    printed = new ByteArrayOutputStream();
    sink = new ByteArrayOutputStream();
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    root.setLevel(originalRootLevel);
  }

  private ExitCode run(String... args) {
    return Main.run(args, sink, new PrintStream(printed, true, StandardCharsets.UTF_8));
  }

  private String usage() {
    return printed.toString(StandardCharsets.UTF_8);
  }

  private String output() {
    return sink.toString(StandardCharsets.UTF_8);
  }

  private boolean loggedError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = run("--help");

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(usage().contains("linelog scenario runner"));
    assertTrue(usage().contains("keys        Attach persistent key=value pairs with a sub-logger"));
    assertEquals("", output());
  }

  @Test
  void missingCommandIsInvalid() {
    ExitCode code = run();

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(usage().contains("usage: linelog"));
    assertTrue(loggedError("Missing command"));
  }

  @Test
  void unknownCommandIsInvalid() {
    ExitCode code = run("bake");

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("Unknown command: bake"));
  }

  @Test
  void unknownFlagIsInvalid() {
    ExitCode code = run("demo", "--loud");

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("unknown flag: --loud"));
  }

  @Test
  void malformedArgumentIsInvalid() {
    ExitCode code = run("demo", "level");

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("unexpected argument: level"));
  }

  @Test
  void unknownSettingIsInvalid() {
    ExitCode code = run("demo", "shade=blue");

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("unknown setting: shade"));
    assertEquals("", output());
  }

  @Test
  void badSettingIsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, run("demo", "level=loud"));
    assertEquals(ExitCode.CONFIG_ERROR, run("demo", "color=sometimes"));
    assertEquals("", output());
  }

  @Test
  void timeFormatThatCannotPrintAnOffsetTimestampIsConfigError() {
    ExitCode code = run("demo", "color=never", "timeFormat=VV");

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(loggedError("cannot render a timestamp"));
    assertEquals("", output());
  }

  @Test
  void demoRunsAtInfoByDefault() {
    ExitCode code = run("demo", "color=never", "timeFormat=kitchen");

    assertEquals(ExitCode.SUCCESS, code);
    String text = output();
    assertFalse(text.contains("DEBUG"));
    assertTrue(text.contains(" INFO: Choosing wine pairing choices=\"[merlot malbec rioja]\"\n"));
    assertTrue(text.contains(" ERROR: No malbec left!\n"));
    assertEquals(4, text.split("\n").length);
  }

  @Test
  void verboseEnablesDebugLines() {
    ExitCode code = run("DEMO", "--verbose", "color=never");

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(output().contains(" DEBUG: Searing steak cook=rare temp=42 time=2m0s\n"));
    assertEquals(Level.DEBUG, root.getLevel());
  }

  @Test
  void prefixArgumentLabelsEveryLine() {
    ExitCode code = run("keys", "prefix=app", "color=never");

    assertEquals(ExitCode.SUCCESS, code);
    for (String line : output().split("\n")) {
      assertTrue(line.contains(" INFO app: "), line);
    }
  }

  @Test
  void settingsFileScenarioSectionAppliesAndCommandLineWins() throws IOException {
    Path yaml = tempDir.resolve("linelog.yaml");
    Files.writeString(yaml, """
        color: false
        timeFormat: kitchen
        scenarios:
          prefix:
            level: 8
        """);

    ExitCode code = run("prefix", "config=" + yaml, "level=warn");

    assertEquals(ExitCode.SUCCESS, code);
    String text = output();
    assertTrue(text.matches("(?s)\\d{1,2}:\\d{2}[AP]M WARN http: Slow endpoint.*"), text);
    assertTrue(text.contains(" ERROR http: Response from something else status=400 duration=33ms\n"));
    assertFalse(text.contains("INFO"));
  }

  @Test
  void settingsFileLevelAppliesWithoutCommandLineOverride() throws IOException {
    Path yaml = tempDir.resolve("quiet.yaml");
    Files.writeString(yaml, """
        color: never
        scenarios:
          PREFIX:
            level: error
        """);

    ExitCode code = run("prefix", "--config=" + yaml);

    assertEquals(ExitCode.SUCCESS, code);
    String[] lines = output().split("\n");
    assertEquals(1, lines.length);
    assertTrue(lines[0].endsWith(" ERROR http: Response from something else status=400 duration=33ms"), lines[0]);
  }

  @Test
  void missingConfigFileIsInvalid() {
    ExitCode code = run("demo", "config=" + tempDir.resolve("absent.yaml"));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("Configuration file does not exist"));
  }

  @Test
  void malformedYamlIsConfigError() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "- just\n- a list\n");

    assertEquals(ExitCode.CONFIG_ERROR, run("demo", "config=" + yaml));
  }

  @Test
  void unknownKeyInSettingsFileIsConfigError() throws IOException {
    Path yaml = tempDir.resolve("typo.yaml");
    Files.writeString(yaml, "colour: never\n");

    assertEquals(ExitCode.CONFIG_ERROR, run("demo", "config=" + yaml));
    assertTrue(loggedError("Invalid configuration file"));
  }
}
