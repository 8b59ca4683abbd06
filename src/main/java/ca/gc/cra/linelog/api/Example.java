package ca.gc.cra.linelog.api;

import ca.gc.cra.linelog.application.Logger;
import ca.gc.cra.linelog.domain.Attr;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Canned logging scenarios that show off levels, typed attributes, sub-loggers and prefixes.
 */
enum Example {
  /** Every level with typed attributes. */
  DEMO("Cook a steak dinner at every log level") {
    @Override
    void run(Logger logger) {
      logger.debug(
          "Searing steak",
          Attr.string("cook", "rare"),
          Attr.integer("temp", 42),
          Attr.duration("time", Duration.ofMinutes(2)));
      logger.info("Choosing wine pairing", Attr.strings("choices", "merlot", "malbec", "rioja"));
      logger.error("No malbec left!");
      logger.warn("Falling back to second choice", Attr.string("fallback", "rioja"));
      logger.info("Eating steak", Attr.string("cut", "sirloin"), Attr.bool("enjoying", true));
    }
  },
  /** Persistent attributes on a derived logger. */
  KEYS("Attach persistent key=value pairs with a sub-logger") {
    @Override
    void run(Logger logger) {
      logger.info(
          "Doing something",
          Attr.bool("cache", true),
          Attr.duration("duration", Duration.ofSeconds(30)),
          Attr.integer("number", 42));
      Logger sub = logger.with(Attr.bool("sub", true));
      sub.info("Hello from the sub logger", Attr.string("subkey", "yes"));
    }
  },
  /** A prefixed logger alongside its parent. */
  PREFIX("Label an HTTP client's lines with a prefix") {
    @Override
    void run(Logger logger) {
      Logger prefixed = logger.prefixed("http");
      logger.info("Calling GitHub API", Attr.string("url", "https://api.github.com/"));
      prefixed.warn("Slow endpoint", "endpoint", "users/slow", "duration", Duration.ofSeconds(10));
      prefixed.info("Response from get repos", "status", 200, "duration", Duration.ofMillis(500));
      prefixed.error("Response from something else", "status", 400, "duration", Duration.ofMillis(33));
    }
  };

  private final String summary;

  Example(String summary) {
    this.summary = summary;
  }

  abstract void run(Logger logger);

  String command() {
    return name().toLowerCase(Locale.ROOT);
  }

  String summary() {
    return summary;
  }

  static Optional<Example> fromCommand(String command) {
    for (Example example : values()) {
      if (example.command().equalsIgnoreCase(command)) {
        return Optional.of(example);
      }
    }
    return Optional.empty();
  }
}
