package ca.gc.cra.linelog.application;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable per-operation scope that carries a {@link Logger}.
 * <p><strong>Why:</strong> Lets deep call paths log with request-specific attributes without a mutable global,
 * by passing the scope explicitly.</p>
 * <p><strong>Thread-safety:</strong> Immutable; binding returns a new child scope.</p>
 *
 * <pre>{@code
 * LogScope scope = LogScope.bind(LogScope.root(), logger.with("request", id));
 * handle(scope);
 * ...
 * LogScope.loggerFrom(scope).info("Handled");
 * }</pre>
 *
 * @since 0.1.0
 */
public final class LogScope {
  private static final LogScope ROOT = new LogScope(null, null);

  private final LogScope parent;
  private final Logger logger;

  private LogScope(LogScope parent, Logger logger) {
    this.parent = parent;
    this.logger = logger;
  }

  /**
   * Returns the empty root scope.
   */
  public static LogScope root() {
    return ROOT;
  }

  /**
   * Returns a child of {@code scope} carrying {@code logger}.
   *
   * @param scope parent scope; {@code null} is treated as {@link #root()}
   * @param logger logger to bind
   * @return new scope; {@code scope} is unchanged
   */
  public static LogScope bind(LogScope scope, Logger logger) {
    Objects.requireNonNull(logger, "logger");
    return new LogScope(scope == null ? ROOT : scope, logger);
  }

  /**
   * Returns the logger bound nearest to {@code scope}.
   *
   * @param scope scope to search; may be {@code null}
   * @return bound logger, or a new default logger writing to standard error when none is bound; never {@code null}
   */
  public static Logger loggerFrom(LogScope scope) {
    for (LogScope current = scope; current != null; current = current.parent) {
      if (current.logger != null) {
        return current.logger;
      }
    }
    return Logger.create(System.err);
  }

  /**
   * Indicates whether a logger is bound in this scope or any ancestor.
   */
  public boolean hasLogger() {
    for (LogScope current = this; current != null; current = current.parent) {
      if (current.logger != null) {
        return true;
      }
    }
    return false;
  }
}
