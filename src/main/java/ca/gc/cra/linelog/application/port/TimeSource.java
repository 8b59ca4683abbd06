package ca.gc.cra.linelog.application.port;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * <strong>What:</strong> Port supplying the instant stamped on each log line.
 * <p><strong>Why:</strong> Lets tests and reproducible tooling inject a fixed clock so rendered timestamps are
 * deterministic.</p>
 * <p><strong>Role:</strong> Port consumed by {@link ca.gc.cra.linelog.application.Logger} on the enabled emit
 * path only.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; loggers call them from any thread.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time; never invoked for disabled or discarded calls.</p>
 *
 * @implNote Default implementation reads the system clock in UTC.
 * @since 0.1.0
 */
@FunctionalInterface
public interface TimeSource {
  /**
   * Returns the current instant together with the offset it should be rendered in.
   *
   * @return current time; never {@code null}
   */
  OffsetDateTime now();

  /** Real wall clock in UTC. */
  TimeSource SYSTEM_UTC = () -> OffsetDateTime.now(ZoneOffset.UTC);

  /**
   * Returns a source that always yields {@code instant}.
   *
   * @param instant fixed time to report
   * @return deterministic time source
   */
  static TimeSource fixed(OffsetDateTime instant) {
    Objects.requireNonNull(instant, "instant");
    return () -> instant;
  }
}
