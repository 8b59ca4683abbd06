package ca.gc.cra.linelog.domain;

/**
 * Decides whether a log call at a given level produces output.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class LevelGate {

  private LevelGate() {}

  /**
   * Returns whether a call attempted at {@code attempted} should be emitted by a logger configured
   * at {@code configured}.
   *
   * @param configured minimum level of the logger
   * @param attempted level of the call
   * @return {@code true} iff {@code attempted >= configured}
   */
  public static boolean shouldEmit(Level configured, Level attempted) {
    return attempted.severity() >= configured.severity();
  }
}
