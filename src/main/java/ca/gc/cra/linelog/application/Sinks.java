package ca.gc.cra.linelog.application;

import java.io.OutputStream;

/**
 * Well-known log sinks.
 */
public final class Sinks {
  private static final OutputStream DISCARD = new OutputStream() {
    @Override
    public void write(int b) {
      // discarded
    }

    @Override
    public void write(byte[] b, int off, int len) {
      // discarded
    }

    @Override
    public String toString() {
      return "Sinks.discard()";
    }
  };

  private Sinks() {}

  /**
   * Returns the designated discard sink. Loggers constructed over it skip all formatting work.
   *
   * @return shared sink that drops every byte
   */
  public static OutputStream discard() {
    return DISCARD;
  }

  /**
   * Returns whether {@code sink} is the designated discard sink (identity comparison).
   */
  public static boolean isDiscard(OutputStream sink) {
    return sink == DISCARD;
  }
}
