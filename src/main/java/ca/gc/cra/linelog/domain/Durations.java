package ca.gc.cra.linelog.domain;

import java.time.Duration;

/**
 * Compact duration rendering: {@code 0s}, {@code 750ns}, {@code 1.5µs}, {@code 57ms}, {@code 30s},
 * {@code 2m0s}, {@code 1h0m0s}.
 * <p>Stateless and thread-safe.</p>
 */
public final class Durations {
  private static final long NANOS_PER_MICRO = 1_000L;
  private static final long NANOS_PER_MILLI = 1_000_000L;
  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private Durations() {}

  /**
   * Formats {@code duration} using the largest units that keep the value exact.
   *
   * @param duration duration to render; must not be {@code null}
   * @return compact representation; falls back to ISO-8601 for durations beyond the nanosecond range
   */
  public static String format(Duration duration) {
    long nanos;
    try {
      nanos = duration.toNanos();
    } catch (ArithmeticException ex) {
      return duration.toString();
    }
    if (nanos == 0) {
      return "0s";
    }
    StringBuilder out = new StringBuilder(16);
    if (nanos < 0) {
      out.append('-');
    }
    // Long.MIN_VALUE negates to itself; the unsigned helpers below still read it correctly
    long magnitude = nanos < 0 ? -nanos : nanos;

    if (Long.compareUnsigned(magnitude, NANOS_PER_SECOND) < 0) {
      if (magnitude < NANOS_PER_MICRO) {
        return out.append(magnitude).append("ns").toString();
      }
      if (magnitude < NANOS_PER_MILLI) {
        appendScaled(out, magnitude, NANOS_PER_MICRO, 3);
        return out.append("µs").toString();
      }
      appendScaled(out, magnitude, NANOS_PER_MILLI, 6);
      return out.append("ms").toString();
    }

    long totalSeconds = Long.divideUnsigned(magnitude, NANOS_PER_SECOND);
    long fractionNanos = Long.remainderUnsigned(magnitude, NANOS_PER_SECOND);
    long seconds = totalSeconds % 60;
    long totalMinutes = totalSeconds / 60;
    if (totalMinutes > 0) {
      long hours = totalMinutes / 60;
      if (hours > 0) {
        out.append(hours).append('h');
      }
      out.append(totalMinutes % 60).append('m');
    }
    out.append(seconds);
    appendFraction(out, fractionNanos, 9);
    return out.append('s').toString();
  }

  private static void appendScaled(StringBuilder out, long value, long unit, int precision) {
    out.append(value / unit);
    appendFraction(out, value % unit, precision);
  }

  private static void appendFraction(StringBuilder out, long remainder, int precision) {
    if (remainder == 0) {
      return;
    }
    String digits = Long.toString(remainder);
    int end = digits.length();
    while (end > 0 && digits.charAt(end - 1) == '0') {
      end--;
    }
    out.append('.');
    for (int i = digits.length(); i < precision; i++) {
      out.append('0');
    }
    out.append(digits, 0, end);
  }
}
