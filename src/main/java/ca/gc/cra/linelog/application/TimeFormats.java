package ca.gc.cra.linelog.application;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Map;

/**
 * Named timestamp layouts accepted by {@link LoggerOption#timeFormat(String)}.
 */
public final class TimeFormats {
  /** {@code 2025-04-01T13:34:03Z}; the default layout. */
  public static final DateTimeFormatter RFC3339 =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX", Locale.ROOT);

  /** {@code 2025-04-01T13:34:03.25Z}; fractional seconds with trailing zeros trimmed. */
  public static final DateTimeFormatter RFC3339_NANO = new DateTimeFormatterBuilder()
      .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .appendOffset("+HH:MM", "Z")
      .toFormatter(Locale.ROOT);

  /** {@code 1:34PM}. */
  public static final DateTimeFormatter KITCHEN = DateTimeFormatter.ofPattern("h:mma", Locale.US);

  /** {@code 2025-04-01 13:34:03}. */
  public static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

  /** {@code 13:34:03}. */
  public static final DateTimeFormatter TIME_ONLY = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT);

  private static final Map<String, DateTimeFormatter> NAMED = Map.of(
      "rfc3339", RFC3339,
      "rfc3339nano", RFC3339_NANO,
      "kitchen", KITCHEN,
      "datetime", DATE_TIME,
      "timeonly", TIME_ONLY);

  private TimeFormats() {}

  /**
   * Resolves a named layout ({@code rfc3339}, {@code rfc3339nano}, {@code kitchen}, {@code datetime},
   * {@code timeonly}; case-insensitive) or compiles {@code layout} as a {@link DateTimeFormatter} pattern.
   *
   * @param layout layout name or pattern
   * @return formatter
   * @throws IllegalArgumentException when the pattern is blank or invalid
   */
  public static DateTimeFormatter resolve(String layout) {
    if (layout == null || layout.isBlank()) {
      throw new IllegalArgumentException("time format must not be blank");
    }
    DateTimeFormatter named = NAMED.get(layout.trim().toLowerCase(Locale.ROOT));
    if (named != null) {
      return named;
    }
    return DateTimeFormatter.ofPattern(layout, Locale.ROOT);
  }

  /**
   * Checks that {@code formatter} can print an offset timestamp, which is what every log line carries.
   *
   * @param formatter compiled layout
   * @return {@code formatter}
   * @throws IllegalArgumentException when the layout asks for a field an {@link OffsetDateTime} lacks, such as a
   *     region id
   */
  public static DateTimeFormatter requireRenderable(DateTimeFormatter formatter) {
    try {
      formatter.format(OffsetDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC));
      return formatter;
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("time format cannot render a timestamp: " + ex.getMessage(), ex);
    }
  }
}
