package ca.gc.cra.linelog.domain;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A single typed key/value pair.
 *
 * <p>Passing an {@code Attr} among the {@code Object...} arguments of a log call counts as one complete
 * pair, so typed and loose pairs can be mixed freely:</p>
 *
 * <pre>{@code
 * logger.info("Choosing wine pairing", Attr.strings("choices", "merlot", "malbec"), "course", 2);
 * }</pre>
 *
 * @param key attribute key; never quoted when rendered
 * @param value typed value
 * @since 0.1.0
 */
public record Attr(String key, AttrValue value) {

  public Attr {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }

  public static Attr string(String key, String value) {
    return new Attr(key, new AttrValue.StringValue(value == null ? AttrValue.NIL : value));
  }

  public static Attr integer(String key, long value) {
    return new Attr(key, new AttrValue.LongValue(value));
  }

  public static Attr number(String key, double value) {
    return new Attr(key, new AttrValue.DoubleValue(value));
  }

  public static Attr bool(String key, boolean value) {
    return new Attr(key, new AttrValue.BoolValue(value));
  }

  public static Attr duration(String key, Duration value) {
    return new Attr(key, AttrValue.of(value));
  }

  public static Attr strings(String key, String... values) {
    return strings(key, values == null ? List.of() : Arrays.asList(values));
  }

  public static Attr strings(String key, List<String> values) {
    return new Attr(key, AttrValue.of(values));
  }

  public static Attr group(String key, Attr... attrs) {
    return new Attr(key, new AttrValue.GroupValue(attrs == null ? List.of() : List.of(attrs)));
  }

  /**
   * Builds an attribute from an arbitrary value, mapped through {@link AttrValue#of(Object)}.
   *
   * @param key attribute key
   * @param value any value; may be {@code null}
   * @return typed attribute
   */
  public static Attr any(String key, Object value) {
    return new Attr(key, AttrValue.of(value));
  }
}
