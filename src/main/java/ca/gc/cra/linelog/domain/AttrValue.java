package ca.gc.cra.linelog.domain;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Closed set of value kinds a log attribute can carry.
 * <p><strong>Why:</strong> Attributes are schema-less, so every supported kind is modelled explicitly with a
 * single stringification each instead of relying on whatever {@code toString()} an object happens to have.</p>
 * <p><strong>Role:</strong> Domain value rendered by the attribute formatter; quoting is applied afterwards and
 * is identical for every kind.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 * @see Attr
 */
public sealed interface AttrValue {
  /** Text rendered for {@code null} values. */
  String NIL = "<nil>";

  /**
   * Renders the default representation of the value, before any quoting.
   *
   * @return rendered text; never {@code null}
   */
  String render();

  /**
   * Maps an arbitrary object onto the closed set of value kinds.
   *
   * <p>Integral boxed types become {@link LongValue}, {@code Float}/{@code Double} become
   * {@link DoubleValue}, collections and arrays become {@link ListValue}, maps and {@link Attr}s become
   * {@link GroupValue}. Anything else is carried as its {@link String#valueOf(Object)} text.</p>
   *
   * @param value candidate value; may be {@code null}
   * @return attribute value; never {@code null}
   */
  static AttrValue of(Object value) {
    if (value == null) {
      return new StringValue(NIL);
    }
    if (value instanceof AttrValue attrValue) {
      return attrValue;
    }
    if (value instanceof String text) {
      return new StringValue(text);
    }
    if (value instanceof Boolean bool) {
      return new BoolValue(bool);
    }
    if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte
        || value instanceof AtomicInteger
        || value instanceof AtomicLong) {
      return new LongValue(((Number) value).longValue());
    }
    if (value instanceof Double number) {
      return new DoubleValue(number);
    }
    if (value instanceof Float number) {
      // Float.toString keeps the shortest float form, so 0.1f stays 0.1 after widening
      return new DoubleValue(Double.parseDouble(Float.toString(number)));
    }
    if (value instanceof Duration duration) {
      return new DurationValue(duration);
    }
    if (value instanceof Attr attr) {
      return new GroupValue(List.of(attr));
    }
    if (value instanceof Map<?, ?> map) {
      List<Attr> attrs = new ArrayList<>(map.size());
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        attrs.add(Attr.any(String.valueOf(entry.getKey()), entry.getValue()));
      }
      attrs.sort(Comparator.comparing(Attr::key));
      return new GroupValue(attrs);
    }
    if (value instanceof Collection<?> collection) {
      List<String> items = new ArrayList<>(collection.size());
      for (Object item : collection) {
        items.add(of(item).render());
      }
      return new ListValue(items);
    }
    List<String> items = arrayItems(value);
    if (items != null) {
      return new ListValue(items);
    }
    return new StringValue(String.valueOf(value));
  }

  private static List<String> arrayItems(Object value) {
    List<String> items = new ArrayList<>();
    if (value instanceof Object[] array) {
      for (Object item : array) {
        items.add(of(item).render());
      }
    } else if (value instanceof int[] array) {
      for (int item : array) {
        items.add(Integer.toString(item));
      }
    } else if (value instanceof long[] array) {
      for (long item : array) {
        items.add(Long.toString(item));
      }
    } else if (value instanceof short[] array) {
      for (short item : array) {
        items.add(Short.toString(item));
      }
    } else if (value instanceof byte[] array) {
      for (byte item : array) {
        items.add(Byte.toString(item));
      }
    } else if (value instanceof double[] array) {
      for (double item : array) {
        items.add(DoubleValue.formatFloat(item));
      }
    } else if (value instanceof float[] array) {
      for (float item : array) {
        items.add(DoubleValue.formatFloat(Double.parseDouble(Float.toString(item))));
      }
    } else if (value instanceof boolean[] array) {
      for (boolean item : array) {
        items.add(Boolean.toString(item));
      }
    } else if (value instanceof char[] array) {
      for (char item : array) {
        items.add(String.valueOf(item));
      }
    } else {
      return null;
    }
    return items;
  }

  /** Plain text value. */
  record StringValue(String value) implements AttrValue {
    public StringValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String render() {
      return value;
    }
  }

  /** Integer value rendered in decimal. */
  record LongValue(long value) implements AttrValue {
    @Override
    public String render() {
      return Long.toString(value);
    }
  }

  /** Floating point value rendered in its shortest form. */
  record DoubleValue(double value) implements AttrValue {
    @Override
    public String render() {
      return formatFloat(value);
    }

    /**
     * Formats a double the way terminal-oriented tools usually print them: {@code 3}, {@code 0.25},
     * {@code 1e+06}, {@code 1e-05}, {@code NaN}, {@code +Inf}.
     *
     * @param value number to format
     * @return compact text form
     */
    static String formatFloat(double value) {
      if (Double.isNaN(value)) {
        return "NaN";
      }
      if (Double.isInfinite(value)) {
        return value > 0 ? "+Inf" : "-Inf";
      }
      if (value == 0.0d) {
        return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
      }
      double abs = Math.abs(value);
      if (abs >= 1e-4 && abs < 1e6) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
      }
      BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
      String digits = decimal.unscaledValue().abs().toString();
      int exponent = digits.length() - 1 - decimal.scale();
      StringBuilder out = new StringBuilder(digits.length() + 6);
      if (value < 0) {
        out.append('-');
      }
      out.append(digits.charAt(0));
      if (digits.length() > 1) {
        out.append('.').append(digits, 1, digits.length());
      }
      out.append('e').append(exponent < 0 ? '-' : '+');
      int absExponent = Math.abs(exponent);
      if (absExponent < 10) {
        out.append('0');
      }
      out.append(absExponent);
      return out.toString();
    }
  }

  /** Boolean value rendered as {@code true} or {@code false}. */
  record BoolValue(boolean value) implements AttrValue {
    @Override
    public String render() {
      return Boolean.toString(value);
    }
  }

  /** Duration rendered in compact unit form, e.g. {@code 2m0s} or {@code 57ms}. */
  record DurationValue(Duration value) implements AttrValue {
    public DurationValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String render() {
      return Durations.format(value);
    }
  }

  /** Sequence of already-rendered strings, shown as {@code [a b c]}. */
  record ListValue(List<String> values) implements AttrValue {
    public ListValue {
      values = List.copyOf(values);
    }

    @Override
    public String render() {
      return "[" + String.join(" ", values) + "]";
    }
  }

  /** Nested key/value pairs, shown as {@code {k=v k2=v2}}. */
  record GroupValue(List<Attr> attrs) implements AttrValue {
    public GroupValue {
      attrs = List.copyOf(attrs);
    }

    @Override
    public String render() {
      StringBuilder out = new StringBuilder(16 * (attrs.size() + 1));
      out.append('{');
      for (int i = 0; i < attrs.size(); i++) {
        if (i > 0) {
          out.append(' ');
        }
        Attr attr = attrs.get(i);
        out.append(attr.key()).append('=').append(attr.value().render());
      }
      return out.append('}').toString();
    }
  }
}
