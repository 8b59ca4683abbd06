package ca.gc.cra.linelog.application;

import ca.gc.cra.linelog.application.port.StyleRole;
import ca.gc.cra.linelog.application.port.Styler;
import ca.gc.cra.linelog.domain.Attr;
import ca.gc.cra.linelog.domain.AttrValue;
import ca.gc.cra.linelog.infrastructure.buffer.GrowableBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Renders key/value attributes as {@code key=value} text.
 * <p><strong>Why:</strong> Keeps lines greppable and unambiguous: a value is wrapped in double quotes with escapes
 * exactly when it is empty, contains whitespace, contains a non-printable character, or contains an invalid
 * character sequence. Keys are never quoted.</p>
 * <p><strong>Role:</strong> Leaf formatter used by {@link ca.gc.cra.linelog.application.Logger}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Walk loose {@code key, value} arguments and typed {@link Attr}s in order.</li>
 *   <li>Pair an unmatched trailing key with {@link #MISSING_VALUE}.</li>
 *   <li>Apply one stringify-then-maybe-quote path to every value kind.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Writes straight into the pooled line buffer; only quoted values allocate a
 * temporary string.</p>
 *
 * @since 0.1.0
 */
public final class AttributeFormatter {
  private static final Logger log = LoggerFactory.getLogger(AttributeFormatter.class);

  /** Placeholder paired with a key that has no value. Rendered unquoted. */
  public static final String MISSING_VALUE = "<MISSING>";

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private AttributeFormatter() {
    // Utility
  }

  /**
   * Appends every pair in {@code kv} to {@code buffer}, each preceded by a single space.
   *
   * @param buffer destination line buffer
   * @param styler styling applied to keys
   * @param kv loose {@code key, value} arguments and/or {@link Attr}s; {@code null} is treated as empty
   */
  public static void appendPairs(GrowableBuffer buffer, Styler styler, Object[] kv) {
    if (kv == null) {
      return;
    }
    int i = 0;
    while (i < kv.length) {
      Object element = kv[i];
      if (element instanceof Attr attr) {
        appendPair(buffer, styler, attr.key(), render(attr.value()));
        i++;
        continue;
      }
      String key = String.valueOf(element);
      if (i + 1 >= kv.length) {
        appendRaw(buffer, styler, key, MISSING_VALUE);
        i++;
      } else {
        appendPair(buffer, styler, key, render(kv[i + 1]));
        i += 2;
      }
    }
  }

  /**
   * Formats a single pair without styling, applying the quoting rules to the value.
   *
   * @param key attribute key
   * @param value attribute value; any object accepted by {@link AttrValue#of(Object)}
   * @return {@code key=value} text
   */
  public static String format(String key, Object value) {
    return key + '=' + quoteIfNeeded(render(value));
  }

  /**
   * Returns {@code text} quoted and escaped when {@link #needsQuotes(String)} says so, otherwise unchanged.
   */
  public static String quoteIfNeeded(String text) {
    return needsQuotes(text) ? quote(text) : text;
  }

  /**
   * Indicates whether {@code text} must be rendered as a quoted string.
   *
   * @param text rendered value
   * @return {@code true} when empty, or when any character is whitespace, non-printable, an unpaired surrogate,
   *     or the replacement character U+FFFD
   */
  public static boolean needsQuotes(String text) {
    if (text.isEmpty()) {
      return true;
    }
    int i = 0;
    while (i < text.length()) {
      int codePoint = text.codePointAt(i);
      if (codePoint == 0xFFFD
          || Character.isWhitespace(codePoint)
          || Character.isSpaceChar(codePoint)
          || !isPrintable(codePoint)) {
        return true;
      }
      i += Character.charCount(codePoint);
    }
    return false;
  }

  /**
   * Wraps {@code text} in double quotes, escaping quotes, backslashes, control and non-printable characters.
   *
   * @param text raw text
   * @return quoted literal, e.g. {@code "ooh\t\nstuff"}
   */
  public static String quote(String text) {
    StringBuilder out = new StringBuilder(text.length() + 8);
    out.append('"');
    int i = 0;
    while (i < text.length()) {
      int codePoint = text.codePointAt(i);
      i += Character.charCount(codePoint);
      switch (codePoint) {
        case 0x07 -> out.append("\\a");
        case '\b' -> out.append("\\b");
        case '\f' -> out.append("\\f");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        case 0x0B -> out.append("\\v");
        case '\\' -> out.append("\\\\");
        case '"' -> out.append("\\\"");
        default -> appendEscaped(out, codePoint);
      }
    }
    return out.append('"').toString();
  }

  private static void appendEscaped(StringBuilder out, int codePoint) {
    if (codePoint < 0x20 || codePoint == 0x7F) {
      out.append("\\x");
      appendHex(out, codePoint, 2);
    } else if (Character.getType(codePoint) == Character.SURROGATE) {
      out.append("\\ufffd");
    } else if (codePoint == ' ' || isPrintable(codePoint)) {
      out.appendCodePoint(codePoint);
    } else if (codePoint < 0x10000) {
      out.append("\\u");
      appendHex(out, codePoint, 4);
    } else {
      out.append("\\U");
      appendHex(out, codePoint, 8);
    }
  }

  private static void appendHex(StringBuilder out, int value, int digits) {
    for (int shift = (digits - 1) * 4; shift >= 0; shift -= 4) {
      out.append(HEX[(value >> shift) & 0xF]);
    }
  }

  private static boolean isPrintable(int codePoint) {
    return switch (Character.getType(codePoint)) {
      case Character.CONTROL,
          Character.FORMAT,
          Character.PRIVATE_USE,
          Character.SURROGATE,
          Character.UNASSIGNED,
          Character.LINE_SEPARATOR,
          Character.PARAGRAPH_SEPARATOR,
          Character.SPACE_SEPARATOR -> false;
      default -> true;
    };
  }

  private static String render(Object value) {
    try {
      return AttrValue.of(value).render();
    } catch (RuntimeException ex) {
      log.debug("Attribute value of type {} failed to render", value.getClass().getName(), ex);
      return "<render failed: " + ex.getClass().getSimpleName() + ">";
    }
  }

  private static void appendPair(GrowableBuffer buffer, Styler styler, String key, String value) {
    appendRaw(buffer, styler, key, quoteIfNeeded(value));
  }

  private static void appendRaw(GrowableBuffer buffer, Styler styler, String key, String value) {
    buffer.writeByte(' ');
    buffer.writeUtf8(styler.apply(StyleRole.KEY, key));
    buffer.writeByte('=');
    buffer.writeUtf8(value);
  }
}
