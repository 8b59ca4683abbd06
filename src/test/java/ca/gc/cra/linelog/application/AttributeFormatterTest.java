package ca.gc.cra.linelog.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.linelog.application.port.StyleRole;
import ca.gc.cra.linelog.application.port.Styler;
import ca.gc.cra.linelog.domain.Attr;
import ca.gc.cra.linelog.infrastructure.buffer.GrowableBuffer;
import org.junit.jupiter.api.Test;

class AttributeFormatterTest {

  private static String pairs(Object... kv) {
    GrowableBuffer buffer = new GrowableBuffer();
    AttributeFormatter.appendPairs(buffer, Styler.NONE, kv);
    return buffer.toString();
  }

  @Test
  void plainValuesAreNotQuoted() {
    assertEquals(" file=./file.txt n=12 ok=true", pairs("file", "./file.txt", "n", 12, "ok", true));
  }

  @Test
  void emptyAndWhitespaceValuesAreQuoted() {
    assertEquals(" empty=\"\"", pairs("empty", ""));
    assertEquals(" s=\"this has spaces\"", pairs("s", "this has spaces"));
    assertEquals(" nbsp=\"a\\u00a0b\"", pairs("nbsp", "a\u00a0b"));
  }

  @Test
  void trailingKeyGetsMissingMarker() {
    assertEquals(" enabled=true elapsed=<MISSING>", pairs("enabled", true, "elapsed"));
    assertEquals(" only=<MISSING>", pairs("only"));
  }

  @Test
  void attrCountsAsWholePair() {
    assertEquals(" a=1 b=2 c=<MISSING>", pairs(Attr.integer("a", 1), "b", 2, "c"));
  }

  @Test
  void nullAndEmptyInputsWriteNothing() {
    assertEquals("", pairs());
    GrowableBuffer buffer = new GrowableBuffer();
    AttributeFormatter.appendPairs(buffer, Styler.NONE, null);
    assertEquals(0, buffer.size());
  }

  @Test
  void keysAreStyledAndValuesAreNot() {
    GrowableBuffer buffer = new GrowableBuffer();
    Styler upper = (role, text) -> role == StyleRole.KEY ? text.toUpperCase() : text;
    AttributeFormatter.appendPairs(buffer, upper, new Object[] {"status", "ok", "gone"});
    assertEquals(" STATUS=ok GONE=<MISSING>", buffer.toString());
  }

  @Test
  void needsQuotesDetectsSpecialCharacters() {
    assertTrue(AttributeFormatter.needsQuotes(""));
    assertTrue(AttributeFormatter.needsQuotes("tab\there"));
    assertTrue(AttributeFormatter.needsQuotes("bell\u0007"));
    assertTrue(AttributeFormatter.needsQuotes("bad\ufffd"));
    assertTrue(AttributeFormatter.needsQuotes("lone\ud800"));
    assertTrue(AttributeFormatter.needsQuotes("zero\u200bwidth"));
    assertFalse(AttributeFormatter.needsQuotes("plain"));
    assertFalse(AttributeFormatter.needsQuotes("caf\u00e9"));
    assertFalse(AttributeFormatter.needsQuotes("quote\"inside"));
    assertFalse(AttributeFormatter.needsQuotes("emoji\ud83c\udf55"));
  }

  @Test
  void quoteEscapesControlAndInvalidCharacters() {
    assertEquals("\"ooh\\t\\nstuff\"", AttributeFormatter.quote("ooh\t\nstuff"));
    assertEquals("\"\\a\\b\\f\\r\\v\"", AttributeFormatter.quote("\u0007\b\f\r\u000b"));
    assertEquals("\"say \\\"hi\\\" \\\\o/\"", AttributeFormatter.quote("say \"hi\" \\o/"));
    assertEquals("\"\\x00\\x1b\\x7f\"", AttributeFormatter.quote("\u0000\u001b\u007f"));
    assertEquals("\"\\u200b\"", AttributeFormatter.quote("\u200b"));
    assertEquals("\"\\ufffd\"", AttributeFormatter.quote("\ud800"));
    assertEquals("\"caf\u00e9 \ud83c\udf55\"", AttributeFormatter.quote("caf\u00e9 \ud83c\udf55"));
  }

  @Test
  void quoteIfNeededLeavesPlainTextAlone() {
    assertEquals("plain", AttributeFormatter.quoteIfNeeded("plain"));
    assertEquals("\"two words\"", AttributeFormatter.quoteIfNeeded("two words"));
  }

  @Test
  void formatRendersSinglePair() {
    assertEquals("retries=3", AttributeFormatter.format("retries", 3));
    assertEquals("reason=\"timed out\"", AttributeFormatter.format("reason", "timed out"));
    assertEquals("value=<nil>", AttributeFormatter.format("value", null));
  }

  @Test
  void failingToStringIsContained() {
    Object broken = new Object() {
      @Override
      public String toString() {
        throw new IllegalStateException("boom");
      }
    };
    assertEquals(" x=\"<render failed: IllegalStateException>\"", pairs("x", broken));
  }
}
