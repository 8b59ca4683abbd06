package ca.gc.cra.linelog.infrastructure.buffer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class GrowableBufferTest {

  @Test
  void capacityIsRoundedToPowerOfTwo() {
    assertEquals(1024, new GrowableBuffer().capacity());
    assertEquals(128, new GrowableBuffer(100).capacity());
    assertThrows(IllegalArgumentException.class, () -> new GrowableBuffer(0));
  }

  @Test
  void growsWhenWritesExceedCapacity() {
    GrowableBuffer buffer = new GrowableBuffer(8);
    buffer.writeUtf8("0123456789abcdef0123");

    assertEquals(20, buffer.size());
    assertTrue(buffer.capacity() >= 20);
    assertEquals("0123456789abcdef0123", buffer.toString());
  }

  @Test
  void encodesUtf8AcrossPlanes() {
    GrowableBuffer buffer = new GrowableBuffer(4);
    String text = "café € 🍕 1.5µs";
    buffer.writeUtf8(text);

    assertEquals(text.getBytes(StandardCharsets.UTF_8).length, buffer.size());
    assertEquals(text, buffer.toString());
  }

  @Test
  void unpairedSurrogateIsReplaced() {
    GrowableBuffer buffer = new GrowableBuffer();
    buffer.writeUtf8("a\ud800b");

    assertEquals("a?b", buffer.toString());
  }

  @Test
  void writeToCopiesOnlyWrittenBytes() throws IOException {
    GrowableBuffer buffer = new GrowableBuffer();
    buffer.write(new byte[] {'h', 'i'});
    buffer.writeByte('\n');
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    buffer.writeTo(out);

    assertArrayEquals(new byte[] {'h', 'i', '\n'}, out.toByteArray());
  }

  @Test
  void clearResetsSizeButKeepsCapacity() {
    GrowableBuffer buffer = new GrowableBuffer(16);
    buffer.writeUtf8("x".repeat(100));
    int grown = buffer.capacity();

    buffer.clear();

    assertEquals(0, buffer.size());
    assertEquals(grown, buffer.capacity());
    assertEquals("", buffer.toString());
  }

  @Test
  void growsBeyondThirtyTwoMebibytes() {
    GrowableBuffer buffer = new GrowableBuffer();
    int size = 33 * 1024 * 1024;

    buffer.write(new byte[size]);
    buffer.writeByte('\n');

    assertEquals(size + 1, buffer.size());
    assertEquals(64 * 1024 * 1024, buffer.capacity());
  }

  @Test
  void reservationPastArrayLimitIsRejected() {
    GrowableBuffer buffer = new GrowableBuffer();
    buffer.writeByte('x');

    assertThrows(IllegalStateException.class, () -> buffer.ensureWritable(GrowableBuffer.MAX_CAPACITY));
    assertEquals(1, buffer.size());
  }
}
