package ca.gc.cra.linelog.infrastructure.buffer;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Expandable byte buffer that encodes text as UTF-8 straight into a single backing array.
 * <p>Supports amortized O(1) appends with exponential growth. Not thread-safe; a buffer is owned by one
 * caller between {@link BufferPool#acquire()} and release.
 */
public final class GrowableBuffer {
  static final int DEFAULT_CAPACITY = 1024;
  // Largest array size the JVM reliably allocates
  static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;
  private static final byte REPLACEMENT = (byte) '?';

  private byte[] data;
  private int writeIndex;

  /**
   * Creates a buffer using the default initial capacity.
   */
  public GrowableBuffer() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a buffer with a caller-supplied initial capacity.
   *
   * @param initialCapacity minimum backing array size
   * @throws IllegalArgumentException when {@code initialCapacity} is not positive
   */
  public GrowableBuffer(int initialCapacity) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    data = new byte[align(Math.min(MAX_CAPACITY, initialCapacity))];
    writeIndex = 0;
  }

  /**
   * Appends a single byte.
   */
  public void writeByte(int value) {
    ensureWritable(1);
    data[writeIndex++] = (byte) value;
  }

  /**
   * Appends the provided bytes, growing the buffer if required.
   *
   * @param src source array; must not be {@code null}
   */
  public void write(byte[] src) {
    Objects.requireNonNull(src, "src");
    if (src.length == 0) {
      return;
    }
    ensureWritable(src.length);
    System.arraycopy(src, 0, data, writeIndex, src.length);
    writeIndex += src.length;
  }

  /**
   * Appends {@code text} encoded as UTF-8. Unpaired surrogates are written as {@code '?'}.
   *
   * @param text characters to append; must not be {@code null}
   */
  public void writeUtf8(CharSequence text) {
    Objects.requireNonNull(text, "text");
    int length = text.length();
    ensureWritable(length);
    int i = 0;
    // ASCII fast path; the upfront reservation covers it
    while (i < length) {
      char c = text.charAt(i);
      if (c >= 0x80) {
        break;
      }
      data[writeIndex++] = (byte) c;
      i++;
    }
    while (i < length) {
      char c = text.charAt(i++);
      ensureWritable(4);
      if (c < 0x80) {
        data[writeIndex++] = (byte) c;
      } else if (c < 0x800) {
        data[writeIndex++] = (byte) (0xC0 | (c >> 6));
        data[writeIndex++] = (byte) (0x80 | (c & 0x3F));
      } else if (Character.isHighSurrogate(c) && i < length && Character.isLowSurrogate(text.charAt(i))) {
        int codePoint = Character.toCodePoint(c, text.charAt(i++));
        data[writeIndex++] = (byte) (0xF0 | (codePoint >> 18));
        data[writeIndex++] = (byte) (0x80 | ((codePoint >> 12) & 0x3F));
        data[writeIndex++] = (byte) (0x80 | ((codePoint >> 6) & 0x3F));
        data[writeIndex++] = (byte) (0x80 | (codePoint & 0x3F));
      } else if (Character.isSurrogate(c)) {
        data[writeIndex++] = REPLACEMENT;
      } else {
        data[writeIndex++] = (byte) (0xE0 | (c >> 12));
        data[writeIndex++] = (byte) (0x80 | ((c >> 6) & 0x3F));
        data[writeIndex++] = (byte) (0x80 | (c & 0x3F));
      }
    }
  }

  /**
   * Returns the number of bytes written since the last {@link #clear()}.
   */
  public int size() {
    return writeIndex;
  }

  /**
   * Returns the length of the backing array.
   */
  public int capacity() {
    return data.length;
  }

  /**
   * Writes the buffered bytes to {@code out} in a single call.
   *
   * @param out destination stream
   * @throws IOException when the destination fails
   */
  public void writeTo(OutputStream out) throws IOException {
    Objects.requireNonNull(out, "out");
    out.write(data, 0, writeIndex);
  }

  /**
   * Ensures at least {@code minWritableBytes} bytes can be appended without reallocating.
   *
   * @throws IllegalStateException when the content would not fit in a Java array
   */
  public void ensureWritable(int minWritableBytes) {
    if (minWritableBytes <= 0) {
      return;
    }
    int writable = data.length - writeIndex;
    if (writable >= minWritableBytes) {
      return;
    }
    int required = writeIndex + minWritableBytes;
    if (required < 0 || required > MAX_CAPACITY) {
      throw new IllegalStateException("buffer would exceed max capacity: " + required);
    }
    long newCapacity = data.length;
    while (newCapacity < required) {
      newCapacity <<= 1;
    }
    byte[] next = new byte[(int) Math.min(newCapacity, MAX_CAPACITY)];
    System.arraycopy(data, 0, next, 0, writeIndex);
    data = next;
  }

  /**
   * Clears the buffer content without shrinking its capacity.
   */
  public void clear() {
    writeIndex = 0;
  }

  /**
   * Decodes the buffered bytes as UTF-8.
   */
  @Override
  public String toString() {
    return new String(data, 0, writeIndex, StandardCharsets.UTF_8);
  }

  private static int align(int value) {
    int n = 1;
    while (n < value) {
      n <<= 1;
    }
    return n;
  }
}
