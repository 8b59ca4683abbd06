package ca.gc.cra.linelog.infrastructure.buffer;

/**
 * Central registry for the shared {@link BufferPool} used by every logger in the process.
 */
public final class BufferPools {
  /** Buffers that grew past this many bytes are not returned to the pool. */
  public static final int MAX_RETAINED_BYTES = 64 * 1024;
  private static final int MAX_POOL_ENTRIES = Math.max(4, 2 * Runtime.getRuntime().availableProcessors());

  private static final BufferPool LINE_POOL =
      new BufferPool(GrowableBuffer.DEFAULT_CAPACITY, MAX_RETAINED_BYTES, MAX_POOL_ENTRIES);

  private BufferPools() {}

  /**
   * Provides the shared pool of line buffers.
   */
  public static BufferPool lineBuffers() {
    return LINE_POOL;
  }
}
