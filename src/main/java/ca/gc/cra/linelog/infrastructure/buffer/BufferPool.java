package ca.gc.cra.linelog.infrastructure.buffer;

import java.util.ArrayDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of reusable {@link GrowableBuffer}s that keeps line formatting off the allocator.
 * <p>Buffers that grew beyond {@code maxRetainedCapacity} are dropped on release rather than pooled, so one
 * oversized line cannot inflate the steady-state footprint. Safe for concurrent use.
 */
public final class BufferPool {
  private final int initialCapacity;
  private final int maxRetainedCapacity;
  private final int maxPoolSize;
  private final ArrayDeque<GrowableBuffer> pool;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicLong acquisitions = new AtomicLong();
  private final AtomicLong allocations = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();

  /**
   * Creates a buffer pool.
   *
   * @param initialCapacity capacity of freshly allocated buffers in bytes
   * @param maxRetainedCapacity largest buffer capacity that is returned to the pool
   * @param maxPoolSize maximum number of idle buffers kept in the pool
   */
  public BufferPool(int initialCapacity, int maxRetainedCapacity, int maxPoolSize) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    if (maxRetainedCapacity < initialCapacity) {
      throw new IllegalArgumentException("maxRetainedCapacity must be >= initialCapacity");
    }
    if (maxPoolSize <= 0) {
      throw new IllegalArgumentException("maxPoolSize must be positive");
    }
    this.initialCapacity = initialCapacity;
    this.maxRetainedCapacity = maxRetainedCapacity;
    this.maxPoolSize = maxPoolSize;
    this.pool = new ArrayDeque<>(maxPoolSize);
  }

  /**
   * Borrows an empty buffer from the pool, creating one when the pool is empty.
   *
   * @return pooled buffer handle; close it to return the buffer
   */
  public PooledBuffer acquire() {
    acquisitions.incrementAndGet();
    GrowableBuffer buffer;
    lock.lock();
    try {
      buffer = pool.pollFirst();
    } finally {
      lock.unlock();
    }
    if (buffer == null) {
      allocations.incrementAndGet();
      buffer = new GrowableBuffer(initialCapacity);
    }
    buffer.clear();
    return new PooledBuffer(this, buffer);
  }

  void release(GrowableBuffer buffer) {
    if (buffer == null) {
      return;
    }
    if (buffer.capacity() > maxRetainedCapacity) {
      dropped.incrementAndGet();
      return;
    }
    buffer.clear();
    lock.lock();
    try {
      if (pool.size() < maxPoolSize) {
        pool.addFirst(buffer);
      }
    } finally {
      lock.unlock();
    }
  }

  /** Total number of {@link #acquire()} calls. */
  public long acquisitions() {
    return acquisitions.get();
  }

  /** Number of acquisitions that had to allocate a new buffer. */
  public long allocations() {
    return allocations.get();
  }

  /** Number of released buffers dropped for exceeding the retained capacity ceiling. */
  public long droppedOversize() {
    return dropped.get();
  }

  /** Number of idle buffers currently held. */
  public int idle() {
    lock.lock();
    try {
      return pool.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Encapsulates a borrowed buffer and returns it to the pool when closed.
   */
  public static final class PooledBuffer implements AutoCloseable {
    private final BufferPool owner;
    private GrowableBuffer buffer;

    private PooledBuffer(BufferPool owner, GrowableBuffer buffer) {
      this.owner = owner;
      this.buffer = buffer;
    }

    /**
     * Exposes the borrowed buffer; callers must not retain it after closing.
     *
     * @return active buffer
     */
    public GrowableBuffer buffer() {
      if (buffer == null) {
        throw new IllegalStateException("buffer already released");
      }
      return buffer;
    }

    @Override
    public void close() {
      if (buffer == null) {
        return;
      }
      owner.release(buffer);
      buffer = null;
    }
  }
}
