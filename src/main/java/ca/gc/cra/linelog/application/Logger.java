package ca.gc.cra.linelog.application;

import ca.gc.cra.linelog.application.port.StyleRole;
import ca.gc.cra.linelog.application.port.Styler;
import ca.gc.cra.linelog.application.port.TimeSource;
import ca.gc.cra.linelog.domain.Level;
import ca.gc.cra.linelog.domain.LevelGate;
import ca.gc.cra.linelog.infrastructure.buffer.BufferPool;
import ca.gc.cra.linelog.infrastructure.buffer.BufferPools;
import ca.gc.cra.linelog.infrastructure.buffer.GrowableBuffer;
import ca.gc.cra.linelog.infrastructure.style.AnsiStyler;
import java.io.IOException;
import java.io.OutputStream;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Levelled, human-readable line logger for command-line programs.
 * <p><strong>Why:</strong> CLIs with a {@code --debug} or {@code --verbose} flag want consistent, colourful,
 * semi-structured output without configuring a logging framework.</p>
 * <p><strong>Line format:</strong>
 * <pre>{@code <timestamp> <LEVEL>[ <prefix>]: <message>[ <key>=<value>]*\n}</pre>
 * <p><strong>Role:</strong> Application core; composes {@link LevelGate}, the pooled line buffers and
 * {@link AttributeFormatter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject disabled or discarded calls before doing any work.</li>
 *   <li>Render each line into a pooled buffer and write it to the sink in one call under a lock.</li>
 *   <li>Derive sub-loggers ({@link #with(Object...)}, {@link #prefixed(String)}) that share the sink and lock.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads. Lines written through a logger and all
 * loggers derived from it never interleave; their relative order under contention is unspecified.</p>
 * <p><strong>Performance:</strong> A disabled or discarded call costs one level comparison: no buffer, no lock and
 * no clock read.</p>
 * <p><strong>Error handling:</strong> No emit call throws. A line that fails to format, or that the sink rejects, is
 * dropped and reported at DEBUG on this class's SLF4J logger.</p>
 *
 * @since 0.1.0
 * @see LoggerOption
 * @see LogScope
 */
public final class Logger {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(Logger.class);
  private static final Object[] NO_ATTRS = new Object[0];

  private final OutputStream sink;
  private final ReentrantLock lock;
  private final boolean discard;
  private final TimeSource timeSource;
  private final DateTimeFormatter timeFormat;
  private final Styler styler;
  private final BufferPool bufferPool;
  private final Level level;
  private final String prefix;
  private final Object[] attrs;

  private Logger(
      OutputStream sink,
      ReentrantLock lock,
      boolean discard,
      TimeSource timeSource,
      DateTimeFormatter timeFormat,
      Styler styler,
      BufferPool bufferPool,
      Level level,
      String prefix,
      Object[] attrs) {
    this.sink = sink;
    this.lock = lock;
    this.discard = discard;
    this.timeSource = timeSource;
    this.timeFormat = timeFormat;
    this.styler = styler;
    this.bufferPool = bufferPool;
    this.level = level;
    this.prefix = prefix;
    this.attrs = attrs;
  }

  /**
   * Creates a logger writing to {@code sink}.
   *
   * @param sink destination for log lines; owned by the caller and never closed by the logger
   * @param options configuration applied in order; later options win
   * @return new logger
   * @throws NullPointerException if {@code sink} or any option is {@code null}
   * @throws IllegalArgumentException if the configured time format cannot render a timestamp
   */
  public static Logger create(OutputStream sink, LoggerOption... options) {
    Objects.requireNonNull(sink, "sink");
    Settings settings = new Settings();
    if (options != null) {
      for (LoggerOption option : options) {
        Objects.requireNonNull(option, "option").applyTo(settings);
      }
    }
    TimeFormats.requireRenderable(settings.timeFormat);
    Styler styler = settings.styler != null ? settings.styler : AnsiStyler.auto();
    return new Logger(
        sink,
        new ReentrantLock(),
        Sinks.isDiscard(sink),
        settings.timeSource,
        settings.timeFormat,
        styler,
        settings.bufferPool,
        settings.level,
        settings.prefix,
        NO_ATTRS);
  }

  /**
   * Returns a logger that appends {@code kv} to this logger's persistent attributes.
   *
   * <p>The result is otherwise an exact clone and shares this logger's sink and lock. This logger is not
   * modified.</p>
   *
   * @param kv loose {@code key, value} pairs and/or {@link ca.gc.cra.linelog.domain.Attr}s
   * @return derived logger
   */
  public Logger with(Object... kv) {
    Object[] merged = attrs;
    if (kv != null && kv.length > 0) {
      merged = Arrays.copyOf(attrs, attrs.length + kv.length);
      System.arraycopy(kv, 0, merged, attrs.length, kv.length);
    }
    return new Logger(sink, lock, discard, timeSource, timeFormat, styler, bufferPool, level, prefix, merged);
  }

  /**
   * Returns a logger whose lines carry {@code prefix} between the level and the message.
   *
   * <p>The result is otherwise an exact clone and shares this logger's sink and lock. This logger is not
   * modified.</p>
   *
   * @param prefix new prefix; {@code null} or empty removes it
   * @return derived logger
   */
  public Logger prefixed(String prefix) {
    String value = prefix == null ? "" : prefix;
    return new Logger(sink, lock, discard, timeSource, timeFormat, styler, bufferPool, level, value, attrs);
  }

  /** Writes a DEBUG line. */
  public void debug(String msg, Object... kv) {
    log(Level.DEBUG, msg, kv);
  }

  /** Writes an INFO line. */
  public void info(String msg, Object... kv) {
    log(Level.INFO, msg, kv);
  }

  /** Writes a WARN line. */
  public void warn(String msg, Object... kv) {
    log(Level.WARN, msg, kv);
  }

  /** Writes an ERROR line. */
  public void error(String msg, Object... kv) {
    log(Level.ERROR, msg, kv);
  }

  /**
   * Writes a line at an arbitrary level. Levels outside the defined four render as {@code unknown}.
   *
   * @param level severity of the line
   * @param msg message written verbatim
   * @param kv loose {@code key, value} pairs and/or {@link ca.gc.cra.linelog.domain.Attr}s
   */
  public void log(Level level, String msg, Object... kv) {
    if (discard || !LevelGate.shouldEmit(this.level, level)) {
      return;
    }
    try (BufferPool.PooledBuffer pooled = bufferPool.acquire()) {
      GrowableBuffer buffer = pooled.buffer();
      if (!formatLine(buffer, level, msg, kv)) {
        return;
      }
      lock.lock();
      try {
        buffer.writeTo(sink);
        sink.flush();
      } catch (IOException | RuntimeException ex) {
        log.debug("Dropped log line after sink write failure", ex);
      } finally {
        lock.unlock();
      }
    }
  }

  /**
   * Indicates whether a call at {@code level} would produce output.
   *
   * @param level level to test
   * @return {@code false} when the level is disabled or the sink is the discard sink
   */
  public boolean isEnabled(Level level) {
    return !discard && LevelGate.shouldEmit(this.level, level);
  }

  /** Returns the minimum level this logger emits. */
  public Level level() {
    return level;
  }

  /** Returns the prefix, or an empty string when none is set. */
  public String prefix() {
    return prefix;
  }

  ReentrantLock lock() {
    return lock;
  }

  private boolean formatLine(GrowableBuffer buffer, Level level, String msg, Object[] kv) {
    try {
      buffer.writeUtf8(styler.apply(StyleRole.TIMESTAMP, timeFormat.format(timeSource.now())));
      buffer.writeByte(' ');
      StyleRole levelRole = StyleRole.forLevel(level);
      buffer.writeUtf8(levelRole == null ? level.label() : styler.apply(levelRole, level.label()));
      if (!prefix.isEmpty()) {
        buffer.writeByte(' ');
        buffer.writeUtf8(styler.apply(StyleRole.PREFIX, prefix));
      }
      buffer.writeByte(':');
      buffer.writeByte(' ');
      buffer.writeUtf8(String.valueOf(msg));
      // Persistent and call-site pairs are separate segments; an odd key in either gets its own marker
      AttributeFormatter.appendPairs(buffer, styler, attrs);
      AttributeFormatter.appendPairs(buffer, styler, kv);
      buffer.writeByte('\n');
      return true;
    } catch (RuntimeException ex) {
      log.debug("Dropped {} log line after formatting failure", level.label(), ex);
      return false;
    }
  }

  /**
   * Mutable settings populated by {@link LoggerOption}s while a logger is created.
   */
  public static final class Settings {
    Level level = Level.INFO;
    DateTimeFormatter timeFormat = TimeFormats.RFC3339;
    TimeSource timeSource = TimeSource.SYSTEM_UTC;
    String prefix = "";
    Styler styler;
    BufferPool bufferPool = BufferPools.lineBuffers();

    Settings() {}
  }
}
