package ca.gc.cra.linelog.benchmarks;

import ca.gc.cra.linelog.application.Logger;
import ca.gc.cra.linelog.application.LoggerOption;
import ca.gc.cra.linelog.application.Sinks;
import ca.gc.cra.linelog.application.port.Styler;
import ca.gc.cra.linelog.application.port.TimeSource;
import ca.gc.cra.linelog.domain.Attr;
import ca.gc.cra.linelog.domain.Level;
import java.io.OutputStream;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
public class LoggerBenchmark {

  @State(Scope.Thread)
  public static class LoggerState {
    private Logger enabled;
    private Logger disabled;
    private Logger discard;

    @Setup
    public void setup() {
      TimeSource fixed = TimeSource.fixed(OffsetDateTime.of(2025, 4, 1, 13, 34, 3, 0, ZoneOffset.UTC));
      OutputStream sink = OutputStream.nullOutputStream();
      enabled = Logger.create(sink,
          LoggerOption.level(Level.DEBUG),
          LoggerOption.timeSource(fixed),
          LoggerOption.styler(Styler.NONE))
          .with("component", "bench");
      disabled = Logger.create(sink, LoggerOption.level(Level.ERROR), LoggerOption.styler(Styler.NONE));
      discard = Logger.create(Sinks.discard(), LoggerOption.level(Level.DEBUG));
    }
  }

  @Benchmark
  public void enabledWithAttributes(LoggerState state) {
    state.enabled.info("request served",
        Attr.string("path", "/users"),
        Attr.integer("status", 200),
        Attr.duration("elapsed", Duration.ofMillis(57)));
  }

  @Benchmark
  public void enabledQuotedValue(LoggerState state) {
    state.enabled.warn("slow query", "sql", "select * from users where name = ''");
  }

  @Benchmark
  public void disabledLevel(LoggerState state) {
    state.disabled.debug("never emitted", "key", "value");
  }

  @Benchmark
  public void discardSink(LoggerState state) {
    state.discard.info("never emitted", "key", "value");
  }
}
