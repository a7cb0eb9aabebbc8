package ca.gc.cra.metawriter.application.writer;

import ca.gc.cra.metawriter.application.port.ClockPort;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Decides when cached datasets are published.
 *
 * <p>Evaluated once per write-frame message: a flush is due when the time since the last flush reached the
 * configured timeout, or when the write count is an exact multiple of the flush frame frequency. The timeout is
 * only checked here, so a quiet stream can leave data unflushed until the next frame or the final close.</p>
 *
 * @since 0.1.0
 */
final class FlushPolicy {
  private final WriterConfiguration config;
  private final ClockPort clock;
  private long lastFlushMillis;

  FlushPolicy(WriterConfiguration config, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.lastFlushMillis = clock.nowMillis();
  }

  boolean due(long writeCount) {
    OptionalDouble timeout = config.flushTimeoutSeconds();
    if (timeout.isPresent()) {
      long elapsedMillis = clock.nowMillis() - lastFlushMillis;
      if (elapsedMillis >= timeout.getAsDouble() * 1000.0) {
        return true;
      }
    }
    return writeCount % config.flushFrameFrequency() == 0;
  }

  void markFlushed() {
    lastFlushMillis = clock.nowMillis();
  }
}
