package ca.gc.cra.metawriter.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock and monotonic time to the writer.
 * <p><strong>Why:</strong> The flush timeout compares wall-clock time; tests inject a manual clock to make the
 * timeout branch deterministic.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()} and {@link System#nanoTime()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns a monotonic timestamp for latency measurement.
   *
   * @return nanoseconds from an arbitrary origin
   */
  default long nanoTime() {
    return System.nanoTime();
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
