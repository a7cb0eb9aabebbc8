package ca.gc.cra.metawriter.application.writer;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Mutable settings of one acquisition writer, keyed by the closed {@link ConfigKey} set.
 * <p><strong>Why:</strong> Settings arrive at runtime from a control front-end as loosely typed maps; each key is
 * parsed and range-checked here before it touches writer state.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; mutated on the writer thread.</p>
 *
 * @since 0.1.0
 */
public final class WriterConfiguration {
  /** Default number of write-frame messages between flushes. */
  public static final int DEFAULT_FLUSH_FRAME_FREQUENCY = 100;
  /** Default flush timeout in seconds. */
  public static final double DEFAULT_FLUSH_TIMEOUT_SECONDS = 1.0;

  private Path directory;
  private String filePrefix;
  private int flushFrameFrequency = DEFAULT_FLUSH_FRAME_FREQUENCY;
  private Double flushTimeoutSeconds = DEFAULT_FLUSH_TIMEOUT_SECONDS;

  /**
   * Creates settings with defaults writing into {@code directory}.
   *
   * @param directory output directory; must not be {@code null}
   */
  public WriterConfiguration(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  /**
   * Returns a copy of these settings.
   *
   * @return independent copy
   */
  public WriterConfiguration copy() {
    WriterConfiguration copy = new WriterConfiguration(directory);
    copy.filePrefix = filePrefix;
    copy.flushFrameFrequency = flushFrameFrequency;
    copy.flushTimeoutSeconds = flushTimeoutSeconds;
    return copy;
  }

  /**
   * Parses and applies one setting.
   *
   * @param key recognized setting
   * @param value raw value
   * @throws IllegalArgumentException when the value does not parse or is out of range
   */
  public void apply(ConfigKey key, Object value) {
    switch (key) {
      case DIRECTORY -> directory = parseDirectory(value);
      case FILE_PREFIX -> filePrefix = value == null || value.toString().isBlank() ? null : value.toString().trim();
      case FLUSH_FRAME_FREQUENCY -> {
        long frequency = parseLong(key, value);
        if (frequency < 1 || frequency > Integer.MAX_VALUE) {
          throw new IllegalArgumentException(key.key() + " must be between 1 and " + Integer.MAX_VALUE
              + " (was " + frequency + ")");
        }
        flushFrameFrequency = (int) frequency;
      }
      case FLUSH_TIMEOUT -> flushTimeoutSeconds = parseTimeout(value);
    }
  }

  /**
   * Returns the current value of a setting.
   *
   * @param key recognized setting
   * @return current value; {@code null} for an unset prefix or disabled timeout
   */
  public Object value(ConfigKey key) {
    return switch (key) {
      case DIRECTORY -> directory.toString();
      case FILE_PREFIX -> filePrefix;
      case FLUSH_FRAME_FREQUENCY -> flushFrameFrequency;
      case FLUSH_TIMEOUT -> flushTimeoutSeconds;
    };
  }

  /**
   * Returns every recognized setting with its current value.
   *
   * @return insertion-ordered map keyed by {@link ConfigKey#key()}
   */
  public Map<String, Object> asMap() {
    Map<String, Object> values = new LinkedHashMap<>();
    for (ConfigKey key : ConfigKey.values()) {
      values.put(key.key(), value(key));
    }
    return values;
  }

  /**
   * Returns the output directory.
   *
   * @return directory
   */
  public Path directory() {
    return directory;
  }

  /**
   * Returns the configured file prefix.
   *
   * @return prefix or {@code null} when unset
   */
  public String filePrefix() {
    return filePrefix;
  }

  /**
   * Returns the flush frame frequency.
   *
   * @return write-frame messages between flushes
   */
  public int flushFrameFrequency() {
    return flushFrameFrequency;
  }

  /**
   * Returns the flush timeout.
   *
   * @return seconds, or empty when the timeout check is disabled
   */
  public OptionalDouble flushTimeoutSeconds() {
    return flushTimeoutSeconds == null ? OptionalDouble.empty() : OptionalDouble.of(flushTimeoutSeconds);
  }

  private static Path parseDirectory(Object value) {
    if (value == null || value.toString().isBlank()) {
      throw new IllegalArgumentException(ConfigKey.DIRECTORY.key() + " must not be blank");
    }
    try {
      return Path.of(value.toString().trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(ConfigKey.DIRECTORY.key() + " is not a valid path: " + value, ex);
    }
  }

  private static long parseLong(ConfigKey key, Object value) {
    if (value instanceof Number number) {
      if (number.doubleValue() != Math.rint(number.doubleValue())) {
        throw new IllegalArgumentException(key.key() + " must be an integer (was " + value + ")");
      }
      return number.longValue();
    }
    if (value != null) {
      try {
        return Long.parseLong(value.toString().trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(key.key() + " must be an integer (was " + value + ")", ex);
      }
    }
    throw new IllegalArgumentException(key.key() + " must not be null");
  }

  private static Double parseTimeout(Object value) {
    if (value == null) {
      return null;
    }
    double seconds;
    if (value instanceof Number number) {
      seconds = number.doubleValue();
    } else {
      String text = value.toString().trim();
      if (text.isEmpty() || text.equalsIgnoreCase("none")) {
        return null;
      }
      try {
        seconds = Double.parseDouble(text);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(
            ConfigKey.FLUSH_TIMEOUT.key() + " must be a number of seconds (was " + value + ")", ex);
      }
    }
    if (Double.isNaN(seconds) || seconds < 0) {
      throw new IllegalArgumentException(
          ConfigKey.FLUSH_TIMEOUT.key() + " must not be negative (was " + value + ")");
    }
    return seconds;
  }
}
