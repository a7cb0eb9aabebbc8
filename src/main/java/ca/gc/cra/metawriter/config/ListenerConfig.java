package ca.gc.cra.metawriter.config;

import ca.gc.cra.metawriter.application.listener.MetaListener;
import ca.gc.cra.metawriter.application.writer.ConfigKey;
import ca.gc.cra.metawriter.application.writer.SideChannelBuffer;
import ca.gc.cra.metawriter.application.writer.WriterConfiguration;
import ca.gc.cra.metawriter.validation.Numbers;
import ca.gc.cra.metawriter.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * <strong>What:</strong> Settings of the replay pipeline: message input, writer defaults, and listener limits.
 * <p><strong>Why:</strong> Gathers the merged YAML/CLI settings into one validated value before any file is
 * opened.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by the replay CLI.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputFile NDJSON message file; empty only in {@link #defaults()}
 * @param outputDirectory directory receiving store files
 * @param filePrefix file prefix applied to every writer; empty means each writer uses its own name
 * @param flushFrequency write-frame messages between flushes
 * @param flushTimeoutSeconds flush timeout; empty disables the timeout check
 * @param detector detector extension name, {@code none} or {@code timing}
 * @param sideChannelCapacity detector records buffered per writer
 * @param writerName writer name for messages without an acquisition id
 * @param maxFinishedWriters finished writers retained for status
 * @since 0.1.0
 */
public record ListenerConfig(
    Optional<Path> inputFile,
    Path outputDirectory,
    Optional<String> filePrefix,
    int flushFrequency,
    OptionalDouble flushTimeoutSeconds,
    String detector,
    int sideChannelCapacity,
    String writerName,
    int maxFinishedWriters) {

  /** Detector names accepted by {@code detector}. */
  public static final Set<String> DETECTORS = Set.of("none", "timing");

  public ListenerConfig {
    inputFile = Objects.requireNonNullElse(inputFile, Optional.empty());
    outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").normalize();
    filePrefix = Objects.requireNonNullElse(filePrefix, Optional.<String>empty())
        .map(prefix -> Strings.requireFileNameComponent("filePrefix", prefix));
    Numbers.requireRange("flushFrequency", flushFrequency, 1, Integer.MAX_VALUE);
    flushTimeoutSeconds = Objects.requireNonNullElse(flushTimeoutSeconds, OptionalDouble.empty());
    detector = Strings.requireNonBlank("detector", detector).toLowerCase(Locale.ROOT);
    if (!DETECTORS.contains(detector)) {
      throw new IllegalArgumentException("detector must be one of " + DETECTORS + " (was " + detector + ")");
    }
    Numbers.requireRange("sideChannelCapacity", sideChannelCapacity, 1, 1_000_000);
    writerName = Strings.requireFileNameComponent("writerName", writerName);
    Numbers.requireRange("maxFinishedWriters", maxFinishedWriters, 0, 10_000);
  }

  /**
   * Returns the baseline settings.
   *
   * @return defaults writing into {@code ./meta}
   */
  public static ListenerConfig defaults() {
    return new ListenerConfig(
        Optional.empty(),
        Path.of("meta"),
        Optional.empty(),
        WriterConfiguration.DEFAULT_FLUSH_FRAME_FREQUENCY,
        OptionalDouble.of(WriterConfiguration.DEFAULT_FLUSH_TIMEOUT_SECONDS),
        "none",
        SideChannelBuffer.DEFAULT_CAPACITY,
        "meta",
        MetaListener.DEFAULT_MAX_FINISHED_WRITERS);
  }

  /**
   * Builds settings from merged key/value pairs.
   *
   * @param options keys {@code in}, {@code out}, {@code filePrefix}, {@code flushFrequency}, {@code flushTimeout},
   *     {@code detector}, {@code sideChannelCapacity}, {@code writerName}, {@code maxFinishedWriters}
   * @return validated settings
   * @throws IllegalArgumentException when {@code in} is missing or a value is invalid
   */
  public static ListenerConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ListenerConfig defaults = defaults();
    String in = options.get("in");
    if (in == null || in.isBlank()) {
      throw new IllegalArgumentException("in is required");
    }
    Path input = parsePath("in", in);
    String out = options.get("out");
    Path output = out == null || out.isBlank() ? defaults.outputDirectory() : parsePath("out", out);
    String prefix = options.get("filePrefix");
    Optional<String> filePrefix = prefix == null || prefix.isBlank() ? Optional.empty() : Optional.of(prefix);
    int frequency = Numbers.parseInt("flushFrequency", options.get("flushFrequency"),
        defaults.flushFrequency(), 1, Integer.MAX_VALUE);
    OptionalDouble timeout = parseTimeout(options.get("flushTimeout"), defaults.flushTimeoutSeconds());
    String detector = Optional.ofNullable(options.get("detector")).filter(value -> !value.isBlank())
        .orElse(defaults.detector());
    int capacity = Numbers.parseInt("sideChannelCapacity", options.get("sideChannelCapacity"),
        defaults.sideChannelCapacity(), 1, 1_000_000);
    String writerName = Optional.ofNullable(options.get("writerName")).filter(value -> !value.isBlank())
        .orElse(defaults.writerName());
    int maxFinished = Numbers.parseInt("maxFinishedWriters", options.get("maxFinishedWriters"),
        defaults.maxFinishedWriters(), 0, 10_000);
    return new ListenerConfig(
        Optional.of(input), output, filePrefix, frequency, timeout, detector, capacity, writerName, maxFinished);
  }

  /**
   * Builds the default writer settings these values describe.
   *
   * @return fresh writer configuration
   */
  public WriterConfiguration toWriterConfiguration() {
    WriterConfiguration config = new WriterConfiguration(outputDirectory);
    filePrefix.ifPresent(prefix -> config.apply(ConfigKey.FILE_PREFIX, prefix));
    config.apply(ConfigKey.FLUSH_FRAME_FREQUENCY, flushFrequency);
    config.apply(ConfigKey.FLUSH_TIMEOUT,
        flushTimeoutSeconds.isPresent() ? flushTimeoutSeconds.getAsDouble() : null);
    return config;
  }

  private static OptionalDouble parseTimeout(String raw, OptionalDouble fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    if (raw.trim().equalsIgnoreCase("none")) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(Numbers.parseNonNegative("flushTimeout", raw, 0));
  }

  private static Path parsePath(String key, String raw) {
    try {
      return Path.of(Strings.requireNonBlank(key, raw));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }
}
