package ca.gc.cra.metawriter.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Embedded default settings for each CLI mode, flattened like the YAML loader output.
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON = Map.of(
      "metricsExporter", "otlp",
      "otelEndpoint", "",
      "verbose", "false");

  private DefaultsForMode() {}

  /**
   * Returns the defaults of {@code mode} merged over the common defaults.
   *
   * @param mode {@code replay} or {@code inspect}
   * @return immutable default settings
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "replay" -> replayDefaults();
      case "inspect" -> Map.of("limit", Integer.toString(InspectConfig.DEFAULT_LIMIT));
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> replayDefaults() {
    ListenerConfig defaults = ListenerConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", defaults.outputDirectory().toString());
    map.put("filePrefix", "");
    map.put("flushFrequency", Integer.toString(defaults.flushFrequency()));
    map.put("flushTimeout", Double.toString(defaults.flushTimeoutSeconds().getAsDouble()));
    map.put("detector", defaults.detector());
    map.put("sideChannelCapacity", Integer.toString(defaults.sideChannelCapacity()));
    map.put("writerName", defaults.writerName());
    map.put("maxFinishedWriters", Integer.toString(defaults.maxFinishedWriters()));
    return map;
  }
}
