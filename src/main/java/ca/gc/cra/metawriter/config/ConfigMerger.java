package ca.gc.cra.metawriter.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges embedded defaults, YAML settings and command-line settings with precedence CLI &gt; YAML &gt; defaults.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings for a mode.
   *
   * @param mode active CLI mode
   * @param yaml settings from the YAML file, if one was given
   * @param cli command-line settings; may be empty
   * @param defaults embedded defaults for the mode
   * @param warn receives one message per CLI key overriding a YAML key; may be {@code null}
   * @return immutable merged settings
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlSettings = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlSettings);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        if (yamlSettings.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, value);
      });
    }
    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("replay".equalsIgnoreCase(mode)) {
      String in = effective.getOrDefault("in", "").trim();
      String out = effective.getOrDefault("out", "").trim();
      if (!in.isEmpty() && !out.isEmpty() && in.equals(out)) {
        throw new IllegalArgumentException("in and out must not name the same path");
      }
    }
  }
}
