package ca.gc.cra.metawriter.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads MetaWriter settings from YAML.
 *
 * <p>The document holds a {@code common} section and one section per command ({@code replay}, {@code inspect}).
 * Only {@code common} and the running command's section are read; the command's values win. Nested mappings
 * become dotted keys, so {@code detector: {name: timing}} yields {@code detector.name=timing}. Section names are
 * matched case-insensitively.</p>
 *
 * <pre>{@code
 * common:
 *   metricsExporter: none
 * replay:
 *   flushFrequency: 10
 *   flushTimeout: none
 * }</pre>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  private static final String COMMON = "common";

  private YamlConfigLoader() {}

  /**
   * Loads the settings {@code mode} sees in {@code path}.
   *
   * @param path YAML file
   * @param mode command name such as {@code replay}
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML, repeats a key, or is not a mapping of
   *     mappings with scalar leaves
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = parser().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Invalid YAML in " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    String command = mode.trim().toLowerCase(Locale.ROOT);
    Object common = null;
    Object selected = null;
    for (Map.Entry<String, Object> section : mapping(document, path.getFileName().toString()).entrySet()) {
      String name = section.getKey().trim().toLowerCase(Locale.ROOT);
      if (name.equals(COMMON)) {
        common = section.getValue();
      } else if (name.equals(command)) {
        selected = section.getValue();
      } else {
        log.debug("{}: section '{}' does not apply to {}", path, section.getKey(), command);
      }
    }

    Map<String, String> settings = new LinkedHashMap<>();
    addLeaves(settings, "", common, COMMON);
    addLeaves(settings, "", selected, command);
    return Optional.of(Map.copyOf(settings));
  }

  private static Yaml parser() {
    LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(false);
    return new Yaml(new SafeConstructor(options));
  }

  private static void addLeaves(Map<String, String> settings, String prefix, Object node, String context) {
    if (node == null) {
      return;
    }
    for (Map.Entry<String, Object> entry : mapping(node, context).entrySet()) {
      String name = entry.getKey().trim();
      if (name.isEmpty()) {
        throw new IllegalArgumentException("Blank key in " + context);
      }
      String key = prefix.isEmpty() ? name : prefix + '.' + name;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?>) {
        addLeaves(settings, key, value, key);
      } else if (value instanceof Collection<?>) {
        throw new IllegalArgumentException("Setting " + key + " must be a single value, not a list");
      } else {
        settings.put(key, value == null ? "" : value.toString());
      }
    }
  }

  private static Map<String, Object> mapping(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> entries = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " has non-text key " + entry.getKey());
      }
      entries.put(key, entry.getValue());
    }
    return entries;
  }
}
