package ca.gc.cra.metawriter.api;

import java.util.Map;

/**
 * Helpers shared by commands that mix flags, {@code key=value} arguments and YAML settings.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable arguments
   * @return YAML path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    String value = map == null ? null : map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
