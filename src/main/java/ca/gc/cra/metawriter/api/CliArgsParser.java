package ca.gc.cra.metawriter.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns {@code key=value} command arguments such as {@code flushFrequency=10} into a settings map.
 *
 * <p>Keys are letters, digits, {@code '.'}, {@code '_'} and {@code '-'}; the value is everything after the first
 * {@code '='}, so {@code otelEndpoint=http://host:4317?a=b} keeps its embedded {@code '='}.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private CliArgsParser() {}

  /**
   * Parses arguments.
   *
   * @param args arguments of the form {@code key=value}; {@code null} yields an empty map
   * @return mutable map in first-seen key order; a repeated key keeps its last value
   * @throws IllegalArgumentException for a token without a key, an invalid key, or a value with control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> settings = new LinkedHashMap<>();
    if (args == null) {
      return settings;
    }
    for (String token : args) {
      if (token != null && !token.isBlank()) {
        addSetting(settings, token.trim());
      }
    }
    return settings;
  }

  private static void addSetting(Map<String, String> settings, String token) {
    int split = token.indexOf('=');
    if (split <= 0) {
      throw new IllegalArgumentException("expected key=value but got '" + token + "'");
    }
    String key = token.substring(0, split).trim();
    String value = token.substring(split + 1).trim();
    if (key.isEmpty() || !key.chars().allMatch(CliArgsParser::isKeyChar)) {
      throw new IllegalArgumentException("invalid setting name '" + key + "'");
    }
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException("value of " + key + " contains control characters");
    }
    settings.put(key, value);
  }

  private static boolean isKeyChar(int c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
        || c == '.' || c == '_' || c == '-';
  }
}
