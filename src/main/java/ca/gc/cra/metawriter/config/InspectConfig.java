package ca.gc.cra.metawriter.config;

import ca.gc.cra.metawriter.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of the {@code inspect} CLI.
 *
 * @param file store file to read
 * @param limit number of leading elements printed per array
 * @since 0.1.0
 */
public record InspectConfig(Path file, int limit) {
  /** Default number of elements printed per array. */
  public static final int DEFAULT_LIMIT = 10;

  public InspectConfig {
    Objects.requireNonNull(file, "file");
    Numbers.requireRange("limit", limit, 0, 1_000_000);
  }

  /**
   * Builds the settings from merged key/value pairs.
   *
   * @param options settings; {@code file} is required
   * @return parsed settings
   * @throws IllegalArgumentException when {@code file} is missing or {@code limit} is invalid
   */
  public static InspectConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String raw = options.get("file");
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("file is required");
    }
    Path file;
    try {
      file = Path.of(raw.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("file is not a valid path: " + raw, ex);
    }
    return new InspectConfig(file, Numbers.parseInt("limit", options.get("limit"), DEFAULT_LIMIT, 0, 1_000_000));
  }
}
