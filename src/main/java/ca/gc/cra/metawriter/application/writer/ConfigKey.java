package ca.gc.cra.metawriter.application.writer;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of settings accepted by {@link AcquisitionWriter#configure(java.util.Map)}.
 *
 * @since 0.1.0
 */
public enum ConfigKey {
  /** Output directory for the store file. */
  DIRECTORY("directory"),
  /** File-name prefix; when unset the writer name is used. */
  FILE_PREFIX("file_prefix"),
  /** Flush after every N write-frame messages. */
  FLUSH_FRAME_FREQUENCY("flush_frame_frequency"),
  /** Flush when this many seconds elapsed since the last flush; {@code null} disables the check. */
  FLUSH_TIMEOUT("flush_timeout");

  private final String key;

  ConfigKey(String key) {
    this.key = key;
  }

  /**
   * Returns the setting name as it appears in configuration maps.
   *
   * @return key such as {@code flush_timeout}
   */
  public String key() {
    return key;
  }

  /**
   * Resolves a setting name.
   *
   * @param raw setting name; case-insensitive
   * @return matching key or empty when unrecognized
   */
  public static Optional<ConfigKey> fromKey(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (ConfigKey candidate : values()) {
      if (candidate.key.equals(normalized)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
