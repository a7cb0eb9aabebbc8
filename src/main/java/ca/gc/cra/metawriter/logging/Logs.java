package ca.gc.cra.metawriter.logging;

import java.nio.charset.StandardCharsets;

/**
 * Bounds message bodies, detector records and dataset seeds before they are written to the log.
 *
 * <p>Detector configuration blobs can run to kilobytes; a preview keeps the first bytes and notes the full size.
 * Cuts always land on a UTF-8 character boundary.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Byte bound used by {@link #preview(Object)}. */
  public static final int DEFAULT_PREVIEW_BYTES = 512;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {}

  /**
   * Renders a value for a log line, bounded to {@link #DEFAULT_PREVIEW_BYTES}.
   *
   * @param value any value; {@code null} renders as {@code "<null>"}
   * @return bounded rendering
   */
  public static String preview(Object value) {
    return preview(value, DEFAULT_PREVIEW_BYTES);
  }

  /**
   * Renders a value for a log line, keeping at most {@code maxBytes} UTF-8 bytes of its text.
   *
   * @param value any value; {@code null} renders as {@code "<null>"}
   * @param maxBytes byte bound; must be positive
   * @return the text unchanged when it fits, otherwise its prefix followed by the kept and total byte counts
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String preview(Object value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    String text = value instanceof byte[] raw ? new String(raw, StandardCharsets.UTF_8) : String.valueOf(value);
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return text;
    }
    int cut = maxBytes;
    // back off continuation bytes (10xxxxxx) so the prefix decodes cleanly
    while (cut > 0 && (bytes[cut] & 0xC0) == 0x80) {
      cut--;
    }
    return new String(bytes, 0, cut, StandardCharsets.UTF_8) + "... (" + cut + " of " + bytes.length + " bytes)";
  }
}
