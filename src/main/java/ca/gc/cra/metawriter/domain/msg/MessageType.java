package ca.gc.cra.metawriter.domain.msg;

import java.util.Locale;
import java.util.Optional;

/**
 * Message types handled by the acquisition writer core.
 *
 * <p>Tags are matched case-insensitively with separators ignored, so {@code start-acquisition},
 * {@code start_acquisition}, and {@code startacquisition} all resolve to {@link #START_ACQUISITION}.</p>
 *
 * @since 0.1.0
 */
public enum MessageType {
  /** A producer joined the run; the first one opens the store. */
  START_ACQUISITION("startacquisition"),
  /** A producer created its data file; carries a create-duration metric. */
  CREATE_FILE("createfile"),
  /** A frame was written at a known storage offset. */
  WRITE_FRAME("writeframe"),
  /** A producer closed its data file; carries a close-duration metric. */
  CLOSE_FILE("closefile"),
  /** A producer left the run; the last one closes the store. */
  STOP_ACQUISITION("stopacquisition");

  private final String tag;

  MessageType(String tag) {
    this.tag = tag;
  }

  /**
   * Returns the canonical wire tag.
   *
   * @return tag such as {@code writeframe}
   */
  public String tag() {
    return tag;
  }

  /**
   * Resolves a wire tag.
   *
   * @param raw tag as received; may be {@code null}
   * @return matching type, or empty for tags outside the core set
   */
  public static Optional<MessageType> fromTag(String raw) {
    String normalized = normalize(raw);
    for (MessageType type : values()) {
      if (type.tag.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /**
   * Normalizes a tag by lower-casing it and dropping {@code '-'} and {@code '_'} separators.
   *
   * @param raw tag as received
   * @return normalized tag; empty for {@code null}
   */
  public static String normalize(String raw) {
    if (raw == null) {
      return "";
    }
    return raw.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
  }
}
