package ca.gc.cra.metawriter.domain.msg;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> One decoded metadata message: a type tag, a type-specific header, and a body.
 * <p><strong>Why:</strong> Transport framing is out of scope; every source (NDJSON replay, tests, a socket front-end)
 * hands the writer this already-decoded pair.</p>
 * <p><strong>Thread-safety:</strong> Immutable; maps are copied on construction. Nested values are not copied.</p>
 *
 * @param type raw type tag; resolved with {@link MessageType#fromTag(String)}
 * @param acquisitionId acquisition the message belongs to; blank routes to the default writer
 * @param header type-specific header fields
 * @param body field to value mapping; empty for blob messages
 * @param blob opaque payload for non-parametric messages; empty when absent
 * @since 0.1.0
 */
public record MetaMessage(
    String type,
    String acquisitionId,
    Map<String, Object> header,
    Map<String, Object> body,
    byte[] blob) {

  /**
   * Normalizes nullable parts.
   */
  public MetaMessage {
    type = Objects.requireNonNullElse(type, "");
    acquisitionId = Objects.requireNonNullElse(acquisitionId, "");
    header = header == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(header));
    body = body == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
    blob = blob == null ? new byte[0] : blob.clone();
  }

  /**
   * Creates a parametric message for the default acquisition.
   *
   * @param type message type
   * @param header header fields
   * @param body body fields
   * @return message
   */
  public static MetaMessage of(MessageType type, Map<String, Object> header, Map<String, Object> body) {
    return new MetaMessage(type.tag(), "", header, body, null);
  }

  /**
   * Returns a copy addressed to another acquisition.
   *
   * @param id acquisition id
   * @return readdressed message
   */
  public MetaMessage withAcquisitionId(String id) {
    return new MetaMessage(type, id, header, body, blob);
  }

  /**
   * Reads an integral header field.
   *
   * @param key header field
   * @return value when present and integral
   */
  public OptionalLong headerLong(String key) {
    return integral(header.get(key));
  }

  /**
   * Reads an integral body field.
   *
   * @param key body field
   * @return value when present and integral
   */
  public OptionalLong bodyLong(String key) {
    return integral(body.get(key));
  }

  @Override
  public byte[] blob() {
    return blob.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetaMessage that)) {
      return false;
    }
    return type.equals(that.type)
        && acquisitionId.equals(that.acquisitionId)
        && header.equals(that.header)
        && body.equals(that.body)
        && Arrays.equals(blob, that.blob);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(type, acquisitionId, header, body);
    return 31 * result + Arrays.hashCode(blob);
  }

  @Override
  public String toString() {
    return "MetaMessage{type='" + type + "', acquisitionId='" + acquisitionId
        + "', header=" + header + ", body=" + body + ", blob=" + blob.length + " bytes}";
  }

  private static OptionalLong integral(Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return OptionalLong.of(((Number) value).longValue());
    }
    if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
      return OptionalLong.of(number.longValue());
    }
    if (value instanceof CharSequence text) {
      try {
        return OptionalLong.of(Long.parseLong(text.toString().trim()));
      } catch (NumberFormatException ex) {
        return OptionalLong.empty();
      }
    }
    return OptionalLong.empty();
  }
}
