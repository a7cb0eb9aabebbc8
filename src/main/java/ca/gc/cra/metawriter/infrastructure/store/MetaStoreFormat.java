package ca.gc.cra.metawriter.infrastructure.store;

import ca.gc.cra.metawriter.domain.dataset.ElementType;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Constants and element codec of the MDS1 journal.
 *
 * <p>A file starts with the magic {@code MDS1} and continues with records of the form
 * {@code int length, byte kind, payload}, where {@code length} counts the kind byte and the payload.
 * Integers are big-endian as written by {@link DataOutputStream}.</p>
 *
 * @since 0.1.0
 */
final class MetaStoreFormat {
  static final byte[] MAGIC = {'M', 'D', 'S', '1'};

  static final byte CREATE = 1;
  static final byte RESIZE = 2;
  static final byte WRITE = 3;
  static final byte CLOSE = 4;

  /** Upper bound on one record; longer length prefixes mark a corrupt file. */
  static final int MAX_RECORD_BYTES = 256 * 1024 * 1024;

  private MetaStoreFormat() {}

  static void writeValue(DataOutputStream out, ElementType type, Object value) throws IOException {
    switch (type) {
      case INT32 -> out.writeInt(((Number) value).intValue());
      case INT64 -> out.writeLong(((Number) value).longValue());
      case STRING -> writeBytes(out, value.toString().getBytes(StandardCharsets.UTF_8));
      case BLOB -> writeBytes(out, (byte[]) value);
      case FLOAT64 -> out.writeDouble(((Number) value).doubleValue());
    }
  }

  static Object readValue(DataInputStream in, ElementType type) throws IOException {
    return switch (type) {
      case INT32 -> in.readInt();
      case INT64 -> in.readLong();
      case STRING -> new String(readBytes(in), StandardCharsets.UTF_8);
      case BLOB -> readBytes(in);
      case FLOAT64 -> in.readDouble();
    };
  }

  private static void writeBytes(DataOutputStream out, byte[] bytes) throws IOException {
    out.writeInt(bytes.length);
    out.write(bytes);
  }

  private static byte[] readBytes(DataInputStream in) throws IOException {
    int length = in.readInt();
    if (length < 0 || length > MAX_RECORD_BYTES) {
      throw new IOException("Corrupt element length: " + length);
    }
    byte[] bytes = new byte[length];
    in.readFully(bytes);
    return bytes;
  }
}
