package ca.gc.cra.metawriter.infrastructure.store;

import ca.gc.cra.metawriter.domain.dataset.ElementType;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays an MDS1 journal into a {@link StoreSnapshot}.
 *
 * <p>Safe to use while a writer is still appending: an incomplete trailing record is treated as the end of the
 * file and reported through {@link StoreSnapshot#truncated()}.</p>
 *
 * @since 0.1.0
 */
public final class MetaStoreReader {
  private static final Logger log = LoggerFactory.getLogger(MetaStoreReader.class);

  private MetaStoreReader() {}

  /**
   * Reads the store at {@code path}.
   *
   * @param path store file
   * @return snapshot of every array
   * @throws IOException when the file cannot be read, lacks the magic, or holds a malformed complete record
   */
  public static StoreSnapshot read(Path path) throws IOException {
    Map<String, ArrayState> arrays = new LinkedHashMap<>();
    boolean closed = false;
    boolean truncated = false;
    try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path), 1 << 16))) {
      byte[] header = new byte[MetaStoreFormat.MAGIC.length];
      if (in.readNBytes(header, 0, header.length) != header.length || !Arrays.equals(header, MetaStoreFormat.MAGIC)) {
        throw new IOException("Invalid store header: " + path);
      }
      while (true) {
        byte[] record;
        try {
          record = nextRecord(in);
        } catch (EOFException eof) {
          truncated = true;
          log.debug("Stopped at incomplete record in {}", path);
          break;
        }
        if (record == null) {
          break;
        }
        if (record[0] == MetaStoreFormat.CLOSE) {
          closed = true;
          continue;
        }
        apply(record, arrays, path);
      }
    }
    Map<String, StoredArraySnapshot> snapshots = new LinkedHashMap<>();
    arrays.forEach((name, state) -> snapshots.put(name, state.snapshot()));
    return new StoreSnapshot(path, snapshots, closed, truncated);
  }

  private static byte[] nextRecord(InputStream in) throws IOException {
    byte[] lengthBytes = new byte[4];
    int read = in.readNBytes(lengthBytes, 0, 4);
    if (read == 0) {
      return null;
    }
    if (read < 4) {
      throw new EOFException();
    }
    int length = ((lengthBytes[0] & 0xff) << 24) | ((lengthBytes[1] & 0xff) << 16)
        | ((lengthBytes[2] & 0xff) << 8) | (lengthBytes[3] & 0xff);
    if (length < 1 || length > MetaStoreFormat.MAX_RECORD_BYTES) {
      throw new IOException("Corrupt record length: " + length);
    }
    byte[] record = new byte[length];
    if (in.readNBytes(record, 0, length) < length) {
      throw new EOFException();
    }
    return record;
  }

  private static void apply(byte[] record, Map<String, ArrayState> arrays, Path path) throws IOException {
    DataInputStream body = new DataInputStream(new ByteArrayInputStream(record, 1, record.length - 1));
    switch (record[0]) {
      case MetaStoreFormat.CREATE -> {
        String name = body.readUTF();
        ElementType type = ElementType.fromCode(body.readByte());
        body.readInt();
        int maxLength = body.readInt();
        Object fill = MetaStoreFormat.readValue(body, type);
        arrays.put(name, new ArrayState(name, type, fill, maxLength));
      }
      case MetaStoreFormat.RESIZE -> {
        ArrayState state = lookup(arrays, body.readUTF(), path);
        state.resize(body.readInt());
      }
      case MetaStoreFormat.WRITE -> {
        ArrayState state = lookup(arrays, body.readUTF(), path);
        int start = body.readInt();
        int count = body.readInt();
        if (start < 0 || count < 0 || start + count > state.values.size()) {
          throw new IOException("Write outside " + state.name + " extent in " + path);
        }
        for (int i = 0; i < count; i++) {
          state.values.set(start + i, MetaStoreFormat.readValue(body, state.type));
        }
      }
      default -> throw new IOException("Unknown record kind " + record[0] + " in " + path);
    }
  }

  private static ArrayState lookup(Map<String, ArrayState> arrays, String name, Path path) throws IOException {
    ArrayState state = arrays.get(name);
    if (state == null) {
      throw new IOException("Record for undeclared array " + name + " in " + path);
    }
    return state;
  }

  private static final class ArrayState {
    private final String name;
    private final ElementType type;
    private final Object fill;
    private final int maxLength;
    private final List<Object> values = new ArrayList<>();

    ArrayState(String name, ElementType type, Object fill, int maxLength) {
      this.name = name;
      this.type = type;
      this.fill = fill;
      this.maxLength = maxLength;
    }

    void resize(int length) throws IOException {
      if (length < 0) {
        throw new IOException("Negative extent for " + name);
      }
      while (values.size() > length) {
        values.remove(values.size() - 1);
      }
      while (values.size() < length) {
        values.add(fill);
      }
    }

    StoredArraySnapshot snapshot() {
      return new StoredArraySnapshot(name, type, fill, maxLength, values);
    }
  }
}
