package ca.gc.cra.metawriter.infrastructure.store;

import ca.gc.cra.metawriter.application.port.ArrayStore;
import ca.gc.cra.metawriter.application.port.ArrayStorePort;
import ca.gc.cra.metawriter.application.port.StoredArray;
import ca.gc.cra.metawriter.domain.dataset.ElementType;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ArrayStorePort} writing MDS1 append-only journal files.
 * <p><strong>Why:</strong> Readers must be able to follow a file while it is written; an append-only journal that
 * only ever gains complete, forced records gives single-writer/multi-reader visibility without locking.</p>
 * <p><strong>Role:</strong> Infrastructure adapter behind the writer's store port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep each array's current contents in memory and track the region changed since its last flush.</li>
 *   <li>On flush, append a resize record when the extent changed and one write record for the dirty region.</li>
 *   <li>Force the channel after every append so the records survive a crash and are visible to readers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The factory is stateless; each returned store is single-writer.</p>
 *
 * @since 0.1.0
 */
public final class MetaStoreFileAdapter implements ArrayStorePort {
  private static final Logger log = LoggerFactory.getLogger(MetaStoreFileAdapter.class);

  @Override
  public ArrayStore create(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    FileChannel channel = FileChannel.open(path,
        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    try {
      channel.write(ByteBuffer.wrap(MetaStoreFormat.MAGIC));
      channel.force(true);
    } catch (IOException ex) {
      try {
        channel.close();
      } catch (IOException closeEx) {
        ex.addSuppressed(closeEx);
      }
      throw ex;
    }
    log.debug("Created store {}", path);
    return new JournalStore(path, channel);
  }

  private static final class JournalStore implements ArrayStore {
    private final Path path;
    private final FileChannel channel;
    private final Map<String, JournalArray> arrays = new LinkedHashMap<>();
    private boolean closed;

    JournalStore(Path path, FileChannel channel) {
      this.path = path;
      this.channel = channel;
    }

    @Override
    public Path path() {
      return path;
    }

    @Override
    public StoredArray createArray(
        String name,
        ElementType elementType,
        Object fillValue,
        int maxElementBytes,
        int initialLength,
        int maxLength) throws IOException {
      ensureOpen();
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(elementType, "elementType");
      if (arrays.containsKey(name)) {
        throw new IllegalArgumentException("Array already exists: " + name);
      }
      if (initialLength < 0 || (maxLength != StoredArray.UNBOUNDED && (maxLength < 0 || initialLength > maxLength))) {
        throw new IllegalArgumentException(
            "Invalid extent for " + name + ": length " + initialLength + ", max " + maxLength);
      }
      Object fill = elementType.coerce(fillValue, maxElementBytes);
      ByteArrayOutputStream bytes = new ByteArrayOutputStream();
      DataOutputStream out = new DataOutputStream(bytes);
      out.writeUTF(name);
      out.writeByte(elementType.code());
      out.writeInt(maxElementBytes);
      out.writeInt(maxLength);
      MetaStoreFormat.writeValue(out, elementType, fill);
      append(MetaStoreFormat.CREATE, bytes.toByteArray());

      JournalArray array = new JournalArray(this, name, elementType, fill, maxLength);
      arrays.put(name, array);
      if (initialLength > 0) {
        array.resize(initialLength);
        array.flush();
      }
      return array;
    }

    @Override
    public StoredArray createArray(String name, List<?> values) throws IOException {
      List<?> seed = values == null ? List.of() : values;
      ElementType type = ElementType.inferAll(seed);
      // coerced up front so a rejected seed leaves no CREATE record behind
      Object[] coerced = type.coerceAll(seed, 0);
      StoredArray array = createArray(name, type, null, 0, 0, StoredArray.UNBOUNDED);
      array.resize(coerced.length);
      array.write(0, coerced);
      array.flush();
      return array;
    }

    @Override
    public void close() throws IOException {
      if (closed) {
        return;
      }
      try {
        for (JournalArray array : arrays.values()) {
          array.flush();
        }
        append(MetaStoreFormat.CLOSE, new byte[0]);
      } finally {
        closed = true;
        channel.close();
        log.debug("Closed store {}", path);
      }
    }

    void ensureOpen() throws IOException {
      if (closed) {
        throw new IOException("Store closed: " + path);
      }
    }

    void append(byte kind, byte[] payload) throws IOException {
      ByteBuffer record = ByteBuffer.allocate(4 + 1 + payload.length);
      record.putInt(1 + payload.length);
      record.put(kind);
      record.put(payload);
      record.flip();
      while (record.hasRemaining()) {
        channel.write(record);
      }
      channel.force(false);
    }
  }

  private static final class JournalArray implements StoredArray {
    private final JournalStore store;
    private final String name;
    private final ElementType elementType;
    private final Object fill;
    private final int maxLength;
    private final List<Object> values = new ArrayList<>();
    private int flushedLength;
    private int dirtyFrom = Integer.MAX_VALUE;
    private int dirtyTo;

    JournalArray(JournalStore store, String name, ElementType elementType, Object fill, int maxLength) {
      this.store = store;
      this.name = name;
      this.elementType = elementType;
      this.fill = fill;
      this.maxLength = maxLength;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public ElementType elementType() {
      return elementType;
    }

    @Override
    public int length() {
      return values.size();
    }

    @Override
    public int maxLength() {
      return maxLength;
    }

    @Override
    public void resize(int newLength) throws IOException {
      store.ensureOpen();
      if (newLength < 0 || (maxLength != UNBOUNDED && newLength > maxLength)) {
        throw new IllegalArgumentException(
            name + ": cannot resize to " + newLength + " (max " + maxLength + ")");
      }
      while (values.size() > newLength) {
        values.remove(values.size() - 1);
      }
      int refilledFrom = values.size();
      while (values.size() < newLength) {
        values.add(fill instanceof byte[] blob ? blob.clone() : fill);
      }
      dirtyTo = Math.min(dirtyTo, newLength);
      // Slots the reader already holds must be rewritten when they return to the fill value.
      int refilledTo = Math.min(newLength, flushedLength);
      if (refilledFrom < refilledTo) {
        dirtyFrom = Math.min(dirtyFrom, refilledFrom);
        dirtyTo = Math.max(dirtyTo, refilledTo);
      }
    }

    @Override
    public void write(int startIndex, Object[] newValues) throws IOException {
      store.ensureOpen();
      Objects.checkFromIndexSize(startIndex, newValues.length, values.size());
      for (int i = 0; i < newValues.length; i++) {
        int index = startIndex + i;
        if (elementType.same(values.get(index), newValues[i])) {
          continue;
        }
        values.set(index, newValues[i]);
        dirtyFrom = Math.min(dirtyFrom, index);
        dirtyTo = Math.max(dirtyTo, index + 1);
      }
    }

    @Override
    public void flush() throws IOException {
      store.ensureOpen();
      if (values.size() != flushedLength) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeUTF(name);
        out.writeInt(values.size());
        store.append(MetaStoreFormat.RESIZE, bytes.toByteArray());
        flushedLength = values.size();
      }
      if (dirtyFrom < dirtyTo) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeUTF(name);
        out.writeInt(dirtyFrom);
        out.writeInt(dirtyTo - dirtyFrom);
        for (int i = dirtyFrom; i < dirtyTo; i++) {
          MetaStoreFormat.writeValue(out, elementType, values.get(i));
        }
        store.append(MetaStoreFormat.WRITE, bytes.toByteArray());
      }
      dirtyFrom = Integer.MAX_VALUE;
      dirtyTo = 0;
    }
  }
}
