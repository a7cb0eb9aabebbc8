package ca.gc.cra.metawriter.application.port;

import ca.gc.cra.metawriter.domain.dataset.ElementType;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> An open persistent store holding named arrays for one acquisition.
 * <p><strong>Why:</strong> Abstracts the on-disk dataset file so the writer core can be exercised against an
 * in-memory store in tests.</p>
 * <p><strong>Role:</strong> Output port created by {@link ArrayStorePort} and owned exclusively by one writer.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; single writer, many external readers of the file.</p>
 *
 * @since 0.1.0
 */
public interface ArrayStore extends AutoCloseable {
  /**
   * Returns the backing file location.
   *
   * @return store path
   */
  Path path();

  /**
   * Creates an empty array.
   *
   * @param name unique array name
   * @param elementType element type
   * @param fillValue fill value for unwritten elements
   * @param maxElementBytes byte bound for string elements; {@code 0} means unbounded
   * @param initialLength initial extent
   * @param maxLength maximum extent or {@link StoredArray#UNBOUNDED}
   * @return handle to the new array
   * @throws IllegalArgumentException when the name already exists
   * @throws IOException when the store cannot record the array
   */
  StoredArray createArray(
      String name,
      ElementType elementType,
      Object fillValue,
      int maxElementBytes,
      int initialLength,
      int maxLength) throws IOException;

  /**
   * Creates an unbounded array seeded with existing values. The element type is
   * {@link ca.gc.cra.metawriter.domain.dataset.ElementType#inferAll(List) inferred from every value}, and all values
   * are coerced before anything is recorded, so a rejected seed leaves the store unchanged.
   *
   * @param name unique array name
   * @param values initial contents
   * @return handle to the new array
   * @throws IllegalArgumentException when the name already exists or a value cannot be coerced
   * @throws IOException when the store cannot record the array
   */
  StoredArray createArray(String name, List<?> values) throws IOException;

  /**
   * Flushes every array and closes the store. Later writes through existing handles fail.
   *
   * @throws IOException when the final flush or close fails
   */
  @Override
  void close() throws IOException;
}
