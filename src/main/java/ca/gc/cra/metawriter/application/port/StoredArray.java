package ca.gc.cra.metawriter.application.port;

import ca.gc.cra.metawriter.domain.dataset.ElementType;
import java.io.IOException;

/**
 * <strong>What:</strong> Handle to one named, typed, resizable array inside an open {@link ArrayStore}.
 * <p><strong>Why:</strong> Datasets mutate the persistent array only through this handle so the store stays the
 * single owner of file I/O.</p>
 * <p><strong>Role:</strong> Output port consumed by cached datasets.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Track the current extent of the growable axis and enforce the declared maximum.</li>
 *   <li>Accept element writes at explicit indices or as trailing appends.</li>
 *   <li>Publish pending changes on {@link #flush()} so concurrent readers observe them.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the acquisition writer thread.</p>
 *
 * @since 0.1.0
 */
public interface StoredArray {
  /** Maximum-length sentinel for arrays without an upper bound. */
  int UNBOUNDED = -1;

  /**
   * Returns the array name.
   *
   * @return unique name within the store
   */
  String name();

  /**
   * Returns the element type.
   *
   * @return element type fixed at creation
   */
  ElementType elementType();

  /**
   * Returns the current extent of the growable axis.
   *
   * @return number of elements
   */
  int length();

  /**
   * Returns the maximum extent.
   *
   * @return maximum number of elements or {@link #UNBOUNDED}
   */
  int maxLength();

  /**
   * Resizes the growable axis; new elements take the fill value.
   *
   * @param newLength new extent
   * @throws IllegalArgumentException when {@code newLength} is negative or exceeds {@link #maxLength()}
   * @throws IOException when the store has been closed
   */
  void resize(int newLength) throws IOException;

  /**
   * Writes consecutive elements starting at {@code startIndex}.
   *
   * @param startIndex first index to overwrite
   * @param values values already coerced to {@link #elementType()}
   * @throws IndexOutOfBoundsException when the region exceeds {@link #length()}
   * @throws IOException when the store has been closed
   */
  void write(int startIndex, Object[] values) throws IOException;

  /**
   * Extends the array by one element holding {@code value}.
   *
   * @param value value already coerced to {@link #elementType()}
   * @throws IOException when the store has been closed
   */
  default void append(Object value) throws IOException {
    int index = length();
    resize(index + 1);
    write(index, new Object[] {value});
  }

  /**
   * Makes pending resizes and writes durable and visible to readers.
   *
   * @throws IOException when the store cannot be written
   */
  void flush() throws IOException;
}
