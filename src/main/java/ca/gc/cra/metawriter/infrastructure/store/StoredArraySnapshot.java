package ca.gc.cra.metawriter.infrastructure.store;

import ca.gc.cra.metawriter.domain.dataset.ElementType;
import java.util.List;
import java.util.Objects;

/**
 * Contents of one array as read back from a store file.
 *
 * @param name array name
 * @param elementType element type
 * @param fillValue fill value for unwritten elements
 * @param maxLength maximum extent or {@code -1} when unbounded
 * @param values elements in index order
 * @since 0.1.0
 */
public record StoredArraySnapshot(
    String name,
    ElementType elementType,
    Object fillValue,
    int maxLength,
    List<Object> values) {

  public StoredArraySnapshot {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(elementType, "elementType");
    values = List.copyOf(values);
  }

  public int length() {
    return values.size();
  }

  /**
   * Returns the element at {@code index}.
   *
   * @param index element index
   * @return element value
   */
  public Object get(int index) {
    return values.get(index);
  }
}
