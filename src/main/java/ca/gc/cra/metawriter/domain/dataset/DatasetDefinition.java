package ca.gc.cra.metawriter.domain.dataset;

import java.util.Objects;

/**
 * <strong>What:</strong> Static description of a metadata dataset created once per acquisition.
 * <p><strong>Why:</strong> Detector extensions and the writer declare datasets before a store exists; the
 * definition is turned into a {@code TypedDataset} per run so cached state never leaks between runs.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param name unique dataset name
 * @param elementType element type
 * @param fillValue fill value matching {@code elementType}
 * @param maxLength byte bound for {@link ElementType#STRING}; {@code 0} means unbounded
 * @param cached whether values are buffered in memory and published on flush
 * @param fixedLength fixed extent of the dataset, or {@link #UNLIMITED} when it grows with the run
 * @since 0.1.0
 */
public record DatasetDefinition(
    String name,
    ElementType elementType,
    Object fillValue,
    int maxLength,
    boolean cached,
    int fixedLength) {

  /** Size sentinel meaning "no known extent": the dataset grows by appending and is never cached. */
  public static final int UNLIMITED = 0;

  /**
   * Validates the definition.
   *
   * @throws IllegalArgumentException when the name is blank or the fill value does not match the type
   */
  public DatasetDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(elementType, "elementType");
    if (name.isBlank()) {
      throw new IllegalArgumentException("dataset name must not be blank");
    }
    if (fixedLength < 0) {
      throw new IllegalArgumentException("fixedLength must not be negative");
    }
    if (maxLength < 0) {
      throw new IllegalArgumentException("maxLength must not be negative");
    }
    fillValue = elementType.coerce(fillValue, maxLength);
  }

  /**
   * Cached 64-bit integer dataset sized per run.
   *
   * @param name dataset name
   * @return definition
   */
  public static DatasetDefinition int64(String name) {
    return new DatasetDefinition(name, ElementType.INT64, -1L, 0, true, UNLIMITED);
  }

  /**
   * 64-bit integer dataset with explicit caching.
   *
   * @param name dataset name
   * @param cached whether to buffer values in memory
   * @return definition
   */
  public static DatasetDefinition int64(String name, boolean cached) {
    return new DatasetDefinition(name, ElementType.INT64, -1L, 0, cached, UNLIMITED);
  }

  /**
   * Cached 32-bit integer dataset sized per run.
   *
   * @param name dataset name
   * @return definition
   */
  public static DatasetDefinition int32(String name) {
    return new DatasetDefinition(name, ElementType.INT32, -1, 0, true, UNLIMITED);
  }

  /**
   * String dataset, optionally bounded.
   *
   * @param name dataset name
   * @param maxLength byte bound, {@code 0} for unbounded
   * @param cached whether to buffer values in memory
   * @return definition
   */
  public static DatasetDefinition string(String name, int maxLength, boolean cached) {
    return new DatasetDefinition(name, ElementType.STRING, "", maxLength, cached, UNLIMITED);
  }

  /**
   * Indicates whether the extent is fixed independently of the run size.
   *
   * @return {@code true} when {@link #fixedLength()} is set
   */
  public boolean hasFixedLength() {
    return fixedLength != UNLIMITED;
  }
}
