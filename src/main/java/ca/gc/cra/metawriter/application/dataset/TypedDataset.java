package ca.gc.cra.metawriter.application.dataset;

import ca.gc.cra.metawriter.application.port.StoredArray;
import ca.gc.cra.metawriter.domain.dataset.DatasetDefinition;
import ca.gc.cra.metawriter.domain.dataset.ElementType;
import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> A named, typed dataset bound to a persistent array, with an optional write-through cache.
 * <p><strong>Why:</strong> When the frame count is known up front, per-frame writes arrive at random (possibly
 * reordered) offsets; buffering them in an exact-size cache turns each write into an index store and amortizes I/O
 * across a batch flush. Without a known size the dataset falls back to direct appends.</p>
 * <p><strong>Role:</strong> Leaf component owned by {@link DatasetRegistry}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Allocate a fill-valued cache sized to the run and resize the persistent array to match.</li>
 *   <li>Reject (log) writes outside the cache bounds; never grow the cache silently.</li>
 *   <li>Publish the cache verbatim on {@link #flush()} and make it visible to readers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; mutated only by the acquisition writer thread.</p>
 *
 * @since 0.1.0
 */
public final class TypedDataset {
  private static final Logger log = LoggerFactory.getLogger(TypedDataset.class);

  /** Offset used when the caller supplies none; uncached datasets ignore it and append. */
  public static final int DEFAULT_OFFSET = 0;

  private final DatasetDefinition definition;
  private boolean cacheEnabled;
  private Object[] cache;
  private StoredArray handle;

  /**
   * Creates an unbound dataset from its definition.
   *
   * @param definition static dataset description; must not be {@code null}
   */
  public TypedDataset(DatasetDefinition definition) {
    this.definition = Objects.requireNonNull(definition, "definition");
    this.cacheEnabled = definition.cached();
    if (cacheEnabled && definition.hasFixedLength()) {
      this.cache = filledCache(definition.fixedLength());
    }
  }

  /**
   * Binds the dataset to a live persistent array.
   *
   * <p>A {@code declaredSize} of {@link DatasetDefinition#UNLIMITED} disables caching for the rest of the
   * dataset's life. Otherwise, when caching is enabled, a fresh cache of exactly {@code declaredSize} elements
   * (or the fixed length) is allocated and the persistent array is resized to match.</p>
   *
   * @param storeArray persistent array handle; must not be {@code null}
   * @param declaredSize run size or {@link DatasetDefinition#UNLIMITED}
   * @throws IOException when the persistent array cannot be resized
   */
  public void initialise(StoredArray storeArray, int declaredSize) throws IOException {
    this.handle = Objects.requireNonNull(storeArray, "storeArray");
    if (declaredSize == DatasetDefinition.UNLIMITED && !definition.hasFixedLength()) {
      cacheEnabled = false;
      cache = null;
      return;
    }
    if (!cacheEnabled) {
      return;
    }
    int size = definition.hasFixedLength() ? definition.fixedLength() : declaredSize;
    cache = filledCache(size);
    if (handle.length() != size) {
      handle.resize(size);
    }
  }

  /**
   * Adds a value at the dataset's default offset.
   *
   * @param value value to add
   * @return {@code true} when the value was accepted
   * @throws IOException when a direct append fails in the store
   */
  public boolean addValue(Object value) throws IOException {
    return addValue(value, DEFAULT_OFFSET);
  }

  /**
   * Adds a value at {@code offset}.
   *
   * <p>Uncached datasets append the value as a new trailing element regardless of {@code offset}. Cached datasets
   * overwrite the cache slot (last write wins); offsets outside {@code [0, cacheLength)} are logged and dropped.</p>
   *
   * @param value value to add; coerced to the dataset's element type
   * @param offset target index
   * @return {@code true} when the value was accepted
   * @throws IOException when a direct append fails in the store
   */
  public boolean addValue(Object value, int offset) throws IOException {
    if (handle == null) {
      log.error("{} | Dataset not initialised; dropping value for offset {}", name(), offset);
      return false;
    }
    Object coerced;
    try {
      coerced = definition.elementType().coerce(value, definition.maxLength());
    } catch (IllegalArgumentException ex) {
      log.error("{} | Cannot store value {}: {}", name(), value, ex.getMessage());
      return false;
    }

    if (!cacheEnabled) {
      handle.append(coerced);
      return true;
    }
    if (offset < 0 || offset >= cache.length) {
      log.error("{} | Cannot add value at offset {}, cache length = {}", name(), offset, cache.length);
      return false;
    }
    cache[offset] = coerced;
    return true;
  }

  /**
   * Copies the cache (when enabled) into the persistent array and issues a flush on it.
   *
   * @throws IOException when the store rejects the write or flush
   */
  public void flush() throws IOException {
    if (handle == null) {
      log.debug("{} | Flush skipped; dataset not initialised", name());
      return;
    }
    if (cacheEnabled) {
      if (log.isDebugEnabled()) {
        log.debug("{} | Writing cache to dataset: {}", name(), summarize(cache));
      }
      handle.write(0, cache.clone());
    }
    handle.flush();
  }

  /**
   * Returns the dataset name.
   *
   * @return name
   */
  public String name() {
    return definition.name();
  }

  /**
   * Returns the static definition.
   *
   * @return definition
   */
  public DatasetDefinition definition() {
    return definition;
  }

  /**
   * Returns the element type.
   *
   * @return element type
   */
  public ElementType elementType() {
    return definition.elementType();
  }

  /**
   * Indicates whether writes are currently buffered.
   *
   * @return {@code true} while caching is enabled
   */
  public boolean isCached() {
    return cacheEnabled;
  }

  /**
   * Returns the cache length, or {@code 0} when caching is disabled or not yet allocated.
   *
   * @return number of cached slots
   */
  public int cacheLength() {
    return cacheEnabled && cache != null ? cache.length : 0;
  }

  /**
   * Returns the cached value at {@code offset}.
   *
   * @param offset cache index
   * @return cached value
   * @throws IllegalStateException when caching is disabled
   * @throws IndexOutOfBoundsException when {@code offset} is outside the cache
   */
  public Object cachedValue(int offset) {
    if (!cacheEnabled || cache == null) {
      throw new IllegalStateException(name() + " has no cache");
    }
    Objects.checkIndex(offset, cache.length);
    return cache[offset];
  }

  /**
   * Indicates whether the dataset is bound to a persistent array.
   *
   * @return {@code true} after {@link #initialise(StoredArray, int)}
   */
  public boolean isInitialised() {
    return handle != null;
  }

  private Object[] filledCache(int size) {
    Object[] values = new Object[size];
    Object fill = definition.fillValue();
    for (int i = 0; i < size; i++) {
      values[i] = fill instanceof byte[] bytes ? bytes.clone() : fill;
    }
    return values;
  }

  private static String summarize(Object[] values) {
    if (values.length <= 10) {
      return Arrays.toString(values);
    }
    return Arrays.toString(Arrays.copyOf(values, 3)) + " ... "
        + Arrays.toString(Arrays.copyOfRange(values, values.length - 3, values.length))
        + " (" + values.length + " elements)";
  }
}
