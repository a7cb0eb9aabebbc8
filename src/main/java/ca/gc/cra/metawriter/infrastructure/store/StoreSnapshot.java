package ca.gc.cra.metawriter.infrastructure.store;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every array of a store file at the moment it was read.
 *
 * @param path file read
 * @param arrays arrays by name, in creation order
 * @param closed whether the writer closed the file
 * @param truncated whether reading stopped at an incomplete trailing record
 * @since 0.1.0
 */
public record StoreSnapshot(Path path, Map<String, StoredArraySnapshot> arrays, boolean closed, boolean truncated) {
  public StoreSnapshot {
    arrays = Collections.unmodifiableMap(new LinkedHashMap<>(arrays));
  }

  public Optional<StoredArraySnapshot> array(String name) {
    return Optional.ofNullable(arrays.get(name));
  }
}
