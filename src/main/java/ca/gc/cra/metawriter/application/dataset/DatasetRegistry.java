package ca.gc.cra.metawriter.application.dataset;

import ca.gc.cra.metawriter.application.port.ArrayStore;
import ca.gc.cra.metawriter.application.port.StoredArray;
import ca.gc.cra.metawriter.domain.dataset.DatasetDefinition;
import ca.gc.cra.metawriter.domain.dataset.ElementType;
import ca.gc.cra.metawriter.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Insertion-ordered collection of the datasets written during one acquisition.
 * <p><strong>Why:</strong> Base datasets, detector datasets, and datasets discovered at runtime are addressed by
 * name from message handlers; a single registry keeps flush order stable and lookups cheap.</p>
 * <p><strong>Role:</strong> Application component owned by {@code AcquisitionWriter}; rebuilt for every run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create one persistent array per registered definition and bind the dataset to it.</li>
 *   <li>Register ad-hoc datasets idempotently once the store is open.</li>
 *   <li>Route named writes, reporting missing fields without aborting the rest of a batch.</li>
 *   <li>Flush every dataset in registration order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; single writer thread.</p>
 *
 * @since 0.1.0
 */
public final class DatasetRegistry {
  private static final Logger log = LoggerFactory.getLogger(DatasetRegistry.class);

  private final String owner;
  private final Map<String, TypedDataset> datasets = new LinkedHashMap<>();

  /**
   * Builds a registry from the static base set unioned with a detector-specific set.
   *
   * @param owner writer name used as log prefix
   * @param baseDefinitions base dataset definitions
   * @param detectorDefinitions detector dataset definitions
   * @throws IllegalArgumentException when two definitions share a name
   */
  public DatasetRegistry(
      String owner,
      List<DatasetDefinition> baseDefinitions,
      List<DatasetDefinition> detectorDefinitions) {
    this.owner = Objects.requireNonNull(owner, "owner");
    List<DatasetDefinition> all = new ArrayList<>(Objects.requireNonNull(baseDefinitions, "baseDefinitions"));
    all.addAll(Objects.requireNonNull(detectorDefinitions, "detectorDefinitions"));
    for (DatasetDefinition definition : all) {
      if (datasets.putIfAbsent(definition.name(), new TypedDataset(definition)) != null) {
        throw new IllegalArgumentException("Duplicate dataset definition: " + definition.name());
      }
    }
  }

  /**
   * Creates a persistent array for every registered dataset and initialises it to {@code declaredSize}.
   *
   * @param store open store
   * @param declaredSize run size or {@link DatasetDefinition#UNLIMITED}
   * @throws IOException when the store cannot create or resize an array
   */
  public void createAll(ArrayStore store, int declaredSize) throws IOException {
    Objects.requireNonNull(store, "store");
    log.debug("{} | Creating datasets", owner);
    for (TypedDataset dataset : datasets.values()) {
      DatasetDefinition definition = dataset.definition();
      int initialLength = definition.hasFixedLength() ? definition.fixedLength() : 0;
      int maxLength = definition.hasFixedLength() ? definition.fixedLength() : StoredArray.UNBOUNDED;
      StoredArray handle = store.createArray(
          definition.name(),
          definition.elementType(),
          definition.fillValue(),
          definition.maxLength(),
          initialLength,
          maxLength);
      dataset.initialise(handle, declaredSize);
    }
  }

  /**
   * Registers a dataset seeded with {@code data} unless one with that name already exists.
   *
   * @param store open store
   * @param name dataset name
   * @param data initial contents; the element type is inferred from every element
   * @param declaredSize run size; dynamic datasets are never cached so this only binds the handle
   * @return {@code true} when a dataset was created; {@code false} when it exists or the seed was rejected
   * @throws IOException when the store cannot create the array
   */
  public boolean addDynamic(ArrayStore store, String name, List<?> data, int declaredSize) throws IOException {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(name, "name");
    if (datasets.containsKey(name)) {
      log.debug("{} | Dataset {} already created", owner, name);
      return false;
    }
    List<?> values = data == null ? List.of() : data;
    log.debug("{} | Creating dataset {} with data {}", owner, name,
        Logs.preview(values));
    ElementType type = ElementType.inferAll(values);
    TypedDataset dataset = new TypedDataset(
        new DatasetDefinition(name, type, null, 0, false, DatasetDefinition.UNLIMITED));
    StoredArray handle;
    try {
      handle = store.createArray(name, values);
    } catch (IllegalArgumentException ex) {
      log.error("{} | Rejected data for dataset {}: {}", owner, name, ex.getMessage());
      return false;
    }
    dataset.initialise(handle, declaredSize);
    datasets.put(name, dataset);
    return true;
  }

  /**
   * Writes one value to the named dataset.
   *
   * @param name dataset name
   * @param value value to write
   * @param offset target offset
   * @return {@code true} when the dataset accepted the value
   * @throws IOException when an uncached append fails in the store
   */
  public boolean writeValue(String name, Object value, int offset) throws IOException {
    TypedDataset dataset = datasets.get(name);
    if (dataset == null) {
      log.error("{} | No such dataset {}", owner, name);
      return false;
    }
    return dataset.addValue(value, offset);
  }

  /**
   * Writes one value to the named dataset at its default offset.
   *
   * @param name dataset name
   * @param value value to write
   * @return {@code true} when the dataset accepted the value
   * @throws IOException when an uncached append fails in the store
   */
  public boolean writeValue(String name, Object value) throws IOException {
    return writeValue(name, value, TypedDataset.DEFAULT_OFFSET);
  }

  /**
   * Writes the named parameters taken from {@code data} at {@code offset}.
   * A parameter absent from {@code data} is logged and skipped; the remaining parameters are still written.
   *
   * @param parameters parameter names, each naming a dataset
   * @param data parameter values
   * @param offset target offset
   * @return number of values accepted
   * @throws IOException when an uncached append fails in the store
   */
  public int writeValues(Collection<String> parameters, Map<String, ?> data, int offset) throws IOException {
    int written = 0;
    for (String parameter : parameters) {
      if (!data.containsKey(parameter)) {
        log.error("{} | Expected parameter {} not found in {}", owner, parameter,
            Logs.preview(data));
        continue;
      }
      if (writeValue(parameter, data.get(parameter), offset)) {
        written++;
      }
    }
    return written;
  }

  /**
   * Flushes every dataset in registration order.
   *
   * @throws IOException when the store rejects a flush
   */
  public void flushAll() throws IOException {
    log.debug("{} | Writing datasets", owner);
    for (TypedDataset dataset : datasets.values()) {
      dataset.flush();
    }
  }

  /**
   * Looks up a dataset by name.
   *
   * @param name dataset name
   * @return dataset when registered
   */
  public Optional<TypedDataset> get(String name) {
    return Optional.ofNullable(datasets.get(name));
  }

  /**
   * Returns dataset names in registration order.
   *
   * @return immutable list of names
   */
  public List<String> names() {
    return List.copyOf(datasets.keySet());
  }

  /**
   * Returns the number of registered datasets.
   *
   * @return dataset count
   */
  public int size() {
    return datasets.size();
  }
}
