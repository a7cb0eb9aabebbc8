package ca.gc.cra.metawriter.application.writer;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded side table of detector records keyed by frame number, waiting for the frame's storage offset.
 *
 * <p>Insertion order decides eviction: once {@link #capacity()} entries are held, inserting a new frame drops the
 * oldest entry. Re-inserting a frame replaces its record in place. Entries leave the table when consumed.</p>
 *
 * @since 0.1.0
 */
public final class SideChannelBuffer {
  /** Default number of frames held before eviction starts. */
  public static final int DEFAULT_CAPACITY = 4096;

  private final int capacity;
  private final LinkedHashMap<Long, Map<String, Object>> pending = new LinkedHashMap<>();

  /**
   * Creates a buffer.
   *
   * @param capacity maximum number of frames held; must be positive
   */
  public SideChannelBuffer(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
    }
    this.capacity = capacity;
  }

  /**
   * Stores the record for {@code frame}.
   *
   * @param frame frame number
   * @param record detector fields; copied
   * @return the frame number evicted to make room, if any
   */
  public Optional<Long> put(long frame, Map<String, Object> record) {
    Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(record));
    if (pending.containsKey(frame)) {
      pending.put(frame, copy);
      return Optional.empty();
    }
    Optional<Long> evicted = Optional.empty();
    if (pending.size() >= capacity) {
      Iterator<Long> oldest = pending.keySet().iterator();
      evicted = Optional.of(oldest.next());
      oldest.remove();
    }
    pending.put(frame, copy);
    return evicted;
  }

  /**
   * Removes and returns the record for {@code frame}.
   *
   * @param frame frame number
   * @return buffered record, or empty when none arrived
   */
  public Optional<Map<String, Object>> take(long frame) {
    return Optional.ofNullable(pending.remove(frame));
  }

  /**
   * Drops every pending record.
   *
   * @return number of records dropped
   */
  public int clear() {
    int dropped = pending.size();
    pending.clear();
    return dropped;
  }

  public int size() {
    return pending.size();
  }

  public int capacity() {
    return capacity;
  }
}
