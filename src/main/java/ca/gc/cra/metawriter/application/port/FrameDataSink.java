package ca.gc.cra.metawriter.application.port;

import java.util.List;
import java.util.Map;

/**
 * Narrow view of the acquisition writer handed to {@link DetectorExtension#handleMessage}.
 *
 * <p>Writes made through this sink follow the writer's rules: they are dropped (and logged) while no store is
 * open, and out-of-range offsets are rejected by the target dataset.</p>
 *
 * @since 0.1.0
 */
public interface FrameDataSink {
  /**
   * Returns the owning writer's name, for log prefixes.
   *
   * @return writer name
   */
  String writerName();

  /**
   * Buffers detector data for {@code frame} until a write-frame message supplies its offset.
   *
   * @param frame frame number
   * @param record detector parameters keyed by name
   */
  void bufferFrameData(long frame, Map<String, Object> record);

  /**
   * Creates a dataset seeded with {@code values} unless one with that name exists.
   *
   * @param name dataset name
   * @param values initial contents
   * @return {@code true} when a dataset was created
   */
  boolean addDynamicDataset(String name, List<?> values);

  /**
   * Writes a value to a dataset at its default offset.
   *
   * @param dataset dataset name
   * @param value value
   * @return {@code true} when the value was accepted
   */
  boolean addValue(String dataset, Object value);
}
