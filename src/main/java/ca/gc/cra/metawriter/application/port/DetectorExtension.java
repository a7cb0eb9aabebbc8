package ca.gc.cra.metawriter.application.port;

import ca.gc.cra.metawriter.domain.dataset.DatasetDefinition;
import ca.gc.cra.metawriter.domain.msg.MetaMessage;
import java.util.List;

/**
 * <strong>What:</strong> Capability interface describing detector-specific metadata.
 * <p><strong>Why:</strong> Detectors add datasets, per-frame parameters, and message types of their own; injecting
 * one variant per detector keeps the writer core closed to detector details.</p>
 * <p><strong>Role:</strong> Injected into {@code AcquisitionWriter} at construction.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Declare extra datasets merged into the registry when the store is created.</li>
 *   <li>Name the per-frame parameters merged from the side channel once a frame's offset is known.</li>
 *   <li>Handle detector message types, usually by buffering per-frame records through {@link FrameDataSink}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from the writer thread only; implementations should be stateless.</p>
 *
 * @since 0.1.0
 */
public interface DetectorExtension {
  /**
   * Returns the detector name used in logs and configuration.
   *
   * @return detector name
   */
  String name();

  /**
   * Returns additional dataset definitions created with the store.
   *
   * @return detector datasets; empty when none
   */
  List<DatasetDefinition> datasetDefinitions();

  /**
   * Returns per-frame parameter names written from the side channel at the frame's offset.
   *
   * @return parameter names, each naming a dataset; empty when the detector has no per-frame data
   */
  List<String> writeFrameParameters();

  /**
   * Handles a message whose type is outside the writer's core set.
   *
   * @param message decoded message
   * @param sink writer operations available to the extension
   * @return {@code true} when the message type belongs to this detector
   */
  boolean handleMessage(MetaMessage message, FrameDataSink sink);

  /** Extension for detectors without specific metadata. */
  DetectorExtension NONE = new DetectorExtension() {
    @Override
    public String name() {
      return "none";
    }

    @Override
    public List<DatasetDefinition> datasetDefinitions() {
      return List.of();
    }

    @Override
    public List<String> writeFrameParameters() {
      return List.of();
    }

    @Override
    public boolean handleMessage(MetaMessage message, FrameDataSink sink) {
      return false;
    }
  };
}
