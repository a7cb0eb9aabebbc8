package ca.gc.cra.metawriter.infrastructure.detector;

import ca.gc.cra.metawriter.application.port.DetectorExtension;
import ca.gc.cra.metawriter.application.port.FrameDataSink;
import ca.gc.cra.metawriter.domain.dataset.DatasetDefinition;
import ca.gc.cra.metawriter.domain.msg.MessageFields;
import ca.gc.cra.metawriter.domain.msg.MessageType;
import ca.gc.cra.metawriter.domain.msg.MetaMessage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Detector capability recording per-frame exposure timing and detector configuration.
 * <p><strong>Why:</strong> The detector reports timing for a frame before the frame processors know where the frame
 * lands in the file; the record waits in the writer's side channel until the offset arrives.</p>
 * <p><strong>Messages:</strong>
 * <ul>
 *   <li>{@code frameinfo}: body holds {@code frame} plus {@code real_time}, {@code start_time},
 *   {@code stop_time}; buffered by frame number.</li>
 *   <li>{@code detectorconfig}: body maps setting names to values; each becomes a dataset, and the optional
 *   {@code series} value is appended to {@code detector_series}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class TimingDetectorExtension implements DetectorExtension {
  private static final Logger log = LoggerFactory.getLogger(TimingDetectorExtension.class);

  public static final String NAME = "timing";
  public static final String REAL_TIME = "real_time";
  public static final String START_TIME = "start_time";
  public static final String STOP_TIME = "stop_time";
  public static final String DETECTOR_SERIES = "detector_series";
  public static final String SERIES = "series";

  static final String FRAME_INFO = "frameinfo";
  static final String DETECTOR_CONFIG = "detectorconfig";

  private static final int SERIES_MAX_BYTES = 64;

  private static final List<DatasetDefinition> DATASETS = List.of(
      DatasetDefinition.int64(REAL_TIME),
      DatasetDefinition.int64(START_TIME),
      DatasetDefinition.int64(STOP_TIME),
      DatasetDefinition.string(DETECTOR_SERIES, SERIES_MAX_BYTES, false));

  private static final List<String> PARAMETERS = List.of(REAL_TIME, START_TIME, STOP_TIME);

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<DatasetDefinition> datasetDefinitions() {
    return DATASETS;
  }

  @Override
  public List<String> writeFrameParameters() {
    return PARAMETERS;
  }

  @Override
  public boolean handleMessage(MetaMessage message, FrameDataSink sink) {
    String type = MessageType.normalize(message.type());
    if (FRAME_INFO.equals(type)) {
      bufferFrameInfo(message, sink);
      return true;
    }
    if (DETECTOR_CONFIG.equals(type)) {
      recordConfig(message, sink);
      return true;
    }
    return false;
  }

  private void bufferFrameInfo(MetaMessage message, FrameDataSink sink) {
    OptionalLong frame = message.bodyLong(MessageFields.FRAME);
    if (frame.isEmpty()) {
      log.error("{} | Frame info without a valid {}: {}", sink.writerName(), MessageFields.FRAME, message.body());
      return;
    }
    Map<String, Object> record = new LinkedHashMap<>(message.body());
    record.remove(MessageFields.FRAME);
    log.debug("{} | Buffering detector data for frame {}", sink.writerName(), frame.getAsLong());
    sink.bufferFrameData(frame.getAsLong(), record);
  }

  private void recordConfig(MetaMessage message, FrameDataSink sink) {
    log.debug("{} | Handling detector config {}", sink.writerName(), message.body().keySet());
    for (Map.Entry<String, Object> entry : message.body().entrySet()) {
      Object value = entry.getValue();
      List<?> values = value instanceof List<?> list ? list : Collections.singletonList(value);
      sink.addDynamicDataset("config/" + entry.getKey(), values);
    }
    Object series = message.body().get(SERIES);
    if (series != null) {
      sink.addValue(DETECTOR_SERIES, series);
    }
  }
}
