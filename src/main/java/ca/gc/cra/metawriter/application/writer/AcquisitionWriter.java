package ca.gc.cra.metawriter.application.writer;

import ca.gc.cra.metawriter.application.dataset.DatasetRegistry;
import ca.gc.cra.metawriter.application.port.ArrayStore;
import ca.gc.cra.metawriter.application.port.ArrayStorePort;
import ca.gc.cra.metawriter.application.port.ClockPort;
import ca.gc.cra.metawriter.application.port.DetectorExtension;
import ca.gc.cra.metawriter.application.port.FrameDataSink;
import ca.gc.cra.metawriter.application.port.MetricsPort;
import ca.gc.cra.metawriter.domain.dataset.DatasetDefinition;
import ca.gc.cra.metawriter.domain.msg.MessageFields;
import ca.gc.cra.metawriter.domain.msg.MessageType;
import ca.gc.cra.metawriter.domain.msg.MetaMessage;
import ca.gc.cra.metawriter.logging.Logs;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes the metadata of one acquisition into a persistent array store.
 * <p><strong>Why:</strong> Several producer processes report frames out of order; this writer tracks the run
 * lifecycle, places every frame's values at its storage offset, and bounds the window of unflushed data.</p>
 * <p><strong>Role:</strong> Application use case driven one message at a time by the listener.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the store on the first start-acquisition while idle and close it when the last producer stops.</li>
 *   <li>Dispatch the five core message types and hand every other type to the {@link DetectorExtension}.</li>
 *   <li>Merge buffered detector records into the frame's offset once a write-frame message reveals it.</li>
 *   <li>Flush cached datasets on the frame-frequency and timeout heuristics of {@link FlushPolicy}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; callers serialize {@link #process(MetaMessage)},
 * {@link #configure(Map)} and {@link #stop()}.</p>
 * <p><strong>Observability:</strong> Logs prefixed with the writer name and emits {@code meta.*} metrics.</p>
 *
 * @since 0.1.0
 */
public final class AcquisitionWriter {
  private static final Logger log = LoggerFactory.getLogger(AcquisitionWriter.class);

  /** Suffix appended to the file prefix or writer name. */
  public static final String FILE_SUFFIX = "_meta.mds";
  /** {@code expectedFrameCount} while idle. */
  public static final int NOT_STARTED = -1;

  /** Datasets written for every acquisition regardless of detector. */
  public static final List<DatasetDefinition> BASE_DATASETS = List.of(
      DatasetDefinition.int64(MessageFields.FRAME),
      DatasetDefinition.int64(MessageFields.OFFSET),
      DatasetDefinition.int64(MessageFields.CREATE_DURATION, false),
      DatasetDefinition.int64(MessageFields.WRITE_DURATION),
      DatasetDefinition.int64(MessageFields.FLUSH_DURATION),
      DatasetDefinition.int64(MessageFields.CLOSE_DURATION, false));

  private static final List<String> WRITE_FRAME_PARAMETERS = List.of(
      MessageFields.FRAME, MessageFields.OFFSET, MessageFields.WRITE_DURATION, MessageFields.FLUSH_DURATION);

  private final String name;
  private final WriterConfiguration config;
  private final DetectorExtension detector;
  private final ArrayStorePort storePort;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final FlushPolicy flushPolicy;
  private final SideChannelBuffer sideChannel;
  private final FrameDataSink sink = new Sink();

  private ArrayStore store;
  private DatasetRegistry registry;
  private Path filePath;
  private int expectedFrameCount = NOT_STARTED;
  private int activeProducers;
  private long writeCount;
  private long writeTimeoutCount;
  private boolean finished;

  /**
   * Creates an idle writer.
   *
   * @param name unique writer name; used for log prefixes and as default file prefix
   * @param config writer settings; owned by this writer from now on
   * @param detector detector capability; {@link DetectorExtension#NONE} for none
   * @param storePort factory for the persistent store
   * @param metrics metrics sink
   * @param clock time source for the flush timeout
   * @param sideChannelCapacity maximum number of buffered detector records
   */
  public AcquisitionWriter(
      String name,
      WriterConfiguration config,
      DetectorExtension detector,
      ArrayStorePort storePort,
      MetricsPort metrics,
      ClockPort clock,
      int sideChannelCapacity) {
    this.name = Objects.requireNonNull(name, "name");
    this.config = Objects.requireNonNull(config, "config");
    this.detector = Objects.requireNonNull(detector, "detector");
    this.storePort = Objects.requireNonNull(storePort, "storePort");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.flushPolicy = new FlushPolicy(config, clock);
    this.sideChannel = new SideChannelBuffer(sideChannelCapacity);
  }

  /**
   * Handles one inbound message to completion.
   *
   * <p>Protocol, bounds and lifecycle errors are logged and the offending item skipped.</p>
   *
   * @param message decoded message; must not be {@code null}
   * @throws UncheckedIOException when the persistent store fails
   */
  public void process(MetaMessage message) {
    Objects.requireNonNull(message, "message");
    metrics.increment("meta.messages.received");
    Optional<MessageType> type = MessageType.fromTag(message.type());
    try {
      if (type.isPresent()) {
        switch (type.get()) {
          case START_ACQUISITION -> startAcquisition(message);
          case CREATE_FILE -> recordDuration(MessageFields.CREATE_DURATION, message);
          case WRITE_FRAME -> writeFrame(message);
          case CLOSE_FILE -> recordDuration(MessageFields.CLOSE_DURATION, message);
          case STOP_ACQUISITION -> stopAcquisition(message);
        }
        return;
      }
    } catch (IOException ex) {
      throw new UncheckedIOException(name + " | Store failure handling " + message.type(), ex);
    }
    if (detector.handleMessage(message, sink)) {
      return;
    }
    log.error("{} | Unknown message type: {}", name, message.type());
    metrics.increment("meta.messages.unknown");
  }

  /**
   * Applies settings; recognized keys are applied even when others in the same call are rejected.
   *
   * @param settings setting name to raw value
   * @return the last error encountered, or empty when every setting applied
   */
  public Optional<String> configure(Map<String, ?> settings) {
    Objects.requireNonNull(settings, "settings");
    String error = null;
    for (Map.Entry<String, ?> entry : settings.entrySet()) {
      Optional<ConfigKey> key = ConfigKey.fromKey(entry.getKey());
      if (key.isEmpty()) {
        error = "Invalid parameter " + entry.getKey();
        log.error("{} | {}", name, error);
        continue;
      }
      try {
        config.apply(key.get(), entry.getValue());
        log.debug("{} | Setting {} to {}", name, key.get().key(), entry.getValue());
      } catch (IllegalArgumentException ex) {
        error = ex.getMessage();
        log.error("{} | {}", name, error);
      }
    }
    return Optional.ofNullable(error);
  }

  /**
   * Returns the current value of every recognized setting.
   *
   * @return setting name to value
   */
  public Map<String, Object> currentConfiguration() {
    return config.asMap();
  }

  /**
   * Forces the open run, if any, to flush and close regardless of outstanding producers. The writer is finished
   * afterwards even when it never opened a store or the close fails.
   *
   * @throws UncheckedIOException when the final flush or close fails
   */
  public void stop() {
    activeProducers = 0;
    try {
      closeRun();
    } catch (IOException ex) {
      throw new UncheckedIOException(name + " | Store failure while stopping", ex);
    } finally {
      finished = true;
    }
    log.info("{} | Finished", name);
  }

  /**
   * Counts one poll interval without write-frame traffic while a run is open.
   */
  public void recordWriteTimeout() {
    if (store != null) {
      writeTimeoutCount++;
    }
  }

  /**
   * Returns a status snapshot.
   *
   * @return current status
   */
  public WriterStatus status() {
    return new WriterStatus(
        name,
        filePath == null ? null : filePath.toString(),
        store != null,
        activeProducers,
        writeCount,
        finished,
        writeTimeoutCount,
        expectedFrameCount);
  }

  public String name() {
    return name;
  }

  public DetectorExtension detector() {
    return detector;
  }

  /**
   * Returns the datasets of the open run.
   *
   * @return registry, or empty while no store is open
   */
  public Optional<DatasetRegistry> datasets() {
    return Optional.ofNullable(registry);
  }

  /**
   * Returns the number of detector records waiting for their offset.
   *
   * @return pending side-channel records
   */
  public int pendingFrameData() {
    return sideChannel.size();
  }

  private void startAcquisition(MetaMessage message) throws IOException {
    activeProducers++;
    log.debug("{} | Handling start acquisition message; {} producers running", name, activeProducers);
    if (expectedFrameCount != NOT_STARTED) {
      return;
    }
    openRun(declaredFrameCount(message));
  }

  private int declaredFrameCount(MetaMessage message) {
    OptionalLong total = message.headerLong(MessageFields.TOTAL_FRAMES);
    if (total.isEmpty()) {
      total = message.bodyLong(MessageFields.TOTAL_FRAMES);
    }
    if (total.isEmpty()) {
      log.error("{} | Start acquisition without {}; datasets will grow without cache",
          name, MessageFields.TOTAL_FRAMES);
      return DatasetDefinition.UNLIMITED;
    }
    long frames = total.getAsLong();
    if (frames < 0 || frames > Integer.MAX_VALUE) {
      log.error("{} | Invalid {} {}; datasets will grow without cache", name, MessageFields.TOTAL_FRAMES, frames);
      return DatasetDefinition.UNLIMITED;
    }
    return (int) frames;
  }

  private void openRun(int frames) throws IOException {
    Path path = config.directory().resolve(fileName());
    log.debug("{} | Opening file {} - Expecting {} frames", name, path, frames);
    if (Files.exists(path)) {
      log.warn("{} | Replacing existing file {}", name, path);
    }
    ArrayStore opened = null;
    try {
      opened = storePort.create(path);
      DatasetRegistry datasets = new DatasetRegistry(name, BASE_DATASETS, detector.datasetDefinitions());
      datasets.createAll(opened, frames);
      store = opened;
      registry = datasets;
      filePath = path;
      expectedFrameCount = frames;
      writeCount = 0;
      writeTimeoutCount = 0;
      finished = false;
      flushPolicy.markFlushed();
      log.info("{} | Opened {} for {} frames", name, path, frames == DatasetDefinition.UNLIMITED ? "unlimited" : frames);
    } catch (IOException | RuntimeException ex) {
      activeProducers = 0;
      expectedFrameCount = NOT_STARTED;
      if (opened != null) {
        try {
          opened.close();
        } catch (IOException closeEx) {
          ex.addSuppressed(closeEx);
        }
      }
      throw ex;
    }
  }

  private String fileName() {
    String prefix = config.filePrefix() != null ? config.filePrefix() : name;
    return prefix + FILE_SUFFIX;
  }

  private void recordDuration(String dataset, MetaMessage message) throws IOException {
    log.debug("{} | Handling {} message", name, message.type());
    if (!storeOpen(dataset)) {
      return;
    }
    if (!message.body().containsKey(dataset)) {
      log.error("{} | Expected parameter {} not found in {}", name, dataset,
          Logs.preview(message.body()));
      return;
    }
    registry.writeValue(dataset, message.body().get(dataset));
  }

  private void writeFrame(MetaMessage message) throws IOException {
    log.debug("{} | Handling write frame message", name);
    if (!storeOpen("frame")) {
      metrics.increment("meta.write.rejected");
      return;
    }
    Map<String, Object> data = message.body();
    OptionalLong offsetField = message.bodyLong(MessageFields.OFFSET);
    if (offsetField.isEmpty()) {
      log.error("{} | Write frame without a valid {}: {}", name, MessageFields.OFFSET,
          Logs.preview(data));
      metrics.increment("meta.write.rejected");
      return;
    }
    long rawOffset = offsetField.getAsLong();
    if (rawOffset < 0 || rawOffset > Integer.MAX_VALUE) {
      log.error("{} | Cannot write frame at offset {}", name, rawOffset);
      metrics.increment("meta.write.rejected");
      return;
    }
    int offset = (int) rawOffset;

    int accepted = registry.writeValues(WRITE_FRAME_PARAMETERS, data, offset);
    if (accepted < WRITE_FRAME_PARAMETERS.size()) {
      metrics.increment("meta.write.rejected");
    }
    writeTimeoutCount = 0;
    writeCount++;
    metrics.increment("meta.frames.written");

    writeDetectorFrameData(message.bodyLong(MessageFields.FRAME), offset);

    if (flushPolicy.due(writeCount)) {
      flush();
    }
  }

  private void writeDetectorFrameData(OptionalLong frame, int offset) throws IOException {
    List<String> parameters = detector.writeFrameParameters();
    if (parameters.isEmpty()) {
      return;
    }
    if (frame.isEmpty()) {
      log.error("{} | Write frame without a valid {}; detector data not merged", name, MessageFields.FRAME);
      return;
    }
    Optional<Map<String, Object>> record = sideChannel.take(frame.getAsLong());
    if (record.isEmpty()) {
      log.debug("{} | No detector meta data stored for frame {}", name, frame.getAsLong());
      return;
    }
    log.debug("{} | Writing detector data for frame {} at offset {}", name, frame.getAsLong(), offset);
    registry.writeValues(parameters, record.get(), offset);
  }

  private void stopAcquisition(MetaMessage message) throws IOException {
    if (activeProducers > 0) {
      activeProducers--;
    }
    OptionalLong rank = message.headerLong(MessageFields.RANK);
    log.debug("{} | Process rank {} stopped; {} producers running", name,
        rank.isPresent() ? rank.getAsLong() : "unknown", activeProducers);
    if (activeProducers == 0) {
      log.info("{} | Last processor stopped", name);
      closeRun();
    }
  }

  private void flush() throws IOException {
    long started = clock.nanoTime();
    registry.flushAll();
    metrics.increment("meta.flush.count");
    metrics.observe("meta.flush.latencyNanos", clock.nanoTime() - started);
    flushPolicy.markFlushed();
  }

  private void closeRun() throws IOException {
    if (store == null) {
      expectedFrameCount = NOT_STARTED;
      return;
    }
    log.info("{} | Closing file {}", name, filePath);
    ArrayStore closing = store;
    IOException failure = null;
    try {
      flush();
    } catch (IOException ex) {
      failure = ex;
    } finally {
      store = null;
      registry = null;
      expectedFrameCount = NOT_STARTED;
      finished = true;
      int stale = sideChannel.clear();
      if (stale > 0) {
        log.warn("{} | Discarded detector data for {} frames that were never written", name, stale);
      }
      try {
        closing.close();
      } catch (IOException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private boolean storeOpen(String target) {
    if (store != null) {
      return true;
    }
    String reason = finished ? "Already finished writing" : "Have not received startacquisition yet";
    log.warn("{} | File not open - {}; dropping {}", name, reason, target);
    return false;
  }

  private final class Sink implements FrameDataSink {
    @Override
    public String writerName() {
      return name;
    }

    @Override
    public void bufferFrameData(long frame, Map<String, Object> record) {
      sideChannel.put(frame, record).ifPresent(evicted -> {
        log.warn("{} | Side channel full; dropped detector data for frame {}", name, evicted);
        metrics.increment("meta.sidechannel.evicted");
      });
    }

    @Override
    public boolean addDynamicDataset(String dataset, List<?> values) {
      if (!storeOpen(dataset)) {
        return false;
      }
      try {
        return registry.addDynamic(store, dataset, values, expectedFrameCount);
      } catch (IOException ex) {
        throw new UncheckedIOException(name + " | Failed to create dataset " + dataset, ex);
      }
    }

    @Override
    public boolean addValue(String dataset, Object value) {
      if (!storeOpen(dataset)) {
        return false;
      }
      try {
        return registry.writeValue(dataset, value);
      } catch (IOException ex) {
        throw new UncheckedIOException(name + " | Failed to write dataset " + dataset, ex);
      }
    }
  }
}
