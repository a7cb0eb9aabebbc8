package ca.gc.cra.metawriter.application.listener;

import ca.gc.cra.metawriter.application.port.ArrayStorePort;
import ca.gc.cra.metawriter.application.port.ClockPort;
import ca.gc.cra.metawriter.application.port.DetectorExtension;
import ca.gc.cra.metawriter.application.port.MetricsPort;
import ca.gc.cra.metawriter.application.writer.AcquisitionWriter;
import ca.gc.cra.metawriter.application.writer.ConfigKey;
import ca.gc.cra.metawriter.application.writer.WriterConfiguration;
import ca.gc.cra.metawriter.application.writer.WriterStatus;
import ca.gc.cra.metawriter.domain.msg.MetaMessage;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Front door for decoded messages; keeps one {@link AcquisitionWriter} per acquisition id.
 * <p><strong>Why:</strong> Producers of concurrent acquisitions share one transport; each acquisition needs its own
 * store file, lifecycle, and producer bookkeeping.</p>
 * <p><strong>Role:</strong> Application service called by transport adapters and the control surface.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create writers lazily with the buffered default settings.</li>
 *   <li>Fan configuration and stop requests out to one or all writers.</li>
 *   <li>Retain finished writers for status readback, bounded by {@code maxFinishedWriters}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Every public method is {@code synchronized}, which serializes message handling
 * for the writers.</p>
 *
 * @since 0.1.0
 */
public final class MetaListener {
  private static final Logger log = LoggerFactory.getLogger(MetaListener.class);

  /** Default number of finished writers retained for status. */
  public static final int DEFAULT_MAX_FINISHED_WRITERS = 16;

  private final String defaultWriterName;
  private final WriterConfiguration defaults;
  private final Supplier<DetectorExtension> detectorFactory;
  private final ArrayStorePort storePort;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final int sideChannelCapacity;
  private final int maxFinishedWriters;
  private final Map<String, AcquisitionWriter> writers = new LinkedHashMap<>();

  /**
   * Creates a listener.
   *
   * @param defaultWriterName writer name used for messages without an acquisition id
   * @param defaults settings copied into every new writer
   * @param detectorFactory supplies one detector extension per writer
   * @param storePort persistent store factory
   * @param metrics metrics sink shared by all writers
   * @param clock time source shared by all writers
   * @param sideChannelCapacity side-channel capacity of every writer
   * @param maxFinishedWriters finished writers retained before the oldest is pruned
   */
  public MetaListener(
      String defaultWriterName,
      WriterConfiguration defaults,
      Supplier<DetectorExtension> detectorFactory,
      ArrayStorePort storePort,
      MetricsPort metrics,
      ClockPort clock,
      int sideChannelCapacity,
      int maxFinishedWriters) {
    if (defaultWriterName == null || defaultWriterName.isBlank()) {
      throw new IllegalArgumentException("defaultWriterName must not be blank");
    }
    if (maxFinishedWriters < 0) {
      throw new IllegalArgumentException("maxFinishedWriters must not be negative");
    }
    this.defaultWriterName = defaultWriterName;
    this.defaults = Objects.requireNonNull(defaults, "defaults").copy();
    this.detectorFactory = Objects.requireNonNull(detectorFactory, "detectorFactory");
    this.storePort = Objects.requireNonNull(storePort, "storePort");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sideChannelCapacity = sideChannelCapacity;
    this.maxFinishedWriters = maxFinishedWriters;
  }

  /**
   * Routes a message to the writer of its acquisition, creating the writer on first sight.
   *
   * @param message decoded message
   * @throws java.io.UncheckedIOException when the writer's store fails
   */
  public synchronized void process(MetaMessage message) {
    Objects.requireNonNull(message, "message");
    AcquisitionWriter writer = writers.computeIfAbsent(writerName(message.acquisitionId()), this::newWriter);
    writer.process(message);
    if (writer.status().finished() && !writer.status().storeOpen()) {
      pruneExcessFinished();
    }
  }

  /**
   * Applies settings to one writer, or to the defaults and every live writer when {@code acquisitionId} is
   * {@code null}.
   *
   * @param acquisitionId target acquisition, or {@code null} for all
   * @param settings setting name to raw value
   * @return the last error reported, or empty when every setting applied
   */
  public synchronized Optional<String> configure(String acquisitionId, Map<String, ?> settings) {
    Objects.requireNonNull(settings, "settings");
    if (acquisitionId == null) {
      String error = applyDefaults(settings);
      for (AcquisitionWriter writer : writers.values()) {
        Optional<String> writerError = writer.configure(settings);
        if (writerError.isPresent()) {
          error = writerError.get();
        }
      }
      return Optional.ofNullable(error);
    }
    return writers.computeIfAbsent(writerName(acquisitionId), this::newWriter).configure(settings);
  }

  /**
   * Forces one writer, or every writer when {@code acquisitionId} is {@code null}, to flush and close.
   *
   * <p>Stopping every writer continues past a failing store; the first failure is rethrown once all writers are
   * stopped, with later ones attached as suppressed exceptions.</p>
   *
   * @param acquisitionId target acquisition, or {@code null} for all
   * @return {@code true} when a writer was stopped
   * @throws UncheckedIOException when a store fails to flush or close
   */
  public synchronized boolean stop(String acquisitionId) {
    if (acquisitionId == null) {
      UncheckedIOException failure = null;
      for (AcquisitionWriter writer : writers.values()) {
        try {
          writer.stop();
        } catch (UncheckedIOException ex) {
          log.error("{} | Stop failed; continuing with remaining writers", writer.name());
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
      return !writers.isEmpty();
    }
    AcquisitionWriter writer = writers.get(writerName(acquisitionId));
    if (writer == null) {
      log.warn("No writer for acquisition {}", acquisitionId);
      return false;
    }
    writer.stop();
    return true;
  }

  /**
   * Counts one poll interval without traffic on every writer with an open store.
   */
  public synchronized void recordWriteTimeout() {
    writers.values().forEach(AcquisitionWriter::recordWriteTimeout);
  }

  /**
   * Returns the status of every known writer.
   *
   * @return acquisition id to status, in creation order
   */
  public synchronized Map<String, WriterStatus> status() {
    Map<String, WriterStatus> statuses = new LinkedHashMap<>();
    writers.forEach((id, writer) -> statuses.put(id, writer.status()));
    return statuses;
  }

  /**
   * Returns the acquisition ids with a writer.
   *
   * @return ids in creation order
   */
  public synchronized List<String> acquisitions() {
    return List.copyOf(writers.keySet());
  }

  /**
   * Returns the settings new writers start with.
   *
   * @return setting name to value
   */
  public synchronized Map<String, Object> defaultConfiguration() {
    return defaults.asMap();
  }

  /**
   * Drops every finished writer that has no open store.
   *
   * @return ids removed
   */
  public synchronized List<String> prune() {
    List<String> removed = new ArrayList<>();
    Iterator<Map.Entry<String, AcquisitionWriter>> it = writers.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, AcquisitionWriter> entry = it.next();
      if (isRetired(entry.getValue())) {
        removed.add(entry.getKey());
        it.remove();
      }
    }
    if (!removed.isEmpty()) {
      log.info("Pruned finished writers {}", removed);
    }
    return removed;
  }

  private void pruneExcessFinished() {
    long finished = writers.values().stream().filter(MetaListener::isRetired).count();
    Iterator<Map.Entry<String, AcquisitionWriter>> it = writers.entrySet().iterator();
    while (finished > maxFinishedWriters && it.hasNext()) {
      Map.Entry<String, AcquisitionWriter> entry = it.next();
      if (isRetired(entry.getValue())) {
        log.debug("Dropping finished writer {}", entry.getKey());
        it.remove();
        finished--;
      }
    }
  }

  private static boolean isRetired(AcquisitionWriter writer) {
    WriterStatus status = writer.status();
    return status.finished() && !status.storeOpen();
  }

  private String applyDefaults(Map<String, ?> settings) {
    String error = null;
    for (Map.Entry<String, ?> entry : settings.entrySet()) {
      Optional<ConfigKey> key = ConfigKey.fromKey(entry.getKey());
      if (key.isEmpty()) {
        error = "Invalid parameter " + entry.getKey();
        continue;
      }
      try {
        defaults.apply(key.get(), entry.getValue());
      } catch (IllegalArgumentException ex) {
        error = ex.getMessage();
      }
    }
    if (error != null) {
      log.error("Default configuration: {}", error);
    }
    return error;
  }

  private String writerName(String acquisitionId) {
    return acquisitionId == null || acquisitionId.isBlank() ? defaultWriterName : acquisitionId.trim();
  }

  private AcquisitionWriter newWriter(String name) {
    log.info("Creating writer {}", name);
    return new AcquisitionWriter(
        name,
        defaults.copy(),
        detectorFactory.get(),
        storePort,
        metrics,
        clock,
        sideChannelCapacity);
  }
}
