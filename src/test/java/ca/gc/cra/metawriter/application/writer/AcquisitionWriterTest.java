package ca.gc.cra.metawriter.application.writer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.metawriter.application.port.DetectorExtension;
import ca.gc.cra.metawriter.domain.dataset.ElementType;
import ca.gc.cra.metawriter.domain.msg.MessageType;
import ca.gc.cra.metawriter.domain.msg.MetaMessage;
import ca.gc.cra.metawriter.infrastructure.detector.TimingDetectorExtension;
import ca.gc.cra.metawriter.infrastructure.store.MetaStoreFileAdapter;
import ca.gc.cra.metawriter.infrastructure.store.MetaStoreReader;
import ca.gc.cra.metawriter.infrastructure.store.StoreSnapshot;
import ca.gc.cra.metawriter.testutil.InMemoryArrayStorePort;
import ca.gc.cra.metawriter.testutil.InMemoryArrayStorePort.MemoryStore;
import ca.gc.cra.metawriter.testutil.ManualClock;
import ca.gc.cra.metawriter.testutil.Messages;
import ca.gc.cra.metawriter.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class AcquisitionWriterTest {
  private final InMemoryArrayStorePort storePort = new InMemoryArrayStorePort();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ManualClock clock = new ManualClock(1_000L);

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(AcquisitionWriter.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    appender.stop();
  }

  private AcquisitionWriter writer(int frequency, Object timeoutSeconds, DetectorExtension detector) {
    WriterConfiguration config = new WriterConfiguration(Path.of("out"));
    config.apply(ConfigKey.FLUSH_FRAME_FREQUENCY, frequency);
    config.apply(ConfigKey.FLUSH_TIMEOUT, timeoutSeconds);
    return new AcquisitionWriter("scan", config, detector, storePort, metrics, clock, 8);
  }

  private boolean logged(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }

  @Test
  void flushesOnFrequencyAndAgainOnClose() {
    AcquisitionWriter writer = writer(2, 1000, DetectorExtension.NONE);

    writer.process(Messages.start(3));
    writer.process(Messages.createFile(7));
    writer.process(Messages.writeFrame(1, 0));
    MemoryStore store = storePort.last();
    assertEquals(0, store.array("frame").flushCount());

    writer.process(Messages.writeFrame(2, 1));
    assertEquals(1, store.array("frame").flushCount());
    assertEquals(List.of(1L, 2L, -1L), store.array("frame").published());

    writer.process(Messages.writeFrame(3, 2));
    assertEquals(1, store.array("frame").flushCount());

    writer.process(Messages.closeFile(9));
    writer.process(Messages.stop(0));

    assertEquals(2, store.array("frame").flushCount());
    assertEquals(List.of(1L, 2L, 3L), store.array("frame").published());
    assertEquals(List.of(0L, 1L, 2L), store.array("offset").published());
    assertEquals(List.of(11L, 12L, 13L), store.array("write_duration").published());
    assertEquals(List.of(7L), store.array("create_duration").published());
    assertEquals(List.of(9L), store.array("close_duration").published());
    assertTrue(store.closed());
    assertEquals(2, metrics.count("meta.flush.count"));
    assertEquals(3, metrics.count("meta.frames.written"));

    WriterStatus status = writer.status();
    assertTrue(status.finished());
    assertFalse(status.storeOpen());
    assertEquals(AcquisitionWriter.NOT_STARTED, status.expectedFrameCount());
    assertEquals(3, status.writeCount());
    assertEquals(Path.of("out", "scan" + AcquisitionWriter.FILE_SUFFIX).toString(), status.filePath());
  }

  @Test
  void flushesWhenTimeoutElapsesBeforeFrequency() {
    AcquisitionWriter writer = writer(100, 0.5, DetectorExtension.NONE);
    writer.process(Messages.start(10));

    writer.process(Messages.writeFrame(0, 0));
    assertEquals(0, metrics.count("meta.flush.count"));

    clock.advance(500);
    writer.process(Messages.writeFrame(1, 1));
    assertEquals(1, metrics.count("meta.flush.count"));

    writer.process(Messages.writeFrame(2, 2));
    assertEquals(1, metrics.count("meta.flush.count"));
  }

  @Test
  void flushesOnEveryHundredthFrameWithTimeoutDisabled() {
    AcquisitionWriter writer = writer(100, "none", DetectorExtension.NONE);
    writer.process(Messages.start(250));

    for (int i = 0; i < 250; i++) {
      writer.process(Messages.writeFrame(i, i));
      clock.advance(10_000);
    }

    assertEquals(2, metrics.count("meta.flush.count"));
    assertEquals(2, storePort.last().array("offset").flushCount());
  }

  @Test
  void mergesDetectorDataAtTheOffsetOfItsFrame() {
    AcquisitionWriter writer = writer(100, null, new TimingDetectorExtension());
    writer.process(Messages.start(4));

    writer.process(Messages.detector("frame_info",
        Map.of("frame", 5, "real_time", 500, "start_time", 400, "stop_time", 600)));
    assertEquals(1, writer.pendingFrameData());

    writer.process(Messages.writeFrame(5, 2));
    assertEquals(0, writer.pendingFrameData());
    writer.process(Messages.stop(0));

    MemoryStore store = storePort.last();
    assertEquals(List.of(-1L, -1L, 500L, -1L), store.array("real_time").published());
    assertEquals(List.of(-1L, -1L, 400L, -1L), store.array("start_time").published());
    assertEquals(List.of(-1L, -1L, 600L, -1L), store.array("stop_time").published());
  }

  @Test
  void frameWithoutDetectorDataIsStillWritten() {
    AcquisitionWriter writer = writer(100, null, new TimingDetectorExtension());
    writer.process(Messages.start(2));

    writer.process(Messages.writeFrame(1, 0));
    writer.process(Messages.stop(0));

    MemoryStore store = storePort.last();
    assertEquals(List.of(1L, -1L), store.array("frame").published());
    assertEquals(List.of(-1L, -1L), store.array("real_time").published());
    assertTrue(logged(Level.DEBUG, "No detector meta data stored for frame 1"));
  }

  @Test
  void staleDetectorDataIsDroppedOnClose() {
    AcquisitionWriter writer = writer(100, null, new TimingDetectorExtension());
    writer.process(Messages.start(2));
    writer.process(Messages.detector("frameinfo", Map.of("frame", 9, "real_time", 1)));

    writer.process(Messages.stop(0));

    assertEquals(0, writer.pendingFrameData());
    assertTrue(logged(Level.WARN, "Discarded detector data for 1 frames"));
  }

  @Test
  void sideChannelEvictionIsCounted() {
    AcquisitionWriter writer = writer(100, null, new TimingDetectorExtension());
    writer.process(Messages.start(20));
    for (int frame = 0; frame < 10; frame++) {
      writer.process(Messages.detector("frameinfo", Map.of("frame", frame, "real_time", frame)));
    }

    assertEquals(8, writer.pendingFrameData());
    assertEquals(2, metrics.count("meta.sidechannel.evicted"));
  }

  @Test
  void detectorConfigCreatesDatasetsOnce() {
    AcquisitionWriter writer = writer(100, null, new TimingDetectorExtension());
    writer.process(Messages.start(2));

    writer.process(Messages.detector("detector_config", Map.of("gain", List.of(1, 2), "series", "s-1")));
    writer.process(Messages.detector("detectorconfig", Map.of("gain", List.of(3))));

    MemoryStore store = storePort.last();
    assertEquals(List.of(1L, 2L), store.array("config/gain").values());
    assertEquals(List.of("s-1"), store.array("config/series").values());
    assertEquals(List.of("s-1"), store.array("detector_series").values());
  }

  @Test
  void storeIsCreatedOnceForSeveralProducers() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);

    writer.process(Messages.start(4));
    writer.process(Messages.start(4));
    writer.process(Messages.stop(0));

    assertEquals(1, storePort.createdCount());
    assertTrue(writer.status().storeOpen());
    assertEquals(1, writer.status().activeProducers());

    writer.process(Messages.stop(1));
    assertFalse(writer.status().storeOpen());
    assertTrue(storePort.last().closed());
  }

  @Test
  void producerCountNeverGoesNegative() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);

    writer.process(Messages.stop(0));
    writer.process(Messages.stop(1));

    assertEquals(0, writer.status().activeProducers());
    assertEquals(0, storePort.createdCount());
  }

  @Test
  void writerReopensAfterClose() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);
    writer.process(Messages.start(1));
    writer.process(Messages.writeFrame(1, 0));
    writer.process(Messages.stop(0));

    writer.process(Messages.start(2));
    assertTrue(writer.status().storeOpen());
    assertFalse(writer.status().finished());
    assertEquals(0, writer.status().writeCount());
    assertEquals(2, writer.status().expectedFrameCount());
    writer.process(Messages.writeFrame(7, 1));
    writer.process(Messages.stop(0));

    assertEquals(2, storePort.createdCount());
    assertEquals(List.of(1L), storePort.stores().get(0).array("frame").published());
    assertEquals(List.of(-1L, 7L), storePort.stores().get(1).array("frame").published());
  }

  @Test
  void outOfRangeOffsetIsRejectedAndLogged() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);
    writer.process(Messages.start(2));

    writer.process(Messages.writeFrame(1, 5));
    writer.process(Messages.stop(0));

    assertEquals(List.of(-1L, -1L), storePort.last().array("frame").published());
    assertEquals(1, metrics.count("meta.write.rejected"));
    assertEquals(1, writer.status().writeCount());
  }

  @Test
  void negativeOffsetIsRejectedBeforeWriting() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);
    writer.process(Messages.start(2));

    writer.process(Messages.writeFrame(1, -1));

    assertEquals(1, metrics.count("meta.write.rejected"));
    assertEquals(0, writer.status().writeCount());
    assertTrue(logged(Level.ERROR, "Cannot write frame at offset -1"));
  }

  @Test
  void writeBeforeStartIsDroppedWithReason() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);

    writer.process(Messages.writeFrame(1, 0));

    assertEquals(1, metrics.count("meta.write.rejected"));
    assertTrue(logged(Level.WARN, "Have not received startacquisition yet"));
  }

  @Test
  void writeAfterCloseIsDroppedWithReason() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);
    writer.process(Messages.start(1));
    writer.process(Messages.stop(0));

    writer.process(Messages.writeFrame(1, 0));
    writer.process(Messages.closeFile(3));

    assertEquals(1, metrics.count("meta.write.rejected"));
    assertTrue(logged(Level.WARN, "Already finished writing"));
  }

  @Test
  void missingTotalFramesFallsBackToUncachedAppends() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);
    writer.process(Messages.startWithoutFrames());

    writer.process(Messages.writeFrame(4, 9));
    writer.process(Messages.writeFrame(5, 0));
    writer.process(Messages.stop(0));

    assertEquals(List.of(4L, 5L), storePort.last().array("frame").published());
    assertTrue(logged(Level.ERROR, "Start acquisition without totalFrames"));
  }

  @Test
  void totalFramesMayComeFromTheBody() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);

    writer.process(MetaMessage.of(MessageType.START_ACQUISITION, Map.of(), Map.of("totalFrames", "3")));

    assertEquals(3, writer.status().expectedFrameCount());
    assertEquals(3, storePort.last().array("frame").length());
  }

  @Test
  void unknownMessageTypeIsCountedAndLogged() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);

    writer.process(Messages.detector("frameinfo", Map.of("frame", 1)));

    assertEquals(1, metrics.count("meta.messages.unknown"));
    assertEquals(1, metrics.count("meta.messages.received"));
    assertTrue(logged(Level.ERROR, "Unknown message type: frameinfo"));
  }

  @Test
  void configureReportsLastErrorAndAppliesValidKeys() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);

    var error = writer.configure(Map.of("file_prefix", "run7", "bogus", 1));
    assertEquals("Invalid parameter bogus", error.orElseThrow());
    assertEquals("run7", writer.currentConfiguration().get("file_prefix"));

    assertTrue(writer.configure(Map.of("flush_frame_frequency", 0)).isPresent());
    assertEquals(100, writer.currentConfiguration().get("flush_frame_frequency"));
    assertTrue(writer.configure(Map.of("flush_frame_frequency", 5)).isEmpty());

    writer.process(Messages.start(1));
    assertEquals(Path.of("out", "run7_meta.mds").toString(), writer.status().filePath());
  }

  @Test
  void stopClosesRegardlessOfProducers() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);
    writer.process(Messages.start(1));
    writer.process(Messages.start(1));

    writer.stop();

    assertEquals(0, writer.status().activeProducers());
    assertTrue(writer.status().finished());
    assertTrue(storePort.last().closed());
    assertTrue(logged(Level.INFO, "Finished"));
  }

  @Test
  void writeTimeoutsAreCountedOnlyWhileOpenAndResetByWrites() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);
    writer.recordWriteTimeout();
    assertEquals(0, writer.status().writeTimeoutCount());

    writer.process(Messages.start(2));
    writer.recordWriteTimeout();
    writer.recordWriteTimeout();
    assertEquals(2, writer.status().writeTimeoutCount());

    writer.process(Messages.writeFrame(1, 0));
    assertEquals(0, writer.status().writeTimeoutCount());
  }

  @Test
  void storeFailureOnStartLeavesWriterIdle() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);
    storePort.failOnCreate(new IOException("disk full"));

    UncheckedIOException ex = assertThrows(UncheckedIOException.class, () -> writer.process(Messages.start(2)));

    assertEquals("disk full", ex.getCause().getMessage());
    assertEquals(0, writer.status().activeProducers());
    assertEquals(AcquisitionWriter.NOT_STARTED, writer.status().expectedFrameCount());
    assertFalse(writer.status().storeOpen());
  }

  @Test
  void baseDatasetsAreCreatedInOrder() {
    AcquisitionWriter writer = writer(100, null, new TimingDetectorExtension());
    writer.process(Messages.start(1));

    assertEquals(
        Arrays.asList("frame", "offset", "create_duration", "write_duration", "flush_duration", "close_duration",
            "real_time", "start_time", "stop_time", "detector_series"),
        List.copyOf(storePort.last().arrays().keySet()));
    assertEquals(writer.datasets().orElseThrow().names(), List.copyOf(storePort.last().arrays().keySet()));
  }

  @Test
  void mixedNumericDetectorConfigIsStoredAsFloat() {
    AcquisitionWriter writer = writer(100, null, new TimingDetectorExtension());
    writer.process(Messages.start(1));

    writer.process(Messages.detector("detectorconfig", Map.of("thresholds", List.of(1, 2.5))));
    writer.process(Messages.detector("detectorconfig", Map.of("thresholds", List.of(3))));

    MemoryStore store = storePort.last();
    assertEquals(ElementType.FLOAT64, store.array("config/thresholds").elementType());
    assertEquals(List.of(1.0, 2.5), store.array("config/thresholds").values());
  }

  @Test
  void mixedNumericDetectorConfigSurvivesInJournalFile(@TempDir Path dir) throws IOException {
    WriterConfiguration config = new WriterConfiguration(dir);
    config.apply(ConfigKey.FLUSH_TIMEOUT, null);
    AcquisitionWriter writer = new AcquisitionWriter("scan", config, new TimingDetectorExtension(),
        new MetaStoreFileAdapter(), metrics, clock, 8);
    writer.process(Messages.start(1));

    writer.process(Messages.detector("detectorconfig", Map.of("thresholds", List.of(1, 2.5))));
    writer.process(Messages.detector("detectorconfig", Map.of("thresholds", List.of(3))));
    writer.process(Messages.writeFrame(0, 0));
    writer.process(Messages.stop(0));

    StoreSnapshot snapshot = MetaStoreReader.read(dir.resolve("scan_meta.mds"));
    assertTrue(snapshot.closed());
    assertEquals(List.of(1.0, 2.5), snapshot.array("config/thresholds").orElseThrow().values());
    assertEquals(List.of(0L), snapshot.array("frame").orElseThrow().values());
  }

  @Test
  void stopBeforeStartStillFinishesWriter() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);

    writer.stop();

    assertTrue(writer.status().finished());
    assertFalse(writer.status().storeOpen());
    assertEquals(0, storePort.createdCount());
  }

  @Test
  void closeFailureIsSuppressedBehindFlushFailure() {
    AcquisitionWriter writer = writer(100, null, DetectorExtension.NONE);
    writer.process(Messages.start(1));
    MemoryStore store = storePort.last();
    store.failOnFlush(new IOException("flush failed"));
    store.failOnClose(new IOException("close failed"));

    UncheckedIOException ex = assertThrows(UncheckedIOException.class, writer::stop);

    assertEquals("flush failed", ex.getCause().getMessage());
    assertEquals(1, ex.getCause().getSuppressed().length);
    assertEquals("close failed", ex.getCause().getSuppressed()[0].getMessage());
    assertTrue(writer.status().finished());
    assertFalse(writer.status().storeOpen());
    assertTrue(store.closed());
  }
}
