package ca.gc.cra.metawriter.application.listener;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.metawriter.application.port.DetectorExtension;
import ca.gc.cra.metawriter.application.writer.ConfigKey;
import ca.gc.cra.metawriter.application.writer.WriterConfiguration;
import ca.gc.cra.metawriter.application.writer.WriterStatus;
import ca.gc.cra.metawriter.testutil.InMemoryArrayStorePort;
import ca.gc.cra.metawriter.testutil.ManualClock;
import ca.gc.cra.metawriter.testutil.Messages;
import ca.gc.cra.metawriter.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetaListenerTest {
  private final InMemoryArrayStorePort storePort = new InMemoryArrayStorePort();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  private MetaListener listener(int maxFinishedWriters) {
    WriterConfiguration defaults = new WriterConfiguration(Path.of("meta"));
    defaults.apply(ConfigKey.FLUSH_TIMEOUT, null);
    return new MetaListener("meta", defaults, () -> DetectorExtension.NONE, storePort, metrics,
        new ManualClock(0), 16, maxFinishedWriters);
  }

  @Test
  void routesMessagesByAcquisitionId() {
    MetaListener listener = listener(16);

    listener.process(Messages.start(2).withAcquisitionId("a"));
    listener.process(Messages.start(2).withAcquisitionId("b"));
    listener.process(Messages.writeFrame(1, 0).withAcquisitionId("a"));

    Map<String, WriterStatus> status = listener.status();
    assertEquals(List.of("a", "b"), List.copyOf(status.keySet()));
    assertEquals(1, status.get("a").writeCount());
    assertEquals(0, status.get("b").writeCount());
    assertEquals(Path.of("meta", "a_meta.mds").toString(), status.get("a").filePath());
    assertEquals(2, storePort.createdCount());
  }

  @Test
  void blankAcquisitionIdUsesDefaultWriter() {
    MetaListener listener = listener(16);

    listener.process(Messages.start(1));

    assertEquals(List.of("meta"), listener.acquisitions());
    assertEquals(Path.of("meta", "meta_meta.mds"), storePort.last().path());
  }

  @Test
  void configureWithoutIdUpdatesDefaultsAndLiveWriters() {
    MetaListener listener = listener(16);
    listener.process(Messages.start(4).withAcquisitionId("a"));

    assertTrue(listener.configure(null, Map.of("flush_frame_frequency", 2)).isEmpty());
    listener.process(Messages.start(4).withAcquisitionId("b"));
    for (String id : List.of("a", "b")) {
      listener.process(Messages.writeFrame(1, 0).withAcquisitionId(id));
      listener.process(Messages.writeFrame(2, 1).withAcquisitionId(id));
    }

    assertEquals(2, listener.defaultConfiguration().get("flush_frame_frequency"));
    assertEquals(2, metrics.count("meta.flush.count"));
  }

  @Test
  void configureWithIdLeavesDefaultsUntouched() {
    MetaListener listener = listener(16);

    assertEquals("Invalid parameter nope",
        listener.configure("a", Map.of("file_prefix", "x", "nope", 1)).orElseThrow());
    listener.process(Messages.start(1).withAcquisitionId("a"));

    assertEquals(Path.of("meta", "x_meta.mds"), storePort.last().path());
    assertNull(listener.defaultConfiguration().get("file_prefix"));
  }

  @Test
  void stopClosesNamedOrAllWriters() {
    MetaListener listener = listener(16);
    listener.process(Messages.start(1).withAcquisitionId("a"));
    listener.process(Messages.start(1).withAcquisitionId("b"));

    assertTrue(listener.stop("a"));
    assertFalse(listener.stop("missing"));
    assertTrue(listener.status().get("a").finished());
    assertTrue(listener.status().get("b").storeOpen());

    assertTrue(listener.stop(null));
    assertTrue(listener.status().get("b").finished());
  }

  @Test
  void stopAllClosesEveryWriterWhenOneStoreFails() {
    MetaListener listener = listener(16);
    for (String id : List.of("a", "b", "c")) {
      listener.process(Messages.start(1).withAcquisitionId(id));
    }
    storePort.stores().get(0).failOnClose(new IOException("a disk gone"));
    storePort.stores().get(2).failOnClose(new IOException("c disk gone"));

    UncheckedIOException ex = assertThrows(UncheckedIOException.class, () -> listener.stop(null));

    assertEquals("a disk gone", ex.getCause().getMessage());
    assertEquals(1, ex.getSuppressed().length);
    assertEquals("c disk gone", ex.getSuppressed()[0].getCause().getMessage());
    for (String id : List.of("a", "b", "c")) {
      assertFalse(listener.status().get(id).storeOpen(), id);
      assertTrue(listener.status().get(id).finished(), id);
    }
    assertTrue(storePort.stores().get(1).closed());
  }

  @Test
  void writerStoppedBeforeStartCanBePruned() {
    MetaListener listener = listener(16);
    listener.configure("idle", Map.of("file_prefix", "x"));

    assertTrue(listener.stop("idle"));

    assertEquals(List.of("idle"), listener.prune());
    assertTrue(listener.acquisitions().isEmpty());
  }

  @Test
  void finishedWritersBeyondLimitAreDroppedOldestFirst() {
    MetaListener listener = listener(1);

    for (String id : List.of("a", "b", "c")) {
      listener.process(Messages.start(1).withAcquisitionId(id));
      listener.process(Messages.stop(0).withAcquisitionId(id));
    }

    assertEquals(List.of("c"), listener.acquisitions());
  }

  @Test
  void pruneRemovesFinishedWritersOnly() {
    MetaListener listener = listener(16);
    listener.process(Messages.start(1).withAcquisitionId("done"));
    listener.process(Messages.stop(0).withAcquisitionId("done"));
    listener.process(Messages.start(1).withAcquisitionId("open"));

    assertEquals(List.of("done"), listener.prune());
    assertEquals(List.of("open"), listener.acquisitions());
  }

  @Test
  void writeTimeoutsReachOpenWriters() {
    MetaListener listener = listener(16);
    listener.process(Messages.start(1).withAcquisitionId("a"));

    listener.recordWriteTimeout();

    assertEquals(1, listener.status().get("a").writeTimeoutCount());
  }

  @Test
  void rejectsInvalidConstruction() {
    WriterConfiguration defaults = new WriterConfiguration(Path.of("meta"));
    assertThrows(IllegalArgumentException.class, () -> new MetaListener(" ", defaults,
        () -> DetectorExtension.NONE, storePort, metrics, new ManualClock(0), 16, 1));
    assertThrows(IllegalArgumentException.class, () -> new MetaListener("meta", defaults,
        () -> DetectorExtension.NONE, storePort, metrics, new ManualClock(0), 16, -1));
  }
}
