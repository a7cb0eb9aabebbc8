package ca.gc.cra.metawriter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.metawriter.application.writer.WriterConfiguration;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class ListenerConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    ListenerConfig config = ListenerConfig.fromMap(Map.of("in", "messages.ndjson"));

    assertEquals(Optional.of(Path.of("messages.ndjson")), config.inputFile());
    assertEquals(Path.of("meta"), config.outputDirectory());
    assertEquals(100, config.flushFrequency());
    assertEquals(OptionalDouble.of(1.0), config.flushTimeoutSeconds());
    assertEquals("none", config.detector());
    assertEquals("meta", config.writerName());
    assertTrue(config.filePrefix().isEmpty());
  }

  @Test
  void fromMapParsesEverySetting() {
    ListenerConfig config = ListenerConfig.fromMap(Map.of(
        "in", "m.ndjson",
        "out", "out",
        "filePrefix", "run",
        "flushFrequency", "5",
        "flushTimeout", "None",
        "detector", "TIMING",
        "sideChannelCapacity", "32",
        "writerName", "w",
        "maxFinishedWriters", "0"));

    assertEquals("run", config.filePrefix().orElseThrow());
    assertEquals(5, config.flushFrequency());
    assertTrue(config.flushTimeoutSeconds().isEmpty());
    assertEquals("timing", config.detector());
    assertEquals(32, config.sideChannelCapacity());
    assertEquals(0, config.maxFinishedWriters());

    WriterConfiguration writer = config.toWriterConfiguration();
    assertEquals(Path.of("out"), writer.directory());
    assertEquals("run", writer.filePrefix());
    assertEquals(5, writer.flushFrameFrequency());
    assertTrue(writer.flushTimeoutSeconds().isEmpty());
  }

  @Test
  void fromMapRejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> ListenerConfig.fromMap(Map.of()));
    assertThrows(IllegalArgumentException.class,
        () -> ListenerConfig.fromMap(Map.of("in", "m", "detector", "unknown")));
    assertThrows(IllegalArgumentException.class,
        () -> ListenerConfig.fromMap(Map.of("in", "m", "flushFrequency", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> ListenerConfig.fromMap(Map.of("in", "m", "flushTimeout", "-2")));
    assertThrows(IllegalArgumentException.class,
        () -> ListenerConfig.fromMap(Map.of("in", "m", "filePrefix", "../x")));
  }

  @Test
  void inspectConfigRequiresFile() {
    InspectConfig config = InspectConfig.fromMap(Map.of("file", "a_meta.mds", "limit", "3"));

    assertEquals(Path.of("a_meta.mds"), config.file());
    assertEquals(3, config.limit());
    assertEquals(InspectConfig.DEFAULT_LIMIT, InspectConfig.fromMap(Map.of("file", "x")).limit());
    assertThrows(IllegalArgumentException.class, () -> InspectConfig.fromMap(Map.of("limit", "3")));
    assertThrows(IllegalArgumentException.class, () -> InspectConfig.fromMap(Map.of("file", "x", "limit", "-1")));
  }
}
