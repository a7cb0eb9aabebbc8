package ca.gc.cra.metawriter.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"in=a.ndjson", " out = ./meta ", "in=b.ndjson"});

    assertEquals(List.of("in", "out"), List.copyOf(map.keySet()));
    assertEquals("b.ndjson", map.get("in"));
    assertEquals("./meta", map.get("out"));
  }

  @Test
  void rejectsMalformedTokens() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"novalue"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"k=a\u0007"}));
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void cliInputSeparatesFlags() {
    CliInput input = CliInput.parse(new String[] {"in=x", "--DRY-RUN", "-v", "", "out=y"});

    assertArrayEquals(new String[] {"in=x", "out=y"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(CliInput.parse(new String[] {"help"}).help());
  }

  @Test
  void configPathIsExtracted() {
    Map<String, String> args = new LinkedHashMap<>(Map.of("config", " cfg.yaml ", "in", "x"));

    assertEquals("cfg.yaml", ConfigCliUtils.extractConfigPath(args));
    assertFalse(args.containsKey("config"));
    assertNull(ConfigCliUtils.extractConfigPath(args));
    assertTrue(ConfigCliUtils.parseBoolean(Map.of("dryRun", "TRUE"), "dryRun"));
    assertFalse(ConfigCliUtils.parseBoolean(null, "dryRun"));
  }

  @Test
  void telemetrySettingsAreMovedToSystemProperties() {
    Map<String, String> settings = new LinkedHashMap<>(Map.of("metricsExporter", "NONE", "in", "x"));

    TelemetryConfigurator.configureMetrics(settings);

    assertEquals("none", System.getProperty("otel.metrics.exporter"));
    assertEquals(Map.of("in", "x"), settings);
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new LinkedHashMap<>(Map.of("metricsExporter", "prom"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new LinkedHashMap<>(Map.of("otelEndpoint", "ftp://x"))));
  }
}
