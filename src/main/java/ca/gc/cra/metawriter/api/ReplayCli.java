package ca.gc.cra.metawriter.api;

import ca.gc.cra.metawriter.application.listener.MetaListener;
import ca.gc.cra.metawriter.application.pipeline.ReplayUseCase;
import ca.gc.cra.metawriter.application.port.ClockPort;
import ca.gc.cra.metawriter.application.port.DetectorExtension;
import ca.gc.cra.metawriter.application.writer.WriterStatus;
import ca.gc.cra.metawriter.config.ConfigMerger;
import ca.gc.cra.metawriter.config.DefaultsForMode;
import ca.gc.cra.metawriter.config.ListenerConfig;
import ca.gc.cra.metawriter.config.YamlConfigLoader;
import ca.gc.cra.metawriter.infrastructure.detector.TimingDetectorExtension;
import ca.gc.cra.metawriter.infrastructure.message.JsonMessageDecoder;
import ca.gc.cra.metawriter.infrastructure.message.NdjsonMessageSource;
import ca.gc.cra.metawriter.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.metawriter.infrastructure.store.MetaStoreFileAdapter;
import ca.gc.cra.metawriter.logging.LoggingConfigurator;
import ca.gc.cra.metawriter.validation.Paths;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays an NDJSON message recording into store files.
 *
 * @since 0.1.0
 */
public final class ReplayCli {
  private static final Logger log = LoggerFactory.getLogger(ReplayCli.class);
  private static final String MODE = "replay";
  private static final String SUMMARY_USAGE =
      "usage: replay in=FILE.ndjson out=DIR [filePrefix=NAME] [flushFrequency=N] [flushTimeout=SECONDS|none] "
          + "[detector=none|timing] [config=YAML] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      metawriter replay

      Usage:
        replay in=messages.ndjson out=./meta [options]

      Required:
        in=FILE                    NDJSON file, one message envelope per line

      Optional:
        out=DIR                    Directory receiving store files (default ./meta)
        filePrefix=NAME            File prefix for every writer (default: acquisition id)
        flushFrequency=N           Flush every N write-frame messages (default 100)
        flushTimeout=SECONDS|none  Flush when this long since the last flush (default 1.0)
        detector=none|timing       Detector extension (default none)
        sideChannelCapacity=N      Detector records buffered per writer (default 4096)
        writerName=NAME            Writer for messages without acqID (default meta)
        maxFinishedWriters=N       Finished writers kept for status (default 16)
        config=FILE.yaml           YAML with common/replay sections; CLI values win
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        otelEndpoint=URL           OTLP endpoint when exporter=otlp
        --dry-run                  Validate and print the plan only
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ReplayCli() {}

  /**
   * Runs the replay command.
   *
   * @param args command arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for replay CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> settings;
    ListenerConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          MODE, yaml, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      settings = new LinkedHashMap<>(effective);
      TelemetryConfigurator.configureMetrics(settings);
      if (!input.verbose() && ConfigCliUtils.parseBoolean(settings, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      config = ListenerConfig.fromMap(settings);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid replay arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(settings, "dryRun");
    Path in;
    Path out;
    try {
      in = Paths.validateReadableFile(config.inputFile().orElseThrow());
      out = Paths.validateWritableDir(config.outputDirectory(), !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid replay paths: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, in, out);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      ListenerConfig resolved = new ListenerConfig(
          Optional.of(in), out, config.filePrefix(), config.flushFrequency(), config.flushTimeoutSeconds(),
          config.detector(), config.sideChannelCapacity(), config.writerName(), config.maxFinishedWriters());
      MetaListener listener = new MetaListener(
          resolved.writerName(),
          resolved.toWriterConfiguration(),
          detectorFactory(resolved.detector()),
          new MetaStoreFileAdapter(),
          metrics,
          ClockPort.SYSTEM,
          resolved.sideChannelCapacity(),
          resolved.maxFinishedWriters());
      log.info("Replaying {} into {} (detector={}, flushFrequency={}, flushTimeout={})",
          in, out, resolved.detector(), resolved.flushFrequency(),
          resolved.flushTimeoutSeconds().isPresent() ? resolved.flushTimeoutSeconds().getAsDouble() : "none");
      ReplayUseCase.ReplaySummary summary =
          new ReplayUseCase(new NdjsonMessageSource(in, new JsonMessageDecoder()), listener).run();
      printSummary(summary);
      return ExitCode.SUCCESS;
    } catch (UncheckedIOException ex) {
      log.error("Store failure during replay of {}", in, ex.getCause());
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read messages from {}", in, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Replay configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during replay", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static Supplier<DetectorExtension> detectorFactory(String detector) {
    return switch (detector) {
      case "timing" -> TimingDetectorExtension::new;
      case "none" -> () -> DetectorExtension.NONE;
      default -> throw new IllegalArgumentException("Unknown detector: " + detector);
    };
  }

  private static void printDryRunPlan(ListenerConfig config, Path in, Path out) {
    CliPrinter.printLines(
        "Replay dry-run: no files will be written.",
        " Input file          : " + in,
        " Output directory    : " + out,
        " File prefix         : " + config.filePrefix().orElse("<acquisition id>"),
        " Flush frequency     : " + config.flushFrequency(),
        " Flush timeout (s)   : "
            + (config.flushTimeoutSeconds().isPresent() ? config.flushTimeoutSeconds().getAsDouble() : "none"),
        " Detector            : " + config.detector(),
        " Side-channel cap    : " + config.sideChannelCapacity(),
        " Default writer      : " + config.writerName(),
        " Re-run without --dry-run to write store files.");
  }

  private static void printSummary(ReplayUseCase.ReplaySummary summary) {
    CliPrinter.println("Replayed " + summary.messages() + " messages");
    for (Map.Entry<String, WriterStatus> entry : summary.writers().entrySet()) {
      WriterStatus status = entry.getValue();
      CliPrinter.println(" " + entry.getKey() + ": file=" + status.filePath()
          + " frames=" + status.writeCount() + " finished=" + status.finished());
    }
  }
}
