package ca.gc.cra.metawriter.api;

import ca.gc.cra.metawriter.config.ConfigMerger;
import ca.gc.cra.metawriter.config.DefaultsForMode;
import ca.gc.cra.metawriter.config.InspectConfig;
import ca.gc.cra.metawriter.infrastructure.store.MetaStoreReader;
import ca.gc.cra.metawriter.infrastructure.store.StoreSnapshot;
import ca.gc.cra.metawriter.infrastructure.store.StoredArraySnapshot;
import ca.gc.cra.metawriter.logging.LoggingConfigurator;
import ca.gc.cra.metawriter.validation.Paths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the arrays of a store file, which may still be open for writing.
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String MODE = "inspect";
  private static final String SUMMARY_USAGE = "usage: inspect file=PATH [limit=N] [--verbose]";
  private static final String HELP_TEXT = """
      metawriter inspect

      Usage:
        inspect file=./meta/scan_meta.mds [limit=10]

      Options:
        file=PATH   Store file to read
        limit=N     Leading elements printed per array (default 10)
        --verbose   Enable DEBUG logging
        --help      Show this message
      """;

  private InspectCli() {}

  /**
   * Runs the inspect command.
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
    }

    InspectConfig config;
    Path file;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          MODE, Optional.empty(), kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      config = InspectConfig.fromMap(effective);
      file = Paths.validateReadableFile(config.file());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid inspect arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    StoreSnapshot snapshot;
    try {
      snapshot = MetaStoreReader.read(file);
    } catch (IOException ex) {
      log.error("Unable to read store {}: {}", file, ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Corrupt store {}: {}", file, ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    CliPrinter.println(file + " (" + (snapshot.closed() ? "closed" : "open")
        + (snapshot.truncated() ? ", trailing record incomplete" : "") + ")");
    for (StoredArraySnapshot array : snapshot.arrays().values()) {
      CliPrinter.printf(" %-24s %-6s length=%d %s",
          array.name(), array.elementType().label(), array.length(), preview(array, config.limit()));
    }
    return ExitCode.SUCCESS;
  }

  static String preview(StoredArraySnapshot array, int limit) {
    StringJoiner joiner = new StringJoiner(", ", "[", array.length() > limit ? ", ...]" : "]");
    for (int i = 0; i < Math.min(limit, array.length()); i++) {
      Object value = array.get(i);
      joiner.add(value instanceof byte[] bytes ? new String(bytes, StandardCharsets.UTF_8) : String.valueOf(value));
    }
    return joiner.toString();
  }
}
