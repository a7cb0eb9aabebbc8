package ca.gc.cra.metawriter.api;

import ca.gc.cra.metawriter.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code metawriter} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: metawriter <replay|inspect> [options]";
  private static final String HELP_TEXT = """
      metawriter command dispatcher

      Usage:
        metawriter <command> [options]

      Commands:
        replay    Write store files from a recorded NDJSON message stream
        inspect   Print the arrays of a store file

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches to a command without exiting the JVM.
   *
   * @param args raw arguments; the first token names the command
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    if (tokens.length == 0 || tokens[0] == null || tokens[0].isBlank()) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = tokens[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(tokens, 1, tokens.length);
    return switch (command) {
      case "replay" -> ReplayCli.run(delegateArgs);
      case "inspect" -> InspectCli.run(delegateArgs);
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "--verbose", "-v" -> {
        LoggingConfigurator.enableVerboseLogging();
        yield run(delegateArgs);
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
