package ca.gc.cra.metawriter.api;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Writes command results and usage text to stdout. Logs go to stderr through Logback, so piping a command's
 * output never mixes the two.
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT =
      new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
  private static volatile PrintWriter target = STDOUT;

  private CliPrinter() {}

  public static void println(String line) {
    target.println(line);
  }

  /**
   * Prints one formatted line using {@link Locale#ROOT} so numbers render the same on every host.
   *
   * @param format {@link String#format} pattern without a trailing newline
   * @param args pattern arguments
   */
  public static void printf(String format, Object... args) {
    target.println(String.format(Locale.ROOT, format, args));
  }

  public static void printLines(String... lines) {
    PrintWriter out = target;
    for (String line : lines) {
      out.println(line);
    }
    out.flush();
  }

  static void redirect(PrintWriter writer) {
    target = writer == null ? STDOUT : writer;
  }

  static void restoreStdout() {
    target = STDOUT;
  }
}
