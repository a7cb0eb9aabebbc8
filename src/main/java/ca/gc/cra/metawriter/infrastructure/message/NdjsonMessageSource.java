package ca.gc.cra.metawriter.infrastructure.message;

import ca.gc.cra.metawriter.application.port.MessageSource;
import ca.gc.cra.metawriter.domain.msg.MetaMessage;
import ca.gc.cra.metawriter.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one JSON envelope per line. Blank lines and lines starting with {@code #} are ignored; malformed lines are
 * logged and skipped.
 *
 * @since 0.1.0
 */
public final class NdjsonMessageSource implements MessageSource {
  private static final Logger log = LoggerFactory.getLogger(NdjsonMessageSource.class);
  private static final int MAX_LOGGED_BYTES = 256;

  private final Path path;
  private final BufferedReader reader;
  private final JsonMessageDecoder decoder;
  private long lineNumber;
  private long malformed;

  /**
   * Opens {@code path} for reading.
   *
   * @param path NDJSON file
   * @param decoder envelope decoder
   * @throws IOException when the file cannot be opened
   */
  public NdjsonMessageSource(Path path, JsonMessageDecoder decoder) throws IOException {
    this.path = Objects.requireNonNull(path, "path");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
  }

  @Override
  public Optional<MetaMessage> next() throws IOException {
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      try {
        return Optional.of(decoder.decode(trimmed));
      } catch (IllegalArgumentException ex) {
        malformed++;
        log.warn("{}:{} skipped malformed message ({}): {}", path, lineNumber, ex.getMessage(),
            Logs.preview(trimmed, MAX_LOGGED_BYTES));
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the number of lines skipped as malformed so far.
   *
   * @return malformed line count
   */
  public long malformedCount() {
    return malformed;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
