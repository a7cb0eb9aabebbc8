package ca.gc.cra.metawriter.application.port;

import ca.gc.cra.metawriter.domain.msg.MetaMessage;
import java.io.IOException;
import java.util.Optional;

/**
 * Pull-based stream of decoded messages.
 *
 * @since 0.1.0
 */
public interface MessageSource extends AutoCloseable {
  /**
   * Returns the next message.
   *
   * @return next message, or empty at end of stream
   * @throws IOException when the underlying input fails
   */
  Optional<MetaMessage> next() throws IOException;

  @Override
  void close() throws IOException;
}
