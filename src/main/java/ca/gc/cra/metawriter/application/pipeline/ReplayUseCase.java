package ca.gc.cra.metawriter.application.pipeline;

import ca.gc.cra.metawriter.application.listener.MetaListener;
import ca.gc.cra.metawriter.application.port.MessageSource;
import ca.gc.cra.metawriter.application.writer.WriterStatus;
import ca.gc.cra.metawriter.domain.msg.MetaMessage;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Feeds every message of a recorded stream through a {@link MetaListener}.
 * <p><strong>Why:</strong> Lets operators rebuild store files offline from captured message streams.</p>
 * <p><strong>Role:</strong> Application use case run by the replay CLI.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call {@link #run()} once.</p>
 * <p><strong>Observability:</strong> Puts the acquisition id of the message in flight into the MDC as
 * {@code acqId}.</p>
 *
 * @since 0.1.0
 */
public final class ReplayUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReplayUseCase.class);
  static final String MDC_ACQUISITION = "acqId";

  private final MessageSource source;
  private final MetaListener listener;

  /**
   * Creates a replay over {@code source}.
   *
   * @param source message stream; closed by {@link #run()}
   * @param listener listener receiving every message
   */
  public ReplayUseCase(MessageSource source, MetaListener listener) {
    this.source = Objects.requireNonNull(source, "source");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  /**
   * Replays the whole stream, then stops every writer so open stores are flushed and closed.
   *
   * @return counts of messages and final writer states
   * @throws IOException when the source fails
   * @throws java.io.UncheckedIOException when a store fails
   */
  public ReplaySummary run() throws IOException {
    long messages = 0;
    try (MessageSource in = source) {
      Optional<MetaMessage> next;
      while ((next = in.next()).isPresent()) {
        MetaMessage message = next.get();
        MDC.put(MDC_ACQUISITION, message.acquisitionId());
        try {
          listener.process(message);
        } finally {
          MDC.remove(MDC_ACQUISITION);
        }
        messages++;
      }
    } finally {
      listener.stop(null);
    }
    Map<String, WriterStatus> writers = listener.status();
    log.info("Replayed {} messages into {} acquisitions", messages, writers.size());
    return new ReplaySummary(messages, writers);
  }

  /**
   * Outcome of a replay.
   *
   * @param messages messages handed to the listener
   * @param writers final status per acquisition
   */
  public record ReplaySummary(long messages, Map<String, WriterStatus> writers) {
    public ReplaySummary {
      writers = Collections.unmodifiableMap(new LinkedHashMap<>(writers));
    }
  }
}
