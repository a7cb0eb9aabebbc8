package ca.gc.cra.metawriter.testutil;

import ca.gc.cra.metawriter.domain.msg.MessageType;
import ca.gc.cra.metawriter.domain.msg.MetaMessage;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builders for the core lifecycle messages. */
public final class Messages {
  private Messages() {}

  public static MetaMessage start(long totalFrames) {
    return MetaMessage.of(MessageType.START_ACQUISITION, Map.of("totalFrames", totalFrames), Map.of());
  }

  public static MetaMessage startWithoutFrames() {
    return MetaMessage.of(MessageType.START_ACQUISITION, Map.of(), Map.of());
  }

  public static MetaMessage createFile(long duration) {
    return MetaMessage.of(MessageType.CREATE_FILE, Map.of(), Map.of("create_duration", duration));
  }

  public static MetaMessage writeFrame(long frame, long offset) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("frame", frame);
    body.put("offset", offset);
    body.put("write_duration", 10 + frame);
    body.put("flush_duration", 20 + frame);
    return MetaMessage.of(MessageType.WRITE_FRAME, Map.of(), body);
  }

  public static MetaMessage closeFile(long duration) {
    return MetaMessage.of(MessageType.CLOSE_FILE, Map.of(), Map.of("close_duration", duration));
  }

  public static MetaMessage stop(int rank) {
    return MetaMessage.of(MessageType.STOP_ACQUISITION, Map.of("rank", rank), Map.of());
  }

  public static MetaMessage detector(String type, Map<String, Object> body) {
    return new MetaMessage(type, "", Map.of(), body, null);
  }
}
