package ca.gc.cra.metawriter.infrastructure.message;

import ca.gc.cra.metawriter.domain.msg.MetaMessage;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes one JSON message envelope into a {@link MetaMessage}.
 *
 * <p>Envelope fields: {@code parameter} (message type, required), {@code acqID} (optional acquisition id),
 * {@code header} (object, optional) and {@code data} (object body, or a string carried as an opaque blob).</p>
 *
 * @since 0.1.0
 */
public final class JsonMessageDecoder {
  static final String TYPE_FIELD = "parameter";
  static final String ACQUISITION_FIELD = "acqID";
  static final String HEADER_FIELD = "header";
  static final String DATA_FIELD = "data";

  private final JsonFactory factory = new JsonFactory();

  /**
   * Decodes a JSON envelope.
   *
   * @param json JSON text; must not be {@code null}
   * @return decoded message
   * @throws IllegalArgumentException when the text is not a valid envelope
   */
  public MetaMessage decode(String json) {
    Objects.requireNonNull(json, "json");
    Object root;
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Message must be a JSON object");
      }
      root = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("Message contains trailing content");
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON message", ex);
    }
    return toMessage(asMap(root, "message"));
  }

  private static MetaMessage toMessage(Map<String, Object> envelope) {
    Object type = envelope.get(TYPE_FIELD);
    if (!(type instanceof String text) || text.isBlank()) {
      throw new IllegalArgumentException("Message has no '" + TYPE_FIELD + "' field");
    }
    Object acquisition = envelope.get(ACQUISITION_FIELD);
    Map<String, Object> header = envelope.get(HEADER_FIELD) == null
        ? Map.of() : asMap(envelope.get(HEADER_FIELD), HEADER_FIELD);
    Object data = envelope.get(DATA_FIELD);
    Map<String, Object> body = Map.of();
    byte[] blob = null;
    if (data instanceof Map<?, ?>) {
      body = asMap(data, DATA_FIELD);
    } else if (data instanceof String payload) {
      blob = payload.getBytes(StandardCharsets.UTF_8);
    } else if (data != null) {
      throw new IllegalArgumentException("'" + DATA_FIELD + "' must be an object or a string");
    }
    return new MetaMessage(text.trim(), acquisition == null ? "" : acquisition.toString(), header, body, blob);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object value, String field) {
    if (!(value instanceof Map<?, ?>)) {
      throw new IllegalArgumentException("'" + field + "' must be a JSON object");
    }
    return (Map<String, Object>) value;
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
