/*
 * Where: provider payload mapping
 * What: converts a stored JSON payload into the typed record a handler expects
 * Why: a payload that cannot be mapped will not map on redelivery either, so it is a skip
 */
package io.paysync.billing.handler.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.paysync.billing.dispatch.EventSkipException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProviderPayloadReader {

  private final ObjectMapper objectMapper;

  public <T> T read(JsonNode payload, Class<T> type) {
    if (payload == null || payload.isNull() || payload.isMissingNode()) {
      throw new EventSkipException(
          "payload is missing", Map.of("payload_type", type.getSimpleName()));
    }
    try {
      return objectMapper.treeToValue(payload, type);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new EventSkipException(
          "malformed payload for " + type.getSimpleName(),
          Map.of("payload_type", type.getSimpleName()),
          ex);
    }
  }

  public JsonNode toTree(Object value) {
    return objectMapper.valueToTree(value);
  }

  public String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      // serialization of our own records failing is a programming error
      throw new IllegalStateException("payload serialization failure", ex);
    }
  }
}
