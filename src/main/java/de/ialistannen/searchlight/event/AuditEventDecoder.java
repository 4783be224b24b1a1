package de.ialistannen.searchlight.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Unwraps audit log entries from pub/sub style envelopes. Both the background function shape
 * ({@code {"data": ..., "eventId": ...}}) and the push subscription shape
 * ({@code {"message": {"data": ..., "messageId": ...}}}) are understood.
 */
public class AuditEventDecoder {

  private final ObjectMapper objectMapper;

  public AuditEventDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Reads the envelope.
   *
   * @param json the envelope json
   * @return the envelope
   * @throws EventDecodeException if the envelope is not a json object
   */
  public EventEnvelope readEnvelope(String json) {
    JsonNode root = readObject(json, "event envelope");

    JsonNode message = root.path("message").isObject() ? root.get("message") : root;
    String eventId = firstText(message, "eventId", "messageId", "message_id")
      .or(() -> firstText(root, "eventId", "id"))
      .orElse("unknown");

    return new EventEnvelope(eventId, firstText(message, "data"));
  }

  /**
   * Decodes the payload of an envelope.
   *
   * @param envelope the envelope
   * @return the audit log entry, empty if the envelope carried no payload
   * @throws EventDecodeException if the payload is not base64 encoded json
   */
  public Optional<JsonNode> decodePayload(EventEnvelope envelope) {
    if (envelope.data().isEmpty()) {
      return Optional.empty();
    }

    String decoded;
    try {
      decoded = new String(Base64.getDecoder().decode(envelope.data().get().trim()), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new EventDecodeException("Payload of event " + envelope.eventId() + " is not valid base64", e);
    }
    return Optional.of(readObject(decoded, "audit log entry"));
  }

  private JsonNode readObject(String json, String what) {
    try {
      JsonNode node = objectMapper.readTree(json);
      if (node == null || !node.isObject()) {
        throw new EventDecodeException("The " + what + " is not a json object");
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new EventDecodeException("The " + what + " is not valid json: " + e.getOriginalMessage(), e);
    }
  }

  private static Optional<String> firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      JsonNode value = node.get(field);
      if (value != null && value.isTextual() && !value.asText().isBlank()) {
        return Optional.of(value.asText());
      }
    }
    return Optional.empty();
  }
}
