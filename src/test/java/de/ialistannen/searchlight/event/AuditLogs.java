package de.ialistannen.searchlight.event;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds audit log entries and envelopes the way the log router delivers them.
 */
final class AuditLogs {

  static final String UPDATE_SERVICE = "google.cloud.run.v2.Services.UpdateService";

  private AuditLogs() {
  }

  static String auditLog(String methodName, List<String> images) {
    String containers = images.stream()
      .map(image -> "{\"image\": \"" + image + "\"}")
      .collect(Collectors.joining(", "));
    return """
      {
        "protoPayload": {
          "methodName": "%s",
          "request": {"template": {"containers": [%s]}}
        },
        "resource": {
          "labels": {"project_id": "my-project", "service_name": "web", "location": "europe-west1"}
        }
      }
      """.formatted(methodName, containers);
  }

  static String envelope(String eventId, String payload) {
    String data = Base64.getEncoder().encodeToString(payload.getBytes(StandardCharsets.UTF_8));
    return "{\"eventId\": \"" + eventId + "\", \"data\": \"" + data + "\"}";
  }

  static String deployment(String eventId, String... images) {
    return envelope(eventId, auditLog(UPDATE_SERVICE, List.of(images)));
  }
}
