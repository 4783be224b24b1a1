package de.ialistannen.searchlight.event;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * The parts of a Cloud Run audit log entry we care about.
 *
 * @param methodName the audited API method
 * @param projectId the project of the service, may be null
 * @param serviceName the service name, may be null
 * @param location the service location, may be null
 * @param images the container images of the requested service revision, in declaration order
 */
public record DeploymentEvent(
  String methodName,
  String projectId,
  String serviceName,
  String location,
  List<String> images
) {

  private static final List<String> DEPLOYMENT_METHODS = List.of(
    "google.cloud.run.v2.Services.CreateService",
    "google.cloud.run.v2.Services.UpdateService"
  );

  /**
   * Extracts the event from an audit log entry. Missing fields become null, a missing or malformed container list
   * results in no images.
   *
   * @param auditLog the audit log entry
   * @return the event
   */
  public static DeploymentEvent fromAuditLog(JsonNode auditLog) {
    JsonNode protoPayload = auditLog.path("protoPayload");
    JsonNode labels = auditLog.path("resource").path("labels");

    return new DeploymentEvent(
      protoPayload.path("methodName").asText(""),
      textOrNull(labels, "project_id"),
      textOrNull(labels, "service_name"),
      textOrNull(labels, "location"),
      extractImages(protoPayload.path("request"))
    );
  }

  /**
   * @return true if the event creates or updates a service
   */
  public boolean isServiceDeployment() {
    return DEPLOYMENT_METHODS.stream().anyMatch(methodName::contains);
  }

  private static List<String> extractImages(JsonNode serviceRequest) {
    List<String> images = new ArrayList<>();
    JsonNode containers = serviceRequest.path("template").path("containers");
    if (!containers.isArray()) {
      return images;
    }

    for (JsonNode container : containers) {
      String image = container.path("image").asText("");
      if (!image.isBlank()) {
        images.add(image.trim());
      }
    }
    return images;
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || !value.isValueNode()) {
      return null;
    }
    return value.asText();
  }
}
