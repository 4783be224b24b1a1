package de.ialistannen.searchlight.storage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identifies where a scanned image was deployed. Any field except the container type may be null.
 *
 * @param containerType the kind of deployment, e.g. {@code cloudrun}
 * @param projectId the project
 * @param serviceName the service
 * @param location the location
 * @param eventId the id of the event that announced the deployment
 */
public record DeploymentLabels(
  String containerType,
  String projectId,
  String serviceName,
  String location,
  String eventId
) {

  /**
   * @return the labels as scanner tags, skipping absent values
   */
  public Map<String, String> asTags() {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("container_type", containerType);
    putIfPresent(tags, "gcp_project", projectId);
    putIfPresent(tags, "service_name", serviceName);
    putIfPresent(tags, "location", location);
    putIfPresent(tags, "event_id", eventId);
    return tags;
  }

  private static void putIfPresent(Map<String, String> tags, String key, String value) {
    if (value != null) {
      tags.put(key, value);
    }
  }
}
