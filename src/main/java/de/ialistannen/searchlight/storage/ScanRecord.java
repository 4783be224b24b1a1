package de.ialistannen.searchlight.storage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import de.ialistannen.searchlight.result.ComplianceSummary;
import de.ialistannen.searchlight.result.ScanMetadata;
import de.ialistannen.searchlight.result.ScanResult;
import de.ialistannen.searchlight.result.ScanStatus;
import de.ialistannen.searchlight.result.VulnerabilitySummary;
import java.time.Instant;

/**
 * A scan result together with where the scanned image was deployed. Written once, never changed.
 *
 * @param timestamp when the record was created
 * @param containerType what kind of deployment triggered the scan, e.g. {@code cloudrun}
 * @param image the image as it appeared in the deployment
 * @param fullName the canonical image name, used as cache key
 * @param projectId the project the image was deployed to
 * @param serviceName the service the image was deployed as
 * @param location the location of the service
 * @param eventId the id of the triggering event
 * @param scanId the scan id
 * @param status the scan status
 * @param vulnerabilities the found vulnerabilities
 * @param compliance the compliance results
 * @param metadata the scan provenance
 */
@JsonNaming(SnakeCaseStrategy.class)
public record ScanRecord(
  Instant timestamp,
  String containerType,
  String image,
  String fullName,
  String projectId,
  String serviceName,
  String location,
  String eventId,
  String scanId,
  ScanStatus status,
  VulnerabilitySummary vulnerabilities,
  ComplianceSummary compliance,
  ScanMetadata metadata
) {

  /**
   * Attaches deployment information to a scan result.
   *
   * @param timestamp the record timestamp
   * @param image the image as it appeared in the deployment
   * @param deployment where the image was deployed
   * @param result the scan result
   * @return the record
   */
  public static ScanRecord of(Instant timestamp, String image, DeploymentLabels deployment, ScanResult result) {
    return new ScanRecord(
      timestamp,
      deployment.containerType(),
      image,
      result.image(),
      deployment.projectId(),
      deployment.serviceName(),
      deployment.location(),
      deployment.eventId(),
      result.scanId(),
      result.status(),
      result.vulnerabilities(),
      result.compliance(),
      result.metadata()
    );
  }
}
