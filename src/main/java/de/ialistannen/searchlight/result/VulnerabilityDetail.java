package de.ialistannen.searchlight.result;

import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A single finding. All fields except the severity are copied verbatim from the scanner and may be null.
 *
 * @param id the scanner specific id (e.g. a Qualys QID)
 * @param cve the CVE id
 * @param severity the normalized severity
 * @param title a human readable title
 * @param packageName the affected package
 * @param packageVersion the installed version of the affected package
 * @param fixedVersion the first version that fixes the finding
 */
@JsonNaming(SnakeCaseStrategy.class)
public record VulnerabilityDetail(
  String id,
  String cve,
  Severity severity,
  String title,
  String packageName,
  String packageVersion,
  String fixedVersion
) {

}
