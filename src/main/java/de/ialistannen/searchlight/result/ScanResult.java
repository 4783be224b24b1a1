package de.ialistannen.searchlight.result;

/**
 * The interpreted outcome of one scan.
 *
 * @param scanId the scan id
 * @param status whether the scanner output could be interpreted
 * @param image the canonical name of the scanned image
 * @param vulnerabilities the vulnerability summary
 * @param compliance the compliance summary
 * @param metadata provenance information
 */
public record ScanResult(
  String scanId,
  ScanStatus status,
  String image,
  VulnerabilitySummary vulnerabilities,
  ComplianceSummary compliance,
  ScanMetadata metadata
) {

}
