package de.ialistannen.searchlight.notifier;

import de.ialistannen.searchlight.result.Severity;
import de.ialistannen.searchlight.result.VulnerabilitySummary;
import de.ialistannen.searchlight.storage.ScanRecord;
import java.time.Instant;

/**
 * The payload published for a scan with severe findings.
 *
 * @param severity {@link Severity#CRITICAL} if there are critical findings, {@link Severity#HIGH} otherwise
 * @param image the image as it appeared in the deployment
 * @param service the service the image was deployed as, may be null
 * @param vulnerabilities the findings
 * @param timestamp the timestamp of the scan record
 */
public record ScanAlert(
  Severity severity,
  String image,
  String service,
  VulnerabilitySummary vulnerabilities,
  Instant timestamp
) {

  public static ScanAlert of(ScanRecord record) {
    Severity severity = record.vulnerabilities().critical() > 0 ? Severity.CRITICAL : Severity.HIGH;
    return new ScanAlert(
      severity,
      record.image(),
      record.serviceName(),
      record.vulnerabilities(),
      record.timestamp()
    );
  }
}
