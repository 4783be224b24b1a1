package de.ialistannen.searchlight.notifier;

import de.ialistannen.searchlight.storage.ScanRecord;
import de.ialistannen.searchlight.util.BestEffort;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a scan is alert-worthy and, if so, logs and publishes the alert. Publishing is best effort: a failed
 * alert never fails the scan.
 */
public class AlertDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertDispatcher.class);

  private final AlertThreshold threshold;
  private final Optional<AlertPublisher> publisher;

  public AlertDispatcher(AlertThreshold threshold, Optional<AlertPublisher> publisher) {
    this.threshold = threshold;
    this.publisher = publisher;
  }

  /**
   * Alerts about a scan if its findings exceed the threshold.
   *
   * @param record the scan record
   * @return true if the record was alert-worthy
   */
  public boolean dispatch(ScanRecord record) {
    if (!threshold.isExceededBy(record.vulnerabilities())) {
      return false;
    }
    ScanAlert alert = ScanAlert.of(record);

    LOGGER.warn(
      "SECURITY ALERT: {} severity vulnerabilities found in {}. Service: {} Vulnerabilities: critical={}, high={}, total={}",
      alert.severity(),
      alert.image(),
      alert.service(),
      alert.vulnerabilities().critical(),
      alert.vulnerabilities().high(),
      alert.vulnerabilities().total()
    );

    publisher.ifPresent(it -> BestEffort.run("publishing alert for " + alert.image(), () -> it.publish(alert)));
    return true;
  }
}
