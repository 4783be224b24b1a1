package de.ialistannen.searchlight.notifier;

import java.io.IOException;

/**
 * Delivers alerts to some channel.
 */
public interface AlertPublisher {

  /**
   * Publishes an alert.
   *
   * @param alert the alert
   * @throws IOException if delivery failed
   * @throws InterruptedException if interrupted while delivering
   */
  void publish(ScanAlert alert) throws IOException, InterruptedException;
}
