package de.ialistannen.searchlight.scan;

import java.time.Duration;

public class ScanTimeoutException extends RuntimeException {

  public ScanTimeoutException(String executionId, Duration timeout) {
    super("Execution " + executionId + " timed out after " + timeout.toSeconds() + " seconds");
  }
}
