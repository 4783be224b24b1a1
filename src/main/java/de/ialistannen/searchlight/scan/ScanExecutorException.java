package de.ialistannen.searchlight.scan;

public class ScanExecutorException extends RuntimeException {

  public ScanExecutorException(String message) {
    super(message);
  }

  public ScanExecutorException(String message, Throwable cause) {
    super(message, cause);
  }
}
