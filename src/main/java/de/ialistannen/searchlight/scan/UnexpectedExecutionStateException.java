package de.ialistannen.searchlight.scan;

public class UnexpectedExecutionStateException extends RuntimeException {

  public UnexpectedExecutionStateException(String executionId) {
    super("Execution " + executionId + " completed without succeeded or failed tasks");
  }
}
