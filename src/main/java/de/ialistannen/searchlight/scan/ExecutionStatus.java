package de.ialistannen.searchlight.scan;

/**
 * A snapshot of an execution's state.
 *
 * @param completed whether the execution has finished
 * @param succeededCount the number of tasks that succeeded
 * @param failedCount the number of tasks that failed
 */
public record ExecutionStatus(boolean completed, int succeededCount, int failedCount) {

  public static ExecutionStatus running() {
    return new ExecutionStatus(false, 0, 0);
  }
}
