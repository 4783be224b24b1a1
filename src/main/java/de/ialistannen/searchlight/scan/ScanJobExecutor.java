package de.ialistannen.searchlight.scan;

/**
 * Runs scan jobs somewhere. All methods throw {@link ScanExecutorException} if the executor can not be reached or
 * rejects the request.
 */
public interface ScanJobExecutor {

  /**
   * Creates (but does not start) a job.
   *
   * @param spec the job spec
   * @return the created job
   */
  ScanJob create(ScanJobSpec spec);

  /**
   * Starts a created job.
   *
   * @param job the job
   * @return the started execution
   */
  ScanExecution run(ScanJob job);

  /**
   * @param execution the execution
   * @return the current status of the execution
   */
  ExecutionStatus status(ScanExecution execution);

  /**
   * @param execution a completed execution
   * @return everything the execution printed to stdout
   */
  String logs(ScanExecution execution);

  /**
   * Deletes the job and everything it left behind.
   *
   * @param job the job
   */
  void delete(ScanJob job);
}
