package de.ialistannen.searchlight.scan;

import de.ialistannen.searchlight.timing.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls an execution until it completes or the timeout elapses. Failed status checks do not end the loop,
 * they are logged and retried on the next tick.
 */
public class ExecutionPoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExecutionPoller.class);

  private final ScanJobExecutor executor;
  private final Clock clock;
  private final Sleeper sleeper;
  private final Duration pollInterval;
  private final Duration timeout;

  public ExecutionPoller(
    ScanJobExecutor executor,
    Clock clock,
    Sleeper sleeper,
    Duration pollInterval,
    Duration timeout
  ) {
    this.executor = executor;
    this.clock = clock;
    this.sleeper = sleeper;
    this.pollInterval = pollInterval;
    this.timeout = timeout;
  }

  /**
   * Blocks until the execution reports completion.
   *
   * @param execution the execution to wait for
   * @return the final status
   * @throws ScanTimeoutException if the execution did not complete within the timeout
   * @throws InterruptedException if interrupted while sleeping
   */
  public ExecutionStatus awaitCompletion(ScanExecution execution) throws InterruptedException {
    Instant start = clock.instant();
    LOGGER.info("Waiting for execution {} to complete...", execution.id());

    while (true) {
      Duration elapsed = Duration.between(start, clock.instant());
      if (elapsed.compareTo(timeout) > 0) {
        throw new ScanTimeoutException(execution.id(), timeout);
      }

      try {
        ExecutionStatus status = executor.status(execution);
        if (status.completed()) {
          LOGGER.info("Execution {} completed after {}s", execution.id(), elapsed.toSeconds());
          return status;
        }
      } catch (ScanExecutorException e) {
        LOGGER.error("Error checking status of execution {}, retrying", execution.id(), e);
      }

      sleeper.sleep(pollInterval);
    }
  }
}
