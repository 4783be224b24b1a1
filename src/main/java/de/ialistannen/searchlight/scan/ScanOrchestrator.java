package de.ialistannen.searchlight.scan;

import de.ialistannen.searchlight.image.ImageReference;
import de.ialistannen.searchlight.result.ScanResult;
import de.ialistannen.searchlight.result.ScanResultInterpreter;
import de.ialistannen.searchlight.util.BestEffort;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans one image: create a job, run it, wait for it, read its output and delete it again. The job is deleted no
 * matter how the scan ended.
 */
public class ScanOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScanOrchestrator.class);

  private final ScanJobExecutor executor;
  private final ExecutionPoller poller;
  private final ScanJobNames jobNames;
  private final ScanResultInterpreter interpreter;
  private final Duration scanTimeout;

  public ScanOrchestrator(
    ScanJobExecutor executor,
    ExecutionPoller poller,
    ScanJobNames jobNames,
    ScanResultInterpreter interpreter,
    Duration scanTimeout
  ) {
    this.executor = executor;
    this.poller = poller;
    this.jobNames = jobNames;
    this.interpreter = interpreter;
    this.scanTimeout = scanTimeout;
  }

  /**
   * Scans an image.
   *
   * @param image the image to scan
   * @param customTags tags passed on to the scanner
   * @return the interpreted result
   * @throws ScanExecutorException if the job could not be created, started or its logs could not be read
   * @throws ScanTimeoutException if the job did not finish in time
   * @throws UnexpectedExecutionStateException if the job finished in a state that is neither success nor failure
   * @throws InterruptedException if interrupted while waiting for the job
   */
  public ScanResult scanImage(ImageReference image, Map<String, String> customTags) throws InterruptedException {
    String jobName = jobNames.generate(image);
    LOGGER.info("Scanning image {} with job {}", image, jobName);

    ScanJobSpec spec = new ScanJobSpec(jobName, image, customTags, scanTimeout);
    // Deletion works by name, so we can clean up even if we never learned the id
    ScanJob job = new ScanJob(jobName, jobName);
    try {
      job = executor.create(spec);
      LOGGER.info("Job {} created", jobName);

      String output = runToCompletion(job);
      return interpreter.interpret(output, image, jobName);
    } catch (RuntimeException e) {
      LOGGER.error("Error scanning image {}: {}", image, e.getMessage());
      throw e;
    } finally {
      ScanJob createdJob = job;
      if (BestEffort.run("deleting job " + jobName, () -> executor.delete(createdJob))) {
        LOGGER.info("Job {} deleted", jobName);
      }
    }
  }

  private String runToCompletion(ScanJob job) throws InterruptedException {
    ScanExecution execution = executor.run(job);
    LOGGER.info("Job execution started: {}", execution.id());

    ExecutionStatus status = poller.awaitCompletion(execution);

    if (status.succeededCount() > 0) {
      LOGGER.info("Execution {} succeeded", execution.id());
    } else if (status.failedCount() > 0) {
      // qscanner exits non-zero when it finds vulnerabilities, the output is still what we want
      LOGGER.warn("Execution {} reported failed tasks, reading its output anyway", execution.id());
    } else {
      throw new UnexpectedExecutionStateException(execution.id());
    }

    return executor.logs(execution);
  }
}
