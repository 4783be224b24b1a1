package de.ialistannen.searchlight.scan;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback.Adapter;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse.ContainerState;
import com.github.dockerjava.api.command.PullImageCmd;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.RestartPolicy;
import com.github.dockerjava.api.model.StreamType;
import de.ialistannen.searchlight.config.ScannerConfig;
import de.ialistannen.searchlight.image.ImageReference;
import de.ialistannen.searchlight.image.ImageReferenceParser;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every scan in its own short-lived docker container. A job is a created container, an execution is that
 * container running. Containers are never restarted.
 */
public class DockerScanJobExecutor implements ScanJobExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(DockerScanJobExecutor.class);

  public static final String MANAGED_BY_LABEL = "managed-by";
  public static final String MANAGED_BY_VALUE = "searchlight";

  private static final long NANO_CPUS = 1_000_000_000L;
  private static final long MEMORY_BYTES = 2L * 1024 * 1024 * 1024;
  static final Duration LEFTOVER_GRACE = Duration.ofMinutes(10);

  private final DockerClient client;
  private final ScannerConfig config;
  private final Clock clock;

  public DockerScanJobExecutor(DockerClient client, ScannerConfig config, Clock clock) {
    this.client = client;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Removes containers a previous, crashed, run left behind. Only containers created longer ago than the scan timeout
   * plus {@link #LEFTOVER_GRACE} are touched, younger ones may still belong to a concurrent invocation.
   */
  public void removeLeftoverJobs() {
    Instant cutoff = clock.instant().minus(config.scanTimeout()).minus(LEFTOVER_GRACE);

    client.listContainersCmd()
      .withStatusFilter(Set.of("exited", "created", "dead"))
      .withShowAll(true)
      .withLabelFilter(Map.of(MANAGED_BY_LABEL, MANAGED_BY_VALUE))
      .exec()
      .stream()
      .filter(container -> container.getCreated() != null)
      .filter(container -> Instant.ofEpochSecond(container.getCreated()).isBefore(cutoff))
      .forEach(container -> {
        LOGGER.info("Removing leftover scan container {}", container.getId());
        client.removeContainerCmd(container.getId()).withForce(true).exec();
      });
  }

  @Override
  public ScanJob create(ScanJobSpec spec) {
    try {
      pullScannerImageIfNecessary();

      CreateContainerCmd command = client.createContainerCmd(config.scannerImage())
        .withName(spec.jobName())
        .withLabels(labels(spec))
        .withEnv("QUALYS_ACCESS_TOKEN=" + config.scannerAccessToken())
        .withEntrypoint(buildScannerCommand(spec, config.scannerPod()))
        .withHostConfig(
          HostConfig.newHostConfig()
            .withNanoCPUs(NANO_CPUS)
            .withMemory(MEMORY_BYTES)
            .withRestartPolicy(RestartPolicy.noRestart())
        );
      config.executorIdentity().ifPresent(command::withUser);

      CreateContainerResponse response = command.exec();
      LOGGER.debug("Created container {} for job {}", response.getId(), spec.jobName());

      return new ScanJob(spec.jobName(), response.getId());
    } catch (DockerException e) {
      throw new ScanExecutorException("Failed to create job " + spec.jobName(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ScanExecutorException("Interrupted while pulling the scanner image for " + spec.jobName(), e);
    }
  }

  @Override
  public ScanExecution run(ScanJob job) {
    try {
      client.startContainerCmd(job.id()).exec();
      return new ScanExecution(job, job.id());
    } catch (DockerException e) {
      throw new ScanExecutorException("Failed to start job " + job.name(), e);
    }
  }

  @Override
  public ExecutionStatus status(ScanExecution execution) {
    ContainerState state;
    try {
      state = client.inspectContainerCmd(execution.id()).exec().getState();
    } catch (RuntimeException e) {
      // Lost daemon connections surface as plain runtime exceptions from the transport
      throw new ScanExecutorException("Failed to inspect execution " + execution.id(), e);
    }

    if (state == null || Boolean.TRUE.equals(state.getRunning()) || !isFinished(state.getStatus())) {
      return ExecutionStatus.running();
    }

    Long exitCode = state.getExitCodeLong();
    if (exitCode == null || "dead".equals(state.getStatus())) {
      return new ExecutionStatus(true, 0, 0);
    }
    if (exitCode == 0) {
      return new ExecutionStatus(true, 1, 0);
    }
    LOGGER.info("Execution {} exited with code {}", execution.id(), exitCode);
    return new ExecutionStatus(true, 0, 1);
  }

  @Override
  public String logs(ScanExecution execution) {
    ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    try {
      client.logContainerCmd(execution.id())
        .withStdOut(true)
        .withStdErr(true)
        .withFollowStream(false)
        .exec(new Adapter<Frame>() {
          @Override
          public void onNext(Frame frame) {
            if (frame.getStreamType() == StreamType.STDERR) {
              String text = new String(frame.getPayload(), StandardCharsets.UTF_8);
              LOGGER.debug("[{}] {}", execution.job().name(), text.stripTrailing());
            } else {
              stdout.writeBytes(frame.getPayload());
            }
          }
        })
        .awaitCompletion();
    } catch (DockerException e) {
      throw new ScanExecutorException("Failed to read logs of execution " + execution.id(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ScanExecutorException("Interrupted while reading logs of execution " + execution.id(), e);
    }
    // Frames may split multi-byte characters, so decode only once everything is there
    return stdout.toString(StandardCharsets.UTF_8);
  }

  @Override
  public void delete(ScanJob job) {
    try {
      client.removeContainerCmd(job.id()).withForce(true).withRemoveVolumes(true).exec();
    } catch (NotFoundException e) {
      LOGGER.debug("Job {} did not exist anymore", job.name());
    } catch (DockerException e) {
      throw new ScanExecutorException("Failed to delete job " + job.name(), e);
    }
  }

  private Map<String, String> labels(ScanJobSpec spec) {
    Map<String, String> labels = new HashMap<>();
    spec.tags().forEach((key, value) -> labels.put("searchlight.tag." + key, value));
    labels.put("searchlight.image", spec.image().fullName());
    labels.put("searchlight.project", config.projectId());
    labels.put("searchlight.region", config.region());
    labels.put("searchlight.timeout-seconds", Long.toString(spec.timeout().toSeconds()));
    labels.put("purpose", "qscanner");
    labels.put(MANAGED_BY_LABEL, MANAGED_BY_VALUE);
    return labels;
  }

  private void pullScannerImageIfNecessary() throws InterruptedException {
    String image = config.scannerImage();
    boolean explicitVersion = image.contains("@") || image.lastIndexOf(':') > image.lastIndexOf('/');
    String reference = explicitVersion ? image : image + ":latest";

    boolean needsPull = client.listImagesCmd()
      .withReferenceFilter(reference)
      .exec()
      .isEmpty();
    if (!needsPull) {
      return;
    }

    LOGGER.info("Scanner image {} not present locally, pulling", reference);
    ImageReference scanner = ImageReferenceParser.parse(image);
    String name = scanner.registry() + "/" + scanner.repository();
    PullImageCmd pull = scanner.digest().isPresent()
      ? client.pullImageCmd(name + "@" + scanner.digest().get())
      : client.pullImageCmd(name).withTag(scanner.tag());
    pull.exec(new PullImageResultCallback()).awaitCompletion(5, TimeUnit.MINUTES);
  }

  /**
   * Builds the scanner invocation. Each custom tag becomes its own {@code --tag key=value} pair.
   *
   * @param spec the job spec
   * @param pod the Qualys pod, if configured
   * @return the command line
   */
  static List<String> buildScannerCommand(ScanJobSpec spec, Optional<String> pod) {
    List<String> command = new ArrayList<>(List.of("qscanner", "image", spec.image().fullName()));
    pod.ifPresent(it -> {
      command.add("--pod");
      command.add(it);
    });
    command.add("--output-format");
    command.add("json");

    for (Entry<String, String> tag : spec.tags().entrySet()) {
      command.add("--tag");
      command.add(tag.getKey() + "=" + tag.getValue());
    }
    return command;
  }

  private static boolean isFinished(String status) {
    return "exited".equals(status) || "dead".equals(status);
  }
}
