package de.ialistannen.searchlight;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientBuilder;
import de.ialistannen.searchlight.cli.CliArguments;
import de.ialistannen.searchlight.cli.CliArgumentsParser;
import de.ialistannen.searchlight.config.ConfigurationException;
import de.ialistannen.searchlight.config.ScannerConfig;
import de.ialistannen.searchlight.event.AuditEventDecoder;
import de.ialistannen.searchlight.event.DeploymentEventHandler;
import de.ialistannen.searchlight.notifier.AlertDispatcher;
import de.ialistannen.searchlight.notifier.AlertPublisher;
import de.ialistannen.searchlight.notifier.NtfyAlertPublisher;
import de.ialistannen.searchlight.result.ScanResultInterpreter;
import de.ialistannen.searchlight.scan.DockerScanJobExecutor;
import de.ialistannen.searchlight.scan.ExecutionPoller;
import de.ialistannen.searchlight.scan.ScanJobNames;
import de.ialistannen.searchlight.scan.ScanOrchestrator;
import de.ialistannen.searchlight.storage.DeploymentLabels;
import de.ialistannen.searchlight.storage.FileBlobStore;
import de.ialistannen.searchlight.storage.FileMetadataStore;
import de.ialistannen.searchlight.storage.ResultStore;
import de.ialistannen.searchlight.timing.Sleeper;
import de.ialistannen.searchlight.util.BestEffort;
import de.ialistannen.searchlight.util.JsonMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws IOException, InterruptedException {
    CliArguments arguments = new CliArgumentsParser().parseOrExit(args);
    ScannerConfig config = loadConfig();

    Clock clock = Clock.systemUTC();
    ObjectMapper objectMapper = JsonMapper.create();

    DefaultDockerClientConfig.Builder dockerConfig = DefaultDockerClientConfig.createDefaultConfigBuilder();
    DockerClient dockerClient = DockerClientBuilder.getInstance(dockerConfig.build()).build();

    DockerScanJobExecutor executor = new DockerScanJobExecutor(dockerClient, config, clock);
    BestEffort.run("removing leftover scan containers", executor::removeLeftoverJobs);

    if (config.scannerPod().isEmpty()) {
      LOGGER.warn("SCANNER_POD is not set, the scanner will use its default pod");
    }

    ScanOrchestrator orchestrator = new ScanOrchestrator(
      executor,
      new ExecutionPoller(executor, clock, Sleeper.SYSTEM, config.pollInterval(), config.scanTimeout()),
      new ScanJobNames(clock),
      new ScanResultInterpreter(objectMapper, clock),
      config.scanTimeout()
    );

    ResultStore resultStore = new ResultStore(
      new FileBlobStore(config.resultsRoot()),
      new FileMetadataStore(config.resultsRoot().resolve("metadata"), objectMapper),
      objectMapper,
      clock
    );
    resultStore.initialize();

    DeploymentEventHandler handler = new DeploymentEventHandler(
      new AuditEventDecoder(objectMapper),
      orchestrator,
      resultStore,
      new AlertDispatcher(config.alertThreshold(), buildAlertPublisher(config, objectMapper)),
      config.cacheWindow(),
      clock
    );

    try {
      if (!arguments.images().isEmpty()) {
        DeploymentLabels labels = new DeploymentLabels(
          "manual",
          config.projectId(),
          null,
          config.region(),
          "manual-" + clock.millis()
        );
        handler.scanImages(arguments.images(), labels, arguments.force());
      } else {
        handler.handle(readEnvelope(arguments), arguments.force());
      }
    } catch (RuntimeException e) {
      LOGGER.error("Error processing event", e);
      throw die("Error processing event: " + e.getMessage());
    }
  }

  private static ScannerConfig loadConfig() {
    try {
      return ScannerConfig.fromEnvironment(System.getenv());
    } catch (ConfigurationException e) {
      throw die(e.getMessage());
    }
  }

  private static Optional<AlertPublisher> buildAlertPublisher(ScannerConfig config, ObjectMapper objectMapper) {
    if (config.notificationTopic().isEmpty()) {
      LOGGER.info("NOTIFICATION_TOPIC not set, alerts are only logged");
      return Optional.empty();
    }
    return Optional.of(
      new NtfyAlertPublisher(
        HttpClient.newBuilder().build(),
        config.notificationServer(),
        config.notificationTopic().get(),
        objectMapper
      )
    );
  }

  private static String readEnvelope(CliArguments arguments) throws IOException {
    if (arguments.eventFile().isPresent()) {
      Path path = Path.of(arguments.eventFile().get());
      LOGGER.info("Reading event from '{}'", path);
      return Files.readString(path, StandardCharsets.UTF_8);
    }
    LOGGER.info("Reading event from stdin");
    return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
  }

  private static RuntimeException die(String msg) {
    LOGGER.error(msg);
    System.exit(1);

    return new RuntimeException();
  }
}
