package de.ialistannen.searchlight.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse.ContainerState;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import de.ialistannen.searchlight.config.ScannerConfig;
import de.ialistannen.searchlight.image.ImageReferenceParser;
import de.ialistannen.searchlight.timing.FakeClock;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DockerScanJobExecutorTest {

  private static final ScanExecution EXECUTION = new ScanExecution(new ScanJob("job", "c1"), "c1");

  private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

  private DockerClient client;
  private FakeClock clock;
  private DockerScanJobExecutor executor;

  @BeforeEach
  void setUp() {
    client = mock(DockerClient.class, RETURNS_DEEP_STUBS);
    clock = new FakeClock(NOW);
    executor = new DockerScanJobExecutor(client, ScannerConfig.fromEnvironment(Map.of("PROJECT_ID", "p")), clock);
  }

  @Test
  void scannerCommandHasOneTagPairPerEntry() {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("container_type", "cloudrun");
    tags.put("service_name", "web");
    ScanJobSpec spec = new ScanJobSpec(
      "job",
      ImageReferenceParser.parse("gcr.io/p/app:v1"),
      tags,
      Duration.ofMinutes(30)
    );

    assertThat(DockerScanJobExecutor.buildScannerCommand(spec, Optional.of("US2"))).containsExactly(
      "qscanner", "image", "gcr.io/p/app:v1",
      "--pod", "US2",
      "--output-format", "json",
      "--tag", "container_type=cloudrun",
      "--tag", "service_name=web"
    );
  }

  @Test
  void scannerCommandWithoutPod() {
    ScanJobSpec spec = new ScanJobSpec("job", ImageReferenceParser.parse("nginx"), Map.of(), Duration.ofMinutes(1));

    assertThat(DockerScanJobExecutor.buildScannerCommand(spec, Optional.empty()))
      .isEqualTo(List.of("qscanner", "image", "docker.io/library/nginx:latest", "--output-format", "json"));
  }

  @Test
  void runningContainerIsNotCompleted() {
    stubState(Boolean.TRUE, "running", null);

    assertThat(executor.status(EXECUTION)).isEqualTo(ExecutionStatus.running());
  }

  @Test
  void createdContainerIsNotCompleted() {
    stubState(Boolean.FALSE, "created", 0L);

    assertThat(executor.status(EXECUTION).completed()).isFalse();
  }

  @Test
  void zeroExitCodeSucceeded() {
    stubState(Boolean.FALSE, "exited", 0L);

    assertThat(executor.status(EXECUTION)).isEqualTo(new ExecutionStatus(true, 1, 0));
  }

  @Test
  void nonZeroExitCodeFailed() {
    stubState(Boolean.FALSE, "exited", 1L);

    assertThat(executor.status(EXECUTION)).isEqualTo(new ExecutionStatus(true, 0, 1));
  }

  @Test
  void deadContainerHasNoOutcome() {
    stubState(Boolean.FALSE, "dead", 137L);

    assertThat(executor.status(EXECUTION)).isEqualTo(new ExecutionStatus(true, 0, 0));
  }

  @Test
  void inspectFailureIsWrapped() {
    when(client.inspectContainerCmd("c1").exec()).thenThrow(new DockerException("daemon gone", 500));

    assertThatThrownBy(() -> executor.status(EXECUTION))
      .isInstanceOf(ScanExecutorException.class)
      .hasCauseInstanceOf(DockerException.class);
  }

  @Test
  void connectionFailureDuringInspectIsWrapped() {
    when(client.inspectContainerCmd("c1").exec())
      .thenThrow(new RuntimeException(new SocketException("Connection reset")));

    assertThatThrownBy(() -> executor.status(EXECUTION))
      .isInstanceOf(ScanExecutorException.class)
      .hasRootCauseInstanceOf(SocketException.class);
  }

  @Test
  void pollingSurvivesConnectionReset() throws InterruptedException {
    ContainerState state = mock(ContainerState.class);
    when(state.getRunning()).thenReturn(Boolean.FALSE);
    when(state.getStatus()).thenReturn("exited");
    when(state.getExitCodeLong()).thenReturn(0L);
    InspectContainerResponse response = mock(InspectContainerResponse.class);
    when(response.getState()).thenReturn(state);
    when(client.inspectContainerCmd("c1").exec())
      .thenThrow(new RuntimeException(new SocketException("Connection reset")))
      .thenReturn(response);

    ExecutionPoller poller = new ExecutionPoller(executor, clock, clock, Duration.ofSeconds(10), Duration.ofSeconds(60));

    assertThat(poller.awaitCompletion(EXECUTION)).isEqualTo(new ExecutionStatus(true, 1, 0));
    assertThat(clock.instant()).isEqualTo(NOW.plusSeconds(10));
  }

  @Test
  void logsAreDecodedAcrossFrameBoundaries() {
    byte[] output = "{\"title\": \"Grüße\"}".getBytes(StandardCharsets.UTF_8);
    // Splits the two bytes of the 'ü'
    int split = "{\"title\": \"Gr".length() + 1;
    List<Frame> frames = List.of(
      new Frame(StreamType.STDOUT, Arrays.copyOfRange(output, 0, split)),
      new Frame(StreamType.STDERR, "pulling layers".getBytes(StandardCharsets.UTF_8)),
      new Frame(StreamType.STDOUT, Arrays.copyOfRange(output, split, output.length))
    );
    when(client.logContainerCmd("c1").withStdOut(true).withStdErr(true).withFollowStream(false).exec(any()))
      .thenAnswer(invocation -> {
        ResultCallback<Frame> callback = invocation.getArgument(0);
        frames.forEach(callback::onNext);
        callback.onComplete();
        return callback;
      });

    assertThat(executor.logs(EXECUTION)).isEqualTo("{\"title\": \"Grüße\"}");
  }

  @Test
  void onlyOldLeftoversAreRemoved() {
    Container abandoned = container("abandoned", NOW.minus(Duration.ofHours(2)));
    Container concurrent = container("concurrent", NOW.minusSeconds(30));
    Container justInsideTimeout = container("slow", NOW.minus(Duration.ofMinutes(35)));
    when(
      client.listContainersCmd()
        .withStatusFilter(anyCollection())
        .withShowAll(true)
        .withLabelFilter(anyMap())
        .exec()
    ).thenReturn(List.of(abandoned, concurrent, justInsideTimeout));

    executor.removeLeftoverJobs();

    verify(client).removeContainerCmd("abandoned");
    verify(client, never()).removeContainerCmd("concurrent");
    verify(client, never()).removeContainerCmd("slow");
  }

  @Test
  void deletingMissingContainerIsFine() {
    when(client.removeContainerCmd("c1").withForce(true).withRemoveVolumes(true).exec())
      .thenThrow(new NotFoundException("no such container"));

    assertThatCode(() -> executor.delete(new ScanJob("job", "c1"))).doesNotThrowAnyException();
  }

  @Test
  void otherDeleteFailuresAreReported() {
    when(client.removeContainerCmd("c1").withForce(true).withRemoveVolumes(true).exec())
      .thenThrow(new DockerException("conflict", 409));

    assertThatThrownBy(() -> executor.delete(new ScanJob("job", "c1"))).isInstanceOf(ScanExecutorException.class);
  }

  private static Container container(String id, Instant created) {
    Container container = mock(Container.class);
    when(container.getId()).thenReturn(id);
    when(container.getCreated()).thenReturn(created.getEpochSecond());
    return container;
  }

  private void stubState(Boolean running, String status, Long exitCode) {
    ContainerState state = mock(ContainerState.class);
    when(state.getRunning()).thenReturn(running);
    when(state.getStatus()).thenReturn(status);
    when(state.getExitCodeLong()).thenReturn(exitCode);
    when(client.inspectContainerCmd("c1").exec().getState()).thenReturn(state);
  }
}
