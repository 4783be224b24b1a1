package de.ialistannen.searchlight.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.ialistannen.searchlight.notifier.AlertThreshold;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScannerConfigTest {

  @Test
  void defaultsApply() {
    ScannerConfig config = ScannerConfig.fromEnvironment(Map.of("PROJECT_ID", "my-project"));

    assertThat(config.projectId()).isEqualTo("my-project");
    assertThat(config.region()).isEqualTo("us-central1");
    assertThat(config.resultsRoot()).isEqualTo(Path.of("data/scan-results"));
    assertThat(config.scannerImage()).isEqualTo("qualys/qscanner:latest");
    assertThat(config.scannerPod()).isEmpty();
    assertThat(config.scannerAccessToken()).isEmpty();
    assertThat(config.executorIdentity()).isEmpty();
    assertThat(config.scanTimeout()).isEqualTo(Duration.ofMinutes(30));
    assertThat(config.pollInterval()).isEqualTo(Duration.ofSeconds(10));
    assertThat(config.cacheWindow()).isEqualTo(Duration.ofHours(24));
    assertThat(config.alertThreshold()).isEqualTo(AlertThreshold.HIGH);
    assertThat(config.notificationTopic()).isEmpty();
    assertThat(config.notificationServer()).isEqualTo(URI.create("https://ntfy.sh"));
  }

  @Test
  void valuesAreRead() {
    ScannerConfig config = ScannerConfig.fromEnvironment(Map.ofEntries(
      Map.entry("PROJECT_ID", "p"),
      Map.entry("REGION", "europe-west1"),
      Map.entry("RESULTS_BUCKET", "/var/lib/scans"),
      Map.entry("SCANNER_POD", "US2"),
      Map.entry("SCANNER_SERVICE_ACCOUNT", "1000:1000"),
      Map.entry("SCAN_TIMEOUT", "600"),
      Map.entry("SCAN_CACHE_HOURS", "2"),
      Map.entry("NOTIFY_SEVERITY_THRESHOLD", "critical"),
      Map.entry("NOTIFICATION_TOPIC", "scans")
    ));

    assertThat(config.region()).isEqualTo("europe-west1");
    assertThat(config.resultsRoot()).isEqualTo(Path.of("/var/lib/scans"));
    assertThat(config.scannerPod()).contains("US2");
    assertThat(config.executorIdentity()).contains("1000:1000");
    assertThat(config.scanTimeout()).isEqualTo(Duration.ofMinutes(10));
    assertThat(config.cacheWindow()).isEqualTo(Duration.ofHours(2));
    assertThat(config.alertThreshold()).isEqualTo(AlertThreshold.CRITICAL);
    assertThat(config.notificationTopic()).contains("scans");
  }

  @Test
  void blankValuesCountAsMissing() {
    ScannerConfig config = ScannerConfig.fromEnvironment(Map.of("PROJECT_ID", "p", "SCANNER_POD", "  "));

    assertThat(config.scannerPod()).isEmpty();
  }

  @Test
  void projectIsRequired() {
    assertThatThrownBy(() -> ScannerConfig.fromEnvironment(Map.of()))
      .isInstanceOf(ConfigurationException.class)
      .hasMessageContaining("PROJECT_ID");
  }

  @Test
  void nonNumericTimeoutIsRejected() {
    assertThatThrownBy(() -> ScannerConfig.fromEnvironment(Map.of("PROJECT_ID", "p", "SCAN_TIMEOUT", "soon")))
      .isInstanceOf(ConfigurationException.class)
      .hasMessageContaining("SCAN_TIMEOUT");
  }

  @Test
  void nonPositiveIntervalIsRejected() {
    assertThatThrownBy(() -> ScannerConfig.fromEnvironment(Map.of("PROJECT_ID", "p", "SCAN_POLL_INTERVAL", "0")))
      .isInstanceOf(ConfigurationException.class)
      .hasMessageContaining("SCAN_POLL_INTERVAL must be positive");
  }

  @Test
  void unknownThresholdIsRejected() {
    assertThatThrownBy(
      () -> ScannerConfig.fromEnvironment(Map.of("PROJECT_ID", "p", "NOTIFY_SEVERITY_THRESHOLD", "MEDIUM"))
    )
      .isInstanceOf(ConfigurationException.class)
      .hasMessageContaining("NOTIFY_SEVERITY_THRESHOLD");
  }
}
