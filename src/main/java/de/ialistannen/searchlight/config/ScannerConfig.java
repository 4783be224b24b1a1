package de.ialistannen.searchlight.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import de.ialistannen.searchlight.notifier.AlertThreshold;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The complete configuration. Built once at start-up and handed to every component that needs a part of it.
 *
 * @param projectId the project owning the scan results
 * @param region the region attached to scan jobs
 * @param resultsRoot the root directory of the result store
 * @param scannerImage the scanner image run for every scan
 * @param scannerPod the Qualys pod passed to the scanner
 * @param scannerAccessToken the Qualys access token passed to the scanner
 * @param executorIdentity the identity scan jobs run as
 * @param scanTimeout the maximum time a single scan may take
 * @param pollInterval the time between two status checks of a running scan
 * @param cacheWindow images scanned within this window are not scanned again
 * @param alertThreshold the findings that trigger an alert
 * @param notificationTopic the topic alerts are published to
 * @param notificationServer the server alerts are published to
 */
public record ScannerConfig(
  String projectId,
  String region,
  Path resultsRoot,
  String scannerImage,
  Optional<String> scannerPod,
  String scannerAccessToken,
  Optional<String> executorIdentity,
  Duration scanTimeout,
  Duration pollInterval,
  Duration cacheWindow,
  AlertThreshold alertThreshold,
  Optional<String> notificationTopic,
  URI notificationServer
) {

  public static final String DEFAULT_REGION = "us-central1";
  public static final String DEFAULT_RESULTS_ROOT = "data/scan-results";
  public static final String DEFAULT_SCANNER_IMAGE = "qualys/qscanner:latest";
  public static final long DEFAULT_SCAN_TIMEOUT_SECONDS = 1800;
  public static final long DEFAULT_POLL_INTERVAL_SECONDS = 10;
  public static final long DEFAULT_CACHE_HOURS = 24;
  public static final String DEFAULT_NOTIFICATION_SERVER = "https://ntfy.sh";

  /**
   * Reads the configuration from environment variables.
   *
   * @param env the environment, usually {@link System#getenv()}
   * @return the configuration
   * @throws ConfigurationException if a variable is missing or malformed
   */
  public static ScannerConfig fromEnvironment(Map<String, String> env) {
    try {
      String projectId = optional(env, "PROJECT_ID")
        .orElseThrow(() -> new ConfigurationException("PROJECT_ID must be set"));

      long timeoutSeconds = positiveLong(env, "SCAN_TIMEOUT", DEFAULT_SCAN_TIMEOUT_SECONDS);
      long pollSeconds = positiveLong(env, "SCAN_POLL_INTERVAL", DEFAULT_POLL_INTERVAL_SECONDS);
      long cacheHours = positiveLong(env, "SCAN_CACHE_HOURS", DEFAULT_CACHE_HOURS);

      return new ScannerConfig(
        projectId,
        optional(env, "REGION").orElse(DEFAULT_REGION),
        Path.of(optional(env, "RESULTS_BUCKET").orElse(DEFAULT_RESULTS_ROOT)),
        optional(env, "SCANNER_IMAGE").orElse(DEFAULT_SCANNER_IMAGE),
        optional(env, "SCANNER_POD"),
        optional(env, "SCANNER_ACCESS_TOKEN").orElse(""),
        optional(env, "SCANNER_SERVICE_ACCOUNT"),
        Duration.ofSeconds(timeoutSeconds),
        Duration.ofSeconds(pollSeconds),
        Duration.ofHours(cacheHours),
        threshold(optional(env, "NOTIFY_SEVERITY_THRESHOLD").orElse(AlertThreshold.HIGH.name())),
        optional(env, "NOTIFICATION_TOPIC"),
        new URI(optional(env, "NOTIFICATION_SERVER").orElse(DEFAULT_NOTIFICATION_SERVER))
      );
    } catch (IllegalArgumentException | URISyntaxException e) {
      throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
    }
  }

  private static Optional<String> optional(Map<String, String> env, String name) {
    return Optional.ofNullable(Strings.emptyToNull(Strings.nullToEmpty(env.get(name)).trim()));
  }

  private static long positiveLong(Map<String, String> env, String name, long defaultValue) {
    Optional<String> value = optional(env, name);
    if (value.isEmpty()) {
      return defaultValue;
    }
    long parsed;
    try {
      parsed = Long.parseLong(value.get());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " is not a number: '" + value.get() + "'", e);
    }
    checkArgument(parsed > 0, "%s must be positive, was %s", name, parsed);
    return parsed;
  }

  private static AlertThreshold threshold(String value) {
    try {
      return AlertThreshold.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("NOTIFY_SEVERITY_THRESHOLD must be CRITICAL or HIGH, was '" + value + "'", e);
    }
  }
}
