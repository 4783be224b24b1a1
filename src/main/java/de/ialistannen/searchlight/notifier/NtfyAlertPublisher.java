package de.ialistannen.searchlight.notifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.ialistannen.searchlight.result.Severity;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes alerts to an ntfy topic. The message body is the alert as json.
 *
 * @see <a href="https://docs.ntfy.sh/publish/">ntfy docs</a>
 */
public class NtfyAlertPublisher implements AlertPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(NtfyAlertPublisher.class);

  private final HttpClient httpClient;
  private final URI topicUrl;
  private final ObjectMapper objectMapper;

  public NtfyAlertPublisher(HttpClient httpClient, URI server, String topic, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.topicUrl = URI.create(server.toString().replaceFirst("/+$", "") + "/" + topic);
    this.objectMapper = objectMapper;
  }

  @Override
  public void publish(ScanAlert alert) throws IOException, InterruptedException {
    boolean critical = alert.severity() == Severity.CRITICAL;
    HttpRequest request = HttpRequest.newBuilder(topicUrl)
      .header("X-Title", "Searchlight: %s vulnerabilities in %s".formatted(alert.severity(), alert.image()))
      .header("X-Tags", critical ? "rotating_light" : "warning")
      .header("X-Priority", critical ? "5" : "4")
      .header("Content-Type", "application/json")
      .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(alert)))
      .build();

    LOGGER.debug("Sending alert to {}", topicUrl);
    HttpResponse<String> response = httpClient.send(request, BodyHandlers.ofString());
    if (response.statusCode() != 200 && response.statusCode() != 204) {
      throw new IOException("Failed to publish alert (HTTP %d): %s".formatted(response.statusCode(), response.body()));
    }
    LOGGER.info("Alert published to {}", topicUrl);
  }
}
