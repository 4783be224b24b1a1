package de.ialistannen.searchlight.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/**
 * Where a scan result came from.
 *
 * @param registry the scanned image's registry
 * @param repository the scanned image's repository
 * @param tag the scanned image's tag
 * @param digest the scanned image's digest or null
 * @param scanTimestamp when the output was interpreted
 * @param scanner the scanner that produced the output
 * @param jobName the name of the scan job
 * @param rawOutput the decoded scanner output, or the undecodable text as a string node
 * @param parseError the decode error, null if the output was decoded
 */
@JsonNaming(SnakeCaseStrategy.class)
public record ScanMetadata(
  String registry,
  String repository,
  String tag,
  String digest,
  Instant scanTimestamp,
  String scanner,
  String jobName,
  JsonNode rawOutput,
  String parseError
) {

}
