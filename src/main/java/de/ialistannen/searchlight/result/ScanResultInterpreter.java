package de.ialistannen.searchlight.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import de.ialistannen.searchlight.image.ImageReference;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the json printed by qscanner into a {@link ScanResult}.
 * <p>
 * qscanner is not consistent about where it puts findings: some versions print {@code vulnerabilities} and
 * {@code compliance} at the top level, others nest them in a {@code results} object. Both are accepted, the top level
 * wins if both are present.
 */
public class ScanResultInterpreter {

  public static final String SCANNER_NAME = "qscanner";

  private static final Logger LOGGER = LoggerFactory.getLogger(ScanResultInterpreter.class);

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ScanResultInterpreter(ObjectMapper objectMapper, Clock clock) {
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Interprets scanner output. Never throws: undecodable output results in a {@link ScanStatus#PARSE_ERROR} result.
   *
   * @param rawOutput the raw scanner output
   * @param image the image that was scanned
   * @param jobName the name of the job that scanned it, used as scan id if the scanner did not report one
   * @return the result
   */
  public ScanResult interpret(String rawOutput, ImageReference image, String jobName) {
    JsonNode root;
    try {
      root = objectMapper.readTree(rawOutput == null ? "" : rawOutput.trim());
    } catch (JsonProcessingException e) {
      LOGGER.error("Failed to parse scanner output for {} as json: {}", image, e.getOriginalMessage());
      LOGGER.debug("Output was: {}", abbreviate(rawOutput));
      return parseError(rawOutput, image, jobName, e.getOriginalMessage());
    }
    if (root == null || root.isMissingNode() || !root.isObject()) {
      LOGGER.error("Scanner output for {} is not a json object", image);
      LOGGER.debug("Output was: {}", abbreviate(rawOutput));
      return parseError(rawOutput, image, jobName, "Scanner output is not a json object");
    }

    VulnerabilitySummary vulnerabilities = parseVulnerabilities(root);
    ComplianceSummary compliance = parseCompliance(root);

    LOGGER.info(
      "Parsed {} vulnerabilities for {}: critical={}, high={}",
      vulnerabilities.total(),
      image,
      vulnerabilities.critical(),
      vulnerabilities.high()
    );

    String scanId = textOrNull(root, "scanId");
    return new ScanResult(
      scanId != null ? scanId : jobName,
      ScanStatus.COMPLETED,
      image.fullName(),
      vulnerabilities,
      compliance,
      metadata(image, jobName, root, null)
    );
  }

  private ScanResult parseError(String rawOutput, ImageReference image, String jobName, String error) {
    return new ScanResult(
      jobName,
      ScanStatus.PARSE_ERROR,
      image.fullName(),
      VulnerabilitySummary.empty(),
      ComplianceSummary.empty(),
      metadata(image, jobName, new TextNode(rawOutput == null ? "" : rawOutput), error)
    );
  }

  private ScanMetadata metadata(ImageReference image, String jobName, JsonNode rawOutput, String parseError) {
    return new ScanMetadata(
      image.registry(),
      image.repository(),
      image.tag(),
      image.digest().orElse(null),
      clock.instant(),
      SCANNER_NAME,
      jobName,
      rawOutput,
      parseError
    );
  }

  /**
   * Parses all findings in the output.
   *
   * @param root the output root
   * @return the vulnerability summary
   */
  VulnerabilitySummary parseVulnerabilities(JsonNode root) {
    List<VulnerabilityDetail> details = new ArrayList<>();

    for (JsonNode finding : findSection(root, "vulnerabilities")) {
      JsonNode packageNode = finding.get("package");
      String packageName;
      String packageVersion;
      if (packageNode != null && packageNode.isObject()) {
        packageName = textOrNull(packageNode, "name");
        packageVersion = textOrNull(packageNode, "version");
      } else {
        packageName = textOrNull(finding, "packageName");
        packageVersion = textOrNull(finding, "packageVersion");
      }

      details.add(new VulnerabilityDetail(
        firstText(finding, "qid", "id"),
        firstText(finding, "cve", "cveId"),
        Severity.normalize(finding.get("severity")),
        firstText(finding, "title", "name"),
        packageName,
        packageVersion,
        firstText(finding, "fixedVersion", "fix")
      ));
    }

    return VulnerabilitySummary.of(details);
  }

  /**
   * Parses all compliance checks in the output.
   *
   * @param root the output root
   * @return the compliance summary
   */
  ComplianceSummary parseCompliance(JsonNode root) {
    List<ComplianceCheck> checks = new ArrayList<>();

    for (JsonNode check : findSection(root, "compliance")) {
      String status = textOrNull(check, "status");
      checks.add(new ComplianceCheck(
        firstText(check, "id", "checkId"),
        firstText(check, "title", "name"),
        status == null ? "" : status.toUpperCase(Locale.ROOT),
        textOrNull(check, "description")
      ));
    }

    return ComplianceSummary.of(checks);
  }

  private static List<JsonNode> findSection(JsonNode root, String name) {
    JsonNode section = root.get(name);
    if (section == null) {
      JsonNode results = root.get("results");
      if (results != null && results.isObject()) {
        section = results.get(name);
      }
    }
    if (section == null || !section.isArray()) {
      return List.of();
    }

    List<JsonNode> entries = new ArrayList<>();
    for (JsonNode entry : section) {
      if (entry.isObject()) {
        entries.add(entry);
      } else {
        LOGGER.debug("Skipping non-object entry in '{}': {}", name, entry);
      }
    }
    return entries;
  }

  private static String firstText(JsonNode node, String primary, String fallback) {
    String value = textOrNull(node, primary);
    return value != null ? value : textOrNull(node, fallback);
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    String text = value.asText();
    return text.isEmpty() ? null : text;
  }

  private static String abbreviate(String output) {
    if (output == null || output.length() <= 500) {
      return output;
    }
    return output.substring(0, 500) + "...";
  }
}
