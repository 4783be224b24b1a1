package de.ialistannen.searchlight.result;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;

/**
 * The severity buckets findings are counted in. Scanners report severities as numeric levels (5 = most severe) or as
 * free-form words, both are folded into one of these.
 */
public enum Severity {
  CRITICAL,
  HIGH,
  MEDIUM,
  LOW,
  INFORMATIONAL;

  /**
   * Normalizes a reported severity. Unknown values count as {@link #MEDIUM}.
   *
   * @param reported the reported severity, may be null
   * @return the bucket
   */
  public static Severity normalize(String reported) {
    if (reported == null) {
      return MEDIUM;
    }
    String value = reported.trim().toUpperCase(Locale.ROOT);

    switch (value) {
      case "5":
        return CRITICAL;
      case "4":
        return HIGH;
      case "3":
        return MEDIUM;
      case "2":
        return LOW;
      case "1":
        return INFORMATIONAL;
      default:
        break;
    }

    if (value.contains("CRIT")) {
      return CRITICAL;
    }
    if (value.contains("HIGH")) {
      return HIGH;
    }
    if (value.contains("MED")) {
      return MEDIUM;
    }
    if (value.contains("LOW")) {
      return LOW;
    }
    if (value.contains("INFO")) {
      return INFORMATIONAL;
    }
    return MEDIUM;
  }

  /**
   * Normalizes a severity straight from scanner json, where it may be a number or a string.
   *
   * @param node the severity node, may be null or missing
   * @return the bucket
   */
  public static Severity normalize(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return MEDIUM;
    }
    if (node.isIntegralNumber()) {
      return normalize(Long.toString(node.asLong()));
    }
    return normalize(node.asText());
  }
}
