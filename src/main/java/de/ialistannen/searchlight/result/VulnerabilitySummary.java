package de.ialistannen.searchlight.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Finding counts per severity bucket, plus the findings themselves in the order the scanner reported them.
 */
public record VulnerabilitySummary(
  @JsonProperty("CRITICAL") int critical,
  @JsonProperty("HIGH") int high,
  @JsonProperty("MEDIUM") int medium,
  @JsonProperty("LOW") int low,
  @JsonProperty("INFORMATIONAL") int informational,
  @JsonProperty("total") int total,
  @JsonProperty("details") List<VulnerabilityDetail> details
) {

  public static VulnerabilitySummary empty() {
    return of(List.of());
  }

  /**
   * Counts the given findings.
   *
   * @param details the findings
   * @return the summary
   */
  public static VulnerabilitySummary of(List<VulnerabilityDetail> details) {
    Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
    for (VulnerabilityDetail detail : details) {
      counts.merge(detail.severity(), 1, Integer::sum);
    }

    return new VulnerabilitySummary(
      counts.getOrDefault(Severity.CRITICAL, 0),
      counts.getOrDefault(Severity.HIGH, 0),
      counts.getOrDefault(Severity.MEDIUM, 0),
      counts.getOrDefault(Severity.LOW, 0),
      counts.getOrDefault(Severity.INFORMATIONAL, 0),
      details.size(),
      List.copyOf(details)
    );
  }

  @JsonIgnore
  public int count(Severity severity) {
    return switch (severity) {
      case CRITICAL -> critical();
      case HIGH -> high();
      case MEDIUM -> medium();
      case LOW -> low();
      case INFORMATIONAL -> informational();
    };
  }
}
