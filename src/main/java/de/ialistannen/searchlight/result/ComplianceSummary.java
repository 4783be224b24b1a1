package de.ialistannen.searchlight.result;

import java.util.List;
import java.util.Set;

/**
 * Pass/fail counts of compliance checks. Checks with any other status only count towards the total.
 */
public record ComplianceSummary(int passed, int failed, int total, List<ComplianceCheck> checks) {

  private static final Set<String> PASSED = Set.of("PASS", "PASSED");
  private static final Set<String> FAILED = Set.of("FAIL", "FAILED");

  public static ComplianceSummary empty() {
    return of(List.of());
  }

  public static ComplianceSummary of(List<ComplianceCheck> checks) {
    int passed = 0;
    int failed = 0;
    for (ComplianceCheck check : checks) {
      if (PASSED.contains(check.status())) {
        passed++;
      } else if (FAILED.contains(check.status())) {
        failed++;
      }
    }
    return new ComplianceSummary(passed, failed, checks.size(), List.copyOf(checks));
  }
}
