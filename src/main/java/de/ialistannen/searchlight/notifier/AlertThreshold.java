package de.ialistannen.searchlight.notifier;

import de.ialistannen.searchlight.result.VulnerabilitySummary;

/**
 * The lowest severity that triggers an alert.
 */
public enum AlertThreshold {
  CRITICAL {
    @Override
    public boolean isExceededBy(VulnerabilitySummary vulnerabilities) {
      return vulnerabilities.critical() > 0;
    }
  },
  HIGH {
    @Override
    public boolean isExceededBy(VulnerabilitySummary vulnerabilities) {
      return vulnerabilities.critical() > 0 || vulnerabilities.high() > 0;
    }
  };

  /**
   * @param vulnerabilities the findings of a scan
   * @return true if the findings warrant an alert
   */
  public abstract boolean isExceededBy(VulnerabilitySummary vulnerabilities);
}
