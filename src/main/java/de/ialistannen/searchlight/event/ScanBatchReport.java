package de.ialistannen.searchlight.event;

import de.ialistannen.searchlight.storage.ScanRecord;
import java.util.List;

/**
 * What happened to the images of one event.
 *
 * @param scanned the records of all images that were scanned
 * @param skipped the images that were skipped because they were scanned recently
 * @param failed the images whose scan failed
 */
public record ScanBatchReport(List<ScanRecord> scanned, List<String> skipped, List<String> failed) {

  public static ScanBatchReport empty() {
    return new ScanBatchReport(List.of(), List.of(), List.of());
  }
}
