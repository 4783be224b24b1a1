package de.ialistannen.searchlight.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.ialistannen.searchlight.util.BestEffort;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists scan results in two tiers: the full record as a json document in the {@link BlobStore}, and a compact
 * {@link ScanIndexEntry} in the {@link MetadataStore} for the "scanned recently" check. Both are keyed by the
 * {@link NameSanitizer sanitized} canonical image name.
 */
public class ResultStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResultStore.class);

  private final BlobStore blobStore;
  private final MetadataStore metadataStore;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ResultStore(BlobStore blobStore, MetadataStore metadataStore, ObjectMapper objectMapper, Clock clock) {
    this.blobStore = blobStore;
    this.metadataStore = metadataStore;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Makes sure the blob store exists. Failures are only logged, the first write will report them again.
   */
  public void initialize() {
    BestEffort.run("ensuring the result store exists", blobStore::ensureExists);
  }

  /**
   * Saves a scan record.
   *
   * @param record the record
   * @return the index entry that was written
   * @throws StorageException if either tier could not be written
   */
  public ScanIndexEntry saveScanResult(ScanRecord record) {
    String sanitizedName = NameSanitizer.sanitize(record.fullName());
    String blobPath = sanitizedName + "/" + NameSanitizer.sanitize(record.scanId()) + ".json";

    try {
      blobStore.put(blobPath, toJson(record));
      LOGGER.info("Saved scan result to {}", blobPath);

      ScanIndexEntry entry = new ScanIndexEntry(
        record.scanId(),
        record.image(),
        record.fullName(),
        record.timestamp(),
        record.status(),
        record.containerType(),
        record.vulnerabilities().critical(),
        record.vulnerabilities().high(),
        record.vulnerabilities().medium(),
        record.vulnerabilities().low(),
        record.vulnerabilities().total(),
        record.compliance().passed(),
        record.compliance().failed(),
        blobPath,
        sanitizedName
      );
      metadataStore.put(entry);
      LOGGER.info("Saved scan metadata for {}", record.scanId());

      return entry;
    } catch (IOException e) {
      LOGGER.error("Error saving scan result for {}", record.image(), e);
      throw new StorageException("Failed to save scan result " + record.scanId(), e);
    }
  }

  /**
   * Saves an error record. Failures are logged, never thrown.
   *
   * @param record the record
   */
  public void saveError(ErrorRecord record) {
    String blobPath = "errors/" + NameSanitizer.sanitize(record.image()) + "/" + NameSanitizer.sanitize(record.timestamp().toString()) + ".json";

    if (BestEffort.run("saving error record " + blobPath, () -> blobStore.put(blobPath, toJson(record)))) {
      LOGGER.info("Saved error record to {}", blobPath);
    }
  }

  /**
   * Checks whether an image was scanned within the given window. Fails open: if the metadata store can not be
   * queried, the image counts as not scanned.
   *
   * @param fullName the canonical image name
   * @param window the window
   * @return true if a scan of the image was recorded within the window
   */
  public boolean isRecentlyScanned(String fullName, Duration window) {
    Instant cutoff = clock.instant().minus(window);
    try {
      List<ScanIndexEntry> recent = metadataStore.findRecent(NameSanitizer.sanitize(fullName), cutoff, 1);
      if (!recent.isEmpty()) {
        LOGGER.info("Found recent scan {} for {}", recent.get(0).scanId(), fullName);
        return true;
      }
      return false;
    } catch (IOException | UncheckedIOException | StorageException e) {
      LOGGER.warn("Error checking recent scans for {}, scanning anyway", fullName, e);
      return false;
    }
  }

  private String toJson(Object value) throws JsonProcessingException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
  }
}
