package de.ialistannen.searchlight.storage;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Stores {@link ScanIndexEntry index entries} keyed by scan id.
 */
public interface MetadataStore {

  /**
   * Stores an entry, replacing an existing one with the same scan id.
   *
   * @param entry the entry
   * @throws IOException if writing fails
   */
  void put(ScanIndexEntry entry) throws IOException;

  /**
   * Finds the newest entries for an image.
   *
   * @param sanitizedImageName the {@link NameSanitizer sanitized} canonical image name
   * @param since the earliest timestamp to include
   * @param limit the maximum number of entries to return
   * @return matching entries, newest first
   * @throws IOException if reading fails
   */
  List<ScanIndexEntry> findRecent(String sanitizedImageName, Instant since, int limit) throws IOException;
}
