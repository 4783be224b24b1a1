package de.ialistannen.searchlight.result;

public enum ScanStatus {
  COMPLETED,
  /**
   * The scanner ran, but its output could not be decoded. The raw output is kept in the metadata.
   */
  PARSE_ERROR
}
