package de.ialistannen.searchlight.storage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import de.ialistannen.searchlight.result.ScanStatus;
import java.time.Instant;

/**
 * The compact, queryable part of a stored scan. The full record lives in the blob store at {@link #blobPath()}.
 */
@JsonNaming(SnakeCaseStrategy.class)
public record ScanIndexEntry(
  String scanId,
  String image,
  String fullName,
  Instant timestamp,
  ScanStatus status,
  String containerType,
  int vulnCritical,
  int vulnHigh,
  int vulnMedium,
  int vulnLow,
  int vulnTotal,
  int compliancePassed,
  int complianceFailed,
  String blobPath,
  String sanitizedImageName
) {

}
