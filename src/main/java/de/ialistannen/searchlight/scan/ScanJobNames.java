package de.ialistannen.searchlight.scan;

import de.ialistannen.searchlight.image.ImageReference;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Generates job names. Names consist of {@code [a-z0-9-]} only, are at most 63 characters long and end with a
 * {@code yyyyMMddHHmmss} UTC timestamp.
 */
public class ScanJobNames {

  public static final int MAX_LENGTH = 63;

  private static final String PREFIX = "qscanner-";
  private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
    .withZone(ZoneOffset.UTC);
  // "-" + timestamp
  private static final int MAX_BASE_LENGTH = MAX_LENGTH - 1 - 14;

  private final Clock clock;

  public ScanJobNames(Clock clock) {
    this.clock = clock;
  }

  /**
   * @param image the image the job scans
   * @return a fresh job name for it
   */
  public String generate(ImageReference image) {
    String base = (PREFIX + image.repository().replace('/', '-') + "-" + image.tag()).toLowerCase(Locale.ROOT);
    base = base.replaceAll("[^a-z0-9-]", "-");

    if (base.length() > MAX_BASE_LENGTH) {
      base = base.substring(0, MAX_BASE_LENGTH);
    }

    return base + "-" + TIMESTAMP_FORMAT.format(clock.instant());
  }
}
