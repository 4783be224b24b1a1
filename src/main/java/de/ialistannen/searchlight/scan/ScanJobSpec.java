package de.ialistannen.searchlight.scan;

import de.ialistannen.searchlight.image.ImageReference;
import java.time.Duration;
import java.util.Map;

/**
 * Everything needed to create one scan job.
 *
 * @param jobName the unique job name, see {@link ScanJobNames}
 * @param image the image to scan
 * @param tags custom tags handed to the scanner, in iteration order
 * @param timeout the time the job may take
 */
public record ScanJobSpec(String jobName, ImageReference image, Map<String, String> tags, Duration timeout) {

}
