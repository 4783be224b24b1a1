package de.ialistannen.searchlight.storage;

import java.time.Instant;
import java.util.Map;

/**
 * A failed attempt at scanning an image.
 *
 * @param timestamp when the failure happened
 * @param image the image as it appeared in the deployment
 * @param error the error message
 * @param context deployment labels, see {@link DeploymentLabels#asTags()}
 */
public record ErrorRecord(Instant timestamp, String image, String error, Map<String, String> context) {

}
