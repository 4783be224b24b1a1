package de.ialistannen.searchlight.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Throwables;
import de.ialistannen.searchlight.image.ImageReference;
import de.ialistannen.searchlight.image.ImageReferenceParser;
import de.ialistannen.searchlight.notifier.AlertDispatcher;
import de.ialistannen.searchlight.result.ScanResult;
import de.ialistannen.searchlight.scan.ScanOrchestrator;
import de.ialistannen.searchlight.storage.DeploymentLabels;
import de.ialistannen.searchlight.storage.ErrorRecord;
import de.ialistannen.searchlight.storage.ResultStore;
import de.ialistannen.searchlight.storage.ScanRecord;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles one deployment event: finds the deployed images and scans each of them in turn. A failing image is
 * recorded and does not stop the remaining ones.
 */
public class DeploymentEventHandler {

  public static final String CLOUD_RUN = "cloudrun";

  private static final Logger LOGGER = LoggerFactory.getLogger(DeploymentEventHandler.class);

  private final AuditEventDecoder decoder;
  private final ScanOrchestrator orchestrator;
  private final ResultStore resultStore;
  private final AlertDispatcher alertDispatcher;
  private final Duration cacheWindow;
  private final Clock clock;

  public DeploymentEventHandler(
    AuditEventDecoder decoder,
    ScanOrchestrator orchestrator,
    ResultStore resultStore,
    AlertDispatcher alertDispatcher,
    Duration cacheWindow,
    Clock clock
  ) {
    this.decoder = decoder;
    this.orchestrator = orchestrator;
    this.resultStore = resultStore;
    this.alertDispatcher = alertDispatcher;
    this.cacheWindow = cacheWindow;
    this.clock = clock;
  }

  public ScanBatchReport handle(String envelopeJson) throws InterruptedException {
    return handle(envelopeJson, false);
  }

  /**
   * Handles an event envelope. Events without payload, for other API methods or without images are ignored.
   *
   * @param envelopeJson the envelope as received
   * @param force whether to scan images even if they were scanned recently
   * @return what happened to the images
   * @throws EventDecodeException if the envelope or its payload is malformed
   * @throws InterruptedException if interrupted while waiting for a scan
   */
  public ScanBatchReport handle(String envelopeJson, boolean force) throws InterruptedException {
    EventEnvelope envelope = decoder.readEnvelope(envelopeJson);
    LOGGER.info("Processing event {}", envelope.eventId());

    Optional<JsonNode> auditLog = decoder.decodePayload(envelope);
    if (auditLog.isEmpty()) {
      LOGGER.warn("No data in message {}", envelope.eventId());
      return ScanBatchReport.empty();
    }

    DeploymentEvent event = DeploymentEvent.fromAuditLog(auditLog.get());
    LOGGER.info("Audit log method: {}", event.methodName());

    if (!event.isServiceDeployment()) {
      LOGGER.info("Ignoring non-deployment event: {}", event.methodName());
      return ScanBatchReport.empty();
    }
    LOGGER.info("Cloud Run service: {} in {}", event.serviceName(), event.location());

    if (event.images().isEmpty()) {
      LOGGER.warn("No container images found in service definition");
      return ScanBatchReport.empty();
    }
    LOGGER.info("Found {} container images to scan", event.images().size());

    DeploymentLabels labels = new DeploymentLabels(
      CLOUD_RUN,
      event.projectId(),
      event.serviceName(),
      event.location(),
      envelope.eventId()
    );
    return scanImages(event.images(), labels, force);
  }

  /**
   * Scans images one after another.
   *
   * @param images the raw image names
   * @param labels where the images are deployed
   * @param force whether to scan images even if they were scanned recently
   * @return what happened to the images
   * @throws InterruptedException if interrupted while waiting for a scan
   */
  public ScanBatchReport scanImages(List<String> images, DeploymentLabels labels, boolean force)
    throws InterruptedException {
    List<ScanRecord> scanned = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    List<String> failed = new ArrayList<>();

    for (String image : images) {
      LOGGER.info("Processing image: {}", image);
      try {
        Optional<ScanRecord> record = scanImage(image, labels, force);
        if (record.isPresent()) {
          scanned.add(record.get());
        } else {
          skipped.add(image);
        }
      } catch (RuntimeException e) {
        LOGGER.error("Error processing image {}", image, e);
        failed.add(image);
        resultStore.saveError(new ErrorRecord(clock.instant(), image, describe(e), labels.asTags()));
      }
    }

    LOGGER.info(
      "Processed {} images: {} scanned, {} skipped, {} failed",
      images.size(),
      scanned.size(),
      skipped.size(),
      failed.size()
    );
    return new ScanBatchReport(scanned, skipped, failed);
  }

  private Optional<ScanRecord> scanImage(String image, DeploymentLabels labels, boolean force)
    throws InterruptedException {
    ImageReference reference = ImageReferenceParser.parse(image);

    if (!force && resultStore.isRecentlyScanned(reference.fullName(), cacheWindow)) {
      LOGGER.info("Image {} was recently scanned, skipping", image);
      return Optional.empty();
    }

    ScanResult result = orchestrator.scanImage(reference, labels.asTags());
    ScanRecord record = ScanRecord.of(clock.instant(), image, labels, result);

    resultStore.saveScanResult(record);
    alertDispatcher.dispatch(record);

    return Optional.of(record);
  }

  private static String describe(Exception e) {
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    Throwable rootCause = Throwables.getRootCause(e);
    if (rootCause != e && rootCause.getMessage() != null) {
      message += ": " + rootCause.getMessage();
    }
    return message;
  }
}
