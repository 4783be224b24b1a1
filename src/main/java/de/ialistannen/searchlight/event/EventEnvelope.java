package de.ialistannen.searchlight.event;

import java.util.Optional;

/**
 * A delivered message, before its payload is decoded.
 *
 * @param eventId the id the transport assigned, {@code unknown} if it did not send one
 * @param data the base64 encoded payload, if any
 */
public record EventEnvelope(String eventId, Optional<String> data) {

}
