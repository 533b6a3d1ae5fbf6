package com.p14n.lineageflow.data;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Decodes queue payloads into {@link LineageEvent}s and validates the fields
 * the consumer depends on.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * EnvelopeDecoder decoder = new EnvelopeDecoder();
 * LineageEvent event = decoder.decode(item.payload());
 * }</pre>
 */
public class EnvelopeDecoder {

    /**
     * Decodes a payload.
     *
     * @param payload the raw queue payload
     * @return the decoded event
     * @throws EnvelopeDecodeException if the payload is not valid JSON or is
     *                                 missing the event type, run id or job
     *                                 name
     */
    public LineageEvent decode(String payload) throws EnvelopeDecodeException {
        if (payload == null || payload.isBlank()) {
            throw new EnvelopeDecodeException("Payload is empty");
        }
        LineageEvent event;
        try {
            event = JsonSupport.MAPPER.readValue(payload, LineageEvent.class);
        } catch (JsonProcessingException e) {
            throw new EnvelopeDecodeException("Payload is not a valid lineage event: " + e.getOriginalMessage(), e);
        }
        if (event == null) {
            throw new EnvelopeDecodeException("Payload is null");
        }
        if (event.eventType() == null || event.eventType().isBlank()) {
            throw new EnvelopeDecodeException("eventType is required");
        }
        if (event.runId() == null || event.runId().isBlank()) {
            throw new EnvelopeDecodeException("run.runId is required");
        }
        if (event.jobName() == null || event.jobName().isBlank()) {
            throw new EnvelopeDecodeException("job.name is required");
        }
        return event;
    }
}
