package com.p14n.lineageflow.data;

import java.time.Duration;

/**
 * Result of handling one queue item.
 *
 * @param eventType     Lineage event type, or {@code unknown} when the payload
 *                      could not be decoded
 * @param correlationId Run id of the event, may be null for undecodable
 *                      payloads
 * @param jobName       Job name, may be null
 * @param namespace     Job namespace
 * @param messageId     Queue message id
 * @param duration      Time spent decoding and processing
 * @param success       Whether the processor accepted the event
 * @param errorDetail   Failure description, null on success; never broadcast
 */
public record ProcessingOutcome(String eventType,
        String correlationId,
        String jobName,
        String namespace,
        long messageId,
        Duration duration,
        boolean success,
        String errorDetail) {

    public static final String UNKNOWN_EVENT_TYPE = "unknown";

    public String status() {
        return success ? "processed" : "failed";
    }
}
