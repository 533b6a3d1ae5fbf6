package com.p14n.lineageflow.broadcast;

import com.p14n.lineageflow.data.ProcessingOutcome;

/**
 * Outcome of one queue item. Failure details stay server side.
 */
public record QueueItemProcessed(String eventType,
        String runId,
        String jobName,
        String namespace,
        long messageId,
        String status,
        boolean success,
        double processingDurationMs) implements EventPayload {

    public static QueueItemProcessed from(ProcessingOutcome outcome) {
        return new QueueItemProcessed(outcome.eventType(),
                outcome.correlationId(),
                outcome.jobName(),
                outcome.namespace(),
                outcome.messageId(),
                outcome.status(),
                outcome.success(),
                outcome.duration().toNanos() / 1_000_000.0);
    }

    @Override
    public Topic topic() {
        return Topic.QUEUE_ITEM_PROCESSED;
    }
}
