package com.p14n.lineageflow.queue;

import static com.p14n.lineageflow.telemetry.OpenTelemetryFunctions.processWithTelemetry;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.broadcast.ErrorNotice;
import com.p14n.lineageflow.broadcast.EventPublisher;
import com.p14n.lineageflow.broadcast.QueueItemProcessed;
import com.p14n.lineageflow.data.EnvelopeDecodeException;
import com.p14n.lineageflow.data.EnvelopeDecoder;
import com.p14n.lineageflow.data.LineageEvent;
import com.p14n.lineageflow.data.LineageFlowConfig;
import com.p14n.lineageflow.data.ProcessingOutcome;
import com.p14n.lineageflow.data.QueueItem;
import com.p14n.lineageflow.telemetry.QueueMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * Consumes lineage events from the source queue.
 *
 * <p>
 * Each item is decoded and passed to the {@link EventProcessor}. Accepted
 * items are deleted; rejected or undecodable items go to the
 * {@link DeadLetterSink}. Every item yields a {@link ProcessingOutcome} that is
 * recorded in metrics and published as a {@code queue-item-processed} event.
 * A failed lease publishes a generic {@code error} event and is retried after
 * a backoff, without limit.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * QueueConsumer consumer = new QueueConsumer(store, processor, sink, pump, config, ot);
 * executor.submit(() -> { consumer.run(); return null; });
 * ...
 * consumer.stop();
 * consumer.awaitStopped(Duration.ofSeconds(10));
 * }</pre>
 */
public class QueueConsumer extends PollingWorker {
    private static final Logger logger = LoggerFactory.getLogger(QueueConsumer.class);

    private final WorkQueueStore store;
    private final EventProcessor processor;
    private final DeadLetterSink deadLetters;
    private final EventPublisher publisher;
    private final EnvelopeDecoder decoder = new EnvelopeDecoder();
    private final String queue;
    private final int batchSize;
    private final Duration pollInterval;
    private final Duration visibilityWindow;
    private final QueueMetrics metrics;
    private final Tracer tracer;

    public QueueConsumer(WorkQueueStore store,
            EventProcessor processor,
            DeadLetterSink deadLetters,
            EventPublisher publisher,
            LineageFlowConfig cfg,
            OpenTelemetry ot) {
        super("Queue consumer[" + cfg.queueName() + "]", cfg.leaseFailureBackoff());
        this.store = store;
        this.processor = processor;
        this.deadLetters = deadLetters;
        this.publisher = publisher;
        this.queue = cfg.queueName();
        this.batchSize = cfg.batchSize();
        this.pollInterval = cfg.pollInterval();
        this.visibilityWindow = cfg.visibilityWindow();
        this.metrics = new QueueMetrics(ot.getMeter("lineageflow-queue"));
        this.tracer = ot.getTracer("lineageflow-queue");
    }

    @Override
    protected void pollOnce() {
        List<QueueItem> batch = store.lease(queue, batchSize, visibilityWindow, pollInterval);
        if (!batch.isEmpty()) {
            logger.atDebug().addArgument(batch.size()).addArgument(queue).log("Leased {} items from {}");
        }
        for (QueueItem item : batch) {
            try {
                handle(item);
            } catch (RuntimeException e) {
                logger.atError().setCause(e).addArgument(item.messageId()).log("Unexpected failure handling message {}");
            }
        }
    }

    @Override
    protected void onPollFailure(RuntimeException e) {
        metrics.recordLeaseFailure(queue);
        publisher.publish(ErrorNotice.queueUnavailable());
    }

    /**
     * Processes one item and reports its outcome.
     *
     * @return the outcome
     */
    ProcessingOutcome handle(QueueItem item) {
        long start = System.nanoTime();
        ProcessingOutcome outcome = processWithTelemetry(tracer, "process_queue_item", queue, item.messageId(),
                () -> process(item, start));
        metrics.recordOutcome(queue, outcome);
        publisher.publish(QueueItemProcessed.from(outcome));
        if (!outcome.success()) {
            publisher.publish(ErrorNotice.itemDeadLettered());
        }
        return outcome;
    }

    private ProcessingOutcome process(QueueItem item, long start) {
        LineageEvent event;
        try {
            event = decoder.decode(item.payload());
        } catch (EnvelopeDecodeException e) {
            logger.atWarn().addArgument(item.messageId()).addArgument(e.getMessage())
                    .log("Message {} could not be decoded: {}");
            String error = "Decode failed: " + e.getMessage();
            deadLetter(item, error);
            return new ProcessingOutcome(ProcessingOutcome.UNKNOWN_EVENT_TYPE, null, null, null,
                    item.messageId(), elapsed(start), false, error);
        }

        String error = null;
        boolean ok;
        try {
            ok = processor.process(event);
            if (!ok) {
                error = "Event processor rejected the event";
            }
        } catch (RuntimeException e) {
            ok = false;
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
            logger.atError().setCause(e).addArgument(item.messageId()).log("Processor failed for message {}");
        }

        if (ok) {
            try {
                store.delete(queue, item.messageId());
            } catch (QueueStoreException e) {
                logger.atWarn().setCause(e).addArgument(item.messageId())
                        .log("Message {} processed but not deleted; it will be redelivered");
            }
        } else {
            deadLetter(item, error);
        }

        return new ProcessingOutcome(event.eventType(), event.runId(), event.jobName(), event.jobNamespace(),
                item.messageId(), elapsed(start), ok, error);
    }

    private void deadLetter(QueueItem item, String error) {
        if (deadLetters.deadLetter(queue, item, error)) {
            metrics.recordDeadLetter(queue);
        }
    }

    private static Duration elapsed(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    public String queueName() {
        return queue;
    }
}
