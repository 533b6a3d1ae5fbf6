package com.p14n.lineageflow.telemetry;

import java.time.Duration;

import com.p14n.lineageflow.data.ProcessingOutcome;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

public class QueueMetrics {
        private static final AttributeKey<String> QUEUE = AttributeKey.stringKey("queue");
        private static final AttributeKey<String> EVENT_TYPE = AttributeKey.stringKey("event_type");
        private static final AttributeKey<String> STATUS = AttributeKey.stringKey("status");

        private final LongCounter itemsProcessed;
        private final DoubleHistogram processingDuration;
        private final LongCounter deadLetterMoves;
        private final LongCounter leaseFailures;

        public QueueMetrics(Meter meter) {
                itemsProcessed = meter.counterBuilder("queue_items_processed")
                                .setDescription("Number of queue items handled, by outcome")
                                .build();

                processingDuration = meter.histogramBuilder("queue_processing_duration")
                                .setDescription("Time spent decoding and processing a queue item")
                                .setUnit("s")
                                .build();

                deadLetterMoves = meter.counterBuilder("queue_dead_letter_moves")
                                .setDescription("Number of items moved to the dead-letter queue")
                                .build();

                leaseFailures = meter.counterBuilder("queue_lease_failures")
                                .setDescription("Number of failed lease attempts")
                                .build();
        }

        public void recordOutcome(String queue, ProcessingOutcome outcome) {
                Attributes attrs = Attributes.of(QUEUE, queue,
                                EVENT_TYPE, outcome.eventType(),
                                STATUS, outcome.status());
                itemsProcessed.add(1, attrs);
                processingDuration.record(seconds(outcome.duration()), Attributes.of(QUEUE, queue,
                                EVENT_TYPE, outcome.eventType()));
        }

        public void recordDeadLetter(String queue) {
                deadLetterMoves.add(1, Attributes.of(QUEUE, queue));
        }

        public void recordLeaseFailure(String queue) {
                leaseFailures.add(1, Attributes.of(QUEUE, queue));
        }

        private static double seconds(Duration d) {
                return d.toNanos() / 1_000_000_000.0;
        }
}
