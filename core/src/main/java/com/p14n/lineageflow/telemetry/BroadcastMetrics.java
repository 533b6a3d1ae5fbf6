package com.p14n.lineageflow.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

public class BroadcastMetrics {
        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");
        private static final AttributeKey<String> REASON = AttributeKey.stringKey("reason");

        private final LongCounter eventsPublished;
        private final LongUpDownCounter activeSessions;
        private final LongCounter zombieDetections;
        private final LongCounter queueFull;

        public BroadcastMetrics(Meter meter) {
                eventsPublished = meter.counterBuilder("broadcast_events_published")
                                .setDescription("Number of events published to subscribers")
                                .build();

                activeSessions = meter.upDownCounterBuilder("broadcast_active_sessions")
                                .setDescription("Number of connected subscriber sessions")
                                .build();

                zombieDetections = meter.counterBuilder("broadcast_zombie_detections")
                                .setDescription("Number of sessions flagged as zombies")
                                .build();

                queueFull = meter.counterBuilder("broadcast_queue_full")
                                .setDescription("Number of events dropped because a session queue was full")
                                .build();
        }

        public void recordPublished(String topic) {
                eventsPublished.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSessionAdded() {
                activeSessions.add(1);
        }

        public void recordSessionRemoved() {
                activeSessions.add(-1);
        }

        public void recordZombie(String reason) {
                zombieDetections.add(1, Attributes.of(REASON, reason));
        }

        public void recordQueueFull() {
                queueFull.add(1);
        }
}
