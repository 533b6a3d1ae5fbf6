package com.p14n.lineageflow.data;

import java.time.Duration;

/**
 * Capacities, intervals and thresholds governing subscriber sessions.
 *
 * <p>
 * Thresholds are exclusive: a session is flagged when a counter
 * <em>exceeds</em> its threshold.
 * </p>
 *
 * @param sessionQueueCapacity  Bounded outbound queue size per session
 * @param replayCapacity        Number of events kept for replay
 * @param replayLength          Events replayed to a new session
 * @param heartbeatInterval     Idle wait before the delivery loop sends a
 *                              heartbeat or probe
 * @param probeInterval         Minimum gap between liveness probes
 * @param hardTimeout           Silence after which a session is evicted
 * @param timeoutSweepInterval  Period of the hard-timeout sweep
 * @param healthCheckInterval   Period of the health evaluation
 * @param missedProbeThreshold  Unacknowledged probes tolerated
 * @param queueFullThreshold    Consecutive full-queue events tolerated
 * @param writeFailureThreshold Consecutive write failures tolerated
 * @param ackTimeout            Time after connect by which a probe must have
 *                              been acknowledged
 * @param zombieGracePeriod     How long a flagged session lingers before
 *                              eviction
 */
public record LivenessSettings(int sessionQueueCapacity,
        int replayCapacity,
        int replayLength,
        Duration heartbeatInterval,
        Duration probeInterval,
        Duration hardTimeout,
        Duration timeoutSweepInterval,
        Duration healthCheckInterval,
        int missedProbeThreshold,
        int queueFullThreshold,
        int writeFailureThreshold,
        Duration ackTimeout,
        Duration zombieGracePeriod) {

    public LivenessSettings {
        if (sessionQueueCapacity < 1) {
            throw new IllegalArgumentException("Session queue capacity must be at least 1");
        }
        if (replayCapacity < 0 || replayLength < 0) {
            throw new IllegalArgumentException("Replay sizes cannot be negative");
        }
    }

    public static LivenessSettings defaults() {
        return new LivenessSettings(100, 1000, 50,
                Duration.ofSeconds(30),
                Duration.ofSeconds(45),
                Duration.ofSeconds(120),
                Duration.ofSeconds(30),
                Duration.ofSeconds(60),
                3, 10, 3,
                Duration.ofSeconds(90),
                Duration.ofSeconds(60));
    }

    public LivenessSettings withSessionQueueCapacity(int capacity) {
        return new LivenessSettings(capacity, replayCapacity, replayLength, heartbeatInterval, probeInterval,
                hardTimeout, timeoutSweepInterval, healthCheckInterval, missedProbeThreshold, queueFullThreshold,
                writeFailureThreshold, ackTimeout, zombieGracePeriod);
    }

    public LivenessSettings withHeartbeat(Duration heartbeat, Duration probe) {
        return new LivenessSettings(sessionQueueCapacity, replayCapacity, replayLength, heartbeat, probe,
                hardTimeout, timeoutSweepInterval, healthCheckInterval, missedProbeThreshold, queueFullThreshold,
                writeFailureThreshold, ackTimeout, zombieGracePeriod);
    }

    public LivenessSettings withReplay(int capacity, int length) {
        return new LivenessSettings(sessionQueueCapacity, capacity, length, heartbeatInterval, probeInterval,
                hardTimeout, timeoutSweepInterval, healthCheckInterval, missedProbeThreshold, queueFullThreshold,
                writeFailureThreshold, ackTimeout, zombieGracePeriod);
    }
}
