package com.p14n.lineageflow.broadcast;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a session for the admin endpoints.
 */
public record SessionSnapshot(String sessionId,
        List<String> topics,
        Instant connectedAt,
        double connectedSeconds,
        Instant lastSendAt,
        Instant lastProbeAt,
        Instant lastAckAt,
        int probeCount,
        int missedProbes,
        int queueFullCount,
        int writeFailures,
        int queueSize,
        boolean zombie,
        String zombieReason,
        Instant zombieSince,
        Double zombieSeconds) {
}
