package com.p14n.lineageflow.broadcast;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Connection counts and per-session counters.
 *
 * @param lastHealthCheck time of the last health evaluation, null before the
 *                        first one
 */
public record BroadcasterStats(int totalSessions,
        int healthySessions,
        int zombieSessions,
        int replayBufferSize,
        long totalZombiesDetected,
        Map<String, Long> zombiesByReason,
        Instant lastHealthCheck,
        List<SessionSnapshot> sessions) {
}
