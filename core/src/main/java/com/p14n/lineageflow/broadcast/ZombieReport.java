package com.p14n.lineageflow.broadcast;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ZombieReport(int zombieCount,
        long totalZombiesDetected,
        Map<String, Long> zombiesByReason,
        Instant lastHealthCheck,
        List<SessionSnapshot> zombies) {
}
