package com.p14n.lineageflow.broadcast;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.broker.AsyncExecutor;
import com.p14n.lineageflow.data.LivenessSettings;

/**
 * Periodically detects and evicts sessions that can no longer receive events.
 *
 * <p>
 * Two independent sweeps run on the executor:
 * </p>
 * <ul>
 * <li>the hard-timeout sweep flags and immediately evicts sessions that have
 * not been written to within the hard timeout</li>
 * <li>the health evaluation flags sessions whose counters exceed their
 * thresholds and evicts sessions flagged at least a grace period ago</li>
 * </ul>
 */
public class LivenessSupervisor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LivenessSupervisor.class);

    private final EventBroadcaster broadcaster;
    private final LivenessSettings settings;
    private final Clock clock;
    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();

    public LivenessSupervisor(EventBroadcaster broadcaster, LivenessSettings settings, Clock clock) {
        this.broadcaster = broadcaster;
        this.settings = settings;
        this.clock = clock;
    }

    public synchronized void start(AsyncExecutor executor) {
        if (!tasks.isEmpty()) {
            throw new IllegalStateException("Supervisor already started");
        }
        long sweep = settings.timeoutSweepInterval().toMillis();
        long health = settings.healthCheckInterval().toMillis();
        tasks.add(executor.scheduleAtFixedRate(this::sweepTimeouts, sweep, sweep, TimeUnit.MILLISECONDS));
        tasks.add(executor.scheduleAtFixedRate(this::evaluateHealth, health, health, TimeUnit.MILLISECONDS));
        logger.atInfo()
                .addArgument(settings.timeoutSweepInterval())
                .addArgument(settings.healthCheckInterval())
                .log("Liveness supervisor started (timeout sweep {}, health check {})");
    }

    /**
     * Flags and evicts every session not written to within the hard timeout.
     *
     * @return the number of sessions evicted
     */
    public int sweepTimeouts() {
        int evicted = 0;
        try {
            Instant now = clock.instant();
            for (SubscriberSession s : broadcaster.sessions()) {
                if (Duration.between(s.lastSendAt(), now).compareTo(settings.hardTimeout()) > 0
                        && broadcaster.evict(s.id(), ZombieReason.TIMEOUT)) {
                    evicted++;
                }
            }
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Timeout sweep failed");
        }
        return evicted;
    }

    /**
     * Flags unhealthy sessions and evicts those whose grace period has
     * passed.
     *
     * @return the number of sessions evicted
     */
    public int evaluateHealth() {
        int evicted = 0;
        try {
            Instant now = clock.instant();
            broadcaster.recordHealthCheck(now);
            for (SubscriberSession s : broadcaster.sessions()) {
                if (s.isZombie()) {
                    if (!now.isBefore(s.zombieSince().plus(settings.zombieGracePeriod()))
                            && broadcaster.unsubscribe(s.id())) {
                        evicted++;
                    }
                    continue;
                }
                ZombieReason reason = diagnose(s, now);
                if (reason != null) {
                    broadcaster.flagZombie(s, reason);
                }
            }
            if (evicted > 0) {
                logger.atInfo().addArgument(evicted).log("Evicted {} zombie sessions");
            }
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Health evaluation failed");
        }
        return evicted;
    }

    ZombieReason diagnose(SubscriberSession s, Instant now) {
        if (s.missedProbes() > settings.missedProbeThreshold()) {
            return ZombieReason.MISSED_PROBES;
        }
        if (s.queueFullCount() > settings.queueFullThreshold()) {
            return ZombieReason.QUEUE_FULL;
        }
        if (s.writeFailures() > settings.writeFailureThreshold()) {
            return ZombieReason.WRITE_FAILURES;
        }
        if (s.lastProbeAt() != null && s.lastAckAt() == null
                && Duration.between(s.connectedAt(), now).compareTo(settings.ackTimeout()) > 0) {
            return ZombieReason.NO_PROBE_ACK;
        }
        return null;
    }

    /** Cancels both sweeps. */
    @Override
    public synchronized void close() {
        for (ScheduledFuture<?> f : tasks) {
            f.cancel(false);
        }
        tasks.clear();
    }
}
