package com.p14n.lineageflow.broadcast;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.data.LivenessSettings;
import com.p14n.lineageflow.telemetry.BroadcastMetrics;

import io.opentelemetry.api.OpenTelemetry;

/**
 * In-memory hub fanning events out to connected subscriber sessions.
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li>One bounded outbound queue per session, written with a non-blocking
 * offer</li>
 * <li>A bounded replay buffer backfilling new sessions with recent events</li>
 * <li>Zombie flagging for sessions that stop keeping up</li>
 * </ul>
 *
 * <p>
 * The session table and the replay buffer are mutated only under a single
 * lock, so a session receives events on a topic in publish order. No I/O
 * happens while the lock is held. A flagged session no longer receives
 * events but stays in the table until it is evicted.
 * </p>
 */
public class EventBroadcaster implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventBroadcaster.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final ConcurrentHashMap<String, SubscriberSession> sessions = new ConcurrentHashMap<>();
    private final ReplayBuffer replay;
    private final LivenessSettings settings;
    private final Clock clock;
    private final BroadcastMetrics metrics;
    private final Map<ZombieReason, AtomicLong> zombieTally = new EnumMap<>(ZombieReason.class);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Instant lastHealthCheck;

    public EventBroadcaster(LivenessSettings settings, Clock clock, OpenTelemetry ot) {
        this.settings = settings;
        this.clock = clock;
        this.replay = new ReplayBuffer(settings.replayCapacity());
        this.metrics = new BroadcastMetrics(ot.getMeter("lineageflow-broadcast"));
        for (ZombieReason r : ZombieReason.values()) {
            zombieTally.put(r, new AtomicLong());
        }
    }

    /**
     * Records the event for replay and offers it to every live session
     * subscribed to its topic. Never blocks on a slow session: a full queue
     * drops the event for that session.
     *
     * @param event the event to publish
     * @throws IllegalStateException    if the broadcaster is closed
     * @throws IllegalArgumentException if the event is null
     */
    public void publish(BroadcastEvent event) {
        if (closed.get()) {
            throw new IllegalStateException("Broadcaster is closed");
        }
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }

        lock.lock();
        try {
            replay.add(event);
            for (SubscriberSession session : sessions.values()) {
                if (session.isZombie() || !session.subscribedTo(event.topic())) {
                    continue;
                }
                if (!session.enqueue(event)) {
                    metrics.recordQueueFull();
                    logger.atDebug()
                            .addArgument(session.id())
                            .addArgument(event.id())
                            .log("Session {} queue full, dropped event {}");
                    if (session.queueFullCount() > settings.queueFullThreshold()) {
                        flagZombie(session, ZombieReason.QUEUE_FULL);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        metrics.recordPublished(event.topic().wireName());
    }

    /**
     * Creates a session for the given topics and queues the most recent
     * buffered events on those topics, oldest first. Replay stops quietly if
     * the session queue fills.
     *
     * @param topics topics to receive, all subscribable
     * @return the new session
     * @throws IllegalStateException    if the broadcaster is closed
     * @throws IllegalArgumentException if topics are null, empty or include a
     *                                  liveness topic
     */
    public SubscriberSession subscribe(Set<Topic> topics) {
        if (closed.get()) {
            throw new IllegalStateException("Broadcaster is closed");
        }
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("Topics cannot be null or empty");
        }
        for (Topic t : topics) {
            if (t == null || !t.subscribable()) {
                throw new IllegalArgumentException("Cannot subscribe to topic: " + t);
            }
        }

        SubscriberSession session = new SubscriberSession(UUID.randomUUID().toString(), topics,
                settings.sessionQueueCapacity(), clock.instant());
        int replayed = 0;
        lock.lock();
        try {
            sessions.put(session.id(), session);
            for (BroadcastEvent e : replay.recent(topics, settings.replayLength())) {
                if (!session.enqueueReplay(e)) {
                    break;
                }
                replayed++;
            }
        } finally {
            lock.unlock();
        }
        metrics.recordSessionAdded();
        logger.atInfo()
                .addArgument(session.id())
                .addArgument(session.topics())
                .addArgument(replayed)
                .log("Session {} subscribed to {} with {} replayed events");
        return session;
    }

    /**
     * Removes a session. Idempotent.
     *
     * @return true if the session was present
     */
    public boolean unsubscribe(String sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("Session id cannot be null");
        }
        SubscriberSession removed;
        lock.lock();
        try {
            removed = sessions.remove(sessionId);
            if (removed != null) {
                removed.markRemoved();
            }
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        metrics.recordSessionRemoved();
        logger.atInfo()
                .addArgument(sessionId)
                .addArgument(removed.isZombie() ? removed.zombieReason().label() : "disconnect")
                .log("Session {} removed ({})");
        return true;
    }

    /**
     * Flags the session as a zombie if it is not one already, then removes it.
     */
    public boolean evict(String sessionId, ZombieReason reason) {
        SubscriberSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        flagZombie(session, reason);
        return unsubscribe(sessionId);
    }

    /**
     * Flags a session as a zombie. The first reason wins; later calls do
     * nothing.
     *
     * @return true if this call flagged the session
     */
    public boolean flagZombie(SubscriberSession session, ZombieReason reason) {
        if (!session.markZombie(reason, clock.instant())) {
            return false;
        }
        zombieTally.get(reason).incrementAndGet();
        metrics.recordZombie(reason.label());
        logger.atWarn()
                .addArgument(session.id())
                .addArgument(reason.label())
                .log("Session {} flagged as zombie: {}");
        return true;
    }

    /**
     * Acknowledges a liveness probe, resetting the session's missed probe
     * count.
     *
     * @return false if the session or probe is unknown
     */
    public boolean acknowledgeProbe(String sessionId, String probeId) {
        if (sessionId == null) {
            return false;
        }
        SubscriberSession session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        boolean acked = session.acknowledgeProbe(probeId, clock.instant());
        if (acked) {
            logger.atDebug().addArgument(probeId).addArgument(sessionId).log("Probe {} acknowledged by {}");
        }
        return acked;
    }

    /** Removes every session currently flagged as a zombie. */
    public CleanupResult cleanupZombies() {
        List<String> zombies = sessions.values().stream()
                .filter(SubscriberSession::isZombie)
                .map(SubscriberSession::id)
                .collect(Collectors.toList());
        int removed = 0;
        for (String id : zombies) {
            if (unsubscribe(id)) {
                removed++;
            }
        }
        logger.atInfo().addArgument(removed).log("Zombie cleanup removed {} sessions");
        return new CleanupResult(zombies.size(), removed);
    }

    public SubscriberSession session(String sessionId) {
        return sessions.get(sessionId);
    }

    /** A copy of the current sessions, oldest first. */
    public List<SubscriberSession> sessions() {
        List<SubscriberSession> copy = new ArrayList<>(sessions.values());
        copy.sort(Comparator.comparing(SubscriberSession::connectedAt));
        return copy;
    }

    void recordHealthCheck(Instant at) {
        lastHealthCheck = at;
    }

    public BroadcasterStats stats() {
        Instant now = clock.instant();
        List<SessionSnapshot> snapshots = sessions().stream()
                .map(s -> s.snapshot(now))
                .collect(Collectors.toList());
        int zombies = (int) snapshots.stream().filter(SessionSnapshot::zombie).count();
        int buffered;
        lock.lock();
        try {
            buffered = replay.size();
        } finally {
            lock.unlock();
        }
        return new BroadcasterStats(snapshots.size(),
                snapshots.size() - zombies,
                zombies,
                buffered,
                totalZombiesDetected(),
                zombiesByReason(),
                lastHealthCheck,
                snapshots);
    }

    public ZombieReport zombieReport() {
        Instant now = clock.instant();
        List<SessionSnapshot> zombies = sessions().stream()
                .filter(SubscriberSession::isZombie)
                .map(s -> s.snapshot(now))
                .collect(Collectors.toList());
        return new ZombieReport(zombies.size(), totalZombiesDetected(), zombiesByReason(), lastHealthCheck, zombies);
    }

    private long totalZombiesDetected() {
        return zombieTally.values().stream().mapToLong(AtomicLong::get).sum();
    }

    private Map<String, Long> zombiesByReason() {
        Map<String, Long> byReason = new LinkedHashMap<>();
        zombieTally.forEach((reason, count) -> byReason.put(reason.label(), count.get()));
        return byReason;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Removes all sessions, waking their delivery loops. Later publishes and
     * subscriptions fail.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        lock.lock();
        try {
            for (SubscriberSession s : sessions.values()) {
                s.markRemoved();
                metrics.recordSessionRemoved();
            }
            sessions.clear();
        } finally {
            lock.unlock();
        }
        logger.atInfo().log("Broadcaster closed");
    }
}
