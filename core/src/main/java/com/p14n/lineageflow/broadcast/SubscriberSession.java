package com.p14n.lineageflow.broadcast;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Server-side state of one streaming connection.
 *
 * <p>
 * The outbound queue has a single writer, the {@link EventBroadcaster}, and a
 * single reader, the session's {@link DeliveryLoop}. Counters and timestamps
 * are updated by the delivery loop, the broadcaster and the
 * {@link LivenessSupervisor}, so each is individually atomic or volatile.
 * </p>
 */
public class SubscriberSession {

    private static final BroadcastEvent WAKE = new BroadcastEvent(Topic.LIVENESS_HEARTBEAT,
            new Heartbeat(""), "wake", Instant.EPOCH);

    private record ZombieMark(ZombieReason reason, Instant at) {
    }

    private final String id;
    private final Set<Topic> topics;
    private final ArrayBlockingQueue<BroadcastEvent> outbound;
    private final Instant connectedAt;

    private volatile Instant lastSendAt;
    private volatile Instant lastProbeAt;
    private volatile Instant lastAckAt;
    private volatile boolean removed;

    private final AtomicInteger probeCount = new AtomicInteger();
    private final AtomicInteger missedProbes = new AtomicInteger();
    private final AtomicInteger queueFullCount = new AtomicInteger();
    private final AtomicInteger writeFailures = new AtomicInteger();
    private final AtomicReference<ZombieMark> zombie = new AtomicReference<>();
    private final Set<String> outstandingProbes = ConcurrentHashMap.newKeySet();

    public SubscriberSession(String id, Set<Topic> topics, int queueCapacity, Instant connectedAt) {
        if (id == null) {
            throw new IllegalArgumentException("Session id cannot be null");
        }
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("Topics cannot be null or empty");
        }
        this.id = id;
        this.topics = Set.copyOf(EnumSet.copyOf(topics));
        this.outbound = new ArrayBlockingQueue<>(queueCapacity);
        this.connectedAt = connectedAt;
        this.lastSendAt = connectedAt;
    }

    public String id() {
        return id;
    }

    public Set<Topic> topics() {
        return topics;
    }

    public boolean subscribedTo(Topic topic) {
        return topics.contains(topic);
    }

    /**
     * Offers an event without blocking. A successful offer resets the
     * consecutive full-queue counter; a failed one increments it.
     *
     * @return true if the event was queued
     */
    boolean enqueue(BroadcastEvent event) {
        if (outbound.offer(event)) {
            queueFullCount.set(0);
            return true;
        }
        queueFullCount.incrementAndGet();
        return false;
    }

    /** Queues a replayed event; a full queue is not counted against the session. */
    boolean enqueueReplay(BroadcastEvent event) {
        return outbound.offer(event);
    }

    /**
     * Waits for the next event.
     *
     * @return the event, or null on timeout or when the session was removed
     */
    BroadcastEvent next(Duration timeout) throws InterruptedException {
        BroadcastEvent e = outbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        return e == WAKE ? null : e;
    }

    void recordSendSuccess(Instant now) {
        writeFailures.set(0);
        lastSendAt = now;
    }

    /** @return the consecutive write failure count after this failure */
    int recordWriteFailure() {
        return writeFailures.incrementAndGet();
    }

    /**
     * Registers a new outstanding probe. Counts it as missed until the client
     * acknowledges it.
     *
     * @return the probe id
     */
    String recordProbeSent(Instant now) {
        String probeId = UUID.randomUUID().toString();
        outstandingProbes.add(probeId);
        probeCount.incrementAndGet();
        missedProbes.incrementAndGet();
        lastProbeAt = now;
        return probeId;
    }

    /**
     * @return true if the probe was outstanding
     */
    boolean acknowledgeProbe(String probeId, Instant now) {
        if (probeId == null || !outstandingProbes.remove(probeId)) {
            return false;
        }
        missedProbes.set(0);
        lastAckAt = now;
        return true;
    }

    /**
     * Flags the session as a zombie. Only the first call has any effect.
     *
     * @return true if this call flagged the session
     */
    boolean markZombie(ZombieReason reason, Instant now) {
        return zombie.compareAndSet(null, new ZombieMark(reason, now));
    }

    void markRemoved() {
        removed = true;
        outbound.clear();
        outbound.offer(WAKE);
    }

    public boolean isRemoved() {
        return removed;
    }

    public boolean isZombie() {
        return zombie.get() != null;
    }

    public ZombieReason zombieReason() {
        ZombieMark m = zombie.get();
        return m == null ? null : m.reason();
    }

    public Instant zombieSince() {
        ZombieMark m = zombie.get();
        return m == null ? null : m.at();
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Instant lastSendAt() {
        return lastSendAt;
    }

    public Instant lastProbeAt() {
        return lastProbeAt;
    }

    public Instant lastAckAt() {
        return lastAckAt;
    }

    public int probeCount() {
        return probeCount.get();
    }

    public int missedProbes() {
        return missedProbes.get();
    }

    public int queueFullCount() {
        return queueFullCount.get();
    }

    public int writeFailures() {
        return writeFailures.get();
    }

    public int queueSize() {
        return outbound.size();
    }

    public SessionSnapshot snapshot(Instant now) {
        ZombieMark m = zombie.get();
        List<String> names = topics.stream().map(Topic::wireName).sorted().collect(Collectors.toList());
        return new SessionSnapshot(id,
                names,
                connectedAt,
                Duration.between(connectedAt, now).toMillis() / 1000.0,
                lastSendAt,
                lastProbeAt,
                lastAckAt,
                probeCount.get(),
                missedProbes.get(),
                queueFullCount.get(),
                writeFailures.get(),
                outbound.size(),
                m != null,
                m == null ? null : m.reason().label(),
                m == null ? null : m.at(),
                m == null ? null : Duration.between(m.at(), now).toMillis() / 1000.0);
    }
}
