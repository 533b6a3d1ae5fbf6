package com.p14n.lineageflow.broadcast;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channel between event producers and the {@link EventBroadcaster}.
 *
 * <p>
 * Producers call {@link #publish(EventPayload)}, which never blocks. A single
 * drain task stamps each payload into a {@link BroadcastEvent} and hands it to
 * the broadcaster, so payloads from one producer are broadcast in the order
 * they were published. The channel is bounded; when it is full new payloads
 * are dropped and counted.
 * </p>
 */
public class BroadcastPump implements EventPublisher, Runnable {
    private static final Logger logger = LoggerFactory.getLogger(BroadcastPump.class);

    private static final long POLL_MILLIS = 100;
    public static final int DEFAULT_CAPACITY = 10_000;

    private final LinkedBlockingQueue<EventPayload> channel;
    private final EventBroadcaster broadcaster;
    private final Clock clock;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean stopping;

    public BroadcastPump(EventBroadcaster broadcaster, Clock clock) {
        this(broadcaster, clock, DEFAULT_CAPACITY);
    }

    public BroadcastPump(EventBroadcaster broadcaster, Clock clock, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.channel = new LinkedBlockingQueue<>(capacity);
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    @Override
    public void publish(EventPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        if (stopping) {
            logger.atDebug().addArgument(payload.topic().wireName()).log("Pump stopping, dropped {} event");
            return;
        }
        if (!channel.offer(payload)) {
            long total = dropped.incrementAndGet();
            logger.atWarn().addArgument(payload.topic().wireName()).addArgument(total)
                    .log("Pump channel full, dropped {} event ({} dropped so far)");
        }
    }

    @Override
    public void run() {
        try {
            while (true) {
                EventPayload payload = channel.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (payload == null) {
                    if (stopping) {
                        break;
                    }
                    continue;
                }
                deliver(payload);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            stopped.countDown();
        }
    }

    private void deliver(EventPayload payload) {
        try {
            broadcaster.publish(BroadcastEvent.of(payload, clock));
        } catch (RuntimeException e) {
            logger.atError().setCause(e).addArgument(payload.topic().wireName()).log("Failed to broadcast {} event");
        }
    }

    /** Number of payloads waiting to be broadcast. */
    public int pending() {
        return channel.size();
    }

    /** Number of payloads dropped because the channel was full. */
    public long dropped() {
        return dropped.get();
    }

    /**
     * Stops accepting payloads and waits for the ones already queued to be
     * broadcast.
     *
     * @return true if the drain task finished in time
     */
    public boolean stop(Duration timeout) throws InterruptedException {
        stopping = true;
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
