package com.p14n.lineageflow.broadcast;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.data.LivenessSettings;

/**
 * Drains one session's outbound queue onto its transport.
 *
 * <p>
 * When the queue stays empty for the heartbeat interval the loop writes a
 * liveness probe if the probe interval has passed since the last one, and a
 * heartbeat otherwise. Consecutive write failures past the threshold flag the
 * session as a zombie and end the loop.
 * </p>
 *
 * <p>
 * The loop also ends when its thread is interrupted or the session is
 * removed. A session that ends without being flagged is unsubscribed; a
 * flagged session is left for the {@link LivenessSupervisor} to evict. The
 * transport is always closed.
 * </p>
 */
public class DeliveryLoop implements Callable<Void> {
    private static final Logger logger = LoggerFactory.getLogger(DeliveryLoop.class);

    private final SubscriberSession session;
    private final SessionTransport transport;
    private final EventBroadcaster broadcaster;
    private final LivenessSettings settings;
    private final Clock clock;

    public DeliveryLoop(SubscriberSession session, SessionTransport transport, EventBroadcaster broadcaster,
            LivenessSettings settings, Clock clock) {
        this.session = session;
        this.transport = transport;
        this.broadcaster = broadcaster;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public Void call() {
        try {
            while (!Thread.currentThread().isInterrupted() && active()) {
                BroadcastEvent event = session.next(settings.heartbeatInterval());
                if (!active()) {
                    break;
                }
                String frame = event != null ? event.toFrame() : idleFrame();
                if (!write(frame)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.atError().setCause(e).addArgument(session.id()).log("Delivery loop for session {} failed");
        } finally {
            if (!session.isZombie()) {
                broadcaster.unsubscribe(session.id());
            }
            transport.close();
            logger.atDebug().addArgument(session.id()).log("Delivery loop for session {} ended");
        }
        return null;
    }

    private boolean active() {
        return !session.isRemoved() && !session.isZombie();
    }

    private String idleFrame() {
        Instant now = clock.instant();
        Instant since = session.lastProbeAt() != null ? session.lastProbeAt() : session.connectedAt();
        if (Duration.between(since, now).compareTo(settings.probeInterval()) >= 0) {
            String probeId = session.recordProbeSent(now);
            return BroadcastEvent.of(new LivenessProbe(session.id(), probeId, true), clock).toFrame();
        }
        return BroadcastEvent.of(new Heartbeat(session.id()), clock).toFrame();
    }

    /**
     * @return false if the session was flagged and the loop must end
     */
    private boolean write(String frame) {
        try {
            transport.write(frame);
            session.recordSendSuccess(clock.instant());
            return true;
        } catch (IOException e) {
            int failures = session.recordWriteFailure();
            logger.atWarn()
                    .addArgument(session.id())
                    .addArgument(failures)
                    .addArgument(e.getMessage())
                    .log("Write to session {} failed ({} consecutive): {}");
            if (failures > settings.writeFailureThreshold()) {
                broadcaster.flagZombie(session, ZombieReason.WRITE_FAILURES);
                return false;
            }
            return true;
        }
    }
}
