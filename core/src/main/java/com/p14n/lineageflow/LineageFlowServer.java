package com.p14n.lineageflow;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.broadcast.BroadcastPump;
import com.p14n.lineageflow.broadcast.DeliveryLoop;
import com.p14n.lineageflow.broadcast.EventBroadcaster;
import com.p14n.lineageflow.broadcast.EventPublisher;
import com.p14n.lineageflow.broadcast.LivenessSupervisor;
import com.p14n.lineageflow.broadcast.SessionTransport;
import com.p14n.lineageflow.broadcast.SubscriberSession;
import com.p14n.lineageflow.broadcast.Topic;
import com.p14n.lineageflow.broker.AsyncExecutor;
import com.p14n.lineageflow.broker.DefaultExecutor;
import com.p14n.lineageflow.data.LineageFlowConfig;
import com.p14n.lineageflow.data.LivenessSettings;
import com.p14n.lineageflow.queue.DeadLetterSink;
import com.p14n.lineageflow.queue.EventProcessor;
import com.p14n.lineageflow.queue.NotificationRelay;
import com.p14n.lineageflow.queue.PostgresWorkQueueStore;
import com.p14n.lineageflow.queue.QueueConsumer;
import com.p14n.lineageflow.queue.QueueDepthReporter;
import com.p14n.lineageflow.queue.WorkQueueStore;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Wires the queue consumer to the event broadcaster and runs the background
 * tasks of both.
 *
 * <p>
 * Key components:
 * </p>
 * <ul>
 * <li>{@link QueueConsumer} and {@link NotificationRelay} leasing from the
 * work queue store</li>
 * <li>{@link BroadcastPump} carrying their events to the
 * {@link EventBroadcaster}</li>
 * <li>{@link LivenessSupervisor} and {@link QueueDepthReporter} on fixed
 * schedules</li>
 * <li>one {@link DeliveryLoop} per connected session</li>
 * </ul>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * LineageFlowServer server = new LineageFlowServer(ds, config, LivenessSettings.defaults(), processor, ot);
 * server.start();
 * SubscriberSession session = server.connect(transport, Topic.defaults());
 * ...
 * server.close();
 * }</pre>
 */
public class LineageFlowServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LineageFlowServer.class);

    private static final Duration DEPTH_REPORT_INTERVAL = Duration.ofSeconds(30);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    private final LineageFlowConfig cfg;
    private final LivenessSettings settings;
    private final Clock clock;
    private final AsyncExecutor executor;
    private final EventBroadcaster broadcaster;
    private final BroadcastPump pump;
    private final QueueConsumer consumer;
    private final NotificationRelay relay;
    private final QueueDepthReporter depthReporter;
    private final LivenessSupervisor supervisor;
    private final Map<String, Future<?>> deliveryLoops = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ScheduledFuture<?> depthReport;

    public LineageFlowServer(DataSource ds, LineageFlowConfig cfg, LivenessSettings settings,
            EventProcessor processor, OpenTelemetry ot) {
        this(new PostgresWorkQueueStore(ds), cfg, settings, processor, ot, Clock.systemUTC(),
                new DefaultExecutor(3));
    }

    public LineageFlowServer(WorkQueueStore store, LineageFlowConfig cfg, LivenessSettings settings,
            EventProcessor processor, OpenTelemetry ot, Clock clock, AsyncExecutor executor) {
        this.cfg = cfg;
        this.settings = settings;
        this.clock = clock;
        this.executor = executor;
        this.broadcaster = new EventBroadcaster(settings, clock, ot);
        this.pump = new BroadcastPump(broadcaster, clock);
        this.consumer = new QueueConsumer(store, processor,
                new DeadLetterSink(store, cfg.deadLetterQueueName(), clock), pump, cfg, ot);
        this.relay = new NotificationRelay(store, pump, cfg.notificationQueueName(), cfg.visibilityWindow(),
                cfg.leaseFailureBackoff());
        this.depthReporter = new QueueDepthReporter(store, pump,
                List.of(cfg.queueName(), cfg.deadLetterQueueName(), cfg.notificationQueueName()));
        this.supervisor = new LivenessSupervisor(broadcaster, settings, clock);
    }

    /**
     * Starts the pump, the consumer, the notification relay, the liveness
     * sweeps and the depth reports.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Server is closed");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Server already started");
        }
        executor.submit(() -> {
            pump.run();
            return null;
        });
        executor.submit(() -> {
            consumer.run();
            return null;
        });
        executor.submit(() -> {
            relay.run();
            return null;
        });
        supervisor.start(executor);
        long period = DEPTH_REPORT_INTERVAL.toMillis();
        depthReport = executor.scheduleAtFixedRate(depthReporter, period, period, TimeUnit.MILLISECONDS);
        logger.atInfo().addArgument(cfg.queueName()).log("Lineage flow server started on queue {}");
    }

    /**
     * Subscribes a new session and starts its delivery loop.
     *
     * @param transport the connection to write to
     * @param topics    topics the client asked for
     * @return the session
     * @throws IllegalStateException    if the server is closed
     * @throws IllegalArgumentException if the topics are not subscribable
     */
    public SubscriberSession connect(SessionTransport transport, Set<Topic> topics) {
        if (closed.get()) {
            throw new IllegalStateException("Server is closed");
        }
        SubscriberSession session = broadcaster.subscribe(topics);
        DeliveryLoop loop = new DeliveryLoop(session, transport, broadcaster, settings, clock);
        String id = session.id();
        Future<?> f = executor.submit(() -> {
            try {
                return loop.call();
            } finally {
                deliveryLoops.remove(id);
            }
        });
        deliveryLoops.put(id, f);
        if (f.isDone()) {
            deliveryLoops.remove(id);
        }
        return session;
    }

    /** Ends a session whose client went away. */
    public boolean disconnect(String sessionId) {
        return broadcaster.unsubscribe(sessionId);
    }

    public EventBroadcaster broadcaster() {
        return broadcaster;
    }

    /** Publisher feeding the broadcaster through the pump. */
    public EventPublisher publisher() {
        return pump;
    }

    public LivenessSupervisor supervisor() {
        return supervisor;
    }

    public QueueConsumer consumer() {
        return consumer;
    }

    int activeDeliveryLoops() {
        return deliveryLoops.size();
    }

    /**
     * Drains the consumer and relay, flushes pending events, stops the
     * periodic tasks, ends every delivery loop and waits for all tasks to
     * finish.
     */
    @Override
    public void close() throws Exception {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.atInfo().log("Lineage flow server stopping");
        try {
            if (started.get()) {
                consumer.stop();
                relay.stop();
                Duration drain = cfg.pollInterval().plus(SHUTDOWN_GRACE);
                if (!consumer.awaitStopped(drain)) {
                    logger.atWarn().log("Queue consumer did not stop in time");
                }
                if (!relay.awaitStopped(drain)) {
                    logger.atWarn().log("Notification relay did not stop in time");
                }
                if (!pump.stop(SHUTDOWN_GRACE)) {
                    logger.atWarn().addArgument(pump.pending()).log("Pump stopped with {} events pending");
                }
                supervisor.close();
                if (depthReport != null) {
                    depthReport.cancel(false);
                }
            }
            for (Future<?> f : deliveryLoops.values()) {
                f.cancel(true);
            }
            broadcaster.close();
        } finally {
            executor.shutdownNow();
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.atWarn().log("Executor did not terminate in time");
            }
        }
        logger.atInfo().log("Lineage flow server stopped");
    }
}
