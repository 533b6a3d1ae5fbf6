package com.p14n.lineageflow.queue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.broadcast.EventPublisher;
import com.p14n.lineageflow.broadcast.SystemMetric;

/**
 * Publishes the depth of each queue as a {@code queue_depth} system metric.
 * Scheduled periodically; a store failure skips one report.
 */
public class QueueDepthReporter implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(QueueDepthReporter.class);

    public static final String METRIC_TYPE = "queue_depth";

    private final WorkQueueStore store;
    private final EventPublisher publisher;
    private final List<String> queues;

    public QueueDepthReporter(WorkQueueStore store, EventPublisher publisher, List<String> queues) {
        this.store = store;
        this.publisher = publisher;
        this.queues = List.copyOf(queues);
    }

    @Override
    public void run() {
        try {
            Map<String, Object> depths = new LinkedHashMap<>();
            long total = 0;
            for (String q : queues) {
                long n = store.length(q);
                depths.put(q, n);
                total += n;
            }
            publisher.publish(new SystemMetric(METRIC_TYPE, total, depths));
        } catch (RuntimeException e) {
            logger.atWarn().setCause(e).log("Failed to report queue depths");
        }
    }
}
