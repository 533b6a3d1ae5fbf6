package com.p14n.lineageflow.queue;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.p14n.lineageflow.broadcast.ErrorNotice;
import com.p14n.lineageflow.broadcast.EventPayload;
import com.p14n.lineageflow.broadcast.EventPublisher;
import com.p14n.lineageflow.broadcast.JobStatus;
import com.p14n.lineageflow.broadcast.SystemMetric;
import com.p14n.lineageflow.data.JsonSupport;
import com.p14n.lineageflow.data.QueueItem;

/**
 * Relays job status and metric notifications from the notification queue to
 * subscribers.
 *
 * <p>
 * Notifications are not critical: each is deleted once read, whether or not
 * it could be parsed.
 * </p>
 */
public class NotificationRelay extends PollingWorker {
    private static final Logger logger = LoggerFactory.getLogger(NotificationRelay.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final int BATCH_SIZE = 10;
    private static final Duration POLL_WAIT = Duration.ofSeconds(1);

    private final WorkQueueStore store;
    private final EventPublisher publisher;
    private final String queue;
    private final Duration visibilityWindow;

    public NotificationRelay(WorkQueueStore store, EventPublisher publisher, String queue,
            Duration visibilityWindow, Duration failureBackoff) {
        super("Notification relay[" + queue + "]", failureBackoff);
        this.store = store;
        this.publisher = publisher;
        this.queue = queue;
        this.visibilityWindow = visibilityWindow;
    }

    @Override
    protected void pollOnce() {
        List<QueueItem> batch = store.lease(queue, BATCH_SIZE, visibilityWindow, POLL_WAIT);
        for (QueueItem item : batch) {
            relay(item);
        }
    }

    void relay(QueueItem item) {
        try {
            publisher.publish(toPayload(item.payload()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.atWarn().addArgument(item.messageId()).addArgument(e.getMessage())
                    .log("Notification {} could not be read: {}");
            publisher.publish(ErrorNotice.notificationInvalid());
        } finally {
            try {
                store.delete(queue, item.messageId());
            } catch (QueueStoreException e) {
                logger.atWarn().setCause(e).addArgument(item.messageId()).log("Failed to delete notification {}");
            }
        }
    }

    /**
     * @throws JsonProcessingException  if the notification is not a JSON object
     * @throws IllegalArgumentException if the notification is JSON null
     */
    static EventPayload toPayload(String json) throws JsonProcessingException {
        Map<String, Object> n = JsonSupport.MAPPER.readValue(json, MAP_TYPE);
        if (n == null) {
            throw new IllegalArgumentException("Notification is empty");
        }
        Object type = n.get("type");
        if ("job_status".equals(type)) {
            return new JobStatus(str(n.get("job_name")), str(n.get("run_id")), str(n.get("status")),
                    n.get("progress") instanceof Number ? ((Number) n.get("progress")).intValue() : null);
        }
        if ("system_metric".equals(type)) {
            Object metadata = n.get("metadata");
            return new SystemMetric(str(n.get("metric_type")), n.get("value"),
                    metadata instanceof Map ? castMap(metadata) : Map.of());
        }
        Map<String, Object> passthrough = new LinkedHashMap<>(n);
        return new SystemMetric("notification", type == null ? null : type.toString(), passthrough);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object o) {
        return (Map<String, Object>) o;
    }

    private static String str(Object o) {
        return o == null ? null : o.toString();
    }
}
