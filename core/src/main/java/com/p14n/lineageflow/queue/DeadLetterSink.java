package com.p14n.lineageflow.queue;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.data.JsonSupport;
import com.p14n.lineageflow.data.QueueItem;

/**
 * Moves failed items to the dead-letter queue.
 *
 * <p>
 * The dead-letter entry is a JSON object holding the original payload
 * verbatim, the error, the failure time and the source message id. The item
 * is deleted from the source queue only after the entry was written, so a
 * store failure leaves it in place for redelivery rather than losing it.
 * </p>
 */
public class DeadLetterSink {
    private static final Logger logger = LoggerFactory.getLogger(DeadLetterSink.class);

    private final WorkQueueStore store;
    private final String deadLetterQueue;
    private final Clock clock;

    public DeadLetterSink(WorkQueueStore store, String deadLetterQueue, Clock clock) {
        this.store = store;
        this.deadLetterQueue = deadLetterQueue;
        this.clock = clock;
    }

    /**
     * @return true if the dead-letter entry was written
     */
    public boolean deadLetter(String sourceQueue, QueueItem item, String error) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("original_message", item.payload());
        entry.put("error", error);
        entry.put("failed_at", clock.instant().toString());
        entry.put("msg_id", item.messageId());

        try {
            store.send(deadLetterQueue, JsonSupport.toJson(entry));
        } catch (QueueStoreException e) {
            logger.atError().setCause(e)
                    .addArgument(item.messageId())
                    .addArgument(sourceQueue)
                    .log("Failed to dead-letter message {}; it stays in {} for redelivery");
            return false;
        }

        try {
            store.delete(sourceQueue, item.messageId());
        } catch (QueueStoreException e) {
            logger.atError().setCause(e)
                    .addArgument(item.messageId())
                    .addArgument(sourceQueue)
                    .log("Message {} was dead-lettered but could not be deleted from {}");
        }
        logger.atWarn()
                .addArgument(item.messageId())
                .addArgument(deadLetterQueue)
                .addArgument(error)
                .log("Message {} moved to {}: {}");
        return true;
    }

    public String queueName() {
        return deadLetterQueue;
    }
}
