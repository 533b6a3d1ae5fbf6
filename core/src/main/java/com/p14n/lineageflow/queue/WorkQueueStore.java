package com.p14n.lineageflow.queue;

import java.time.Duration;
import java.util.List;

import com.p14n.lineageflow.data.QueueItem;

/**
 * A durable, at-least-once work queue addressed by queue name.
 *
 * <p>
 * Implementations signal infrastructure failures with
 * {@link QueueStoreException}.
 * </p>
 */
public interface WorkQueueStore {

    /**
     * Leases up to {@code maxItems} visible items. Leased items stay invisible
     * for {@code visibilityWindow} and reappear unless deleted.
     *
     * @param queue            queue name
     * @param maxItems         maximum number of items to return
     * @param visibilityWindow how long leased items stay invisible
     * @param pollWait         how long to wait for items when none are visible
     * @return leased items in message id order, empty if none arrived in time
     */
    List<QueueItem> lease(String queue, int maxItems, Duration visibilityWindow, Duration pollWait);

    /**
     * Deletes an item.
     *
     * @return true if the item existed
     */
    boolean delete(String queue, long messageId);

    /**
     * Appends a payload to a queue.
     *
     * @return the new message id
     */
    long send(String queue, String payload);

    /**
     * Counts the items in a queue, visible or leased.
     */
    long length(String queue);
}
