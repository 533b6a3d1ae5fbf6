package com.p14n.lineageflow.data;

import java.time.Instant;

/**
 * A leased item from a work queue.
 *
 * @param messageId  Store-assigned id, unique within the queue
 * @param payload    Raw payload text
 * @param readCount  Number of times the item has been leased, including this
 *                   one
 * @param enqueuedAt When the item was sent
 */
public record QueueItem(long messageId, String payload, int readCount, Instant enqueuedAt) {
}
