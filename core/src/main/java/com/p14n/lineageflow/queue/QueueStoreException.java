package com.p14n.lineageflow.queue;

/**
 * Thrown when the work queue store cannot be reached or rejects an operation.
 */
public class QueueStoreException extends RuntimeException {

    public QueueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
