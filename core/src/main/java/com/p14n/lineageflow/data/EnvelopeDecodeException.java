package com.p14n.lineageflow.data;

/**
 * Thrown when a queue payload cannot be turned into a {@link LineageEvent}.
 * A decode failure is a payload failure: the item is dead-lettered, never
 * retried in place.
 */
public class EnvelopeDecodeException extends Exception {

    public EnvelopeDecodeException(String message) {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
