package com.p14n.lineageflow.broadcast;

/**
 * Accepts payloads for broadcast. Implementations must not block the caller.
 */
@FunctionalInterface
public interface EventPublisher {

    void publish(EventPayload payload);
}
