package com.p14n.lineageflow.broadcast;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.lineageflow.data.JsonSupport;

/**
 * An immutable event as delivered to subscribers.
 *
 * @param topic     the event topic, always {@code payload.topic()}
 * @param payload   the typed body
 * @param id        unique event id
 * @param timestamp creation time
 */
public record BroadcastEvent(Topic topic, EventPayload payload, String id, Instant timestamp) {

    public BroadcastEvent {
        if (topic == null || payload == null || id == null || timestamp == null) {
            throw new IllegalArgumentException("Broadcast event fields cannot be null");
        }
    }

    public static BroadcastEvent of(EventPayload payload, Clock clock) {
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        return new BroadcastEvent(payload.topic(), payload, UUID.randomUUID().toString(), clock.instant());
    }

    /**
     * Renders the server-sent events frame:
     * {@code id: <id>\nevent: <topic>\ndata: {"timestamp": <epoch seconds>, "data": {...}}\n\n}.
     */
    public String toFrame() {
        ObjectNode data = JsonSupport.WIRE_MAPPER.createObjectNode();
        data.put("timestamp", timestamp.getEpochSecond() + timestamp.getNano() / 1_000_000_000.0);
        data.set("data", JsonSupport.WIRE_MAPPER.valueToTree(payload));
        String json;
        try {
            json = JsonSupport.WIRE_MAPPER.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + id, e);
        }
        return "id: " + id + "\nevent: " + topic.wireName() + "\ndata: " + json + "\n\n";
    }
}
