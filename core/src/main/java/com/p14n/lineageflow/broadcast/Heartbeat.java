package com.p14n.lineageflow.broadcast;

public record Heartbeat(String sessionId) implements EventPayload {

    @Override
    public Topic topic() {
        return Topic.LIVENESS_HEARTBEAT;
    }
}
