package com.p14n.lineageflow.broadcast;

public record LivenessProbe(String sessionId, String probeId, boolean expectedAck) implements EventPayload {

    @Override
    public Topic topic() {
        return Topic.LIVENESS_PROBE;
    }
}
