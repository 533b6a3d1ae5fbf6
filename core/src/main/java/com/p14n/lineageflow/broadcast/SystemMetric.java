package com.p14n.lineageflow.broadcast;

import java.util.Map;

/**
 * A point-in-time measurement. {@code metadata} carries passthrough fields
 * whose shape depends on the metric type.
 */
public record SystemMetric(String metricType, Object value, Map<String, Object> metadata) implements EventPayload {

    public SystemMetric {
        metadata = metadata == null ? Map.of() : metadata;
    }

    @Override
    public Topic topic() {
        return Topic.SYSTEM_METRIC;
    }
}
