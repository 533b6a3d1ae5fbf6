package com.p14n.lineageflow.broadcast;

import java.util.EnumSet;
import java.util.Set;

/**
 * Broadcast topics and their names on the wire.
 */
public enum Topic {
    QUEUE_ITEM_PROCESSED("queue-item-processed", true),
    JOB_STATUS("job-status", true),
    SYSTEM_METRIC("system-metric", true),
    LIVENESS_PROBE("liveness-probe", false),
    LIVENESS_HEARTBEAT("liveness-heartbeat", false),
    ERROR("error", true);

    private final String wireName;
    private final boolean subscribable;

    Topic(String wireName, boolean subscribable) {
        this.wireName = wireName;
        this.subscribable = subscribable;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Liveness topics are written by each session's delivery loop and cannot
     * be requested by clients.
     */
    public boolean subscribable() {
        return subscribable;
    }

    /**
     * @throws IllegalArgumentException if no topic has the given name
     */
    public static Topic fromWireName(String name) {
        for (Topic t : values()) {
            if (t.wireName.equals(name)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown topic: " + name);
    }

    /** Topics a client receives when it does not name any. */
    public static Set<Topic> defaults() {
        return EnumSet.of(QUEUE_ITEM_PROCESSED, JOB_STATUS, SYSTEM_METRIC);
    }
}
