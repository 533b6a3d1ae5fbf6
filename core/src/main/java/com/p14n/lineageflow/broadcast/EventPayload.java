package com.p14n.lineageflow.broadcast;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Typed body of a broadcast event. Each implementation belongs to exactly one
 * topic.
 */
public interface EventPayload {

    @JsonIgnore
    Topic topic();
}
