package com.p14n.lineageflow.queue;

/**
 * Lifecycle of a polling worker. There is no pause or resume.
 */
public enum ConsumerState {
    RUNNING,
    /** Stop requested; the current batch is being finished. */
    DRAINING,
    STOPPED
}
