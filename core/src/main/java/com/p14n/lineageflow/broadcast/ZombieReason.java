package com.p14n.lineageflow.broadcast;

/**
 * Why a session was judged unable to receive events.
 */
public enum ZombieReason {
    TIMEOUT("timeout"),
    MISSED_PROBES("missed_probes"),
    QUEUE_FULL("queue_full"),
    WRITE_FAILURES("write_failures"),
    NO_PROBE_ACK("no_probe_ack");

    private final String label;

    ZombieReason(String label) {
        this.label = label;
    }

    /** Name used in metrics and admin output. */
    public String label() {
        return label;
    }
}
