package com.p14n.lineageflow.queue;

import com.p14n.lineageflow.data.LineageEvent;

/**
 * Business logic applied to each decoded lineage event.
 *
 * <p>
 * The queue delivers at least once, so implementations must tolerate being
 * called more than once for the same event.
 * </p>
 */
@FunctionalInterface
public interface EventProcessor {

    /**
     * @param event the decoded event
     * @return true if the event was handled, false to dead-letter it
     */
    boolean process(LineageEvent event);
}
