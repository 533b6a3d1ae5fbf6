package com.p14n.lineageflow.broadcast;

/**
 * Progress of a job run, relayed from the notification queue.
 *
 * @param progress percentage complete, null when unknown
 */
public record JobStatus(String jobName, String runId, String status, Integer progress) implements EventPayload {

    @Override
    public Topic topic() {
        return Topic.JOB_STATUS;
    }
}
