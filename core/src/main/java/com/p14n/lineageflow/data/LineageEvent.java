package com.p14n.lineageflow.data;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Record representing an OpenLineage run event decoded from a queue payload.
 *
 * <p>
 * The {@code run} and {@code job} facets are kept as maps because their shape
 * varies by producer; only {@code run.runId}, {@code job.name} and
 * {@code job.namespace} are read by the core.
 * </p>
 *
 * @param eventType Event type: START, RUNNING, COMPLETE, FAIL, ABORT
 * @param eventTime Time the event occurred, may be null
 * @param run       Run facet, must contain {@code runId}
 * @param job       Job facet, must contain {@code name}
 * @param inputs    Input datasets
 * @param outputs   Output datasets
 * @param producer  Producer URI
 * @param schemaURL OpenLineage schema URL
 */
public record LineageEvent(
        @JsonAlias("event_type") String eventType,
        @JsonAlias("event_time") Instant eventTime,
        Map<String, Object> run,
        Map<String, Object> job,
        List<Map<String, Object>> inputs,
        List<Map<String, Object>> outputs,
        String producer,
        String schemaURL) {

    /** Namespace reported for jobs that do not declare one. */
    public static final String DEFAULT_NAMESPACE = "default";

    public LineageEvent {
        inputs = inputs == null ? List.of() : inputs;
        outputs = outputs == null ? List.of() : outputs;
    }

    public String runId() {
        return stringField(run, "runId");
    }

    public String jobName() {
        return stringField(job, "name");
    }

    public String jobNamespace() {
        String ns = stringField(job, "namespace");
        return ns == null || ns.isBlank() ? DEFAULT_NAMESPACE : ns;
    }

    private static String stringField(Map<String, Object> facet, String key) {
        if (facet == null) {
            return null;
        }
        Object v = facet.get(key);
        return v == null ? null : v.toString();
    }
}
