package com.p14n.lineageflow.broadcast;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.lineageflow.MutableClock;
import com.p14n.lineageflow.RecordingTransport;
import com.p14n.lineageflow.data.JsonSupport;

public class BroadcastEventTest {

    @Test
    public void frameCarriesIdTopicAndTimestampedData() throws Exception {
        MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L, 500_000_000));
        BroadcastEvent event = BroadcastEvent.of(new JobStatus("daily_load", "r1", "RUNNING", 40), clock);

        String frame = event.toFrame();

        assertTrue(frame.startsWith("id: " + event.id() + "\nevent: job-status\ndata: "));
        assertTrue(frame.endsWith("\n\n"));
        JsonNode data = JsonSupport.MAPPER.readTree(RecordingTransport.dataOf(frame));
        assertEquals(1_700_000_000.5, data.get("timestamp").asDouble(), 0.0001);
        assertEquals("daily_load", data.get("data").get("job_name").asText());
        assertEquals("r1", data.get("data").get("run_id").asText());
        assertEquals(40, data.get("data").get("progress").asInt());
    }

    @Test
    public void topicFollowsPayload() {
        BroadcastEvent event = BroadcastEvent.of(ErrorNotice.queueUnavailable(), new MutableClock());
        assertEquals(Topic.ERROR, event.topic());
        assertNotNull(event.id());
    }

    @Test
    public void probeFrameAsksForAcknowledgement() throws Exception {
        String frame = BroadcastEvent.of(new LivenessProbe("s1", "p1", true), new MutableClock()).toFrame();

        assertEquals("liveness-probe", RecordingTransport.topicOf(frame));
        JsonNode data = JsonSupport.MAPPER.readTree(RecordingTransport.dataOf(frame)).get("data");
        assertEquals("s1", data.get("session_id").asText());
        assertEquals("p1", data.get("probe_id").asText());
        assertTrue(data.get("expected_ack").asBoolean());
    }

    @Test
    public void topicNamesRoundTrip() {
        for (Topic t : Topic.values()) {
            assertEquals(t, Topic.fromWireName(t.wireName()));
        }
        assertThrows(IllegalArgumentException.class, () -> Topic.fromWireName("lineage"));
        assertFalse(Topic.defaults().contains(Topic.LIVENESS_PROBE));
    }
}
