package com.p14n.lineageflow.data;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;

import org.junit.jupiter.api.Test;

public class EnvelopeDecoderTest {

    private final EnvelopeDecoder decoder = new EnvelopeDecoder();

    @Test
    public void decodesOpenLineageEvent() throws Exception {
        LineageEvent e = decoder.decode("""
                {"eventType":"START","eventTime":"2024-05-01T10:00:00Z",
                 "run":{"runId":"r1"},"job":{"namespace":"etl","name":"daily_load"},
                 "inputs":[{"namespace":"s3","name":"raw"}],
                 "producer":"https://example.com/producer","extra":"ignored"}""");

        assertEquals("START", e.eventType());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), e.eventTime());
        assertEquals("r1", e.runId());
        assertEquals("daily_load", e.jobName());
        assertEquals("etl", e.jobNamespace());
        assertEquals(1, e.inputs().size());
        assertTrue(e.outputs().isEmpty());
    }

    @Test
    public void acceptsSnakeCaseEventTypeAndDefaultsNamespace() throws Exception {
        LineageEvent e = decoder.decode("""
                {"event_type":"COMPLETE","run":{"runId":"r2"},"job":{"name":"j"}}""");

        assertEquals("COMPLETE", e.eventType());
        assertEquals(LineageEvent.DEFAULT_NAMESPACE, e.jobNamespace());
        assertNull(e.eventTime());
    }

    @Test
    public void rejectsMalformedJson() {
        EnvelopeDecodeException ex = assertThrows(EnvelopeDecodeException.class,
                () -> decoder.decode("{not json"));
        assertNotNull(ex.getCause());
    }

    @Test
    public void rejectsMissingRunId() {
        EnvelopeDecodeException ex = assertThrows(EnvelopeDecodeException.class,
                () -> decoder.decode("{\"eventType\":\"START\",\"run\":{},\"job\":{\"name\":\"j\"}}"));
        assertTrue(ex.getMessage().contains("runId"));
    }

    @Test
    public void rejectsMissingJobNameAndEventType() {
        assertThrows(EnvelopeDecodeException.class,
                () -> decoder.decode("{\"eventType\":\"START\",\"run\":{\"runId\":\"r\"},\"job\":{}}"));
        assertThrows(EnvelopeDecodeException.class,
                () -> decoder.decode("{\"run\":{\"runId\":\"r\"},\"job\":{\"name\":\"j\"}}"));
    }

    @Test
    public void rejectsEmptyAndNullPayloads() {
        assertThrows(EnvelopeDecodeException.class, () -> decoder.decode(""));
        assertThrows(EnvelopeDecodeException.class, () -> decoder.decode(null));
        assertThrows(EnvelopeDecodeException.class, () -> decoder.decode("null"));
    }
}
