package com.p14n.lineageflow.processor;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;

import javax.sql.DataSource;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.p14n.lineageflow.MutableClock;
import com.p14n.lineageflow.data.EnvelopeDecoder;
import com.p14n.lineageflow.data.LineageEvent;
import com.p14n.lineageflow.db.QueueSetup;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;

public class RunEventLedgerTest {

    private EmbeddedPostgres pg;
    private DataSource ds;
    private RunEventLedger ledger;
    private final MutableClock clock = new MutableClock();
    private final EnvelopeDecoder decoder = new EnvelopeDecoder();

    @BeforeEach
    public void setUp() throws Exception {
        pg = EmbeddedPostgres.start();
        ds = pg.getPostgresDatabase();
        new QueueSetup(ds).createSchemaIfNotExists().createRunEventsTableIfNotExists();
        ledger = new RunEventLedger(ds, clock);
    }

    @AfterEach
    public void tearDown() throws Exception {
        if (pg != null) {
            pg.close();
        }
    }

    private long rows() throws Exception {
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT count(*) FROM lineageflow.run_events")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Test
    public void processingTheSameEventTwiceRecordsItOnce() throws Exception {
        LineageEvent start = decoder.decode("""
                {"eventType":"START","eventTime":"2024-05-01T10:00:00Z",
                 "run":{"runId":"r1"},"job":{"namespace":"etl","name":"daily_load"},
                 "inputs":[{"name":"raw"}],"outputs":[{"name":"clean"},{"name":"agg"}]}""");

        assertTrue(ledger.process(start));
        assertTrue(ledger.process(start));

        assertEquals(1, rows());
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(
                        "SELECT job_namespace, job_name, input_count, output_count FROM lineageflow.run_events")) {
            rs.next();
            assertEquals("etl", rs.getString(1));
            assertEquals("daily_load", rs.getString(2));
            assertEquals(1, rs.getInt(3));
            assertEquals(2, rs.getInt(4));
        }
    }

    @Test
    public void redeliveredEventWithoutTimeIsRecordedOnce() throws Exception {
        LineageEvent start = decoder.decode(
                "{\"event_type\":\"START\",\"run\":{\"runId\":\"r1\"},\"job\":{\"name\":\"daily_load\"}}");
        Instant firstSeen = clock.instant();

        assertTrue(ledger.process(start));
        clock.advance(Duration.ofSeconds(30));
        assertTrue(ledger.process(start));

        assertEquals(1, rows());
        try (Connection conn = ds.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT event_time, recorded_at FROM lineageflow.run_events")) {
            rs.next();
            assertEquals(RunEventLedger.NO_EVENT_TIME, rs.getTimestamp(1).toInstant());
            assertEquals(firstSeen, rs.getTimestamp(2).toInstant());
        }
    }

    @Test
    public void distinctEventTypesOfOneRunAreKept() throws Exception {
        assertTrue(ledger.process(decoder.decode("""
                {"eventType":"START","eventTime":"2024-05-01T10:00:00Z","run":{"runId":"r1"},"job":{"name":"j"}}""")));
        assertTrue(ledger.process(decoder.decode("""
                {"eventType":"COMPLETE","eventTime":"2024-05-01T10:05:00Z","run":{"runId":"r1"},"job":{"name":"j"}}""")));

        assertEquals(2, rows());
    }

    @Test
    public void missingTableIsReportedAsFailure() throws Exception {
        try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE lineageflow.run_events");
        }
        assertFalse(ledger.process(decoder.decode(
                "{\"eventType\":\"START\",\"run\":{\"runId\":\"r1\"},\"job\":{\"name\":\"j\"}}")));
    }
}
