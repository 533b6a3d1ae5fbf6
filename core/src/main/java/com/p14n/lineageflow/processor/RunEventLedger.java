package com.p14n.lineageflow.processor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.data.JsonSupport;
import com.p14n.lineageflow.data.LineageEvent;
import com.p14n.lineageflow.queue.EventProcessor;

/**
 * Records each lineage event in {@code lineageflow.run_events}.
 *
 * <p>
 * Rows are keyed by run id, event type and event time, and inserted with
 * {@code ON CONFLICT DO NOTHING}, so a redelivered event leaves the ledger
 * unchanged. Events without an event time are keyed with the epoch, so for
 * them the key is effectively run id and event type. {@code recorded_at}
 * holds the processing time.
 * </p>
 */
public class RunEventLedger implements EventProcessor {
    private static final Logger logger = LoggerFactory.getLogger(RunEventLedger.class);

    private static final String INSERT = """
            INSERT INTO lineageflow.run_events
                (run_id, event_type, event_time, job_namespace, job_name, producer,
                 input_count, output_count, payload, recorded_at)
            VALUES (?,?,?,?,?,?,?,?,?,?)
            ON CONFLICT (run_id, event_type, event_time) DO NOTHING""";

    /** Event time stored for events that carry none. */
    public static final Instant NO_EVENT_TIME = Instant.EPOCH;

    private final DataSource ds;
    private final Clock clock;

    public RunEventLedger(DataSource ds, Clock clock) {
        this.ds = ds;
        this.clock = clock;
    }

    /**
     * @return false if the row could not be written
     */
    @Override
    public boolean process(LineageEvent event) {
        Instant eventTime = event.eventTime() != null ? event.eventTime() : NO_EVENT_TIME;
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(INSERT)) {
            stmt.setString(1, event.runId());
            stmt.setString(2, event.eventType());
            stmt.setTimestamp(3, Timestamp.from(eventTime));
            stmt.setString(4, event.jobNamespace());
            stmt.setString(5, event.jobName());
            stmt.setString(6, event.producer());
            stmt.setInt(7, event.inputs().size());
            stmt.setInt(8, event.outputs().size());
            stmt.setString(9, JsonSupport.toJson(event));
            stmt.setTimestamp(10, Timestamp.from(clock.instant()));
            int inserted = stmt.executeUpdate();
            if (inserted == 0) {
                logger.atDebug().addArgument(event.runId()).addArgument(event.eventType())
                        .log("Run {} event {} already recorded");
            }
            return true;
        } catch (SQLException e) {
            logger.atError().setCause(e).addArgument(event.runId()).log("Failed to record event for run {}");
            return false;
        }
    }
}
