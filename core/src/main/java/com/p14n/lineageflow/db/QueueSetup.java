package com.p14n.lineageflow.db;

import com.p14n.lineageflow.data.LineageFlowConfig;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the lineageflow schema, the work queue tables and the run event
 * ledger.
 *
 * <p>
 * Each queue is a table {@code lineageflow.q_<name>} with a visibility
 * timestamp ({@code vt}) and a read count, mirroring the pgmq layout.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * new QueueSetup(dataSource).setupAll(config);
 * }
 * </pre>
 */
public class QueueSetup {
    private static final Logger logger = LoggerFactory.getLogger(QueueSetup.class);

    /** Schema holding all queue and ledger tables. */
    public static final String SCHEMA = "lineageflow";

    private final String jdbcUrl;
    private final String username;
    private final String password;

    private final DataSource ds;

    /**
     * Creates a new QueueSetup instance with explicit connection parameters.
     *
     * @param jdbcUrl  PostgreSQL JDBC URL
     * @param username Database username
     * @param password Database password
     */
    public QueueSetup(String jdbcUrl, String username, String password) {
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
        this.ds = null;
    }

    public QueueSetup(DataSource ds) {
        this.jdbcUrl = null;
        this.username = null;
        this.password = null;
        this.ds = ds;
    }

    /**
     * Creates the schema, the source, dead-letter and notification queues and
     * the run event ledger.
     *
     * @param cfg configuration naming the queues
     * @return this instance for method chaining
     * @throws RuntimeException if database operations fail
     */
    public QueueSetup setupAll(LineageFlowConfig cfg) {
        createSchemaIfNotExists();
        createQueueIfNotExists(cfg.queueName());
        createQueueIfNotExists(cfg.deadLetterQueueName());
        createQueueIfNotExists(cfg.notificationQueueName());
        createRunEventsTableIfNotExists();
        return this;
    }

    public QueueSetup createSchemaIfNotExists() {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("CREATE SCHEMA IF NOT EXISTS " + SCHEMA);
            logger.atInfo().log("Schema creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating schema");
            throw new RuntimeException("Failed to create schema", e);
        }
        return this;
    }

    /**
     * Creates a queue table if it doesn't exist.
     *
     * @param queue Name of the queue
     * @return this instance for method chaining
     * @throws IllegalArgumentException if the queue name is invalid
     * @throws RuntimeException         if table creation fails
     */
    public QueueSetup createQueueIfNotExists(String queue) {
        String table = SQL.queueTable(queue);

        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute(String.format("""
                    CREATE TABLE IF NOT EXISTS %s (
                        msg_id bigint GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                        read_ct integer NOT NULL DEFAULT 0,
                        enqueued_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT clock_timestamp(),
                        vt TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT clock_timestamp(),
                        message text NOT NULL
                    )""", table));

            stmt.execute(String.format("CREATE INDEX IF NOT EXISTS idx_q_%s_vt ON %s (vt)", queue, table));
            logger.atInfo().log("Queue creation completed successfully for queue: {}", queue);

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating queue: {}", queue);
            throw new RuntimeException("Failed to create queue", e);
        }
        return this;
    }

    /**
     * Creates the run event ledger table if it doesn't exist. A row is unique
     * per run, event type and event time so redelivered events are ignored.
     *
     * @return this instance for method chaining
     * @throws RuntimeException if table creation fails
     */
    public QueueSetup createRunEventsTableIfNotExists() {
        try (Connection conn = getConnection();
                Statement stmt = conn.createStatement()) {

            stmt.execute("""
                    CREATE TABLE IF NOT EXISTS lineageflow.run_events (
                        idn bigint GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                        run_id VARCHAR(255) NOT NULL,
                        event_type VARCHAR(32) NOT NULL,
                        event_time TIMESTAMP WITH TIME ZONE NOT NULL,
                        job_namespace VARCHAR(1024) NOT NULL,
                        job_name VARCHAR(1024) NOT NULL,
                        producer VARCHAR(1024),
                        input_count integer NOT NULL DEFAULT 0,
                        output_count integer NOT NULL DEFAULT 0,
                        payload text,
                        recorded_at TIMESTAMP WITH TIME ZONE DEFAULT current_timestamp,
                        UNIQUE (run_id, event_type, event_time)
                    )""");

            stmt.execute("""
                    CREATE INDEX IF NOT EXISTS idx_run_events_job
                    ON lineageflow.run_events (job_namespace, job_name)""");

            logger.atInfo().log("Run events table creation completed successfully");

        } catch (SQLException e) {
            logger.atError().setCause(e).log("Error creating run events table");
            throw new RuntimeException("Failed to create run_events table", e);
        }
        return this;
    }

    private Connection getConnection() throws SQLException {
        if (ds != null)
            return ds.getConnection();
        return DriverManager.getConnection(jdbcUrl, username, password);
    }

}
