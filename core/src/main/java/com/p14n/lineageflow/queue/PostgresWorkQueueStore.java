package com.p14n.lineageflow.queue;

import static com.p14n.lineageflow.db.SQL.queueTable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.data.QueueItem;
import com.p14n.lineageflow.db.SQL;

/**
 * {@link WorkQueueStore} backed by the tables created by
 * {@link com.p14n.lineageflow.db.QueueSetup}.
 *
 * <p>
 * Leasing locks candidate rows with {@code FOR UPDATE SKIP LOCKED} and pushes
 * their visibility timestamp forward, so concurrent consumers never lease the
 * same item while its window is open.
 * </p>
 */
public class PostgresWorkQueueStore implements WorkQueueStore {
    private static final Logger logger = LoggerFactory.getLogger(PostgresWorkQueueStore.class);

    private static final long POLL_STEP_MILLIS = 100;

    private final DataSource ds;

    public PostgresWorkQueueStore(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public List<QueueItem> lease(String queue, int maxItems, Duration visibilityWindow, Duration pollWait) {
        if (maxItems < 1) {
            throw new IllegalArgumentException("maxItems must be at least 1");
        }
        String table = queueTable(queue);
        long deadline = System.nanoTime() + pollWait.toNanos();
        while (true) {
            List<QueueItem> items = leaseOnce(table, queue, maxItems, visibilityWindow);
            long remaining = deadline - System.nanoTime();
            if (!items.isEmpty() || remaining <= 0) {
                return items;
            }
            try {
                Thread.sleep(Math.min(POLL_STEP_MILLIS, Math.max(1, remaining / 1_000_000)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            }
        }
    }

    private List<QueueItem> leaseOnce(String table, String queue, int maxItems, Duration visibilityWindow) {
        String sql = String.format("""
                WITH next AS (
                    SELECT msg_id FROM %1$s
                    WHERE vt <= clock_timestamp()
                    ORDER BY msg_id
                    LIMIT ?
                    FOR UPDATE SKIP LOCKED)
                UPDATE %1$s q
                SET vt = clock_timestamp() + make_interval(secs => ?),
                    read_ct = q.read_ct + 1
                FROM next
                WHERE q.msg_id = next.msg_id
                RETURNING q.msg_id, q.read_ct, q.enqueued_at, q.message""", table);

        Connection conn = null;
        try {
            conn = ds.getConnection();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setInt(1, maxItems);
                stmt.setDouble(2, visibilityWindow.toMillis() / 1000.0);
                List<QueueItem> items = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        items.add(SQL.itemFromResultSet(rs));
                    }
                }
                items.sort(Comparator.comparingLong(QueueItem::messageId));
                return items;
            }
        } catch (SQLException e) {
            SQL.handleSQLException(e, conn);
            throw new QueueStoreException("Failed to lease from queue " + queue, e);
        } finally {
            close(conn);
        }
    }

    @Override
    public boolean delete(String queue, long messageId) {
        String sql = "DELETE FROM " + queueTable(queue) + " WHERE msg_id = ?";
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setLong(1, messageId);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to delete message " + messageId + " from queue " + queue, e);
        }
    }

    @Override
    public long send(String queue, String payload) {
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        String sql = "INSERT INTO " + queueTable(queue) + " (message) VALUES (?) RETURNING msg_id";
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, payload);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to send to queue " + queue, e);
        }
    }

    @Override
    public long length(String queue) {
        String sql = "SELECT count(*) FROM " + queueTable(queue);
        try (Connection conn = ds.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql);
                ResultSet rs = stmt.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new QueueStoreException("Failed to read length of queue " + queue, e);
        }
    }

    private static void close(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Failed to close connection");
        }
    }
}
