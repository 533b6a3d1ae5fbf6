package com.p14n.lineageflow.db;

import com.p14n.lineageflow.data.QueueItem;

import java.sql.*;
import java.util.regex.Pattern;

/**
 * Utility class providing SQL helpers for the queue tables.
 */
public class SQL {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    /** Private constructor to prevent instantiation of utility class */
    private SQL() {
    }

    /**
     * Returns the qualified table name for a queue.
     *
     * @param queue queue name
     * @return the table name, e.g. {@code lineageflow.q_lineage_events}
     * @throws IllegalArgumentException if the queue name is not a valid SQL
     *                                  identifier
     */
    public static String queueTable(String queue) {
        if (queue == null || queue.trim().isEmpty()) {
            throw new IllegalArgumentException("Queue name cannot be null or empty");
        }
        if (!IDENTIFIER.matcher(queue).matches()) {
            throw new IllegalArgumentException("Queue name is not a valid SQL identifier: " + queue);
        }
        return QueueSetup.SCHEMA + ".q_" + queue;
    }

    /**
     * Creates a QueueItem from the current ResultSet row.
     *
     * @param rs ResultSet positioned at the row to map
     * @return the item
     * @throws SQLException if any database access error occurs
     */
    public static QueueItem itemFromResultSet(ResultSet rs) throws SQLException {
        Timestamp enqueued = rs.getTimestamp("enqueued_at");
        return new QueueItem(
                rs.getLong("msg_id"),
                rs.getString("message"),
                rs.getInt("read_ct"),
                enqueued == null ? null : enqueued.toInstant());
    }

    /**
     * Handles SQLException by attempting to rollback the transaction.
     * If rollback fails, the rollback exception is added as a suppressed exception.
     *
     * @param e    Original SQLException that triggered the rollback
     * @param conn Connection to rollback (may be null)
     */
    public static void handleSQLException(SQLException e, Connection conn) {
        if (conn != null) {
            try {
                if (!conn.isClosed() && !conn.getAutoCommit()) {
                    conn.rollback();
                }
            } catch (SQLException rollbackEx) {
                e.addSuppressed(rollbackEx);
            }
        }
    }

}
