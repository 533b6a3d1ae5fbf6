package com.p14n.lineageflow.broadcast;

import java.io.IOException;

/**
 * The write side of one streaming connection.
 */
public interface SessionTransport {

    /**
     * Writes a complete frame, blocking until it is handed to the network or
     * fails.
     *
     * @throws IOException if the connection is closed or the write fails
     */
    void write(String frame) throws IOException;

    /** Ends the stream. Safe to call more than once. */
    void close();
}
