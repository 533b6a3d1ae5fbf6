package com.p14n.lineageflow.vertx;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.broadcast.SessionTransport;

import io.vertx.core.http.HttpServerResponse;

/**
 * Writes server-sent event frames to a chunked Vert.x response.
 *
 * <p>
 * Writes are made from the session's delivery loop thread and wait for
 * Vert.x to complete them, so a client that stops reading surfaces as a
 * write timeout. Frames are held back until {@link #open(String)} has sent
 * the response headers.
 * </p>
 */
public class VertxSessionTransport implements SessionTransport {
    private static final Logger logger = LoggerFactory.getLogger(VertxSessionTransport.class);

    private final HttpServerResponse response;
    private final Duration writeTimeout;
    private final CountDownLatch opened = new CountDownLatch(1);

    public VertxSessionTransport(HttpServerResponse response, Duration writeTimeout) {
        this.response = response;
        this.writeTimeout = writeTimeout;
    }

    /**
     * Sends the stream headers, including the session id, followed by an SSE
     * comment so the client sees the stream open at once.
     */
    public void open(String sessionId) {
        try {
            response.putHeader(EventStreamHttpServer.SESSION_HEADER, sessionId);
            response.write(":\n\n");
        } catch (IllegalStateException e) {
            logger.atDebug().setCause(e).addArgument(sessionId).log("Stream for session {} closed before opening");
        } finally {
            opened.countDown();
        }
    }

    @Override
    public void write(String frame) throws IOException {
        try {
            if (!opened.await(writeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IOException("Stream was not opened within " + writeTimeout);
            }
            if (response.closed() || response.ended()) {
                throw new IOException("Stream closed");
            }
            response.write(frame)
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IOException("Write failed", e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("Write timed out after " + writeTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while writing", e);
        } catch (IllegalStateException e) {
            throw new IOException("Stream closed", e);
        }
    }

    @Override
    public void close() {
        if (response.closed() || response.ended()) {
            return;
        }
        try {
            response.end();
        } catch (IllegalStateException e) {
            logger.atDebug().setCause(e).log("Stream already ended");
        }
    }
}
