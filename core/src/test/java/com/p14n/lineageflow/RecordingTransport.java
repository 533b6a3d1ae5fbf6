package com.p14n.lineageflow;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.p14n.lineageflow.broadcast.SessionTransport;

/**
 * Transport that records frames, optionally failing every write.
 */
public class RecordingTransport implements SessionTransport {

    private final LinkedBlockingQueue<String> frames = new LinkedBlockingQueue<>();
    private final AtomicInteger attempts = new AtomicInteger();
    private final CountDownLatch closed = new CountDownLatch(1);
    private volatile boolean failing;

    public static RecordingTransport failing() {
        RecordingTransport t = new RecordingTransport();
        t.failing = true;
        return t;
    }

    @Override
    public void write(String frame) throws IOException {
        attempts.incrementAndGet();
        if (failing) {
            throw new IOException("Broken pipe");
        }
        frames.add(frame);
    }

    @Override
    public void close() {
        closed.countDown();
    }

    public int attempts() {
        return attempts.get();
    }

    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isClosed() {
        return closed.getCount() == 0;
    }

    /** Waits for the next frame, or returns null on timeout. */
    public String nextFrame(Duration timeout) throws InterruptedException {
        return frames.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Waits for {@code n} frames and returns them. */
    public List<String> awaitFrames(int n, Duration timeout) throws InterruptedException {
        List<String> out = new ArrayList<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (out.size() < n) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            String f = frames.poll(remaining, TimeUnit.NANOSECONDS);
            if (f != null) {
                out.add(f);
            }
        }
        return out;
    }

    /** The {@code event:} line of a frame. */
    public static String topicOf(String frame) {
        for (String line : frame.split("\n")) {
            if (line.startsWith("event: ")) {
                return line.substring("event: ".length());
            }
        }
        return null;
    }

    /** The JSON after {@code data: } in a frame. */
    public static String dataOf(String frame) {
        for (String line : frame.split("\n")) {
            if (line.startsWith("data: ")) {
                return line.substring("data: ".length());
            }
        }
        return null;
    }
}
