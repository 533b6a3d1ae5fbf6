package com.p14n.lineageflow.queue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for loops that repeatedly lease and handle a batch from a work queue.
 *
 * <p>
 * {@link #stop()} moves the worker to {@link ConsumerState#DRAINING}; the
 * batch in hand is finished and the loop then stops. Subclasses report lease
 * failures by throwing from {@link #pollOnce()}; the loop logs them, calls
 * {@link #onPollFailure(RuntimeException)} and waits the backoff before trying
 * again, forever.
 * </p>
 */
public abstract class PollingWorker implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(PollingWorker.class);

    private final String name;
    private final Duration failureBackoff;
    private final AtomicReference<ConsumerState> state = new AtomicReference<>(ConsumerState.RUNNING);
    private final CountDownLatch stopRequested = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);

    protected PollingWorker(String name, Duration failureBackoff) {
        this.name = name;
        this.failureBackoff = failureBackoff;
    }

    /**
     * Leases and handles one batch.
     *
     * @throws RuntimeException if the lease itself failed
     */
    protected abstract void pollOnce();

    /** Called after a failed poll, before the backoff. */
    protected void onPollFailure(RuntimeException e) {
    }

    @Override
    public void run() {
        logger.atInfo().addArgument(name).log("{} started");
        try {
            while (state.get() == ConsumerState.RUNNING && !Thread.currentThread().isInterrupted()) {
                try {
                    pollOnce();
                } catch (RuntimeException e) {
                    logger.atError().setCause(e).addArgument(name).addArgument(failureBackoff)
                            .log("{} poll failed, retrying in {}");
                    onPollFailure(e);
                    if (stopRequested.await(failureBackoff.toMillis(), TimeUnit.MILLISECONDS)) {
                        break;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state.set(ConsumerState.STOPPED);
            stopped.countDown();
            logger.atInfo().addArgument(name).log("{} stopped");
        }
    }

    /** Requests a stop after the current batch. */
    public void stop() {
        state.compareAndSet(ConsumerState.RUNNING, ConsumerState.DRAINING);
        stopRequested.countDown();
    }

    /**
     * Waits for the loop to finish.
     *
     * @return true if it stopped within the timeout
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public ConsumerState state() {
        return state.get();
    }
}
