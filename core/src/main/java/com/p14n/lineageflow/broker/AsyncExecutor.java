package com.p14n.lineageflow.broker;

import java.util.List;
import java.util.concurrent.*;

/**
 * Interface for asynchronous task execution.
 */
public interface AsyncExecutor extends AutoCloseable {

    /**
     * Schedules a task for repeated fixed-rate execution.
     *
     * @param command      The task to execute
     * @param initialDelay The time to delay first execution
     * @param period       The period between successive executions
     * @param unit         The time unit of the initialDelay and period parameters
     * @return A ScheduledFuture representing pending completion of the task
     */
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable command,
            long initialDelay,
            long period,
            TimeUnit unit);

    /**
     * Submits a long-running task, such as a polling loop or a session
     * delivery loop, and returns a Future representing its completion.
     * Cancelling the future with interruption is the way to stop the task.
     *
     * @param task The task to submit
     * @param <T>  The type of the task result
     * @return A Future representing pending completion of the task
     */
    <T> Future<T> submit(Callable<T> task);

    /**
     * Shuts down the executor and returns a list of runnables that were not
     * executed. Running tasks are interrupted.
     *
     * @return A list of runnables that were not executed
     */
    List<Runnable> shutdownNow();

    /**
     * Blocks until all tasks have completed after a shutdown request, or the
     * timeout occurs.
     *
     * @param timeout the maximum time to wait
     * @param unit    the time unit of the timeout argument
     * @return true if the executor terminated, false if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

}
