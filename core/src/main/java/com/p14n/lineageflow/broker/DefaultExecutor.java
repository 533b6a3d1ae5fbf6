package com.p14n.lineageflow.broker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by two thread pools:
 * a scheduled pool for the periodic liveness and reporting sweeps, and a
 * cached pool for long-running loops (queue consumers, the broadcast pump and
 * one delivery loop per connected subscriber).
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li>Loop threads are created on demand and reclaimed when idle</li>
 * <li>Scheduled task execution with customizable intervals</li>
 * <li>Named thread factories for better debugging and monitoring</li>
 * </ul>
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ScheduledExecutorService se;
        private final ExecutorService es;

        /**
         * Creates a new executor with a scheduled thread pool and a cached
         * loop pool.
         *
         * @param scheduledSize the size of the scheduled thread pool
         */
        public DefaultExecutor(int scheduledSize) {
                this.se = createScheduledExecutorService(scheduledSize);
                this.es = createLoopExecutorService();
        }

        protected ThreadFactory createNamedFactory(String nameFormat) {
                return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
        }

        /**
         * Creates a cached thread pool with named threads for blocking loops.
         *
         * @return a cached thread pool executor service
         */
        protected ExecutorService createLoopExecutorService() {
                return Executors.newCachedThreadPool(
                                createNamedFactory("lineageflow-loop-%d"));
        }

        /**
         * Creates a scheduled thread pool with named threads.
         *
         * @param size the number of threads in the pool
         * @return a scheduled thread pool executor service
         */
        protected ScheduledExecutorService createScheduledExecutorService(int size) {
                return Executors.newScheduledThreadPool(size,
                                createNamedFactory("lineageflow-scheduled-%d"));
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
                return se.scheduleAtFixedRate(command, initialDelay, period, unit);
        }

        @Override
        public List<Runnable> shutdownNow() {
                var x = new ArrayList<Runnable>();
                x.addAll(es.shutdownNow());
                x.addAll(se.shutdownNow());
                return x;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
                long deadline = System.nanoTime() + unit.toNanos(timeout);
                boolean loops = es.awaitTermination(timeout, unit);
                long remaining = Math.max(0, deadline - System.nanoTime());
                return se.awaitTermination(remaining, TimeUnit.NANOSECONDS) && loops;
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return es.submit(task);
        }

        @Override
        public void close() throws Exception {
                shutdownNow();
        }
}
