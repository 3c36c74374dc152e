package org.broadinstitute.abc.sampler.remote;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.abc.utils.Utils;

import java.util.concurrent.*;

/**
 * {@link RemoteExecutor} backed by a local {@link ExecutorService}, for running the batched sampler on a
 * single machine or in tests.
 */
public final class ExecutorServiceRemoteExecutor implements RemoteExecutor, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ExecutorServiceRemoteExecutor.class);

    private static final long TERMINATION_TIMEOUT_SECONDS = 10;

    private final ExecutorService executorService;
    private final int numWorkers;

    /**
     * @param executorService   executor running the tasks
     * @param numWorkers        number of tasks {@code executorService} runs concurrently
     */
    public ExecutorServiceRemoteExecutor(final ExecutorService executorService, final int numWorkers) {
        this.executorService = Utils.nonNull(executorService, "The executor service cannot be null.");
        this.numWorkers = Utils.positive(numWorkers, "The number of workers must be positive");
    }

    /**
     * Executor with a fixed pool of {@code numWorkers} daemon threads.
     */
    public static ExecutorServiceRemoteExecutor newFixedThreadPool(final int numWorkers) {
        final ThreadFactory threadFactory =
                new ThreadFactoryBuilder().setNameFormat("abc-remote-worker-%d").setDaemon(true).build();
        return new ExecutorServiceRemoteExecutor(Executors.newFixedThreadPool(numWorkers, threadFactory), numWorkers);
    }

    @Override
    public <R> RemoteHandle<R> submit(final Callable<R> task) {
        Utils.nonNull(task, "Cannot submit a null task.");
        return new FutureHandle<>(executorService.submit(task));
    }

    @Override
    public int availableWorkers() {
        return numWorkers;
    }

    /**
     * Cancels the running tasks and waits for the worker threads to stop.
     */
    @Override
    public void close() {
        executorService.shutdownNow();
        try {
            if (!executorService.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Remote workers still running " + TERMINATION_TIMEOUT_SECONDS + " s after shutdown.");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class FutureHandle<R> implements RemoteHandle<R> {
        private final Future<R> future;

        private FutureHandle(final Future<R> future) {
            this.future = future;
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }

        @Override
        public R result() throws ExecutionException, InterruptedException {
            return future.get();
        }

        @Override
        public boolean cancel() {
            return future.cancel(true);
        }
    }
}
