package org.broadinstitute.abc.sampler.remote;

import java.util.concurrent.ExecutionException;

/**
 * Handle on a task submitted to a {@link RemoteExecutor}.
 *
 * @param <R>   type of the task result
 */
public interface RemoteHandle<R> {
    /**
     * Whether the task has finished, successfully or not.  Never blocks.
     */
    boolean isDone();

    /**
     * Result of the task, waiting for it if necessary.
     * @throws ExecutionException if the task threw; the cause is the exception thrown by the task
     */
    R result() throws ExecutionException, InterruptedException;

    /**
     * Attempts to cancel the task.
     * @return  false if the task could not be cancelled, typically because it has already completed
     */
    boolean cancel();
}
