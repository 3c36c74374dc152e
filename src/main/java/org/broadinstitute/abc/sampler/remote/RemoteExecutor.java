package org.broadinstitute.abc.sampler.remote;

import java.util.concurrent.Callable;

/**
 * Capability to run tasks on remote workers, for example a cluster client.
 */
public interface RemoteExecutor {
    /**
     * Submits a task for execution; must not block until the task completes.
     */
    <R> RemoteHandle<R> submit(final Callable<R> task);

    /**
     * Number of workers currently available to run tasks.
     */
    int availableWorkers();
}
