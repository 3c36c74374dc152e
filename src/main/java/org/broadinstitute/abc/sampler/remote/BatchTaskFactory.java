package org.broadinstitute.abc.sampler.remote;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Packages a batch of parameters into a task for a {@link RemoteExecutor}.
 */
interface BatchTaskFactory<T> {
    /**
     * @param parameters    parameters of the batch
     * @param jobIds        job id of each parameter
     * @param seed          seed of the random number generator used to evaluate the batch
     * @throws org.broadinstitute.abc.exceptions.SamplingException.Transport if the batch cannot be transmitted
     */
    Callable<List<EvaluatedJob<T>>> createTask(final List<T> parameters, final long[] jobIds, final long seed);
}
