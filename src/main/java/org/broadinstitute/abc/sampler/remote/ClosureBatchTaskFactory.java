package org.broadinstitute.abc.sampler.remote;

import org.broadinstitute.abc.sampler.ParticleEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Hands the evaluator and the parameters to the task by reference.  Whether they can cross a process boundary is
 * left to the {@link RemoteExecutor}.
 */
final class ClosureBatchTaskFactory<T> implements BatchTaskFactory<T> {
    private final ParticleEvaluator<T> evaluator;

    ClosureBatchTaskFactory(final ParticleEvaluator<T> evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public Callable<List<EvaluatedJob<T>>> createTask(final List<T> parameters, final long[] jobIds, final long seed) {
        final List<T> batch = new ArrayList<>(parameters);
        final long[] batchJobIds = jobIds.clone();
        return () -> BatchEvaluation.evaluate(evaluator, batch, batchJobIds, seed);
    }
}
