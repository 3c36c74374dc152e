package org.broadinstitute.abc.sampler.remote;

import org.broadinstitute.abc.sampler.ParticleEvaluator;

/**
 * How evaluation batches are packaged for the {@link RemoteExecutor}.  Both ways schedule identically; they differ
 * only in what they can carry.
 */
public enum TaskTransport {
    /**
     * Evaluator and parameters travel as Java-serialized bytes.
     */
    SERIALIZED {
        @Override
        <T> BatchTaskFactory<T> prepare(final ParticleEvaluator<T> evaluator) {
            return new SerializedBatchTaskFactory<>(evaluator);
        }
    },

    /**
     * Evaluator and parameters are captured by reference.
     */
    CLOSURE {
        @Override
        <T> BatchTaskFactory<T> prepare(final ParticleEvaluator<T> evaluator) {
            return new ClosureBatchTaskFactory<>(evaluator);
        }
    };

    abstract <T> BatchTaskFactory<T> prepare(final ParticleEvaluator<T> evaluator);
}
