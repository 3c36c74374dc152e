package org.broadinstitute.abc.sampler.remote;

import org.apache.commons.lang3.SerializationException;
import org.apache.commons.lang3.SerializationUtils;
import org.broadinstitute.abc.exceptions.SamplingException;
import org.broadinstitute.abc.sampler.ParticleEvaluator;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Ships batches as serialized bytes.  The evaluator is serialized once per round, the parameters once per batch;
 * anything that is not serializable is rejected at submission.
 */
final class SerializedBatchTaskFactory<T> implements BatchTaskFactory<T> {
    private final byte[] serializedEvaluator;

    SerializedBatchTaskFactory(final ParticleEvaluator<T> evaluator) {
        try {
            serializedEvaluator = SerializationUtils.serialize(evaluator);
        } catch (final SerializationException e) {
            throw new SamplingException.Transport("evaluation function", e);
        }
    }

    @Override
    public Callable<List<EvaluatedJob<T>>> createTask(final List<T> parameters, final long[] jobIds, final long seed) {
        final byte[] serializedParameters;
        try {
            serializedParameters = SerializationUtils.serialize(new ArrayList<>(parameters));
        } catch (final SerializationException e) {
            throw new SamplingException.Transport("parameters of job " + jobIds[0], e);
        }
        return new SerializedBatchTask<>(serializedEvaluator, serializedParameters, jobIds.clone(), seed);
    }

    private static final class SerializedBatchTask<T> implements Callable<List<EvaluatedJob<T>>>, Serializable {
        private static final long serialVersionUID = 1L;

        private final byte[] serializedEvaluator;
        private final byte[] serializedParameters;
        private final long[] jobIds;
        private final long seed;

        private SerializedBatchTask(final byte[] serializedEvaluator, final byte[] serializedParameters,
                                    final long[] jobIds, final long seed) {
            this.serializedEvaluator = serializedEvaluator;
            this.serializedParameters = serializedParameters;
            this.jobIds = jobIds;
            this.seed = seed;
        }

        @Override
        public List<EvaluatedJob<T>> call() {
            final ParticleEvaluator<T> evaluator = SerializationUtils.deserialize(serializedEvaluator);
            final List<T> parameters = SerializationUtils.deserialize(serializedParameters);
            return BatchEvaluation.evaluate(evaluator, parameters, jobIds, seed);
        }
    }
}
