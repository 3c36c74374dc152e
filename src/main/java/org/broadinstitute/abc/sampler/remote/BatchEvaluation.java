package org.broadinstitute.abc.sampler.remote;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.broadinstitute.abc.population.FullInfoParticle;
import org.broadinstitute.abc.sampler.ParticleEvaluator;
import org.broadinstitute.abc.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Evaluation of one batch on a worker, shared by the task transports.
 */
final class BatchEvaluation {

    private BatchEvaluation() {}

    static <T> List<EvaluatedJob<T>> evaluate(final ParticleEvaluator<T> evaluator, final List<T> parameters,
                                              final long[] jobIds, final long seed) {
        Utils.validateArg(parameters.size() == jobIds.length, "Each parameter of a batch needs a job id.");
        final RandomGenerator rng = RandomGeneratorFactory.createRandomGenerator(new Random(seed));
        final List<EvaluatedJob<T>> results = new ArrayList<>(jobIds.length);
        for (int i = 0; i < jobIds.length; i++) {
            final FullInfoParticle<T> particle = evaluator.evaluate(parameters.get(i), rng);
            results.add(new EvaluatedJob<>(jobIds[i], Utils.nonNull(particle, "The evaluation function returned null.")));
        }
        return results;
    }
}
