package org.broadinstitute.abc.sampler;

import org.apache.commons.math3.random.RandomGenerator;
import org.broadinstitute.abc.population.FullInfoParticle;
import org.broadinstitute.abc.utils.Utils;

/**
 * Draws and evaluates one candidate at a time in the calling thread.  Also used by the workers of the multicore
 * sampler to produce their particles.
 *
 * @param <T>   type of the parameter
 */
public final class SingleCoreSampler<T> extends AbstractSampler<T> {

    public SingleCoreSampler() {
        super();
    }

    public SingleCoreSampler(final long seed) {
        super(seed);
    }

    public SingleCoreSampler(final RandomGenerator rng) {
        super(rng);
    }

    @Override
    protected Sample<T> doSampleUntilNAccepted(final SamplerOptions<T> options) {
        final SamplingResult<T> result = sampleSequentially(options, rng());
        setNumberOfEvaluations(result.getNumberOfEvaluations());
        return result.getSample();
    }

    /**
     * Draws and evaluates candidates with {@code rng} until {@code options.getN()} are accepted.  Runs without the
     * round bookkeeping of a sampler instance, for callers that produce many small rounds such as pool workers.
     */
    public static <T> SamplingResult<T> sampleSequentially(final SamplerOptions<T> options, final RandomGenerator rng) {
        Utils.nonNull(options, "The sampler options cannot be null.");
        Utils.nonNull(rng, "The random number generator cannot be null.");
        final Sample<T> sample = options.getSampleFactory().createEmptySample();
        long numEvaluations = 0;
        while (sample.numAccepted() < options.getN()) {
            final T parameter = options.getSampleOne().draw(rng);
            final FullInfoParticle<T> particle = options.getSimulEvalOne().evaluate(parameter, rng);
            numEvaluations++;
            sample.append(Utils.nonNull(particle, "The evaluation function returned null."));
        }
        return new SamplingResult<>(sample, numEvaluations);
    }
}
