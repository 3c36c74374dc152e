package org.broadinstitute.abc.sampler;

import org.broadinstitute.abc.utils.Utils;

/**
 * Configuration of one sampling round.  A fresh instance is created by the caller for every round.
 *
 * @param <T>   type of the parameter
 */
public final class SamplerOptions<T> {
    private final int n;
    private final ParameterDrawer<T> sampleOne;
    private final ParticleEvaluator<T> simulEvalOne;
    private final SampleFactory<T> sampleFactory;

    /**
     * @param n             number of particles to accept
     * @param sampleOne     draws a candidate parameter
     * @param simulEvalOne  simulates a candidate and decides on its acceptance
     * @param sampleFactory creates the samples of this round
     */
    public SamplerOptions(final int n, final ParameterDrawer<T> sampleOne, final ParticleEvaluator<T> simulEvalOne,
                          final SampleFactory<T> sampleFactory) {
        this.n = Utils.positive(n, "The number of particles to accept must be positive");
        this.sampleOne = Utils.nonNull(sampleOne, "The parameter draw function cannot be null.");
        this.simulEvalOne = Utils.nonNull(simulEvalOne, "The evaluation function cannot be null.");
        this.sampleFactory = Utils.nonNull(sampleFactory, "The sample factory cannot be null.");
    }

    public SamplerOptions(final int n, final ParameterDrawer<T> sampleOne, final ParticleEvaluator<T> simulEvalOne,
                          final boolean recordRejectedSummaryStatistics) {
        this(n, sampleOne, simulEvalOne, new SampleFactory<>(recordRejectedSummaryStatistics));
    }

    /**
     * Same functions and recording option with a different target count.
     */
    public SamplerOptions<T> withN(final int newN) {
        return new SamplerOptions<>(newN, sampleOne, simulEvalOne, sampleFactory);
    }

    public int getN() {
        return n;
    }

    public ParameterDrawer<T> getSampleOne() {
        return sampleOne;
    }

    public ParticleEvaluator<T> getSimulEvalOne() {
        return simulEvalOne;
    }

    public SampleFactory<T> getSampleFactory() {
        return sampleFactory;
    }

    public boolean isRecordingRejectedSummaryStatistics() {
        return sampleFactory.isRecordingRejectedSummaryStatistics();
    }
}
