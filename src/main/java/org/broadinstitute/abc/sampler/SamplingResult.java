package org.broadinstitute.abc.sampler;

import org.broadinstitute.abc.utils.Utils;

/**
 * A finished {@link Sample} together with the number of evaluations it took.
 *
 * @param <T>   type of the parameter
 */
public final class SamplingResult<T> {
    private final Sample<T> sample;
    private final long numberOfEvaluations;

    public SamplingResult(final Sample<T> sample, final long numberOfEvaluations) {
        this.sample = Utils.nonNull(sample);
        Utils.validateArg(numberOfEvaluations >= sample.numAccepted(),
                "The number of evaluations cannot be smaller than the number of accepted particles.");
        this.numberOfEvaluations = numberOfEvaluations;
    }

    public Sample<T> getSample() {
        return sample;
    }

    public long getNumberOfEvaluations() {
        return numberOfEvaluations;
    }

    /**
     * Accepted particles per evaluation; zero if nothing was evaluated.
     */
    public double getAcceptanceRate() {
        return numberOfEvaluations == 0 ? 0. : (double) sample.numAccepted() / numberOfEvaluations;
    }
}
