package org.broadinstitute.abc.sampler.multicore;

import org.broadinstitute.abc.sampler.Sample;

/**
 * One accepted particle, as a single-particle sample, and the number of evaluations it took.
 */
final class WorkerResult<T> {
    private final Sample<T> sample;
    private final long numberOfEvaluations;

    WorkerResult(final Sample<T> sample, final long numberOfEvaluations) {
        this.sample = sample;
        this.numberOfEvaluations = numberOfEvaluations;
    }

    Sample<T> getSample() {
        return sample;
    }

    long getNumberOfEvaluations() {
        return numberOfEvaluations;
    }
}
