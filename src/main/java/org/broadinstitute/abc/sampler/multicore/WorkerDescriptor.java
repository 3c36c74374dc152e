package org.broadinstitute.abc.sampler.multicore;

import org.broadinstitute.abc.sampler.SamplerOptions;

/**
 * Everything a worker needs, handed over explicitly at startup: the per-particle options and the seed of the
 * worker's private random number generator.
 */
final class WorkerDescriptor<T> {
    private final int workerIndex;
    private final SamplerOptions<T> singleParticleOptions;
    private final long seed;

    WorkerDescriptor(final int workerIndex, final SamplerOptions<T> singleParticleOptions, final long seed) {
        this.workerIndex = workerIndex;
        this.singleParticleOptions = singleParticleOptions;
        this.seed = seed;
    }

    int getWorkerIndex() {
        return workerIndex;
    }

    SamplerOptions<T> getSingleParticleOptions() {
        return singleParticleOptions;
    }

    long getSeed() {
        return seed;
    }
}
