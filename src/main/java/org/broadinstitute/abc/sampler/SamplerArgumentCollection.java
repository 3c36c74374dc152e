package org.broadinstitute.abc.sampler;

import org.broadinstitute.abc.sampler.multicore.MulticoreParticleParallelSampler;
import org.broadinstitute.abc.sampler.multicore.MulticoreSampler;
import org.broadinstitute.abc.sampler.remote.BatchedRemoteSampler;
import org.broadinstitute.abc.sampler.remote.RemoteExecutor;
import org.broadinstitute.abc.sampler.remote.TaskTransport;
import org.broadinstitute.abc.utils.Utils;
import org.broadinstitute.barclay.argparser.Argument;

import java.io.Serializable;

/**
 * Arguments selecting and configuring a {@link Sampler}.
 */
public final class SamplerArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public enum SamplerKind {
        SINGLE_CORE, MULTICORE, BATCHED_REMOTE
    }

    @Argument(fullName = "sampler", shortName = "sampler", doc = "Sampling backend", optional = true)
    public SamplerKind samplerKind = SamplerKind.MULTICORE;

    @Argument(fullName = "num-processes", shortName = "num-processes",
            doc = "Number of workers; defaults to the ABC_NUM_PROCS environment variable or the number of processors",
            optional = true)
    public int numProcesses = MulticoreSampler.numCoresAvailable();

    @Argument(fullName = "batch-size", shortName = "batch-size",
            doc = "Number of parameters evaluated per remote batch", optional = true)
    public int batchSize = BatchedRemoteSampler.DEFAULT_BATCH_SIZE;

    @Argument(fullName = "max-jobs", shortName = "max-jobs",
            doc = "Maximum number of remote batches running at once", optional = true)
    public int maxJobs = BatchedRemoteSampler.DEFAULT_MAX_JOBS;

    @Argument(fullName = "task-transport", shortName = "task-transport",
            doc = "How remote batches are shipped to the workers", optional = true)
    public TaskTransport taskTransport = TaskTransport.SERIALIZED;

    @Argument(fullName = "sampler-seed", shortName = "sampler-seed",
            doc = "Seed of the sampler's random number generator; unseeded if not given", optional = true)
    public Long seed = null;

    @Argument(fullName = "record-rejected-summary-statistics", shortName = "record-rejected-summary-statistics",
            doc = "Keep the summary statistics of rejected evaluations in the sample", optional = true)
    public boolean recordRejectedSummaryStatistics = false;

    /**
     * Builds the configured local sampler.  A batched remote sampler needs an executor whose lifetime the caller
     * manages; build it with {@link #createSampler(RemoteExecutor)}.
     */
    public <T> Sampler<T> createSampler() {
        Utils.validateArg(samplerKind != SamplerKind.BATCHED_REMOTE,
                "A batched remote sampler needs a remote executor; use createSampler(RemoteExecutor).");
        return createSampler(null);
    }

    /**
     * Builds the configured sampler, using {@code remoteExecutor} if it is a batched remote sampler.
     */
    public <T> Sampler<T> createSampler(final RemoteExecutor remoteExecutor) {
        validate();
        switch (samplerKind) {
            case SINGLE_CORE:
                return seed == null ? new SingleCoreSampler<>() : new SingleCoreSampler<>(seed);
            case MULTICORE:
                return seed == null
                        ? new MulticoreParticleParallelSampler<>(numProcesses)
                        : new MulticoreParticleParallelSampler<>(numProcesses, seed);
            case BATCHED_REMOTE:
                Utils.nonNull(remoteExecutor, "A batched remote sampler needs a remote executor.");
                return seed == null
                        ? new BatchedRemoteSampler<>(remoteExecutor, batchSize, maxJobs, taskTransport)
                        : new BatchedRemoteSampler<>(remoteExecutor, batchSize, maxJobs, taskTransport, seed);
            default:
                throw new IllegalStateException("Unknown sampler kind: " + samplerKind);
        }
    }

    public <T> SampleFactory<T> createSampleFactory() {
        return new SampleFactory<>(recordRejectedSummaryStatistics);
    }

    public void validate() {
        Utils.nonNull(samplerKind, "The sampler kind must be given.");
        Utils.nonNull(taskTransport, "The task transport must be given.");
        Utils.positive(numProcesses, "The number of workers must be positive");
        Utils.positive(batchSize, "The batch size must be positive");
        Utils.positive(maxJobs, "The maximum number of jobs must be positive");
    }
}
