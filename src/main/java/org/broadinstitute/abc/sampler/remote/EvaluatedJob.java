package org.broadinstitute.abc.sampler.remote;

import org.broadinstitute.abc.population.FullInfoParticle;

import java.io.Serializable;

/**
 * Evaluation result of one parameter, tagged with the job id it was submitted under.
 */
public final class EvaluatedJob<T> implements Serializable {
    private static final long serialVersionUID = 1L;

    private final long jobId;
    private final FullInfoParticle<T> particle;

    public EvaluatedJob(final long jobId, final FullInfoParticle<T> particle) {
        this.jobId = jobId;
        this.particle = particle;
    }

    public long getJobId() {
        return jobId;
    }

    public FullInfoParticle<T> getParticle() {
        return particle;
    }

    public boolean isAccepted() {
        return particle.isAccepted();
    }

    @Override
    public String toString() {
        return "EvaluatedJob{" + jobId + (isAccepted() ? ", accepted}" : ", rejected}");
    }
}
