package org.broadinstitute.abc.sampler;

import org.apache.commons.math3.random.RandomGenerator;
import org.broadinstitute.abc.population.FullInfoParticle;

import java.io.Serializable;

/**
 * Simulates a parameter, compares the simulation to the observed data and decides whether to accept it.
 * Implementations are shipped to remote workers and must therefore be serializable together with everything
 * they capture.
 *
 * @param <T>   type of the parameter
 */
@FunctionalInterface
public interface ParticleEvaluator<T> extends Serializable {
    /**
     * @param parameter parameter to evaluate
     * @param rng       random number generator private to the calling worker
     * @return          the full evaluation record; must not be {@code null}
     */
    FullInfoParticle<T> evaluate(final T parameter, final RandomGenerator rng);
}
