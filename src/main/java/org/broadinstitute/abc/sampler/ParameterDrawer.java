package org.broadinstitute.abc.sampler;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Draws one candidate parameter.  Called repeatedly and, by the parallel samplers, from several threads at once,
 * each with its own {@link RandomGenerator}.
 *
 * @param <T>   type of the parameter
 */
@FunctionalInterface
public interface ParameterDrawer<T> {
    T draw(final RandomGenerator rng);
}
