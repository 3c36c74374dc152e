package org.broadinstitute.abc.sampler;

/**
 * Produces a population of accepted particles by repeatedly drawing and evaluating candidates.
 * <p>
 *     A sampler keeps its configuration across rounds, but a single instance must not run two rounds at once:
 *     the evaluation count is written by the running round only.
 * </p>
 *
 * @param <T>   type of the parameter
 */
public interface Sampler<T> {
    /**
     * Draws and evaluates candidates until exactly {@code options.getN()} have been accepted.
     * There is no time limit; a round whose acceptance probability is zero does not terminate.
     * Exceptions thrown by the evaluation function propagate and abort the round without a partial result.
     * @param options   configuration of this round
     * @return          sample holding exactly {@code options.getN()} accepted particles
     */
    Sample<T> sampleUntilNAccepted(final SamplerOptions<T> options);

    /**
     * Number of evaluations consumed by the last completed round, counted in submission order.
     * Acceptance-rate estimates downstream rely on this.
     */
    long getNumberOfEvaluations();

    /**
     * Runs a round and returns its sample together with its evaluation count.
     */
    default SamplingResult<T> sample(final SamplerOptions<T> options) {
        final Sample<T> sample = sampleUntilNAccepted(options);
        return new SamplingResult<>(sample, getNumberOfEvaluations());
    }
}
