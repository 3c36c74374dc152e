package org.broadinstitute.abc.sampler;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.abc.utils.Utils;

import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class of the samplers.  Owns the random number generator and the evaluation count of the sampler and
 * makes sure that at most one round runs on an instance at a time.
 *
 * @param <T>   type of the parameter
 */
public abstract class AbstractSampler<T> implements Sampler<T> {
    private final Logger logger = LogManager.getLogger(getClass());

    private final RandomGenerator rng;
    private final AtomicBoolean isRoundRunning = new AtomicBoolean(false);

    private volatile long numberOfEvaluations = 0;

    /**
     * Sampler seeded from the system entropy source.
     */
    protected AbstractSampler() {
        this(RandomGeneratorFactory.createRandomGenerator(new Random()));
    }

    protected AbstractSampler(final long seed) {
        this(RandomGeneratorFactory.createRandomGenerator(new Random(seed)));
    }

    protected AbstractSampler(final RandomGenerator rng) {
        this.rng = Utils.nonNull(rng, "The random number generator cannot be null.");
    }

    @Override
    public final Sample<T> sampleUntilNAccepted(final SamplerOptions<T> options) {
        Utils.nonNull(options, "The sampler options cannot be null.");
        if (!isRoundRunning.compareAndSet(false, true)) {
            throw new IllegalStateException("A sampling round is already running on this sampler.");
        }
        try {
            numberOfEvaluations = 0;
            logger.info("Sampling until " + options.getN() + " particles are accepted.");
            final Sample<T> sample = doSampleUntilNAccepted(options);
            logger.info(sample.numAccepted() + " particles accepted after " + numberOfEvaluations + " evaluations.");
            return sample;
        } finally {
            isRoundRunning.set(false);
        }
    }

    @Override
    public final long getNumberOfEvaluations() {
        return numberOfEvaluations;
    }

    /**
     * Performs the round.  Implementations must call {@link #setNumberOfEvaluations(long)} before returning.
     */
    protected abstract Sample<T> doSampleUntilNAccepted(final SamplerOptions<T> options);

    protected final void setNumberOfEvaluations(final long numberOfEvaluations) {
        Utils.validateArg(numberOfEvaluations >= 0, "The number of evaluations cannot be negative.");
        this.numberOfEvaluations = numberOfEvaluations;
    }

    /**
     * Generator of this sampler; only the thread running the current round may use it.
     */
    protected final RandomGenerator rng() {
        return rng;
    }
}
