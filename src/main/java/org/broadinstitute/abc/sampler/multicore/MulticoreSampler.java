package org.broadinstitute.abc.sampler.multicore;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.abc.sampler.AbstractSampler;
import org.broadinstitute.abc.utils.Utils;

/**
 * Base class of the samplers that evaluate on a fixed pool of local workers.
 *
 * @param <T>   type of the parameter
 */
public abstract class MulticoreSampler<T> extends AbstractSampler<T> {
    private static final Logger logger = LogManager.getLogger(MulticoreSampler.class);

    /**
     * Environment variable overriding the number of workers used by default.
     */
    public static final String NUM_PROCS_ENVIRONMENT_VARIABLE = "ABC_NUM_PROCS";

    /**
     * System property overriding the number of workers used by default; takes precedence over the environment.
     */
    public static final String NUM_PROCS_PROPERTY = "abc.num.procs";

    private final int numProcesses;

    protected MulticoreSampler(final int numProcesses, final RandomGenerator rng) {
        super(rng);
        this.numProcesses = Utils.positive(numProcesses, "The number of workers must be positive");
    }

    protected MulticoreSampler(final int numProcesses, final long seed) {
        super(seed);
        this.numProcesses = Utils.positive(numProcesses, "The number of workers must be positive");
    }

    protected MulticoreSampler(final int numProcesses) {
        super();
        this.numProcesses = Utils.positive(numProcesses, "The number of workers must be positive");
    }

    public int getNumProcesses() {
        return numProcesses;
    }

    /**
     * Number of workers to use when none is configured: the value of {@link #NUM_PROCS_PROPERTY} or
     * {@link #NUM_PROCS_ENVIRONMENT_VARIABLE} if set, otherwise the number of available processors.
     */
    public static int numCoresAvailable() {
        final String property = System.getProperty(NUM_PROCS_PROPERTY);
        final String configured = property != null ? property : System.getenv(NUM_PROCS_ENVIRONMENT_VARIABLE);
        if (configured != null) {
            try {
                return Utils.positive(Integer.parseInt(configured.trim()), "Configured number of workers must be positive");
            } catch (final IllegalArgumentException e) {
                logger.warn("Ignoring invalid number of workers '" + configured + "': " + e.getMessage());
            }
        }
        return Runtime.getRuntime().availableProcessors();
    }
}
