package org.broadinstitute.abc.sampler.multicore;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.abc.sampler.SamplingResult;
import org.broadinstitute.abc.sampler.SingleCoreSampler;

import java.util.Random;
import java.util.concurrent.BlockingQueue;

/**
 * Takes tokens from the feed queue and answers every WORK token with one accepted particle on the result queue.
 * <p>
 *     A worker stops cleanly on a TERMINATE token.  If the evaluation throws, the worker records the failure and
 *     stops; the coordinator picks the failure up on its next health check.
 * </p>
 */
final class ParticleWorker<T> implements Runnable {
    private static final Logger logger = LogManager.getLogger(ParticleWorker.class);

    private final WorkerDescriptor<T> descriptor;
    private final BlockingQueue<WorkToken> feedQueue;
    private final BlockingQueue<WorkerResult<T>> resultQueue;

    private volatile boolean isTerminatedCleanly = false;
    private volatile Throwable failure = null;

    ParticleWorker(final WorkerDescriptor<T> descriptor,
                   final BlockingQueue<WorkToken> feedQueue,
                   final BlockingQueue<WorkerResult<T>> resultQueue) {
        this.descriptor = descriptor;
        this.feedQueue = feedQueue;
        this.resultQueue = resultQueue;
    }

    @Override
    public void run() {
        final RandomGenerator rng = RandomGeneratorFactory.createRandomGenerator(new Random(descriptor.getSeed()));
        int numParticles = 0;
        try {
            while (feedQueue.take() == WorkToken.WORK) {
                final SamplingResult<T> result =
                        SingleCoreSampler.sampleSequentially(descriptor.getSingleParticleOptions(), rng);
                resultQueue.put(new WorkerResult<>(result.getSample(), result.getNumberOfEvaluations()));
                numParticles++;
            }
            isTerminatedCleanly = true;
            logger.debug("Worker " + descriptor.getWorkerIndex() + " done after " + numParticles + " particles.");
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Worker " + descriptor.getWorkerIndex() + " interrupted.");
        } catch (final RuntimeException | Error e) {
            failure = e;
            logger.debug("Worker " + descriptor.getWorkerIndex() + " failed: " + e);
        }
    }

    int getWorkerIndex() {
        return descriptor.getWorkerIndex();
    }

    boolean isTerminatedCleanly() {
        return isTerminatedCleanly;
    }

    /**
     * Exception that killed this worker, or {@code null}.
     */
    Throwable getFailure() {
        return failure;
    }
}
