package org.broadinstitute.abc.sampler.multicore;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.abc.exceptions.SamplingException;
import org.broadinstitute.abc.sampler.Sample;
import org.broadinstitute.abc.sampler.SamplerOptions;
import org.broadinstitute.abc.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Samples on a pool of worker threads, one particle per work token.
 * <p>
 *     A feeder puts n work tokens and one termination token per worker on a shared feed queue.  Each of the
 *     min(n, number of workers) workers turns work tokens into accepted particles with its own generator through
 *     {@link org.broadinstitute.abc.sampler.SingleCoreSampler#sampleSequentially} and posts them on a shared result queue, from
 *     which this sampler receives exactly n results.  Since every token costs at most one particle, starting more
 *     than n workers would not help.
 * </p>
 * <p>
 *     Before every receive, and again whenever no result arrived within {@link #DEFAULT_HEALTH_CHECK_INTERVAL_MILLIS},
 *     the workers are checked.  A worker that died with results outstanding is fatal; nothing is retried.  Started
 *     evaluations are never cancelled.
 * </p>
 *
 * @param <T>   type of the parameter
 */
public final class MulticoreParticleParallelSampler<T> extends MulticoreSampler<T> {
    private static final Logger logger = LogManager.getLogger(MulticoreParticleParallelSampler.class);

    static final long DEFAULT_HEALTH_CHECK_INTERVAL_MILLIS = 1000;

    private final ThreadFactory workerThreadFactory;
    private final ThreadFactory feederThreadFactory;
    private final long healthCheckIntervalMillis;

    public MulticoreParticleParallelSampler() {
        this(numCoresAvailable());
    }

    public MulticoreParticleParallelSampler(final int numProcesses) {
        super(numProcesses);
        this.workerThreadFactory = defaultWorkerThreadFactory();
        this.feederThreadFactory = defaultFeederThreadFactory();
        this.healthCheckIntervalMillis = DEFAULT_HEALTH_CHECK_INTERVAL_MILLIS;
    }

    public MulticoreParticleParallelSampler(final int numProcesses, final long seed) {
        super(numProcesses, seed);
        this.workerThreadFactory = defaultWorkerThreadFactory();
        this.feederThreadFactory = defaultFeederThreadFactory();
        this.healthCheckIntervalMillis = DEFAULT_HEALTH_CHECK_INTERVAL_MILLIS;
    }

    @VisibleForTesting
    MulticoreParticleParallelSampler(final int numProcesses, final RandomGenerator rng,
                                     final ThreadFactory workerThreadFactory, final long healthCheckIntervalMillis) {
        this(numProcesses, rng, workerThreadFactory, defaultFeederThreadFactory(), healthCheckIntervalMillis);
    }

    @VisibleForTesting
    MulticoreParticleParallelSampler(final int numProcesses, final RandomGenerator rng,
                                     final ThreadFactory workerThreadFactory, final ThreadFactory feederThreadFactory,
                                     final long healthCheckIntervalMillis) {
        super(numProcesses, rng);
        this.workerThreadFactory = Utils.nonNull(workerThreadFactory);
        this.feederThreadFactory = Utils.nonNull(feederThreadFactory);
        Utils.validateArg(healthCheckIntervalMillis > 0, "The health check interval must be positive.");
        this.healthCheckIntervalMillis = healthCheckIntervalMillis;
    }

    private static ThreadFactory defaultWorkerThreadFactory() {
        return new ThreadFactoryBuilder().setNameFormat("abc-particle-worker-%d").setDaemon(true).build();
    }

    private static ThreadFactory defaultFeederThreadFactory() {
        return new ThreadFactoryBuilder().setNameFormat("abc-particle-feeder-%d").setDaemon(true).build();
    }

    @Override
    protected Sample<T> doSampleUntilNAccepted(final SamplerOptions<T> options) {
        final int n = options.getN();
        final int numWorkers = Math.min(n, getNumProcesses());
        logger.debug("Start sampling on " + numWorkers + " workers (" + getNumProcesses() + " requested).");

        final BlockingQueue<WorkToken> feedQueue = new LinkedBlockingQueue<>();
        final BlockingQueue<WorkerResult<T>> resultQueue = new LinkedBlockingQueue<>();
        final SamplerOptions<T> singleParticleOptions = options.withN(1);

        final List<ParticleWorker<T>> workers = new ArrayList<>(numWorkers);
        final List<Thread> workerThreads = new ArrayList<>(numWorkers);
        for (int i = 0; i < numWorkers; i++) {
            final ParticleWorker<T> worker = new ParticleWorker<>(
                    new WorkerDescriptor<>(i, singleParticleOptions, rng().nextLong()), feedQueue, resultQueue);
            workers.add(worker);
            workerThreads.add(workerThreadFactory.newThread(worker));
        }
        final Thread feederThread = feederThreadFactory.newThread(new Feeder(feedQueue, n, numWorkers));

        workerThreads.forEach(Thread::start);
        feederThread.start();

        final List<WorkerResult<T>> results = new ArrayList<>(n);
        try {
            for (int i = 0; i < n; i++) {
                results.add(receiveIfWorkersHealthy(resultQueue, workers, workerThreads, n - i));
            }
            feederThread.join();
            for (final Thread workerThread : workerThreads) {
                workerThread.join();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            withdrawWork(feedQueue, feederThread, numWorkers);
            throw new SamplingException("Interrupted while waiting for worker results.", e);
        } catch (final RuntimeException | Error e) {
            withdrawWork(feedQueue, feederThread, numWorkers);
            throw e;
        }

        long numEvaluations = 0;
        final List<Sample<T>> workerSamples = new ArrayList<>(n);
        for (final WorkerResult<T> result : results) {
            numEvaluations += result.getNumberOfEvaluations();
            workerSamples.add(result.getSample());
        }
        setNumberOfEvaluations(numEvaluations);
        return options.getSampleFactory().createEmptySample().mergeAll(workerSamples);
    }

    private WorkerResult<T> receiveIfWorkersHealthy(final BlockingQueue<WorkerResult<T>> resultQueue,
                                                    final List<ParticleWorker<T>> workers,
                                                    final List<Thread> workerThreads,
                                                    final int numOutstanding) throws InterruptedException {
        while (true) {
            checkWorkersHealthy(workers, workerThreads, numOutstanding);
            final WorkerResult<T> result = resultQueue.poll(healthCheckIntervalMillis, TimeUnit.MILLISECONDS);
            if (result != null) {
                return result;
            }
        }
    }

    /**
     * A worker is healthy while it runs or once it has stopped on a termination token.  A worker killed by a
     * {@link RuntimeException} of the evaluation function rethrows that exception here.
     */
    private static <T> void checkWorkersHealthy(final List<ParticleWorker<T>> workers,
                                                final List<Thread> workerThreads,
                                                final int numOutstanding) {
        for (int i = 0; i < workers.size(); i++) {
            final ParticleWorker<T> worker = workers.get(i);
            final Throwable failure = worker.getFailure();
            if (failure instanceof RuntimeException) {
                throw (RuntimeException) failure;
            }
            if (failure != null) {
                throw new SamplingException.WorkerFailure(workerThreads.get(i).getName(), numOutstanding, failure);
            }
            if (!workerThreads.get(i).isAlive() && !worker.isTerminatedCleanly()) {
                throw new SamplingException.WorkerFailure(workerThreads.get(i).getName(), numOutstanding);
            }
        }
    }

    /**
     * Replaces the tokens nobody has taken yet by termination tokens, so that the surviving workers stop after
     * their current evaluation.
     */
    private static void withdrawWork(final BlockingQueue<WorkToken> feedQueue, final Thread feederThread,
                                     final int numWorkers) {
        feederThread.interrupt();
        try {
            feederThread.join(DEFAULT_HEALTH_CHECK_INTERVAL_MILLIS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        feedQueue.clear();
        for (int i = 0; i < numWorkers; i++) {
            feedQueue.offer(WorkToken.TERMINATE);
        }
    }
}
