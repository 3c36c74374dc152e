package org.broadinstitute.abc.sampler.remote;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.abc.exceptions.SamplingException;
import org.broadinstitute.abc.sampler.AbstractSampler;
import org.broadinstitute.abc.sampler.Sample;
import org.broadinstitute.abc.sampler.SamplerOptions;
import org.broadinstitute.abc.utils.Utils;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * Samples by submitting batches of evaluations to a {@link RemoteExecutor} and reassembling their results in
 * submission order.
 * <p>
 *     Every parameter gets a job id, strictly increasing in the order parameters are drawn.  Batches may complete
 *     in any order; their results are consumed in job-id order only, so the population and the reported number
 *     of evaluations do not depend on completion order.
 * </p>
 * <p>
 *     New batches are submitted while fewer than min(max jobs, available workers) are running and while fewer
 *     than n accepted results have been seen in total.  Sampling stops once n accepted results have been consumed
 *     in order; the batches still running are then cancelled and buffered results beyond that point are
 *     discarded, which keeps the number of evaluations close to n.
 * </p>
 *
 * @param <T>   type of the parameter
 */
public final class BatchedRemoteSampler<T> extends AbstractSampler<T> {
    private static final Logger logger = LogManager.getLogger(BatchedRemoteSampler.class);

    public static final int DEFAULT_BATCH_SIZE = 1;
    public static final int DEFAULT_MAX_JOBS = 200;

    private static final long POLL_INTERVAL_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final RemoteExecutor remoteExecutor;
    private final int batchSize;
    private final int maxJobs;
    private final TaskTransport taskTransport;

    public BatchedRemoteSampler(final RemoteExecutor remoteExecutor) {
        this(remoteExecutor, DEFAULT_BATCH_SIZE, DEFAULT_MAX_JOBS, TaskTransport.SERIALIZED);
    }

    /**
     * @param remoteExecutor    executor running the batches
     * @param batchSize         number of parameters per batch
     * @param maxJobs           maximum number of batches running at once
     * @param taskTransport     how batches are shipped to the executor
     */
    public BatchedRemoteSampler(final RemoteExecutor remoteExecutor, final int batchSize, final int maxJobs,
                                final TaskTransport taskTransport) {
        this(remoteExecutor, batchSize, maxJobs, taskTransport,
                RandomGeneratorFactory.createRandomGenerator(new Random()));
    }

    public BatchedRemoteSampler(final RemoteExecutor remoteExecutor, final int batchSize, final int maxJobs,
                                final TaskTransport taskTransport, final long seed) {
        this(remoteExecutor, batchSize, maxJobs, taskTransport,
                RandomGeneratorFactory.createRandomGenerator(new Random(seed)));
    }

    public BatchedRemoteSampler(final RemoteExecutor remoteExecutor, final int batchSize, final int maxJobs,
                                final TaskTransport taskTransport, final RandomGenerator rng) {
        super(rng);
        this.remoteExecutor = Utils.nonNull(remoteExecutor, "The remote executor cannot be null.");
        this.batchSize = Utils.positive(batchSize, "The batch size must be positive");
        this.maxJobs = Utils.positive(maxJobs, "The maximum number of jobs must be positive");
        this.taskTransport = Utils.nonNull(taskTransport, "The task transport cannot be null.");
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxJobs() {
        return maxJobs;
    }

    public TaskTransport getTaskTransport() {
        return taskTransport;
    }

    @Override
    protected Sample<T> doSampleUntilNAccepted(final SamplerOptions<T> options) {
        final int n = options.getN();
        final BatchTaskFactory<T> taskFactory = taskTransport.prepare(options.getSimulEvalOne());
        final SequentialResultBuffer<T> buffer = new SequentialResultBuffer<>();
        final List<RemoteHandle<List<EvaluatedJob<T>>>> runningJobs = new ArrayList<>();
        long nextJobId = SequentialResultBuffer.FIRST_JOB_ID;
        int numBatchesSubmitted = 0;

        try {
            while (true) {
                final boolean hasCollected = collectFinishedJobs(runningJobs, buffer);
                buffer.consumeInOrder();
                if (buffer.acceptedSequential() >= n) {
                    break;
                }

                final int capacity = Math.min(maxJobs, remoteExecutor.availableWorkers());
                if (capacity <= 0 && runningJobs.isEmpty()) {
                    throw new SamplingException("The remote executor reports no available workers and no batch is "
                            + "running; " + buffer.acceptedSequential() + " of " + n + " particles accepted.");
                }
                if (runningJobs.size() < capacity && buffer.acceptedTotal() < n) {
                    final int numNewBatches = capacity - runningJobs.size();
                    for (int i = 0; i < numNewBatches; i++) {
                        runningJobs.add(submitBatch(options, taskFactory, nextJobId));
                        nextJobId += batchSize;
                        numBatchesSubmitted++;
                    }
                    logger.debug("Submitted " + numNewBatches + " batches; " + runningJobs.size() + " running.");
                } else if (!hasCollected) {
                    LockSupport.parkNanos(POLL_INTERVAL_NANOS);
                    if (Thread.currentThread().isInterrupted()) {
                        throw new SamplingException("Interrupted while waiting for remote batches.");
                    }
                }
            }
        } finally {
            for (final RemoteHandle<List<EvaluatedJob<T>>> job : runningJobs) {
                job.cancel();
            }
            logger.debug("Cancelled " + runningJobs.size() + " running batches; discarded "
                    + buffer.numUnprocessed() + " out-of-order results.");
        }

        final Sample<T> sample = options.getSampleFactory().createEmptySample();
        long lastJobId = 0;
        for (final EvaluatedJob<T> job : buffer.consumed()) {
            if (sample.numAccepted() >= n) {
                break;
            }
            sample.append(job.getParticle());
            lastJobId = job.getJobId();
        }
        logger.debug(numBatchesSubmitted + " batches submitted; last job consumed: " + lastJobId + ".");
        setNumberOfEvaluations(lastJobId);
        return sample;
    }

    private RemoteHandle<List<EvaluatedJob<T>>> submitBatch(final SamplerOptions<T> options,
                                                            final BatchTaskFactory<T> taskFactory,
                                                            final long firstJobId) {
        final List<T> parameters = new ArrayList<>(batchSize);
        final long[] jobIds = new long[batchSize];
        for (int i = 0; i < batchSize; i++) {
            parameters.add(options.getSampleOne().draw(rng()));
            jobIds[i] = firstJobId + i;
        }
        return remoteExecutor.submit(taskFactory.createTask(parameters, jobIds, rng().nextLong()));
    }

    /**
     * Moves the results of every finished batch into {@code buffer}.
     * @return  whether any batch had finished
     */
    private static <T> boolean collectFinishedJobs(final List<RemoteHandle<List<EvaluatedJob<T>>>> runningJobs,
                                                   final SequentialResultBuffer<T> buffer) {
        boolean hasCollected = false;
        final Iterator<RemoteHandle<List<EvaluatedJob<T>>>> iterator = runningJobs.iterator();
        while (iterator.hasNext()) {
            final RemoteHandle<List<EvaluatedJob<T>>> job = iterator.next();
            if (job.isDone()) {
                iterator.remove();
                getResult(job).forEach(buffer::offer);
                hasCollected = true;
            }
        }
        return hasCollected;
    }

    /**
     * Result of a finished batch; exceptions thrown by the evaluation function are rethrown unchanged.
     */
    private static <R> R getResult(final RemoteHandle<R> job) {
        try {
            return job.result();
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new SamplingException("Remote batch failed.", cause);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SamplingException("Interrupted while collecting a remote batch.", e);
        }
    }
}
