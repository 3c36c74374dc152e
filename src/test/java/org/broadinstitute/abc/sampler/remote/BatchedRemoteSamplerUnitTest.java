package org.broadinstitute.abc.sampler.remote;

import org.broadinstitute.abc.exceptions.SamplingException;
import org.broadinstitute.abc.population.FullInfoParticle;
import org.broadinstitute.abc.population.ParameterPoint;
import org.broadinstitute.abc.population.SummaryStatistics;
import org.broadinstitute.abc.sampler.ParticleEvaluator;
import org.broadinstitute.abc.sampler.Sample;
import org.broadinstitute.abc.sampler.SamplerOptions;
import org.broadinstitute.abc.test.BaseTest;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

public final class BatchedRemoteSamplerUnitTest extends BaseTest {
    private static final int NUM_WORKERS = 4;

    private ExecutorServiceRemoteExecutor threadPool;

    /**
     * Parameter type that cannot be serialized.
     */
    private static final class LocalParameter {
    }

    @BeforeClass
    public void startThreadPool() {
        threadPool = ExecutorServiceRemoteExecutor.newFixedThreadPool(NUM_WORKERS);
    }

    @AfterClass(alwaysRun = true)
    public void stopThreadPool() {
        threadPool.close();
    }

    @DataProvider(name = "configurations")
    public Object[][] configurations() {
        return new Object[][] {
                // transport, batch size, max jobs, n
                {TaskTransport.SERIALIZED, 1, BatchedRemoteSampler.DEFAULT_MAX_JOBS, 1},
                {TaskTransport.SERIALIZED, 1, BatchedRemoteSampler.DEFAULT_MAX_JOBS, 25},
                {TaskTransport.SERIALIZED, 3, 2, 25},
                {TaskTransport.CLOSURE, 1, BatchedRemoteSampler.DEFAULT_MAX_JOBS, 25},
                {TaskTransport.CLOSURE, 5, 10, 7},
        };
    }

    @Test(dataProvider = "configurations")
    public void testAlwaysAccept(final TaskTransport transport, final int batchSize, final int maxJobs, final int n) {
        final BatchedRemoteSampler<ParameterPoint> sampler = new BatchedRemoteSampler<>(threadPool, batchSize, maxJobs, transport, 3L);
        final Sample<ParameterPoint> sample =
                sampler.sampleUntilNAccepted(new SamplerOptions<>(n, uniformDrawer(), alwaysAccept(), false));
        Assert.assertEquals(sample.numAccepted(), n);
        Assert.assertEquals(sampler.getNumberOfEvaluations(), n);
    }

    @Test(dataProvider = "configurations")
    public void testPartialAcceptance(final TaskTransport transport, final int batchSize, final int maxJobs, final int n) {
        final BatchedRemoteSampler<ParameterPoint> sampler = new BatchedRemoteSampler<>(threadPool, batchSize, maxJobs, transport, 5L);
        final Sample<ParameterPoint> sample =
                sampler.sampleUntilNAccepted(new SamplerOptions<>(n, uniformDrawer(), acceptWithProbability(0.4), true));
        Assert.assertEquals(sample.numAccepted(), n);
        Assert.assertTrue(sampler.getNumberOfEvaluations() >= n);
        // one statistic per evaluation consumed, in job-id order without gaps
        Assert.assertEquals(sample.getAllSummaryStatistics().size(), sampler.getNumberOfEvaluations());
    }

    @Test
    public void testSameSeedSamePopulation() {
        final SamplerOptions<ParameterPoint> options = new SamplerOptions<>(20, uniformDrawer(), acceptWithProbability(0.5), false);
        final BatchedRemoteSampler<ParameterPoint> first = new BatchedRemoteSampler<>(threadPool, 2, 8, TaskTransport.SERIALIZED, 99L);
        final BatchedRemoteSampler<ParameterPoint> second = new BatchedRemoteSampler<>(threadPool, 2, 8, TaskTransport.SERIALIZED, 99L);
        final List<ParameterPoint> firstParameters = first.sampleUntilNAccepted(options).getAcceptedPopulation().getParameters();
        final List<ParameterPoint> secondParameters = second.sampleUntilNAccepted(options).getAcceptedPopulation().getParameters();
        Assert.assertEquals(firstParameters, secondParameters);
        Assert.assertEquals(first.getNumberOfEvaluations(), second.getNumberOfEvaluations());
    }

    @Test
    public void testPopulationFollowsSubmissionOrderWhenBatchesFinishInReverse() {
        final RemoteExecutorFixtures.ReverseCompletion executor = new RemoteExecutorFixtures.ReverseCompletion(3);
        final BatchedRemoteSampler<ParameterPoint> sampler = new BatchedRemoteSampler<>(executor, 1, 10, TaskTransport.CLOSURE, 0L);
        final Sample<ParameterPoint> sample =
                sampler.sampleUntilNAccepted(new SamplerOptions<>(5, countingDrawer(), acceptEvenTheta(), false));

        // theta = job id - 1, so the accepted jobs are 1, 3, 5, 7 and 9
        Assert.assertEquals(sample.getAcceptedPopulation().getParameters(),
                Arrays.asList(point(0.), point(2.), point(4.), point(6.), point(8.)));
        Assert.assertEquals(sampler.getNumberOfEvaluations(), 9);
        Assert.assertTrue(executor.pending.isEmpty());
    }

    @Test
    public void testNoSubmissionOnceEnoughAccepted() {
        final int n = 10;
        final int batchSize = 2;
        final int numWorkers = 3;
        final RemoteExecutorFixtures.Synchronous executor = new RemoteExecutorFixtures.Synchronous(numWorkers);
        final BatchedRemoteSampler<ParameterPoint> sampler = new BatchedRemoteSampler<>(executor, batchSize, 10, TaskTransport.SERIALIZED, 0L);
        final Sample<ParameterPoint> sample =
                sampler.sampleUntilNAccepted(new SamplerOptions<>(n, uniformDrawer(), alwaysAccept(), false));

        Assert.assertEquals(sample.numAccepted(), n);
        Assert.assertEquals(sampler.getNumberOfEvaluations(), n);
        // two top-ups of three batches of two; the second one completes the population
        Assert.assertEquals(executor.numSubmitted, 6);
        Assert.assertEquals(executor.numEvaluationsSubmitted, 12);
        Assert.assertTrue(executor.numEvaluationsSubmitted <= n + numWorkers * batchSize);
    }

    @Test
    public void testInFlightBatchesBoundedByMaxJobsAndWorkers() {
        final RemoteExecutorFixtures.ReverseCompletion executor = new RemoteExecutorFixtures.ReverseCompletion(8);
        final BatchedRemoteSampler<ParameterPoint> sampler = new BatchedRemoteSampler<>(executor, 1, 2, TaskTransport.CLOSURE, 0L);
        sampler.sampleUntilNAccepted(new SamplerOptions<>(6, uniformDrawer(), acceptWithProbability(0.5), false));
        Assert.assertEquals(executor.maxInFlight, 2);

        final RemoteExecutorFixtures.ReverseCompletion fewWorkers = new RemoteExecutorFixtures.ReverseCompletion(3);
        new BatchedRemoteSampler<ParameterPoint>(fewWorkers, 1, 200, TaskTransport.CLOSURE, 0L)
                .sampleUntilNAccepted(new SamplerOptions<>(6, uniformDrawer(), acceptWithProbability(0.5), false));
        Assert.assertEquals(fewWorkers.maxInFlight, 3);
    }

    @Test
    public void testEvaluationErrorPropagatesAndCancelsRunningBatches() {
        final ParticleEvaluator<ParameterPoint> failing = (parameter, rng) -> {
            throw new IllegalStateException("simulation failed");
        };
        final RemoteExecutorFixtures.Synchronous executor = new RemoteExecutorFixtures.Synchronous(3);
        final BatchedRemoteSampler<ParameterPoint> sampler = new BatchedRemoteSampler<>(executor, 1, 10, TaskTransport.SERIALIZED, 0L);
        final IllegalStateException exception = Assert.expectThrows(IllegalStateException.class,
                () -> sampler.sampleUntilNAccepted(new SamplerOptions<>(5, uniformDrawer(), failing, false)));
        Assert.assertEquals(exception.getMessage(), "simulation failed");
        Assert.assertEquals(executor.numCancelled, 2);
        Assert.assertTrue(executor.pending.isEmpty());
    }

    @Test
    public void testUnserializableEvaluatorFailsAtSubmission() {
        final Object notSerializable = new Object();
        final ParticleEvaluator<ParameterPoint> capturing = (parameter, rng) -> {
            final SummaryStatistics statistics = SummaryStatistics.of(STATISTIC_NAME, notSerializable.hashCode());
            return FullInfoParticle.accepted(0, parameter, 1., statistics, 0.);
        };
        final RemoteExecutorFixtures.Synchronous executor = new RemoteExecutorFixtures.Synchronous(2);
        final SamplerOptions<ParameterPoint> options = new SamplerOptions<>(3, uniformDrawer(), capturing, false);

        Assert.assertThrows(SamplingException.Transport.class,
                () -> new BatchedRemoteSampler<ParameterPoint>(executor, 1, 10, TaskTransport.SERIALIZED, 0L).sampleUntilNAccepted(options));
        Assert.assertEquals(executor.numSubmitted, 0);

        final BatchedRemoteSampler<ParameterPoint> closureSampler = new BatchedRemoteSampler<>(executor, 1, 10, TaskTransport.CLOSURE, 0L);
        Assert.assertEquals(closureSampler.sampleUntilNAccepted(options).numAccepted(), 3);
    }

    @Test
    public void testUnserializableParametersFailAtSubmission() {
        final ParticleEvaluator<LocalParameter> evaluator = (parameter, rng) ->
                FullInfoParticle.accepted(0, parameter, 1., SummaryStatistics.of(STATISTIC_NAME, 0.), 0.);
        final SamplerOptions<LocalParameter> options = new SamplerOptions<>(2, rng -> new LocalParameter(), evaluator, false);
        final RemoteExecutorFixtures.Synchronous executor = new RemoteExecutorFixtures.Synchronous(2);

        Assert.assertThrows(SamplingException.Transport.class,
                () -> new BatchedRemoteSampler<LocalParameter>(executor, 1, 10, TaskTransport.SERIALIZED, 0L).sampleUntilNAccepted(options));
        Assert.assertEquals(executor.numSubmitted, 0);

        Assert.assertEquals(new BatchedRemoteSampler<LocalParameter>(executor, 1, 10, TaskTransport.CLOSURE, 0L)
                .sampleUntilNAccepted(options).numAccepted(), 2);
    }

    @Test(timeOut = 10000)
    public void testExecutorWithoutWorkersFails() {
        final RemoteExecutorFixtures.Synchronous executor = new RemoteExecutorFixtures.Synchronous(0);
        final BatchedRemoteSampler<ParameterPoint> sampler = new BatchedRemoteSampler<>(executor, 1, 10, TaskTransport.CLOSURE, 0L);
        Assert.assertThrows(SamplingException.class,
                () -> sampler.sampleUntilNAccepted(new SamplerOptions<>(3, uniformDrawer(), alwaysAccept(), false)));
        Assert.assertEquals(executor.numSubmitted, 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonPositiveBatchSize() {
        new BatchedRemoteSampler<ParameterPoint>(threadPool, 0, 10, TaskTransport.SERIALIZED);
    }
}
