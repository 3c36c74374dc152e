package org.broadinstitute.abc.sampler.remote;

import org.broadinstitute.abc.population.FullInfoParticle;
import org.broadinstitute.abc.population.ParameterPoint;
import org.broadinstitute.abc.population.SummaryStatistics;
import org.broadinstitute.abc.test.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

public final class SequentialResultBufferUnitTest extends BaseTest {

    private static EvaluatedJob<ParameterPoint> job(final long jobId, final boolean accepted) {
        final SummaryStatistics statistics = SummaryStatistics.of(STATISTIC_NAME, jobId);
        return new EvaluatedJob<>(jobId, accepted
                ? FullInfoParticle.accepted(0, point(jobId), 1., statistics, 0.)
                : FullInfoParticle.rejected(0, point(jobId), statistics, 1.));
    }

    private static List<Long> consumedIds(final SequentialResultBuffer<ParameterPoint> buffer) {
        return buffer.consumed().stream().map(EvaluatedJob::getJobId).collect(Collectors.toList());
    }

    @Test
    public void testReverseCompletionIsConsumedInOrder() {
        final SequentialResultBuffer<ParameterPoint> buffer = new SequentialResultBuffer<>();
        final long lastJobId = 6;
        for (long jobId = lastJobId; jobId > SequentialResultBuffer.FIRST_JOB_ID; jobId--) {
            buffer.offer(job(jobId, true));
            Assert.assertEquals(buffer.consumeInOrder(), 0);
            Assert.assertEquals(buffer.nextValidIndex(), SequentialResultBuffer.FIRST_JOB_ID - 1);
        }
        buffer.offer(job(SequentialResultBuffer.FIRST_JOB_ID, true));
        Assert.assertEquals(buffer.consumeInOrder(), 6);

        Assert.assertEquals(consumedIds(buffer),
                LongStream.rangeClosed(SequentialResultBuffer.FIRST_JOB_ID, lastJobId).boxed().collect(Collectors.toList()));
        Assert.assertEquals(buffer.nextValidIndex(), lastJobId);
        Assert.assertEquals(buffer.numUnprocessed(), 0);
    }

    @Test
    public void testGapBlocksConsumption() {
        final SequentialResultBuffer<ParameterPoint> buffer = new SequentialResultBuffer<>();
        buffer.offer(job(1, true));
        buffer.offer(job(3, true));
        buffer.offer(job(4, false));
        Assert.assertEquals(buffer.consumeInOrder(), 1);
        Assert.assertEquals(buffer.nextValidIndex(), 1);
        Assert.assertEquals(buffer.numUnprocessed(), 2);
        Assert.assertEquals(buffer.acceptedTotal(), 2);
        Assert.assertEquals(buffer.acceptedSequential(), 1);

        buffer.offer(job(2, false));
        Assert.assertEquals(buffer.consumeInOrder(), 3);
        Assert.assertEquals(consumedIds(buffer), Arrays.asList(1L, 2L, 3L, 4L));
        Assert.assertEquals(buffer.acceptedTotal(), 2);
        Assert.assertEquals(buffer.acceptedSequential(), 2);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDuplicateBufferedResult() {
        final SequentialResultBuffer<ParameterPoint> buffer = new SequentialResultBuffer<>();
        buffer.offer(job(2, true));
        buffer.offer(job(2, true));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testAlreadyConsumedResult() {
        final SequentialResultBuffer<ParameterPoint> buffer = new SequentialResultBuffer<>();
        buffer.offer(job(1, true));
        buffer.consumeInOrder();
        buffer.offer(job(1, true));
    }
}
