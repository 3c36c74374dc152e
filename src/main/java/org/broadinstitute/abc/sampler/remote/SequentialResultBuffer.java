package org.broadinstitute.abc.sampler.remote;

import org.broadinstitute.abc.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

/**
 * Restores submission order from results that complete in any order.
 * <p>
 *     Results are buffered by job id until every smaller id has arrived; they are then consumed in strictly
 *     increasing job-id order without gaps.  Two acceptance counts are kept: one over every result seen, used to
 *     stop submitting, and one over the consumed results only, used to stop sampling.
 * </p>
 */
final class SequentialResultBuffer<T> {
    static final long FIRST_JOB_ID = 1;

    private final TreeMap<Long, EvaluatedJob<T>> unprocessed = new TreeMap<>();
    private final List<EvaluatedJob<T>> consumed = new ArrayList<>();

    private long nextValidIndex = FIRST_JOB_ID - 1;
    private int acceptedTotal = 0;
    private int acceptedSequential = 0;

    void offer(final EvaluatedJob<T> job) {
        Utils.nonNull(job, "Cannot buffer a null result.");
        Utils.validateArg(job.getJobId() > nextValidIndex && !unprocessed.containsKey(job.getJobId()),
                () -> "Result for job " + job.getJobId() + " received twice.");
        unprocessed.put(job.getJobId(), job);
        if (job.isAccepted()) {
            acceptedTotal++;
        }
    }

    /**
     * Consumes buffered results for as long as the smallest buffered id follows the last consumed one.
     * @return  number of results consumed by this call
     */
    int consumeInOrder() {
        int numConsumed = 0;
        while (!unprocessed.isEmpty() && unprocessed.firstKey() == nextValidIndex + 1) {
            final EvaluatedJob<T> job = unprocessed.pollFirstEntry().getValue();
            consumed.add(job);
            nextValidIndex++;
            if (job.isAccepted()) {
                acceptedSequential++;
            }
            numConsumed++;
        }
        return numConsumed;
    }

    /**
     * Consumed results in increasing job-id order.
     */
    List<EvaluatedJob<T>> consumed() {
        return Collections.unmodifiableList(consumed);
    }

    long nextValidIndex() {
        return nextValidIndex;
    }

    int acceptedTotal() {
        return acceptedTotal;
    }

    int acceptedSequential() {
        return acceptedSequential;
    }

    int numUnprocessed() {
        return unprocessed.size();
    }
}
