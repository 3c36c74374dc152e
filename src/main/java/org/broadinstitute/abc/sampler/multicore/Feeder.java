package org.broadinstitute.abc.sampler.multicore;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.BlockingQueue;

/**
 * Puts the work tokens of a round on the feed queue, followed by one termination token per worker.
 */
final class Feeder implements Runnable {
    private static final Logger logger = LogManager.getLogger(Feeder.class);

    private final BlockingQueue<WorkToken> feedQueue;
    private final int numJobs;
    private final int numWorkers;

    Feeder(final BlockingQueue<WorkToken> feedQueue, final int numJobs, final int numWorkers) {
        this.feedQueue = feedQueue;
        this.numJobs = numJobs;
        this.numWorkers = numWorkers;
    }

    @Override
    public void run() {
        try {
            for (int i = 0; i < numJobs; i++) {
                feedQueue.put(WorkToken.WORK);
            }
            for (int i = 0; i < numWorkers; i++) {
                feedQueue.put(WorkToken.TERMINATE);
            }
            logger.debug("Fed " + numJobs + " jobs to " + numWorkers + " workers.");
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Feeder interrupted; not all jobs were queued.");
        }
    }
}
