package org.broadinstitute.abc.sampler.multicore;

/**
 * Items of the feed queue: each WORK token asks for one accepted particle, a TERMINATE token stops one worker.
 */
enum WorkToken {
    WORK, TERMINATE
}
