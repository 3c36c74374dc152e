package org.broadinstitute.abc.sampler;

/**
 * Creates empty {@link Sample}s that all share the same recording option, so that samples produced by different
 * workers can be merged.
 *
 * @param <T>   type of the parameter
 */
public final class SampleFactory<T> {
    private final boolean recordRejectedSummaryStatistics;

    public SampleFactory(final boolean recordRejectedSummaryStatistics) {
        this.recordRejectedSummaryStatistics = recordRejectedSummaryStatistics;
    }

    public boolean isRecordingRejectedSummaryStatistics() {
        return recordRejectedSummaryStatistics;
    }

    public Sample<T> createEmptySample() {
        return new Sample<>(recordRejectedSummaryStatistics);
    }
}
