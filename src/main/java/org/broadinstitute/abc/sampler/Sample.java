package org.broadinstitute.abc.sampler;

import org.broadinstitute.abc.population.FullInfoParticle;
import org.broadinstitute.abc.population.Particle;
import org.broadinstitute.abc.population.Population;
import org.broadinstitute.abc.population.SummaryStatistics;
import org.broadinstitute.abc.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the particles produced during one sampling round.
 * <p>
 *     Only accepted particles enter the population.  If the sample records rejected summary statistics, the
 *     summary statistics of every attempt of every appended particle, accepted or not, are kept as well; adaptive
 *     distance functions use them to rescale.
 * </p>
 * <p>
 *     A sample is filled by a single sampling round and sealed once its population has been taken; it is not
 *     thread-safe.
 * </p>
 *
 * @param <T>   type of the parameter
 */
public final class Sample<T> {
    private final boolean recordRejectedSummaryStatistics;
    private final List<Particle<T>> acceptedParticles;
    private final List<SummaryStatistics> allSummaryStatistics;
    private boolean isSealed = false;

    public Sample(final boolean recordRejectedSummaryStatistics) {
        this(recordRejectedSummaryStatistics, 0, 0);
    }

    private Sample(final boolean recordRejectedSummaryStatistics, final int numParticles, final int numStatistics) {
        this.recordRejectedSummaryStatistics = recordRejectedSummaryStatistics;
        acceptedParticles = new ArrayList<>(numParticles);
        allSummaryStatistics = new ArrayList<>(numStatistics);
    }

    /**
     * Adds an evaluated particle.  Call exactly once per produced particle.
     * @throws IllegalStateException if the population of this sample has already been taken
     */
    public void append(final FullInfoParticle<T> particle) {
        Utils.nonNull(particle, "Cannot append a null particle.");
        if (isSealed) {
            throw new IllegalStateException("Cannot append to a sample whose population has been taken.");
        }
        if (particle.isAccepted()) {
            acceptedParticles.add(particle.toParticle());
        }
        if (recordRejectedSummaryStatistics) {
            allSummaryStatistics.addAll(particle.allSummaryStatistics());
        }
    }

    /**
     * Concatenates this sample and {@code other} into a new sample.  Both must have been created with the same
     * recording option.  The order of the merged particles is not part of the contract.
     */
    public Sample<T> merge(final Sample<T> other) {
        Utils.nonNull(other, "Cannot merge with a null sample.");
        return mergeAll(Collections.singletonList(other));
    }

    /**
     * Concatenates this sample and all of {@code others} into a new sample in a single pass; neither this sample
     * nor {@code others} are modified.  All must have been created with the same recording option.
     */
    public Sample<T> mergeAll(final Collection<Sample<T>> others) {
        Utils.nonNullElements(others, "Cannot merge with a null sample.");
        int numParticles = acceptedParticles.size();
        int numStatistics = allSummaryStatistics.size();
        for (final Sample<T> other : others) {
            Utils.validateArg(recordRejectedSummaryStatistics == other.recordRejectedSummaryStatistics,
                    "Can only merge samples created with the same recording option.");
            numParticles += other.acceptedParticles.size();
            numStatistics += other.allSummaryStatistics.size();
        }
        final Sample<T> merged = new Sample<>(recordRejectedSummaryStatistics, numParticles, numStatistics);
        merged.acceptedParticles.addAll(acceptedParticles);
        merged.allSummaryStatistics.addAll(allSummaryStatistics);
        for (final Sample<T> other : others) {
            merged.acceptedParticles.addAll(other.acceptedParticles);
            merged.allSummaryStatistics.addAll(other.allSummaryStatistics);
        }
        return merged;
    }

    public int numAccepted() {
        return acceptedParticles.size();
    }

    public List<Particle<T>> getAcceptedParticles() {
        return Collections.unmodifiableList(acceptedParticles);
    }

    /**
     * Summary statistics of all attempts; empty unless rejected summary statistics are recorded.
     */
    public List<SummaryStatistics> getAllSummaryStatistics() {
        return Collections.unmodifiableList(allSummaryStatistics);
    }

    public boolean isRecordingRejectedSummaryStatistics() {
        return recordRejectedSummaryStatistics;
    }

    /**
     * Returns the population of accepted particles and seals this sample against further appends.
     */
    public Population<T> getAcceptedPopulation() {
        isSealed = true;
        return new Population<>(acceptedParticles);
    }

    public boolean isSealed() {
        return isSealed;
    }
}
