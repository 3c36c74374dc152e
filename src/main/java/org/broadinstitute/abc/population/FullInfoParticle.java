package org.broadinstitute.abc.population;

import org.broadinstitute.abc.utils.Utils;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The complete record of evaluating one parameter point: the acceptance decision plus the summary statistics and
 * distances of every simulation attempt, accepted or rejected.  A single evaluation may involve several internal
 * simulation attempts; all of them are retained here, while {@link #toParticle()} keeps only the accepted ones.
 *
 * @param <T>   type of the parameter
 */
public final class FullInfoParticle<T> implements Serializable {
    private static final long serialVersionUID = 1L;

    private final int modelIndex;
    private final T parameter;
    private final double weight;
    private final List<SummaryStatistics> acceptedSummaryStatistics;
    private final List<Double> acceptedDistances;
    private final List<SummaryStatistics> rejectedSummaryStatistics;
    private final List<Double> rejectedDistances;
    private final boolean accepted;

    public FullInfoParticle(final int modelIndex, final T parameter, final double weight,
                            final List<SummaryStatistics> acceptedSummaryStatistics,
                            final List<Double> acceptedDistances,
                            final List<SummaryStatistics> rejectedSummaryStatistics,
                            final List<Double> rejectedDistances,
                            final boolean accepted) {
        Utils.nonNull(parameter, "The parameter of a particle cannot be null.");
        Utils.nonNullElements(acceptedSummaryStatistics, "Accepted summary statistics cannot be null.");
        Utils.nonNullElements(acceptedDistances, "Accepted distances cannot be null.");
        Utils.nonNullElements(rejectedSummaryStatistics, "Rejected summary statistics cannot be null.");
        Utils.nonNullElements(rejectedDistances, "Rejected distances cannot be null.");
        Utils.validateArg(acceptedSummaryStatistics.size() == acceptedDistances.size(),
                "Each accepted summary statistic must have a distance.");
        Utils.validateArg(rejectedSummaryStatistics.size() == rejectedDistances.size(),
                "Each rejected summary statistic must have a distance.");
        this.modelIndex = modelIndex;
        this.parameter = parameter;
        this.weight = weight;
        this.acceptedSummaryStatistics = Collections.unmodifiableList(new ArrayList<>(acceptedSummaryStatistics));
        this.acceptedDistances = Collections.unmodifiableList(new ArrayList<>(acceptedDistances));
        this.rejectedSummaryStatistics = Collections.unmodifiableList(new ArrayList<>(rejectedSummaryStatistics));
        this.rejectedDistances = Collections.unmodifiableList(new ArrayList<>(rejectedDistances));
        this.accepted = accepted;
    }

    /**
     * Particle whose single simulation attempt was accepted.
     */
    public static <T> FullInfoParticle<T> accepted(final int modelIndex, final T parameter, final double weight,
                                                   final SummaryStatistics summaryStatistics, final double distance) {
        return new FullInfoParticle<>(modelIndex, parameter, weight,
                Collections.singletonList(summaryStatistics), Collections.singletonList(distance),
                Collections.emptyList(), Collections.emptyList(), true);
    }

    /**
     * Particle whose single simulation attempt was rejected.
     */
    public static <T> FullInfoParticle<T> rejected(final int modelIndex, final T parameter,
                                                   final SummaryStatistics summaryStatistics, final double distance) {
        return new FullInfoParticle<>(modelIndex, parameter, 0.,
                Collections.emptyList(), Collections.emptyList(),
                Collections.singletonList(summaryStatistics), Collections.singletonList(distance), false);
    }

    public boolean isAccepted() {
        return accepted;
    }

    public int getModelIndex() {
        return modelIndex;
    }

    public T getParameter() {
        return parameter;
    }

    public double getWeight() {
        return weight;
    }

    public List<SummaryStatistics> getAcceptedSummaryStatistics() {
        return acceptedSummaryStatistics;
    }

    public List<SummaryStatistics> getRejectedSummaryStatistics() {
        return rejectedSummaryStatistics;
    }

    public List<Double> getAcceptedDistances() {
        return acceptedDistances;
    }

    public List<Double> getRejectedDistances() {
        return rejectedDistances;
    }

    /**
     * Summary statistics of all attempts, accepted ones first.
     */
    public List<SummaryStatistics> allSummaryStatistics() {
        final List<SummaryStatistics> all = new ArrayList<>(acceptedSummaryStatistics.size() + rejectedSummaryStatistics.size());
        all.addAll(acceptedSummaryStatistics);
        all.addAll(rejectedSummaryStatistics);
        return all;
    }

    public Particle<T> toParticle() {
        return new Particle<>(modelIndex, parameter, Math.max(weight, 0.), acceptedSummaryStatistics, acceptedDistances);
    }

    @Override
    public String toString() {
        return "FullInfoParticle{model=" + modelIndex + ", parameter=" + parameter + ", accepted=" + accepted
                + ", attempts=" + (acceptedSummaryStatistics.size() + rejectedSummaryStatistics.size()) + "}";
    }
}
