package org.broadinstitute.abc.population;

import org.broadinstitute.abc.utils.Utils;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An accepted parameter point together with the summary statistics and distances of its accepted simulations.
 * This is the trimmed form of a {@link FullInfoParticle} that is kept in a {@link Population}.
 *
 * @param <T>   type of the parameter
 */
public final class Particle<T> implements Serializable {
    private static final long serialVersionUID = 1L;

    private final int modelIndex;
    private final T parameter;
    private final double weight;
    private final List<SummaryStatistics> acceptedSummaryStatistics;
    private final List<Double> acceptedDistances;

    public Particle(final int modelIndex, final T parameter, final double weight,
                    final List<SummaryStatistics> acceptedSummaryStatistics, final List<Double> acceptedDistances) {
        Utils.nonNull(parameter, "The parameter of a particle cannot be null.");
        Utils.nonNullElements(acceptedSummaryStatistics, "Accepted summary statistics cannot be null.");
        Utils.nonNullElements(acceptedDistances, "Accepted distances cannot be null.");
        Utils.validateArg(weight >= 0., "The weight of a particle must be non-negative.");
        this.modelIndex = modelIndex;
        this.parameter = parameter;
        this.weight = weight;
        this.acceptedSummaryStatistics = Collections.unmodifiableList(new ArrayList<>(acceptedSummaryStatistics));
        this.acceptedDistances = Collections.unmodifiableList(new ArrayList<>(acceptedDistances));
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

    public List<Double> getAcceptedDistances() {
        return acceptedDistances;
    }

    @Override
    public String toString() {
        return "Particle{model=" + modelIndex + ", parameter=" + parameter + ", weight=" + weight + "}";
    }
}
