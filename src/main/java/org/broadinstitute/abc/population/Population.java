package org.broadinstitute.abc.population;

import org.broadinstitute.abc.utils.Utils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A read-only generation of accepted particles.
 *
 * @param <T>   type of the parameter
 */
public final class Population<T> {
    private final List<Particle<T>> particles;

    public Population(final List<Particle<T>> particles) {
        Utils.nonNullElements(particles, "The particles of a population cannot be null.");
        this.particles = Collections.unmodifiableList(new ArrayList<>(particles));
    }

    public int size() {
        return particles.size();
    }

    public List<Particle<T>> getParticles() {
        return particles;
    }

    public List<T> getParameters() {
        return particles.stream().map(Particle::getParameter).collect(Collectors.toList());
    }

    /**
     * Particle weights scaled to sum to one.
     * @throws IllegalStateException if the population is empty or all weights are zero
     */
    public double[] getNormalizedWeights() {
        final double total = totalWeight();
        return particles.stream().mapToDouble(p -> p.getWeight() / total).toArray();
    }

    /**
     * Probability of each model index, obtained by summing the weights of its particles.
     */
    public SortedMap<Integer, Double> getModelProbabilities() {
        final double total = totalWeight();
        final SortedMap<Integer, Double> probabilities = new TreeMap<>();
        for (final Particle<T> particle : particles) {
            probabilities.merge(particle.getModelIndex(), particle.getWeight() / total, Double::sum);
        }
        return probabilities;
    }

    private double totalWeight() {
        final double total = particles.stream().mapToDouble(Particle::getWeight).sum();
        if (!(total > 0.)) {
            throw new IllegalStateException("Cannot normalize a population with zero total weight.");
        }
        return total;
    }
}
