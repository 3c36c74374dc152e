package org.broadinstitute.abc.population;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

public final class PopulationUnitTest {
    private static final double EPSILON = 1E-12;

    private static Particle<String> particle(final int model, final String parameter, final double weight) {
        return new Particle<>(model, parameter, weight, Collections.emptyList(), Collections.emptyList());
    }

    @Test
    public void testWeightsAndModelProbabilities() {
        final Population<String> population = new Population<>(Arrays.asList(
                particle(0, "a", 1.), particle(1, "b", 2.), particle(0, "c", 1.)));
        Assert.assertEquals(population.size(), 3);
        Assert.assertEquals(population.getParameters(), Arrays.asList("a", "b", "c"));

        final double[] weights = population.getNormalizedWeights();
        Assert.assertEquals(weights[0], 0.25, EPSILON);
        Assert.assertEquals(weights[1], 0.5, EPSILON);
        Assert.assertEquals(weights[2], 0.25, EPSILON);

        final SortedMap<Integer, Double> modelProbabilities = population.getModelProbabilities();
        Assert.assertEquals(modelProbabilities.size(), 2);
        Assert.assertEquals(modelProbabilities.get(0), 0.5, EPSILON);
        Assert.assertEquals(modelProbabilities.get(1), 0.5, EPSILON);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testEmptyPopulationCannotBeNormalized() {
        new Population<String>(Collections.emptyList()).getNormalizedWeights();
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testParticlesAreReadOnly() {
        final List<Particle<String>> particles = new Population<>(Collections.singletonList(particle(0, "a", 1.))).getParticles();
        particles.add(particle(0, "b", 1.));
    }
}
