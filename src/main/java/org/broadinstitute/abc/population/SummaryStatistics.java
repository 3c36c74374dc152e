package org.broadinstitute.abc.population;

import org.broadinstitute.abc.utils.Utils;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named summary statistics of one simulation attempt.
 */
public final class SummaryStatistics implements Serializable {
    private static final long serialVersionUID = 1L;

    private final Map<String, Double> statistics;

    public SummaryStatistics(final Map<String, Double> statistics) {
        Utils.nonNull(statistics, "The summary statistics cannot be null.");
        this.statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
    }

    public static SummaryStatistics of(final String name, final double value) {
        return new SummaryStatistics(Collections.singletonMap(name, value));
    }

    public double get(final String name) {
        final Double value = statistics.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No summary statistic named " + name + ".");
        }
        return value;
    }

    public Set<String> names() {
        return statistics.keySet();
    }

    public Map<String, Double> asMap() {
        return statistics;
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof SummaryStatistics && statistics.equals(((SummaryStatistics) o).statistics));
    }

    @Override
    public int hashCode() {
        return statistics.hashCode();
    }

    @Override
    public String toString() {
        return statistics.toString();
    }
}
