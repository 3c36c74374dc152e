package org.broadinstitute.abc.population;

import org.broadinstitute.abc.utils.Utils;

import java.io.Serializable;
import java.util.*;

/**
 * A point in parameter space, keyed by parameter name.  This is the usual parameter type handed to the samplers
 * by the draw function; it is immutable and can therefore be shared freely between workers.
 */
public final class ParameterPoint implements Serializable {
    private static final long serialVersionUID = 1L;

    private final LinkedHashMap<String, Double> parameterMap = new LinkedHashMap<>();

    public ParameterPoint(final List<Parameter> parameters) {
        Utils.nonNullElements(parameters, "List of parameters cannot be null or contain null.");
        for (final Parameter parameter : parameters) {
            if (parameterMap.containsKey(parameter.name())) {
                throw new IllegalArgumentException("List of parameters cannot contain duplicate parameter names.");
            }
            parameterMap.put(parameter.name(), parameter.value());
        }
    }

    /**
     * Builds a point whose parameters are named {@code prefix + i} for the i-th value.
     */
    public static ParameterPoint of(final String parameterNamePrefix, final double... values) {
        Utils.nonNull(parameterNamePrefix);
        final List<Parameter> parameters = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            parameters.add(new Parameter(parameterNamePrefix + i, values[i]));
        }
        return new ParameterPoint(parameters);
    }

    public double get(final String parameterName) {
        final Double value = parameterMap.get(parameterName);
        if (value == null) {
            throw new IllegalArgumentException("Can only get pre-existing parameters; check parameter name.");
        }
        return value;
    }

    public Set<String> parameterNames() {
        return Collections.unmodifiableSet(parameterMap.keySet());
    }

    public int size() {
        return parameterMap.size();
    }

    /**
     * Returns a copy of this point with one parameter replaced.
     */
    public ParameterPoint with(final String parameterName, final double value) {
        if (!parameterMap.containsKey(parameterName)) {
            throw new UnsupportedOperationException("Can only update pre-existing parameters; check parameter name.");
        }
        final List<Parameter> parameters = new ArrayList<>(parameterMap.size());
        parameterMap.forEach((n, v) -> parameters.add(new Parameter(n, n.equals(parameterName) ? value : v)));
        return new ParameterPoint(parameters);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return parameterMap.equals(((ParameterPoint) o).parameterMap);
    }

    @Override
    public int hashCode() {
        return parameterMap.hashCode();
    }

    @Override
    public String toString() {
        return parameterMap.toString();
    }
}
