package org.broadinstitute.abc.population;

import org.broadinstitute.abc.utils.Utils;

import java.io.Serializable;

/**
 * A named scalar model parameter.
 */
public final class Parameter implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final double value;

    public Parameter(final String name, final double value) {
        Utils.nonNull(name, "The parameter name cannot be null.");
        this.name = name;
        this.value = value;
    }

    public String name() {
        return name;
    }

    public double value() {
        return value;
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
