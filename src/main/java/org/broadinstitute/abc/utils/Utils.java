package org.broadinstitute.abc.utils;

import java.util.Collection;
import java.util.function.Supplier;

/**
 * Argument-checking helpers shared across the sampler packages.
 */
public final class Utils {

    private Utils() {}

    /**
     * Checks that an object is not {@code null} and returns it.
     * @param object    object to check
     * @param message   message of the exception thrown if {@code object} is {@code null}
     * @throws IllegalArgumentException if {@code object} is {@code null}
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    public static <T> T nonNull(final T object) {
        return nonNull(object, "Null object is not allowed here.");
    }

    /**
     * Checks that a collection is non-null and contains no {@code null} elements.
     */
    public static <T extends Collection<?>> T nonNullElements(final T collection, final String message) {
        nonNull(collection, message);
        for (final Object element : collection) {
            nonNull(element, message);
        }
        return collection;
    }

    public static void validateArg(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> message) {
        if (!condition) {
            throw new IllegalArgumentException(message.get());
        }
    }

    /**
     * Checks that an integer argument is strictly positive and returns it.
     */
    public static int positive(final int value, final String message) {
        validateArg(value > 0, () -> message + " (was " + value + ")");
        return value;
    }
}
