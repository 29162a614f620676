package co.fanki.sourcefacts.shared;

import java.util.Collection;

/**
 * Argument checks shared by the analyzers and their configuration.
 *
 * <p>Every check throws {@link IllegalArgumentException}: a bad argument is
 * a caller bug, never a per-file analysis failure.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class, not instantiable
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a collection holds at least one element.
     *
     * @param values the collection to check
     * @param message the exception message if null or empty
     * @param <C> the collection type
     * @return the non-empty collection
     * @throws IllegalArgumentException if values is null or empty
     */
    public static <C extends Collection<?>> C requireNonEmpty(
            final C values, final String message) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(message);
        }
        return values;
    }

    /**
     * Ensures that a condition is true.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that a limit or timeout is strictly positive.
     *
     * @param value the number to check
     * @param message the exception message if not positive
     * @return the positive number
     * @throws IllegalArgumentException if value is not positive
     */
    public static int requirePositive(final int value, final String message) {
        if (value <= 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a duration expressed in seconds is strictly positive.
     *
     * @param value the number to check
     * @param message the exception message if not positive
     * @return the positive number
     * @throws IllegalArgumentException if value is not positive
     */
    public static long requirePositive(final long value, final String message) {
        if (value <= 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

}
