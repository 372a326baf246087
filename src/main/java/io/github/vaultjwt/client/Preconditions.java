package io.github.vaultjwt.client;

/**
 * Utility class for argument validation.
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class
    }

    /**
     * Validates that a string is neither null nor blank.
     *
     * @param value the value to check
     * @param name  the parameter name for the error message
     * @return the value
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        return value;
    }

    /**
     * Validates that a number is strictly positive.
     *
     * @param value the value to check
     * @param name  the parameter name for the error message
     * @return the value
     * @throws IllegalArgumentException if the value is zero or negative
     */
    public static long requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }
}
