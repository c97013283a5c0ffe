package org.gwflow.utils.param;

/**
 * Numeric argument checks.
 *
 * Double.NaN will generally cause a check to fail.  Note that any comparison with a NaN yields false.
 */
public final class ParamUtils {
    private ParamUtils() {}

    /**
     * Checks that the input is positive or zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static double isPositiveOrZero(final double val, final String message) {
        if (!(val >= 0)) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    public static int isPositiveOrZero(final int val, final String message) {
        if (val < 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * Checks that the input is greater than zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static double isPositive(final double val, final String message) {
        if (!(val > 0)) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    public static int isPositive(final int val, final String message) {
        if (val <= 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }
}
