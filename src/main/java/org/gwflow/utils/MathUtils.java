package org.gwflow.utils;

import org.apache.commons.math3.util.FastMath;

/**
 * MathUtils is a static class (no instantiation allowed!) with some useful math methods.
 */
public final class MathUtils {
    public static final double TWO_PI = 2. * Math.PI;
    public static final double HALF_PI = 0.5 * Math.PI;
    public static final double LOG_2_PI = Math.log(TWO_PI);

    private MathUtils() {}

    public static int maxElementIndex(final double[] array) {
        Utils.nonNull(array);
        Utils.validateArg(array.length > 0, "Array size cannot be 0!");
        int maxI = 0;
        for (int i = 1; i < array.length; i++) {
            if (array[i] > array[maxI]) {
                maxI = i;
            }
        }
        return maxI;
    }

    /**
     * Computes $\log(\sum_i e^{a_i})$ trying to avoid underflow issues by using the log-sum-exp trick.
     *
     * <p>
     * This trick consists of shifting all the log values by the maximum so that exponent values are
     * much larger (close to 1) before they are summed. Then the result is shifted back down by
     * the same amount in order to obtain the correct value.
     * </p>
     * @return any double value.
     */
    public static double logSumExp(final double... logValues) {
        Utils.nonNull(logValues);
        final int maxElementIndex = maxElementIndex(logValues);
        final double maxValue = logValues[maxElementIndex];
        if (maxValue == Double.NEGATIVE_INFINITY || maxValue == Double.POSITIVE_INFINITY) {
            return maxValue;
        }
        double sum = 1.0;
        for (int i = 0; i < logValues.length; i++) {
            final double curVal = logValues[i];
            if (i == maxElementIndex || curVal == Double.NEGATIVE_INFINITY) {
                continue;
            }
            sum += FastMath.exp(curVal - maxValue);
        }
        return maxValue + FastMath.log(sum);
    }

    /**
     * Wraps {@code x} into the half-open interval {@code [lower, lower + period)}.
     */
    public static double wrap(final double x, final double lower, final double period) {
        Utils.validateArg(period > 0, "Period must be positive.");
        double wrapped = lower + ((x - lower) % period);
        if (wrapped < lower) {
            wrapped += period;
        }
        //floating-point remainder can land exactly on the excluded upper end
        if (wrapped >= lower + period) {
            wrapped = lower;
        }
        return wrapped;
    }

    /**
     * Log density of the standard normal distribution summed over the elements of {@code x}.
     */
    public static double standardNormalLogDensity(final double[] x) {
        Utils.nonNull(x);
        double sumOfSquares = 0.;
        for (final double xi : x) {
            sumOfSquares += xi * xi;
        }
        return -0.5 * (sumOfSquares + x.length * LOG_2_PI);
    }
}
