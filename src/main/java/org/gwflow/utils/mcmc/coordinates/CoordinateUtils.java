package org.gwflow.utils.mcmc.coordinates;

import org.apache.commons.math3.analysis.function.Logit;
import org.apache.commons.math3.analysis.function.Sigmoid;
import org.gwflow.utils.Utils;

/**
 * Maps between a variable bounded by {@code [min, max]} and an unbounded coordinate on the real line,
 * using the logistic sigmoid and its inverse.
 */
public final class CoordinateUtils {
    private static final Sigmoid SIGMOID = new Sigmoid();
    private static final Logit LOGIT = new Logit();

    private CoordinateUtils() {}

    public static double transformUnboundedCoordinateToBoundedVariable(final double unboundedCoordinate,
                                                                       final double min,
                                                                       final double max) {
        Utils.validateArg(min < max, "Minimum bound must be strictly less than maximum bound.");
        return min + (max - min) * SIGMOID.value(unboundedCoordinate);
    }

    public static double transformBoundedVariableToUnboundedCoordinate(final double boundedVariable,
                                                                       final double min,
                                                                       final double max) {
        Utils.validateArg(min < max, "Minimum bound must be strictly less than maximum bound.");
        Utils.validateArg(min <= boundedVariable && boundedVariable <= max,
                () -> "Variable value " + boundedVariable + " is not within variable bounds [" + min + ", " + max + "].");
        return LOGIT.value((boundedVariable - min) / (max - min));
    }

    /**
     * Log of the derivative of the bounded variable with respect to the unbounded coordinate,
     * i.e. {@code log((x - min)(max - x)/(max - min))}.  Negative infinity on or outside the bounds.
     */
    public static double calculateLogJacobianFactor(final double boundedVariable,
                                                    final double min,
                                                    final double max) {
        Utils.validateArg(min < max, "Minimum bound must be strictly less than maximum bound.");
        return boundedVariable < min || boundedVariable > max ?
                Double.NEGATIVE_INFINITY :
                Math.log(boundedVariable - min) + Math.log(max - boundedVariable) - Math.log(max - min);
    }
}
