package org.gwflow.utils.test;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;
import org.testng.Assert;

import java.util.*;

/**
 * This is the base test class for all of our test cases.  All test cases should extend from this
 * class; it provides tolerance-aware assertions and random-point helpers.
 */
public abstract class BaseTest {
    public static final double DEFAULT_FLOAT_TOLERANCE = 1E-8;

    public static RandomGenerator createRandomGenerator(final long seed) {
        return RandomGeneratorFactory.createRandomGenerator(new Random(seed));
    }

    /**
     * Asserts {@code |actual - expected| <= tolerance * max(1, |expected|)}.
     */
    public static void assertEqualsDoubleSmart(final double actual, final double expected, final double tolerance, final String message) {
        if (Double.isNaN(expected)) {
            Assert.assertTrue(Double.isNaN(actual), "expected is nan, actual is not");
        } else if (Double.isInfinite(expected)) {
            Assert.assertEquals(actual, expected, "expected is infinite, actual is not");
        } else {
            final double delta = Math.abs(actual - expected);
            Assert.assertTrue(delta <= tolerance * Math.max(1., Math.abs(expected)), "expected = " + expected + " actual = " + actual
                    + " not within tolerance " + tolerance
                    + (message == null ? "" : " message: " + message));
        }
    }

    public static void assertEqualsDoubleSmart(final double actual, final double expected, final double tolerance) {
        assertEqualsDoubleSmart(actual, expected, tolerance, null);
    }

    public static void assertEqualsDoubleSmart(final double actual, final double expected) {
        assertEqualsDoubleSmart(actual, expected, DEFAULT_FLOAT_TOLERANCE);
    }

    /**
     * Asserts that two points hold the same names with values equal within tolerance.
     */
    public static void assertPointsEqual(final Point actual, final Point expected, final double tolerance) {
        Assert.assertEquals(new LinkedHashSet<>(actual.names()), new LinkedHashSet<>(expected.names()), "parameter names differ");
        for (final String name : expected.names()) {
            assertEqualsDoubleSmart(actual.get(name), expected.get(name), tolerance, name);
        }
    }

    public static void assertPointsEqual(final Point actual, final Point expected) {
        assertPointsEqual(actual, expected, DEFAULT_FLOAT_TOLERANCE);
    }

    /**
     * Draws points uniformly within the bounds of the descriptors, shrunk by {@code margin} (as a fraction of the
     * width) at both ends.
     */
    public static List<Point> uniformPoints(final List<ParameterDescriptor> descriptors, final int numPoints,
                                            final double margin, final RandomGenerator rng) {
        final List<Point> points = new ArrayList<>(numPoints);
        for (int i = 0; i < numPoints; i++) {
            final Point.Builder builder = Point.builder();
            for (final ParameterDescriptor descriptor : descriptors) {
                final double lower = descriptor.lower() + margin * descriptor.width();
                final double upper = descriptor.upper() - margin * descriptor.width();
                builder.put(descriptor.name(), lower + (upper - lower) * rng.nextDouble());
            }
            points.add(builder.build());
        }
        return points;
    }
}
