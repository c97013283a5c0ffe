package org.gwflow.utils.clustering;

import org.apache.commons.math3.random.RandomGenerator;
import org.gwflow.utils.mcmc.Point;
import org.gwflow.utils.test.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class KMeansPartitionerUnitTest extends BaseTest {
    private static final List<String> NAMES = Arrays.asList("x", "y");

    private static List<Point> twoBlobs(final int numPerBlob, final RandomGenerator rng) {
        final List<Point> points = new ArrayList<>();
        for (int i = 0; i < numPerBlob; i++) {
            points.add(Point.fromArray(NAMES, new double[]{-10. + 0.1 * rng.nextGaussian(), 0.1 * rng.nextGaussian()}));
            points.add(Point.fromArray(NAMES, new double[]{10. + 0.1 * rng.nextGaussian(), 0.1 * rng.nextGaussian()}));
        }
        return points;
    }

    @Test
    public void testSeparatesBlobs() {
        final RandomGenerator rng = createRandomGenerator(13);
        final List<List<Point>> clusters = new KMeansPartitioner(2, 10, 100, rng).partition(twoBlobs(50, rng), NAMES);
        Assert.assertEquals(clusters.size(), 2);
        for (final List<Point> cluster : clusters) {
            Assert.assertEquals(cluster.size(), 50);
            final double sign = Math.signum(cluster.get(0).get("x"));
            Assert.assertTrue(cluster.stream().allMatch(p -> Math.signum(p.get("x")) == sign));
        }
    }

    @Test
    public void testMinimumClusterSizeLimitsClusters() {
        final RandomGenerator rng = createRandomGenerator(13);
        final List<Point> points = twoBlobs(5, rng);
        final List<List<Point>> clusters = new KMeansPartitioner(4, 20, 100, rng).partition(points, NAMES);
        Assert.assertEquals(clusters.size(), 1);
        Assert.assertEquals(clusters.get(0).size(), points.size());
    }
}
