package org.gwflow.utils.clustering;

import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.Point;
import org.gwflow.utils.param.ParamUtils;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Partitions points with k-means++ into at most {@code maxClusters} clusters, each holding at least
 * {@code minClusterSize} points.  The number of clusters is reduced until every cluster is large enough.
 */
public final class KMeansPartitioner {
    private static final Logger logger = LogManager.getLogger(KMeansPartitioner.class);

    private final int maxClusters;
    private final int minClusterSize;
    private final int maxIterations;
    private final RandomGenerator rng;

    public KMeansPartitioner(final int maxClusters, final int minClusterSize, final int maxIterations,
                             final RandomGenerator rng) {
        this.maxClusters = ParamUtils.isPositive(maxClusters, "Maximum number of clusters must be positive.");
        this.minClusterSize = ParamUtils.isPositive(minClusterSize, "Minimum cluster size must be positive.");
        this.maxIterations = ParamUtils.isPositive(maxIterations, "Maximum number of k-means iterations must be positive.");
        this.rng = Utils.nonNull(rng, "Random generator cannot be null.");
    }

    /**
     * @param points    points to partition
     * @param names     coordinates used for the distance, in order
     * @return the clusters, each a non-empty list of the original points
     */
    public List<List<Point>> partition(final List<Point> points, final List<String> names) {
        Utils.nonEmpty(points, "List of points cannot be null or empty.");
        Utils.nonEmpty(names, "List of coordinate names cannot be null or empty.");
        final List<IndexedDoublePoint> indexedPoints = IntStream.range(0, points.size())
                .mapToObj(i -> new IndexedDoublePoint(points.get(i).toArray(names), i))
                .collect(Collectors.toList());
        for (int numClusters = Math.min(maxClusters, points.size() / minClusterSize); numClusters > 1; numClusters--) {
            final KMeansPlusPlusClusterer<IndexedDoublePoint> clusterer =
                    new KMeansPlusPlusClusterer<>(numClusters, maxIterations, new EuclideanDistance(), rng);
            final List<CentroidCluster<IndexedDoublePoint>> clusters = clusterer.cluster(indexedPoints);
            if (clusters.stream().allMatch(c -> c.getPoints().size() >= minClusterSize)) {
                logger.debug("Partitioned " + points.size() + " points into " + numClusters + " clusters.");
                return clusters.stream()
                        .map(c -> c.getPoints().stream().map(p -> points.get(p.index)).collect(Collectors.toList()))
                        .collect(Collectors.toList());
            }
        }
        logger.debug("Using a single cluster for " + points.size() + " points.");
        return Collections.singletonList(points);
    }

    private static final class IndexedDoublePoint implements Clusterable {
        private final double[] point;
        private final int index;

        private IndexedDoublePoint(final double[] point, final int index) {
            this.point = point;
            this.index = index;
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}
