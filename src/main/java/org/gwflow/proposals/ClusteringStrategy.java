package org.gwflow.proposals;

import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.gwflow.reparameterisations.CompositeReparameterisation;
import org.gwflow.utils.MathUtils;
import org.gwflow.utils.Utils;
import org.gwflow.utils.clustering.KMeansPartitioner;
import org.gwflow.utils.mcmc.Point;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.IntStream;

/**
 * Partitions the transformed training points with k-means++ and trains one base proposal per cluster.  The proposal
 * is the mixture of the per-cluster models with weights proportional to cluster membership.
 */
final class ClusteringStrategy implements ProposalStrategy {
    private static final Logger logger = LogManager.getLogger(ClusteringStrategy.class);

    private final Supplier<BaseProposal> baseProposalFactory;
    private final KMeansPartitioner partitioner;
    private final RandomGenerator rng;

    private List<BaseProposal> components = null;
    private double[] logWeights = null;
    private EnumeratedIntegerDistribution componentDistribution = null;

    ClusteringStrategy(final Supplier<BaseProposal> baseProposalFactory, final KMeansPartitioner partitioner,
                       final RandomGenerator rng) {
        this.baseProposalFactory = Utils.nonNull(baseProposalFactory, "Base proposal factory cannot be null.");
        this.partitioner = Utils.nonNull(partitioner, "Partitioner cannot be null.");
        this.rng = Utils.nonNull(rng, "Random generator cannot be null.");
    }

    int getNumClusters() {
        return components == null ? 0 : components.size();
    }

    @Override
    public void fit(final List<Point> transformedPoints) {
        Utils.nonEmpty(transformedPoints, "List of training points cannot be null or empty.");
        final List<String> names = new ArrayList<>(transformedPoints.get(0).names());
        final List<List<Point>> clusters = partitioner.partition(transformedPoints, names);
        final List<BaseProposal> newComponents = new ArrayList<>(clusters.size());
        final double[] weights = new double[clusters.size()];
        for (int k = 0; k < clusters.size(); k++) {
            final BaseProposal component = Utils.nonNull(baseProposalFactory.get(), "Base proposal factory returned null.");
            component.fit(clusters.get(k));
            newComponents.add(component);
            weights[k] = (double) clusters.get(k).size() / transformedPoints.size();
        }
        logger.info("Fitted " + clusters.size() + " cluster(s) to " + transformedPoints.size() + " points with weights " + Arrays.toString(weights));
        components = Collections.unmodifiableList(newComponents);
        logWeights = Arrays.stream(weights).map(FastMath::log).toArray();
        componentDistribution = new EnumeratedIntegerDistribution(rng, IntStream.range(0, weights.length).toArray(), weights);
    }

    @Override
    public List<Point> sample(final int n, final CompositeReparameterisation composite) {
        checkFitted();
        final int[] counts = new int[components.size()];
        for (final int k : componentDistribution.sample(n)) {
            counts[k]++;
        }
        final List<Point> samples = new ArrayList<>(n);
        for (int k = 0; k < counts.length; k++) {
            if (counts[k] > 0) {
                samples.addAll(components.get(k).sampleTransformed(counts[k]));
            }
        }
        return samples;
    }

    @Override
    public double logProb(final Point transformedPoint) {
        checkFitted();
        final double[] logComponentProbs = new double[components.size()];
        for (int k = 0; k < components.size(); k++) {
            logComponentProbs[k] = logWeights[k] + components.get(k).logProbTransformed(transformedPoint);
        }
        return MathUtils.logSumExp(logComponentProbs);
    }

    private void checkFitted() {
        if (components == null) {
            throw new IllegalStateException("Clustering proposal must be updated with live points before use.");
        }
    }
}
