package org.gwflow.proposals;

import org.apache.commons.math3.random.RandomGenerator;
import org.gwflow.reparameterisations.CompositeReparameterisation;
import org.gwflow.utils.MathUtils;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.Point;
import org.gwflow.utils.param.ParamUtils;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Extends the transformed space with latent dimensions {@code augment_0 ... augment_{k-1}} drawn from a standard
 * normal distribution.  The base proposal is trained and sampled jointly over the extended space; the latent
 * dimensions are dropped before mapping back to physical space.
 *
 * <p>
 *     The marginal density of a transformed point is estimated by importance sampling with the auxiliary
 *     distribution, {@code log q(y) ~ logsumexp_i[log q(y, e_i) - log N(e_i)] - log m}, or, without marginalisation,
 *     by the conditional at the auxiliary mode, {@code log q(y, 0) - log N(0)}.
 * </p>
 */
final class AugmentedStrategy implements ProposalStrategy {
    static final String AUGMENT_PREFIX = "augment_";

    private final BaseProposal baseProposal;
    private final List<String> latentNames;
    private final boolean marginalise;
    private final int numMarginalisationSamples;
    private final RandomGenerator rng;

    AugmentedStrategy(final BaseProposal baseProposal, final int augmentDimensions, final boolean marginalise,
                      final int numMarginalisationSamples, final RandomGenerator rng) {
        this.baseProposal = Utils.nonNull(baseProposal, "Base proposal cannot be null.");
        ParamUtils.isPositive(augmentDimensions, "Number of augment dimensions must be positive.");
        this.latentNames = Collections.unmodifiableList(IntStream.range(0, augmentDimensions)
                .mapToObj(i -> AUGMENT_PREFIX + i).collect(Collectors.toList()));
        this.marginalise = marginalise;
        this.numMarginalisationSamples = ParamUtils.isPositive(numMarginalisationSamples, "Number of marginalisation samples must be positive.");
        this.rng = Utils.nonNull(rng, "Random generator cannot be null.");
    }

    List<String> getLatentNames() {
        return latentNames;
    }

    @Override
    public void fit(final List<Point> transformedPoints) {
        final List<Point> augmented = transformedPoints.stream()
                .map(p -> p.merge(latentPoint(drawLatent())))
                .collect(Collectors.toList());
        baseProposal.fit(augmented);
    }

    @Override
    public List<Point> sample(final int n, final CompositeReparameterisation composite) {
        return baseProposal.sampleTransformed(n).stream()
                .map(p -> p.without(latentNames))
                .collect(Collectors.toList());
    }

    @Override
    public double logProb(final Point transformedPoint) {
        if (!marginalise) {
            final double[] mode = new double[latentNames.size()];
            return baseProposal.logProbTransformed(transformedPoint.merge(latentPoint(mode)))
                    - MathUtils.standardNormalLogDensity(mode);
        }
        final double[] logWeights = new double[numMarginalisationSamples];
        for (int i = 0; i < numMarginalisationSamples; i++) {
            final double[] latent = drawLatent();
            logWeights[i] = baseProposal.logProbTransformed(transformedPoint.merge(latentPoint(latent)))
                    - MathUtils.standardNormalLogDensity(latent);
        }
        return MathUtils.logSumExp(logWeights) - Math.log(numMarginalisationSamples);
    }

    private double[] drawLatent() {
        return IntStream.range(0, latentNames.size()).mapToDouble(i -> rng.nextGaussian()).toArray();
    }

    private Point latentPoint(final double[] latent) {
        return Point.fromArray(latentNames, latent);
    }
}
