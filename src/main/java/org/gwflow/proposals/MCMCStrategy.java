package org.gwflow.proposals;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.reparameterisations.CompositeReparameterisation;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.Point;
import org.gwflow.utils.mcmc.RandomWalkMetropolisSampler;
import org.gwflow.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Refines every draw of the base proposal with a short random-walk Metropolis-Hastings chain in transformed space
 * targeting {@code q(y) 1[constraint(T^-1(y))]}.  Steps are Gaussian with scale
 * {@code stepScale / sqrt(d)} times the per-dimension standard deviation of the training points.  Chains that never
 * reach a valid point are dropped.
 */
final class MCMCStrategy implements ProposalStrategy {
    private static final Logger logger = LogManager.getLogger(MCMCStrategy.class);

    private final BaseProposal baseProposal;
    private final int numSteps;
    private final double stepScale;
    private final LikelihoodConstraint constraint;
    private final RandomGenerator rng;

    private List<String> names = null;
    private double[] stepSizes = null;

    MCMCStrategy(final BaseProposal baseProposal, final int numSteps, final double stepScale,
                 final LikelihoodConstraint constraint, final RandomGenerator rng) {
        this.baseProposal = Utils.nonNull(baseProposal, "Base proposal cannot be null.");
        this.numSteps = ParamUtils.isPositiveOrZero(numSteps, "Number of MCMC steps must be non-negative.");
        this.stepScale = ParamUtils.isPositive(stepScale, "MCMC step scale must be positive.");
        this.constraint = Utils.nonNull(constraint, "Likelihood constraint cannot be null.");
        this.rng = Utils.nonNull(rng, "Random generator cannot be null.");
    }

    @Override
    public void fit(final List<Point> transformedPoints) {
        Utils.nonEmpty(transformedPoints, "List of training points cannot be null or empty.");
        baseProposal.fit(transformedPoints);
        final List<String> newNames = new ArrayList<>(transformedPoints.get(0).names());
        final double[] newStepSizes = new double[newNames.size()];
        final double scale = stepScale / Math.sqrt(newNames.size());
        for (int i = 0; i < newNames.size(); i++) {
            final String name = newNames.get(i);
            final double[] values = transformedPoints.stream().mapToDouble(p -> p.get(name)).toArray();
            final double standardDeviation = values.length > 1 ? new StandardDeviation().evaluate(values) : 0.;
            newStepSizes[i] = scale * standardDeviation;
        }
        names = newNames;
        stepSizes = newStepSizes;
    }

    @Override
    public List<Point> sample(final int n, final CompositeReparameterisation composite) {
        final List<Point> draws = baseProposal.sampleTransformed(n);
        if (stepSizes == null || numSteps == 0) {
            return draws;
        }
        final RandomWalkMetropolisSampler sampler = new RandomWalkMetropolisSampler(
                y -> logTarget(Point.fromArray(names, y), composite), stepSizes, rng);
        final List<Point> refined = new ArrayList<>(draws.size());
        for (final Point draw : draws) {
            final Point result = Point.fromArray(names, sampler.run(draw.toArray(names), numSteps));
            if (logTarget(result, composite) > Double.NEGATIVE_INFINITY) {
                refined.add(result);
            }
        }
        sampler.logAcceptanceRate();
        if (refined.size() < draws.size()) {
            logger.debug("Dropped " + (draws.size() - refined.size()) + " chain(s) that never reached a valid point.");
        }
        return refined;
    }

    @Override
    public double logProb(final Point transformedPoint) {
        return baseProposal.logProbTransformed(transformedPoint);
    }

    /**
     * Log proposal density if the point maps to a physical point within the likelihood constraint, otherwise
     * negative infinity.
     */
    private double logTarget(final Point transformedPoint, final CompositeReparameterisation composite) {
        final Point physical;
        try {
            physical = composite.inverse(transformedPoint).getPoint();
        } catch (final DomainException e) {
            logger.trace("Rejected MCMC proposal: " + e.getMessage());
            return Double.NEGATIVE_INFINITY;
        }
        return constraint.isSatisfied(physical) ? baseProposal.logProbTransformed(transformedPoint) : Double.NEGATIVE_INFINITY;
    }
}
