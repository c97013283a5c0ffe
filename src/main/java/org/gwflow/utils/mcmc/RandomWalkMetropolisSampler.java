package org.gwflow.utils.mcmc;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.gwflow.utils.Utils;
import org.gwflow.utils.param.ParamUtils;

import java.util.Arrays;
import java.util.function.Function;

/**
 * Random-walk Metropolis-Hastings sampler with independent Gaussian steps per dimension.  The log target may
 * return negative infinity (or NaN) outside its support; such proposals are always rejected, and a chain started
 * outside the support accepts the first proposal inside it.
 */
public final class RandomWalkMetropolisSampler {
    private static final Logger logger = LogManager.getLogger(RandomWalkMetropolisSampler.class);

    private final Function<double[], Double> logTarget;
    private final double[] stepSizes;
    private final RandomGenerator rng;

    private int numSamples = 0;
    private int numAccepted = 0;

    public RandomWalkMetropolisSampler(final Function<double[], Double> logTarget, final double[] stepSizes,
                                       final RandomGenerator rng) {
        this.logTarget = Utils.nonNull(logTarget, "Log target cannot be null.");
        Utils.nonNull(stepSizes, "Step sizes cannot be null.");
        Arrays.stream(stepSizes).forEach(s -> ParamUtils.isPositiveOrZero(s, "Step sizes must be non-negative."));
        this.stepSizes = stepSizes.clone();
        this.rng = Utils.nonNull(rng, "Random generator cannot be null.");
    }

    /**
     * Runs {@code numSteps} steps starting from {@code initial} and returns the final state.
     */
    public double[] run(final double[] initial, final int numSteps) {
        Utils.nonNull(initial, "Initial state cannot be null.");
        Utils.validateArg(initial.length == stepSizes.length, "Initial state and step sizes must have the same dimension.");
        ParamUtils.isPositiveOrZero(numSteps, "Number of steps must be non-negative.");
        double[] current = initial.clone();
        double currentLogTarget = logTarget.apply(current);
        for (int step = 0; step < numSteps; step++) {
            final double[] proposed = new double[current.length];
            for (int i = 0; i < current.length; i++) {
                proposed[i] = current[i] + stepSizes[i] * rng.nextGaussian();
            }
            final double proposedLogTarget = logTarget.apply(proposed);
            numSamples++;
            if (!(proposedLogTarget > Double.NEGATIVE_INFINITY)) {
                continue;
            }
            //accept or reject
            final boolean accept = !(currentLogTarget > Double.NEGATIVE_INFINITY)
                    || rng.nextDouble() < Math.min(1., Math.exp(proposedLogTarget - currentLogTarget));
            if (accept) {
                numAccepted++;
                current = proposed;
                currentLogTarget = proposedLogTarget;
            }
        }
        return current;
    }

    public double getAcceptanceRate() {
        return numSamples == 0 ? 0. : (double) numAccepted / numSamples;
    }

    public void logAcceptanceRate() {
        logger.debug("Acceptance rate: " + getAcceptanceRate());
    }
}
