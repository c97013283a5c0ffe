package org.gwflow.proposals;

import org.gwflow.utils.mcmc.Point;

/**
 * The current likelihood contour of the sampling engine, evaluated on physical points.
 */
@FunctionalInterface
public interface LikelihoodConstraint {
    LikelihoodConstraint NONE = point -> true;

    boolean isSatisfied(final Point physicalPoint);
}
