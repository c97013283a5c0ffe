package org.gwflow.proposals;

import org.gwflow.utils.mcmc.Point;

import java.util.List;

/**
 * A density model in transformed space, typically a normalising flow, supplied by the sampling engine.
 * All points are keyed by transformed parameter names.
 */
public interface BaseProposal {

    /**
     * Draws {@code n} points from the current model.
     */
    List<Point> sampleTransformed(final int n);

    /**
     * Log density of the current model at {@code point}.
     */
    double logProbTransformed(final Point point);

    /**
     * Trains the model on {@code points}.
     */
    void fit(final List<Point> points);
}
