package org.gwflow.proposals;

import org.gwflow.reparameterisations.CompositeReparameterisation;
import org.gwflow.utils.mcmc.Point;

import java.util.List;

/**
 * Draws and evaluates points in transformed space on behalf of a {@link GWFlowProposal}.
 */
interface ProposalStrategy {

    void fit(final List<Point> transformedPoints);

    /**
     * Draws up to {@code n} transformed points, keyed by the outputs of {@code composite}.  May return fewer
     * points than requested.
     */
    List<Point> sample(final int n, final CompositeReparameterisation composite);

    double logProb(final Point transformedPoint);
}
