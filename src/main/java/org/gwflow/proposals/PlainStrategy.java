package org.gwflow.proposals;

import org.gwflow.reparameterisations.CompositeReparameterisation;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.Point;

import java.util.List;

/**
 * Delegates directly to the base proposal.
 */
final class PlainStrategy implements ProposalStrategy {
    private final BaseProposal baseProposal;

    PlainStrategy(final BaseProposal baseProposal) {
        this.baseProposal = Utils.nonNull(baseProposal, "Base proposal cannot be null.");
    }

    @Override
    public void fit(final List<Point> transformedPoints) {
        baseProposal.fit(transformedPoints);
    }

    @Override
    public List<Point> sample(final int n, final CompositeReparameterisation composite) {
        return baseProposal.sampleTransformed(n);
    }

    @Override
    public double logProb(final Point transformedPoint) {
        return baseProposal.logProbTransformed(transformedPoint);
    }
}
