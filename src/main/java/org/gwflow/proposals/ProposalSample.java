package org.gwflow.proposals;

import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.Point;

/**
 * A proposed physical point together with its log proposal density in physical space.
 */
public final class ProposalSample {
    private final Point point;
    private final double logProb;

    public ProposalSample(final Point point, final double logProb) {
        this.point = Utils.nonNull(point);
        this.logProb = logProb;
    }

    public Point getPoint() {
        return point;
    }

    public double getLogProb() {
        return logProb;
    }

    @Override
    public String toString() {
        return point + " (log q = " + logProb + ")";
    }
}
