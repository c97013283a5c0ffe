package org.gwflow.proposals;

import org.gwflow.utils.mcmc.Point;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Proposes new physical points for the sampling engine and evaluates the proposal density in physical units.
 */
public interface Proposal {

    /**
     * @throws org.gwflow.exceptions.GWFlowException.ProposalExhaustedException if {@code n} valid points could not be drawn
     */
    List<ProposalSample> sample(final int n);

    /**
     * @throws org.gwflow.exceptions.GWFlowException.DomainException if {@code point} is outside the domain of the reparameterisations
     */
    double logProb(final Point point);

    /**
     * Adapts the proposal to the current live points (physical units).
     */
    void update(final List<Point> livePoints);

    default List<Point> populate(final int n) {
        return sample(n).stream().map(ProposalSample::getPoint).collect(Collectors.toList());
    }
}
