package org.gwflow.reparameterisations;

import org.gwflow.utils.mcmc.Point;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A bidirectional coordinate transform over a subset of the physical parameters.
 *
 * <p>
 *     {@link #forward} reads the values of {@link #getInputParameters()} (and of {@link #getRequiredParameters()})
 *     from a physical-space context and returns a point holding exactly {@link #getOutputParameters()}.
 *     {@link #inverse} reads the outputs (and the required parameters, in physical units) and returns a point
 *     holding exactly the inputs.  The two are mutual inverses up to floating-point tolerance and the
 *     log-Jacobian of the inverse is the negation of the log-Jacobian of the forward map for the same pair.
 * </p>
 *
 * <p>
 *     Implementations are immutable: neither direction mutates its argument, and {@link #fit} returns a new
 *     instance rather than updating this one.
 * </p>
 */
public interface Reparameterisation {

    /**
     * Physical parameters owned (consumed) by this reparameterisation, in order.
     */
    List<String> getInputParameters();

    /**
     * Transformed parameters produced by this reparameterisation, in order.
     */
    List<String> getOutputParameters();

    /**
     * Physical parameters read but not owned; they must be available in physical units in both directions.
     */
    default Set<String> getRequiredParameters() {
        return Collections.emptySet();
    }

    /**
     * @throws org.gwflow.exceptions.GWFlowException.DomainException if an input is outside the domain of the transform
     */
    TransformResult forward(final Point physical);

    /**
     * @throws org.gwflow.exceptions.GWFlowException.DomainException if an output cannot be mapped back to a valid physical value
     */
    TransformResult inverse(final Point transformed);

    /**
     * False when several physical points map to the same transformed point and the inverse chooses among them.
     */
    default boolean isOneToOne() {
        return true;
    }

    /**
     * Transformed points that {@link #inverse} maps to the same physical point as {@code transformed}, each with
     * the values not produced by this reparameterisation left unchanged.  The first element is the image of that
     * physical point under {@link #forward}.  Densities in transformed space are summed over these points.
     * Many-to-one maps that account for the choice in their log-Jacobian return {@code transformed} alone.
     */
    default List<Point> preimages(final Point transformed) {
        return Collections.singletonList(transformed);
    }

    /**
     * True if the transform adapts to the current live points through {@link #fit}.
     */
    default boolean isFitted() {
        return false;
    }

    /**
     * Returns a reparameterisation adapted to {@code livePoints} (physical units).  Reparameterisations that are not
     * fitted return themselves.
     */
    default Reparameterisation fit(final List<Point> livePoints) {
        return this;
    }
}
