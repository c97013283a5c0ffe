package org.gwflow.reparameterisations;

import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.Point;

/**
 * The values produced by one direction of a {@link Reparameterisation} together with the log-Jacobian
 * determinant of that direction, evaluated at the input.
 */
public final class TransformResult {
    private final Point point;
    private final double logJacobian;

    public TransformResult(final Point point, final double logJacobian) {
        this.point = Utils.nonNull(point);
        this.logJacobian = logJacobian;
    }

    public Point getPoint() {
        return point;
    }

    public double getLogJacobian() {
        return logJacobian;
    }

    @Override
    public String toString() {
        return point + " (log|J| = " + logJacobian + ")";
    }
}
