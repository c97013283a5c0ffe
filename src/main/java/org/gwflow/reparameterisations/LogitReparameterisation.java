package org.gwflow.reparameterisations;

import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.coordinates.CoordinateUtils;

/**
 * Maps a bounded parameter onto the real line with the logit of its position within the prior bounds.
 * The domain is open: values on the bounds map to infinity and are rejected.
 */
public final class LogitReparameterisation extends ScalarReparameterisation {

    public LogitReparameterisation(final ParameterDescriptor descriptor) {
        super(descriptor);
        if (!descriptor.hasFiniteBounds()) {
            throw new ConfigurationException("Logit requires finite prior bounds for parameter " + descriptor.name() + ".");
        }
    }

    @Override
    protected double transform(final double value) {
        checkWithinBounds(value);
        return CoordinateUtils.transformBoundedVariableToUnboundedCoordinate(value, descriptor.lower(), descriptor.upper());
    }

    @Override
    protected double inverseTransform(final double transformedValue) {
        if (Double.isInfinite(transformedValue)) {
            throw new DomainException(getOutputName(), transformedValue, "logit coordinate must be finite");
        }
        return CoordinateUtils.transformUnboundedCoordinateToBoundedVariable(transformedValue, descriptor.lower(), descriptor.upper());
    }

    //the sigmoid has derivative exp(factor), so the logit has the negation
    @Override
    protected double logJacobian(final double value) {
        return -CoordinateUtils.calculateLogJacobianFactor(value, descriptor.lower(), descriptor.upper());
    }
}
