package org.gwflow.reparameterisations;

import org.gwflow.exceptions.GWFlowException.ConfigurationException;
import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.utils.mcmc.ParameterDescriptor;

/**
 * Maps an angle with a sine prior (e.g. an inclination or spin tilt) to {@code -cos(theta)}, which is uniformly
 * distributed under that prior.  The prior bounds must lie within [0, pi]; the end points of [0, pi] have a
 * vanishing Jacobian and are rejected.
 */
public final class AngleSineReparameterisation extends ScalarReparameterisation {

    public AngleSineReparameterisation(final ParameterDescriptor descriptor) {
        super(descriptor);
        if (!(descriptor.lower() >= 0. && descriptor.upper() <= Math.PI)) {
            throw new ConfigurationException("Prior bounds of " + descriptor.name() + " must lie within [0, pi] for a sine prior.");
        }
    }

    @Override
    protected double transform(final double value) {
        checkWithinBounds(value);
        return -Math.cos(value);
    }

    @Override
    protected double inverseTransform(final double transformedValue) {
        if (transformedValue < -1. || transformedValue > 1.) {
            throw new DomainException(getOutputName(), transformedValue, "value is outside [-1, 1]");
        }
        return checkWithinBounds(Math.acos(-transformedValue));
    }

    @Override
    protected double logJacobian(final double value) {
        return Math.log(Math.abs(Math.sin(value)));
    }
}
