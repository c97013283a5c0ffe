package org.gwflow.reparameterisations;

import org.gwflow.utils.mcmc.ParameterDescriptor;

/**
 * Passes a parameter through unchanged, under its own name.
 */
public final class IdentityReparameterisation extends ScalarReparameterisation {

    public IdentityReparameterisation(final ParameterDescriptor descriptor) {
        super(descriptor, descriptor.name());
    }

    @Override
    protected double transform(final double value) {
        return value;
    }

    @Override
    protected double inverseTransform(final double transformedValue) {
        return transformedValue;
    }

    @Override
    protected double logJacobian(final double value) {
        return 0.;
    }
}
